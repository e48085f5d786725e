package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.prompt.PromptConfig;
import com.cario.scholar.app.service.PromptLoaderService;
import com.cario.scholar.app.service.client.DocumentTextService;
import com.cario.scholar.app.service.client.LlmTextService;
import com.cario.scholar.app.service.matching.NameNormalizer;
import com.cario.scholar.app.util.JsonSchemas;
import com.cario.scholar.app.util.LlmJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.prompt.PromptTemplate;

/**
 * Reads the first page of a record's pdf and asks the language model which affiliations and email
 * belong to each listed author.
 *
 * <p>The record's author list is authoritative. Names the model returns are mapped back by exact
 * match, then by folded match; names that match no listed author are dropped. An unreadable pdf or
 * an unparseable answer yields empty affiliations for every author rather than an error.
 */
@Log4j2
public class AffiliationExtractionWorker implements EnrichmentWorker {

  static final String SCHEMA_NAME = "AffiliationExtraction";

  private final DocumentTextService documents;
  private final LlmTextService llm;
  private final PromptLoaderService prompts;
  private final String promptLocation;
  private final ResilientCallExecutor executor;
  private final CredentialPool documentPool;
  private final CredentialPool llmPool;

  private final ObjectMapper om = new ObjectMapper();
  private final Map<String, Object> schema = JsonSchemas.fromPojo(AffiliationExtraction.class);

  public AffiliationExtractionWorker(
      DocumentTextService documents,
      LlmTextService llm,
      PromptLoaderService prompts,
      String promptLocation,
      ResilientCallExecutor executor,
      CredentialPool documentPool,
      CredentialPool llmPool) {
    this.documents = documents;
    this.llm = llm;
    this.prompts = prompts;
    this.promptLocation = promptLocation;
    this.executor = executor;
    this.documentPool = documentPool;
    this.llmPool = llmPool;
  }

  @Override
  public String source() {
    return "affiliation";
  }

  @Override
  public WorkerOutcome<EnrichmentFragment> enrich(RawRecord record, EnrichmentFragment current) {
    try {
      return extract(record);
    } catch (RuntimeException e) {
      log.error("affiliation.extract failed id={}", record.getId(), e);
      return WorkerOutcome.failed("affiliation extraction failed: " + e.getMessage());
    }
  }

  private WorkerOutcome<EnrichmentFragment> extract(RawRecord record) {
    WorkerOutcome<String> text =
        executor.call("document.text", documentPool, c -> documents.firstPageText(record.getPdfUrl()));
    if (!text.isOk()) {
      return text.propagate();
    }
    String firstPage = text.orElse("");
    if (firstPage.isBlank()) {
      log.info("affiliation.noText id={}", record.getId());
      return WorkerOutcome.ok(emptyAffiliations(record));
    }

    PromptConfig cfg = prompts.load(promptLocation);
    Map<String, Object> vars = new HashMap<>();
    vars.put("authors", toJson(record.getAuthors()));
    vars.put("text", firstPage);
    Map<String, Object> all = cfg.variables(vars);
    String system = new PromptTemplate(cfg.getSystemTemplate()).render(all);
    Message user = new PromptTemplate(cfg.getUserTemplate()).createMessage(all);

    WorkerOutcome<String> answer =
        executor.call(
            "llm.affiliations", llmPool, c -> llm.complete(system, user, SCHEMA_NAME, schema));
    if (!answer.isOk()) {
      return answer.propagate();
    }
    EnrichmentFragment fragment = parse(record, answer.orElse(""));
    log.info(
        "affiliation.done id={} authors={} withAffiliations={}",
        record.getId(),
        record.getAuthors().size(),
        fragment.getAuthors().values().stream().filter(a -> !a.getAffiliations().isEmpty()).count());
    return WorkerOutcome.ok(fragment);
  }

  /** Maps the model's answer onto the record's authors, in record order. */
  EnrichmentFragment parse(RawRecord record, String raw) {
    AffiliationExtraction parsed;
    try {
      parsed = om.readValue(LlmJson.stripCodeFences(raw), AffiliationExtraction.class);
    } catch (JsonProcessingException e) {
      log.warn("affiliation.parse failed id={} err={}", record.getId(), e.getOriginalMessage());
      return emptyAffiliations(record);
    }
    if (parsed == null || parsed.getAuthors() == null) {
      return emptyAffiliations(record);
    }

    Map<String, AffiliationExtraction.AuthorEntry> exact = new LinkedHashMap<>();
    Map<String, AffiliationExtraction.AuthorEntry> folded = new LinkedHashMap<>();
    for (AffiliationExtraction.AuthorEntry e : parsed.getAuthors()) {
      if (e == null || e.getName() == null) {
        continue;
      }
      exact.putIfAbsent(e.getName().trim(), e);
      folded.putIfAbsent(NameNormalizer.fold(e.getName()), e);
    }

    List<AuthorFragment> authors = new ArrayList<>();
    for (String name : record.getAuthors()) {
      AffiliationExtraction.AuthorEntry e = exact.get(name.trim());
      if (e == null) {
        e = folded.get(NameNormalizer.fold(name));
      }
      if (e == null) {
        authors.add(AuthorFragment.named(name));
        continue;
      }
      authors.add(
          AuthorFragment.builder()
              .name(name)
              .affiliations(cleanAffiliations(e.getAffiliations()))
              .email(blankToNull(e.getEmail()))
              .build());
    }
    return EnrichmentFragment.of(record.getId(), authors);
  }

  private static List<String> cleanAffiliations(List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (String a : raw) {
      String t = blankToNull(a);
      if (t != null && !out.contains(t)) {
        out.add(t);
      }
    }
    return out;
  }

  private static EnrichmentFragment emptyAffiliations(RawRecord record) {
    return EnrichmentFragment.of(
        record.getId(), record.getAuthors().stream().map(AuthorFragment::named).toList());
  }

  private String toJson(List<String> authors) {
    try {
      return om.writeValueAsString(authors);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("author list not serializable", e);
    }
  }

  private static String blankToNull(String s) {
    if (s == null) {
      return null;
    }
    String t = s.trim();
    return t.isEmpty() || "null".equalsIgnoreCase(t) ? null : t;
  }
}
