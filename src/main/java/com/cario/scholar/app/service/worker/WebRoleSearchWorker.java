package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.RoleAssignment;
import com.cario.scholar.app.model.RoleAssignment.RoleSource;
import com.cario.scholar.app.model.WebSearchResult;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.prompt.PromptConfig;
import com.cario.scholar.app.service.PromptLoaderService;
import com.cario.scholar.app.service.client.LlmTextService;
import com.cario.scholar.app.service.client.TavilySearchClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.prompt.PromptTemplate;

/**
 * Fills roles the registry could not provide: a web search per (author, affiliation) pair, then a
 * language-model call that reads one role title out of the results.
 */
@Log4j2
public class WebRoleSearchWorker implements EnrichmentWorker {

  private static final Set<String> NO_ROLE = Set.of("unknown", "unclear", "not found", "none", "");
  private static final int CONTEXT_RESULTS = 3;
  private static final int CONTENT_CHARS = 500;

  private final TavilySearchClient search;
  private final LlmTextService llm;
  private final PromptLoaderService prompts;
  private final String promptLocation;
  private final ResilientCallExecutor executor;
  private final CredentialPool searchPool;
  private final CredentialPool llmPool;

  public WebRoleSearchWorker(
      TavilySearchClient search,
      LlmTextService llm,
      PromptLoaderService prompts,
      String promptLocation,
      ResilientCallExecutor executor,
      CredentialPool searchPool,
      CredentialPool llmPool) {
    this.search = search;
    this.llm = llm;
    this.prompts = prompts;
    this.promptLocation = promptLocation;
    this.executor = executor;
    this.searchPool = searchPool;
    this.llmPool = llmPool;
  }

  @Override
  public String source() {
    return searchPool.getSource();
  }

  @Override
  public WorkerOutcome<EnrichmentFragment> enrich(RawRecord record, EnrichmentFragment current) {
    if (searchPool.size() == 0) {
      log.debug("webrole.disabled id={} reason=no credentials", record.getId());
      return WorkerOutcome.ok(EnrichmentFragment.empty(record.getId()));
    }
    List<AuthorFragment> out = new ArrayList<>();
    int searched = 0;
    try {
      for (AuthorFragment author : current.getAuthors().values()) {
        Map<String, RoleAssignment> found = new LinkedHashMap<>();
        for (String aff : author.getAffiliations()) {
          if (hasRole(author.getRoles().get(aff))) {
            continue;
          }
          searched++;
          WorkerOutcome<String> role = findRole(author.getName(), aff);
          if (!role.isOk()) {
            return role.propagate();
          }
          String title = role.orElse(null);
          if (title != null) {
            found.put(aff, RoleAssignment.builder().role(title).source(RoleSource.WEB_SEARCH).build());
          }
        }
        if (!found.isEmpty()) {
          out.add(AuthorFragment.builder().name(author.getName()).roles(found).build());
        }
      }
    } catch (RuntimeException e) {
      log.error("webrole.enrich failed id={}", record.getId(), e);
      return WorkerOutcome.failed("web role search failed: " + e.getMessage());
    }
    log.info("webrole.done id={} searched={} found={}", record.getId(), searched, out.size());
    return WorkerOutcome.ok(EnrichmentFragment.of(record.getId(), out));
  }

  /** Role title for one pair; an Ok(null) when the web has nothing usable. */
  WorkerOutcome<String> findRole(String name, String affiliation) {
    String query = query(name, affiliation);
    WorkerOutcome<WebSearchResult> result =
        executor.call("tavily.search", searchPool, key -> search.search(query, key));
    if (!result.isOk()) {
      return result.propagate();
    }
    String context = context(result.orElse(null));
    if (context.isBlank()) {
      return WorkerOutcome.ok(null);
    }

    PromptConfig cfg = prompts.load(promptLocation);
    Map<String, Object> vars =
        cfg.variables(Map.of("name", name, "affiliation", affiliation, "context", context));
    String system = new PromptTemplate(cfg.getSystemTemplate()).render(vars);
    String user = new PromptTemplate(cfg.getUserTemplate()).render(vars);

    WorkerOutcome<String> answer =
        executor.call("llm.role", llmPool, c -> llm.complete(system, user));
    if (!answer.isOk()) {
      return answer;
    }
    return WorkerOutcome.ok(cleanRole(answer.orElse(null)));
  }

  static String query(String name, String affiliation) {
    return "What is " + name + "'s role position job title at " + affiliation + "?";
  }

  /** Answer summary plus the top results, content truncated. */
  static String context(WebSearchResult result) {
    if (result == null) {
      return "";
    }
    List<String> parts = new ArrayList<>();
    if (result.getAnswer() != null && !result.getAnswer().isBlank()) {
      parts.add("Summary: " + result.getAnswer());
    }
    int i = 0;
    for (WebSearchResult.Hit hit : result.getHits()) {
      if (i == CONTEXT_RESULTS) {
        break;
      }
      i++;
      String content = hit.getContent() == null ? "" : hit.getContent();
      if (content.isBlank()) {
        continue;
      }
      if (content.length() > CONTENT_CHARS) {
        content = content.substring(0, CONTENT_CHARS) + "...";
      }
      parts.add("Result " + i + " (" + hit.getUrl() + "): " + hit.getTitle() + "\n" + content);
    }
    return String.join("\n\n", parts);
  }

  /** Trimmed role title, or null for the model's ways of saying "no role". */
  static String cleanRole(String raw) {
    if (raw == null) {
      return null;
    }
    String t = raw.trim();
    if (t.length() >= 2 && (t.startsWith("\"") && t.endsWith("\"") || t.startsWith("'") && t.endsWith("'"))) {
      t = t.substring(1, t.length() - 1).trim();
    }
    if (t.endsWith(".")) {
      t = t.substring(0, t.length() - 1).trim();
    }
    return NO_ROLE.contains(t.toLowerCase(Locale.ROOT)) ? null : t;
  }

  private static boolean hasRole(RoleAssignment r) {
    return r != null && r.getRole() != null && !r.getRole().isBlank();
  }
}
