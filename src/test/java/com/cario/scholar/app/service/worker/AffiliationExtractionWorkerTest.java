package com.cario.scholar.app.service.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.service.PromptLoaderService;
import com.cario.scholar.app.service.client.DocumentTextService;
import com.cario.scholar.app.service.client.LlmTextService;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.Message;
import org.springframework.core.io.DefaultResourceLoader;

class AffiliationExtractionWorkerTest {

  private static final String PDF = "https://arxiv.org/pdf/2401.00001";
  private static final String ANSWER =
      "{\"authors\":[{\"name\":\"Alice Smith\",\"affiliations\":[\"MIT\"]},"
          + "{\"name\":\"Bob Lee\",\"affiliations\":[]}]}";

  private DocumentTextService documents;
  private LlmTextService llm;
  private AffiliationExtractionWorker worker;

  private final RawRecord record =
      RawRecord.builder()
          .id("2401.00001")
          .title("A paper")
          .author("Alice Smith")
          .author("Bob Lee")
          .pdfUrl(PDF)
          .build();

  @BeforeEach
  void setUp() {
    documents = mock(DocumentTextService.class);
    llm = mock(LlmTextService.class);
    worker =
        new AffiliationExtractionWorker(
            documents,
            llm,
            new PromptLoaderService(new DefaultResourceLoader(), null),
            "classpath:prompts/affiliation-prompts.yaml",
            new ResilientCallExecutor(3, Duration.ZERO, new QuotaErrorClassifier()),
            CredentialPool.unmetered("pdf"),
            CredentialPool.single("llm"));
    when(documents.firstPageText(PDF))
        .thenReturn("Alice Smith (MIT) alice@mit.edu, Bob Lee. Abstract ...");
  }

  @Test
  void networkErrorIsRetriedThenAnswerIsMapped() {
    when(llm.complete(anyString(), any(Message.class), eq("AffiliationExtraction"), anyMap()))
        .thenThrow(new RuntimeException("I/O error on POST request: Connection reset"))
        .thenReturn(ANSWER);

    WorkerOutcome<EnrichmentFragment> out = worker.enrich(record, EnrichmentFragment.empty("2401.00001"));

    assertThat(out.isOk()).isTrue();
    EnrichmentFragment f = out.orElse(null);
    assertThat(f.getAuthors().keySet()).containsExactly("Alice Smith", "Bob Lee");
    assertThat(f.author("Alice Smith").getAffiliations()).containsExactly("MIT");
    assertThat(f.author("Bob Lee").getAffiliations()).isEmpty();
    verify(llm, times(2)).complete(anyString(), any(Message.class), anyString(), anyMap());
  }

  @Test
  void unparseableAnswerGivesEmptyAffiliations() {
    when(llm.complete(anyString(), any(Message.class), anyString(), anyMap()))
        .thenReturn("Sorry, I cannot help with that.");

    WorkerOutcome<EnrichmentFragment> out = worker.enrich(record, EnrichmentFragment.empty("2401.00001"));

    assertThat(out.isOk()).isTrue();
    assertThat(out.orElse(null).getAuthors().values())
        .extracting(AuthorFragment::getName)
        .containsExactly("Alice Smith", "Bob Lee");
    assertThat(out.orElse(null).hasAffiliations()).isFalse();
  }

  @Test
  void blankDocumentSkipsTheModel() {
    when(documents.firstPageText(PDF)).thenReturn("  ");

    WorkerOutcome<EnrichmentFragment> out = worker.enrich(record, EnrichmentFragment.empty("2401.00001"));

    assertThat(out.isOk()).isTrue();
    assertThat(out.orElse(null).hasAffiliations()).isFalse();
    verify(llm, never()).complete(anyString(), any(Message.class), anyString(), anyMap());
  }

  @Test
  void exhaustedModelQuotaIsReported() {
    when(llm.complete(anyString(), any(Message.class), anyString(), anyMap()))
        .thenThrow(new RuntimeException("insufficient_quota: You exceeded your current quota"));

    WorkerOutcome<EnrichmentFragment> out = worker.enrich(record, EnrichmentFragment.empty("2401.00001"));

    assertThat(out).isInstanceOf(WorkerOutcome.QuotaExhausted.class);
    assertThat(((WorkerOutcome.QuotaExhausted<EnrichmentFragment>) out).source()).isEqualTo("llm");
  }

  @Test
  void parseMapsNamesByFoldAndDropsUnknownAuthors() {
    String raw =
        "```json\n"
            + "{\"authors\":["
            + "{\"name\":\"ALICE SMITH\",\"affiliations\":[\" MIT \",\"MIT\",\"\"],\"email\":\"alice@mit.edu\"},"
            + "{\"name\":\"Bob Lee\",\"affiliations\":[\"Stanford University\"],\"email\":\"null\"},"
            + "{\"name\":\"Carol Invented\",\"affiliations\":[\"Nowhere\"]}"
            + "]}\n"
            + "```";

    EnrichmentFragment f = worker.parse(record, raw);

    assertThat(f.getAuthors().keySet()).containsExactly("Alice Smith", "Bob Lee");
    assertThat(f.author("Alice Smith").getAffiliations()).containsExactly("MIT");
    assertThat(f.author("Alice Smith").getEmail()).isEqualTo("alice@mit.edu");
    assertThat(f.author("Bob Lee").getEmail()).isNull();
  }
}
