package com.cario.scholar.app.service;

import static com.cario.scholar.app.model.ProcessingStatus.API_EXHAUSTED;
import static com.cario.scholar.app.model.ProcessingStatus.COMPLETED;
import static com.cario.scholar.app.model.ProcessingStatus.FAILED;
import static com.cario.scholar.app.model.ProcessingStatus.IN_PROGRESS;
import static com.cario.scholar.app.model.ProcessingStatus.PAUSED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.scholar.app.model.EnrichedRecord;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.IngestReport;
import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.Session;
import com.cario.scholar.app.model.UpsertResult;
import com.cario.scholar.app.repository.file.FileProgressStore;
import com.cario.scholar.app.repository.jdbc.ScholarlyRecordRepository;
import com.cario.scholar.app.service.client.ArxivClient;
import com.cario.scholar.app.service.worker.CredentialPool;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

class BatchOrchestratorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path dir;

  private FileProgressStore store;
  private ArxivClient arxiv;
  private FanoutCoordinator fanout;
  private ScholarlyRecordRepository repository;
  private CredentialPool tavily;

  @BeforeEach
  void setUp() {
    store = new FileProgressStore(dir);
    arxiv = mock(ArxivClient.class);
    fanout = mock(FanoutCoordinator.class);
    repository = mock(ScholarlyRecordRepository.class);
    tavily = new CredentialPool("tavily", List.of("k1"));

    when(arxiv.fetchByIds(anyList()))
        .thenAnswer(
            inv -> {
              List<String> ids = inv.getArgument(0);
              return ids.stream().map(BatchOrchestratorTest::raw).toList();
            });
    when(repository.upsert(any())).thenReturn(UpsertResult.builder().papersInserted(1).build());
    fanoutSucceeds();
  }

  private BatchOrchestrator orchestrator(int sliceSize) {
    return new BatchOrchestrator(
        store, arxiv, fanout, repository, List.of(tavily), sliceSize, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static RawRecord raw(String id) {
    return RawRecord.builder().id(id).title("Paper " + id).author("Alice Smith").build();
  }

  private static EnrichedRecord enriched(RawRecord r) {
    return new EnrichedRecord(r, EnrichmentFragment.empty(r.getId()));
  }

  private void fanoutSucceeds() {
    fanoutWith(b -> {});
  }

  /** Dispatches every record, enriches all of them, then lets {@code adjust} edit the result. */
  private void fanoutWith(Consumer<FanoutResult.FanoutResultBuilder> adjust) {
    doAnswer(
            inv -> {
              List<RawRecord> records = inv.getArgument(0);
              FanoutCoordinator.Listener listener = inv.getArgument(1);
              FanoutResult.FanoutResultBuilder b = FanoutResult.builder();
              for (RawRecord r : records) {
                listener.onDispatched(r.getId());
                b.record(enriched(r));
              }
              adjust.accept(b);
              return b.build();
            })
        .when(fanout)
        .run(anyList(), any());
  }

  @Test
  void runsAllSlicesToCompletion() {
    IngestReport report = orchestrator(2).startSession("ids:3", List.of("a", "b", "c", "a"));

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getTotalItems()).isEqualTo(3);
    assertThat(report.getProcessed()).isEqualTo(3);
    assertThat(report.getInserted()).isEqualTo(3);
    assertThat(report.getResumeHint()).isNull();
    verify(arxiv).fetchByIds(List.of("a", "b"));
    verify(arxiv).fetchByIds(List.of("c"));
    verify(repository, times(3)).upsert(any());
  }

  @Test
  void recordsMissingAtTheSourceArePaused() {
    when(arxiv.fetchByIds(anyList())).thenReturn(List.of(raw("a")));

    IngestReport report = orchestrator(5).startSession("ids:2", List.of("a", "gone"));

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getProcessed()).isEqualTo(1);
    assertThat(report.getSkipped()).isEqualTo(1);
    assertThat(store.getItems(report.getSessionId(), PAUSED))
        .extracting(ItemRecord::getErrorMessage)
        .containsExactly("not found");
  }

  @Test
  void fetchFailureFailsTheSlice() {
    when(arxiv.fetchByIds(anyList())).thenThrow(new RuntimeException("arXiv down"));

    IngestReport report = orchestrator(5).startSession("ids:2", List.of("a", "b"));

    assertThat(report.getFailed()).isEqualTo(2);
    assertThat(report.getItemErrors()).containsEntry("a", "fetch failed: arXiv down");
    assertThat(report.getResumeHint()).isNotNull();
    verify(repository, never()).upsert(any());
  }

  @Test
  void quotaStopsTheSessionAndResumeOnlyRunsWhatIsLeft() {
    when(fanout.run(anyList(), any()))
        .thenAnswer(
            inv -> {
              List<RawRecord> records = inv.getArgument(0);
              FanoutCoordinator.Listener listener = inv.getArgument(1);
              listener.onDispatched("a");
              listener.onDispatched("b");
              return FanoutResult.builder()
                  .record(enriched(records.get(0)))
                  .quotaExhausted(true)
                  .exhaustedSource("tavily")
                  .credentialIndex(1)
                  .quotaHitId("b")
                  .undispatchedId("c")
                  .undispatchedId("d")
                  .build();
            });
    tavily.rotateFrom("k1");
    BatchOrchestrator orchestrator = orchestrator(10);

    IngestReport first = orchestrator.startSession("ids:4", List.of("a", "b", "c", "d"));

    assertThat(first.getStatus()).isEqualTo(API_EXHAUSTED);
    assertThat(first.getProcessed()).isEqualTo(1);
    assertThat(first.getItemErrors()).containsExactly(Map.entry("b", "quota exhausted: tavily"));
    assertThat(first.getResumeHint())
        .isEqualTo("API quota exhausted. Resume with POST /api/sessions/" + first.getSessionId() + "/resume");
    Session stopped = store.getSession(first.getSessionId()).orElseThrow();
    assertThat(stopped.getActiveCredentialIndex()).isEqualTo(1);
    assertThat(store.getPendingIds(first.getSessionId())).containsExactly("b", "c", "d");

    fanoutSucceeds();
    IngestReport second = orchestrator.resume(first.getSessionId());

    assertThat(second.getStatus()).isEqualTo(COMPLETED);
    assertThat(second.getProcessed()).isEqualTo(4);
    assertThat(second.getFailed()).isZero();
    assertThat(tavily.current()).isEqualTo("k1");
    verify(arxiv).fetchByIds(List.of("b", "c", "d"));
    verify(repository, times(4)).upsert(any());
  }

  @Test
  void unreachableStoreFailsTheSessionAndResumeRecovers() {
    when(repository.upsert(any()))
        .thenReturn(UpsertResult.builder().papersInserted(1).build())
        .thenThrow(new DataAccessResourceFailureException("connection refused"));
    BatchOrchestrator orchestrator = orchestrator(10);

    IngestReport first = orchestrator.startSession("ids:2", List.of("a", "b"));

    assertThat(first.getStatus()).isEqualTo(FAILED);
    assertThat(first.getErrorMessage()).startsWith("persistence unavailable");
    assertThat(first.getProcessed()).isEqualTo(1);
    assertThat(first.getInserted()).isEqualTo(1);
    assertThat(store.getItems(first.getSessionId(), IN_PROGRESS))
        .extracting(ItemRecord::getRecordId)
        .containsExactly("b");

    reset(repository);
    when(repository.upsert(any())).thenReturn(UpsertResult.builder().papersSkipped(1).build());
    IngestReport second = orchestrator.resume(first.getSessionId());

    assertThat(second.getStatus()).isEqualTo(COMPLETED);
    assertThat(second.getProcessed()).isEqualTo(2);
    assertThat(second.getInserted()).isEqualTo(1);
    assertThat(second.getUpdated()).isEqualTo(1);
    verify(repository, times(1)).upsert(any());
    verify(arxiv).fetchByIds(List.of("b"));
    ItemRecord b = store.getItems(first.getSessionId(), null).get(1);
    assertThat(b.getAttempts()).isEqualTo(2);
  }

  @Test
  void rejectedRowFailsOnlyThatItem() {
    when(repository.upsert(any()))
        .thenThrow(new DataIntegrityViolationException("value too long"))
        .thenReturn(UpsertResult.builder().papersInserted(1).build());

    IngestReport report = orchestrator(10).startSession("ids:2", List.of("a", "b"));

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getProcessed()).isEqualTo(1);
    assertThat(report.getFailed()).isEqualTo(1);
    assertThat(report.getItemErrors().get("a")).startsWith("persist failed");
    assertThat(report.getResumeHint()).isNotNull();
  }

  @Test
  void unexpectedEnrichmentErrorFailsTheItem() {
    fanoutWith(
        b -> {
          List<EnrichedRecord> ok = new ArrayList<>(b.build().getRecords().subList(1, 2));
          b.clearRecords().records(ok).failure("a", "unexpected error: boom");
        });

    IngestReport report = orchestrator(10).startSession("ids:2", List.of("a", "b"));

    assertThat(report.getFailed()).isEqualTo(1);
    assertThat(report.getItemErrors()).containsKey("a");
    assertThat(store.getPendingIds(report.getSessionId())).containsExactly("a");
  }

  @Test
  void degradedRecordIsPersistedAndKeepsTheReason() {
    fanoutWith(b -> b.warning("a", "orcid: orcid.search failed after 3 attempts: 503"));

    IngestReport report = orchestrator(10).startSession("ids:2", List.of("a", "b"));

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getProcessed()).isEqualTo(2);
    assertThat(report.getFailed()).isZero();
    verify(repository, times(2)).upsert(any());
    assertThat(store.getItems(report.getSessionId(), COMPLETED))
        .extracting(ItemRecord::getErrorMessage)
        .containsExactly("orcid: orcid.search failed after 3 attempts: 503", null);
  }

  @Test
  void versionedIdsShareOneItem() {
    IngestReport report =
        orchestrator(10).startSession("ids:1", List.of("2401.00001v2", " 2401.00001 "));

    assertThat(report.getTotalItems()).isEqualTo(1);
    assertThat(report.getProcessed()).isEqualTo(1);
    assertThat(report.getSkipped()).isZero();
    verify(arxiv).fetchByIds(List.of("2401.00001"));
  }

  @Test
  void runningSessionCannotBeResumedAgain() {
    BatchOrchestrator orchestrator = orchestrator(10);
    List<Throwable> rejected = new ArrayList<>();
    when(fanout.run(anyList(), any()))
        .thenAnswer(
            inv -> {
              List<RawRecord> records = inv.getArgument(0);
              FanoutCoordinator.Listener listener = inv.getArgument(1);
              String sessionId = store.listSessions(null).get(0).getSessionId();
              assertThat(orchestrator.isRunning(sessionId)).isTrue();
              try {
                orchestrator.resume(sessionId);
              } catch (IllegalStateException e) {
                rejected.add(e);
              }
              FanoutResult.FanoutResultBuilder b = FanoutResult.builder();
              for (RawRecord r : records) {
                listener.onDispatched(r.getId());
                b.record(enriched(r));
              }
              return b.build();
            });

    IngestReport report = orchestrator.startSession("ids:2", List.of("a", "b"));

    assertThat(rejected).hasSize(1);
    assertThat(rejected.get(0)).hasMessageEndingWith("is already running");
    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getProcessed()).isEqualTo(2);
    assertThat(orchestrator.isRunning(report.getSessionId())).isFalse();
    verify(repository, times(2)).upsert(any());
  }

  @Test
  void pauseStopsBeforeTheNextSlice() {
    BatchOrchestrator orchestrator = orchestrator(1);
    when(fanout.run(anyList(), any()))
        .thenAnswer(
            inv -> {
              List<RawRecord> records = inv.getArgument(0);
              FanoutCoordinator.Listener listener = inv.getArgument(1);
              String sessionId = store.listSessions(null).get(0).getSessionId();
              orchestrator.requestPause(sessionId);
              FanoutResult.FanoutResultBuilder b = FanoutResult.builder();
              for (RawRecord r : records) {
                listener.onDispatched(r.getId());
                b.record(enriched(r));
              }
              return b.build();
            });

    IngestReport report = orchestrator.startSession("ids:2", List.of("a", "b"));

    assertThat(report.getStatus()).isEqualTo(PAUSED);
    assertThat(report.getProcessed()).isEqualTo(1);
    assertThat(store.getPendingIds(report.getSessionId())).containsExactly("b");
  }

  @Test
  void ingestRecentSearchesTheWindow() {
    when(arxiv.searchWindow(anyList(), any(), any(), anyInt())).thenReturn(List.of(raw("x"), raw("y")));

    IngestReport report = orchestrator(10).ingestRecent(List.of("cs.AI", "cs.CL"), 2, 50);

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getProcessed()).isEqualTo(2);
    assertThat(store.getSession(report.getSessionId()).orElseThrow().getSourceDescriptor())
        .isEqualTo("arxiv:cs.AI,cs.CL:last-2d");
    verify(arxiv)
        .searchWindow(eq(List.of("cs.AI", "cs.CL")), eq(NOW.minus(Duration.ofDays(2))), eq(NOW), eq(50));
    verify(arxiv, never()).fetchByIds(anyList());
  }

  @Test
  void emptyWindowCompletesAnEmptySession() {
    when(arxiv.searchWindow(anyList(), any(), any(), anyInt())).thenReturn(List.of());

    IngestReport report = orchestrator(10).ingestRecent(List.of("cs.AI"), 1, 10);

    assertThat(report.getStatus()).isEqualTo(COMPLETED);
    assertThat(report.getTotalItems()).isZero();
    assertThat(report.getResumeHint()).isNull();
  }

  @Test
  void invalidArgumentsAreRejected() {
    BatchOrchestrator orchestrator = orchestrator(10);

    assertThatThrownBy(() -> orchestrator.ingestRecent(List.of(), 1, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> orchestrator.ingestRecent(List.of("cs.AI"), 0, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> orchestrator.startSession("ids:0", List.<String>of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> orchestrator.resume("batch_unknown"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown session: batch_unknown");
  }

  @Test
  void completedSessionCannotBeResumed() {
    BatchOrchestrator orchestrator = orchestrator(10);
    IngestReport report = orchestrator.startSession("ids:1", List.of("a"));

    assertThatThrownBy(() -> orchestrator.resume(report.getSessionId()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void resumeHintNamesTheEndpoint() {
    Session paused = Session.builder().sessionId("batch_1").status(PAUSED).build();
    Session exhausted = Session.builder().sessionId("batch_2").status(API_EXHAUSTED).build();

    assertThat(BatchOrchestrator.resumeHint(paused)).isEqualTo("Resume with POST /api/sessions/batch_1/resume");
    assertThat(BatchOrchestrator.resumeHint(exhausted)).startsWith("API quota exhausted. ");
  }
}
