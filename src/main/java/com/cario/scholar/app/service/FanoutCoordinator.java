package com.cario.scholar.app.service;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichedRecord;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.service.worker.EnrichmentWorker;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.log4j.Log4j2;

/**
 * Runs the enrichment stages for a slice of records concurrently and gathers the results.
 *
 * <p>Each record is one chain: affiliation extraction, then (only when some affiliation was found)
 * registry lookup, web role search and metrics, in that order. Every stage holds a permit of its
 * own semaphore while it runs, which caps concurrent calls per external source. Once any stage
 * reports quota exhaustion no further stage starts; stages already running finish. All chains are
 * joined before the result is built.
 *
 * <p>A stage that fails after its retries leaves the record with what earlier stages found; the
 * record still completes and the reason is reported as a warning. Only an unexpected exception
 * fails a record.
 */
@Log4j2
public class FanoutCoordinator {

  /** Notified from worker threads. */
  @FunctionalInterface
  public interface Listener {
    Listener NONE = recordId -> {};

    /** The first stage of {@code recordId} is about to run. */
    void onDispatched(String recordId);
  }

  private final Stage affiliation;
  private final Stage registry;
  private final Stage webRole;
  private final Stage metrics;
  private final Executor executor;

  public FanoutCoordinator(
      EnrichmentWorker affiliationWorker,
      EnrichmentWorker registryWorker,
      EnrichmentWorker webRoleWorker,
      EnrichmentWorker metricsWorker,
      Executor executor,
      int affiliationPermits,
      int registryPermits,
      int webRolePermits,
      int metricsPermits) {
    this.affiliation = new Stage(affiliationWorker, affiliationPermits);
    this.registry = new Stage(registryWorker, registryPermits);
    this.webRole = new Stage(webRoleWorker, webRolePermits);
    this.metrics = new Stage(metricsWorker, metricsPermits);
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public FanoutResult run(List<RawRecord> records, Listener listener) {
    Listener l = listener == null ? Listener.NONE : listener;
    Run run = new Run();
    log.info("fanout.slice.start size={}", records.size());

    List<CompletableFuture<RecordRun>> futures = new ArrayList<>(records.size());
    for (RawRecord r : records) {
      futures.add(
          CompletableFuture.supplyAsync(() -> process(r, run, l), executor)
              .exceptionally(
                  t -> {
                    log.error("fanout.record failed id={}", r.getId(), t);
                    return RecordRun.failed(r, "unexpected error: " + t.getMessage());
                  }));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    FanoutResult.FanoutResultBuilder out = FanoutResult.builder();
    for (CompletableFuture<RecordRun> f : futures) {
      RecordRun rr = f.join();
      switch (rr.state) {
        case DONE -> {
          out.record(new EnrichedRecord(rr.record, rr.fragment));
          if (!rr.warnings.isEmpty()) {
            out.warning(rr.record.getId(), String.join("; ", rr.warnings));
          }
        }
        case FAILED -> out.failure(rr.record.getId(), rr.error);
        case QUOTA -> out.quotaHitId(rr.record.getId());
        case UNDISPATCHED -> out.undispatchedId(rr.record.getId());
      }
    }
    WorkerOutcome.QuotaExhausted<?> q = run.quota.get();
    if (q != null) {
      out.quotaExhausted(true).exhaustedSource(q.source()).credentialIndex(q.credentialIndex());
    }
    FanoutResult result = out.build();
    log.info(
        "fanout.slice.done size={} done={} degraded={} failed={} quotaHit={} undispatched={} quota={}",
        records.size(),
        result.getRecords().size(),
        result.getWarnings().size(),
        result.getFailures().size(),
        result.getQuotaHitIds().size(),
        result.getUndispatchedIds().size(),
        result.isQuotaExhausted());
    return result;
  }

  private RecordRun process(RawRecord record, Run run, Listener listener) {
    EnrichmentFragment acc = seed(record);
    List<String> warnings = new ArrayList<>();

    StageResult first = affiliation.run(record, acc, run, () -> listener.onDispatched(record.getId()));
    if (first.skipped) {
      return RecordRun.undispatched(record);
    }
    if (first.outcome instanceof WorkerOutcome.QuotaExhausted<?>) {
      return RecordRun.quotaHit(record);
    }
    acc = merge(record, acc, first, warnings);
    if (!acc.hasAffiliations()) {
      return RecordRun.done(record, acc, warnings);
    }

    for (Stage stage : List.of(registry, webRole, metrics)) {
      StageResult sr = stage.run(record, acc, run, null);
      if (sr.skipped || sr.outcome instanceof WorkerOutcome.QuotaExhausted<?>) {
        return RecordRun.quotaHit(record);
      }
      acc = merge(record, acc, sr, warnings);
    }
    return RecordRun.done(record, acc, warnings);
  }

  /** A stage that gave up contributes nothing; the record keeps what earlier stages found. */
  private static EnrichmentFragment merge(
      RawRecord record, EnrichmentFragment acc, StageResult sr, List<String> warnings) {
    if (sr.outcome instanceof WorkerOutcome.Failed<EnrichmentFragment> f) {
      log.warn("fanout.stage.degraded id={} source={} reason={}", record.getId(), sr.source, f.reason());
      warnings.add(sr.source + ": " + f.reason());
      return acc;
    }
    return FragmentMerger.merge(acc, sr.outcome.orElse(EnrichmentFragment.empty(record.getId())));
  }

  /** One entry per listed author, so the merged fragment always covers the whole author list. */
  private static EnrichmentFragment seed(RawRecord record) {
    return EnrichmentFragment.of(
        record.getId(), record.getAuthors().stream().map(AuthorFragment::named).toList());
  }

  // ---------------------------------------------------------------------
  // Internals
  // ---------------------------------------------------------------------

  /** Shared state of one {@link #run} call. */
  private static final class Run {
    final AtomicBoolean stop = new AtomicBoolean();
    final AtomicReference<WorkerOutcome.QuotaExhausted<?>> quota = new AtomicReference<>();

    void quotaHit(WorkerOutcome.QuotaExhausted<?> q) {
      if (quota.compareAndSet(null, q)) {
        log.warn("fanout.quota source={} index={}", q.source(), q.credentialIndex());
      }
      stop.set(true);
    }
  }

  private static final class Stage {
    final EnrichmentWorker worker;
    final Semaphore permits;

    Stage(EnrichmentWorker worker, int permits) {
      if (permits < 1) {
        throw new IllegalArgumentException("permits must be >= 1 for " + worker.source());
      }
      this.worker = Objects.requireNonNull(worker, "worker");
      this.permits = new Semaphore(permits);
    }

    StageResult run(RawRecord record, EnrichmentFragment current, Run run, Runnable onStart) {
      if (run.stop.get()) {
        return StageResult.SKIPPED;
      }
      try {
        permits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new StageResult(worker.source(), WorkerOutcome.failed("interrupted"));
      }
      try {
        if (run.stop.get()) {
          return StageResult.SKIPPED;
        }
        if (onStart != null) {
          onStart.run();
        }
        WorkerOutcome<EnrichmentFragment> outcome = worker.enrich(record, current);
        if (outcome instanceof WorkerOutcome.QuotaExhausted<?> q) {
          run.quotaHit(q);
        }
        return new StageResult(worker.source(), outcome);
      } finally {
        permits.release();
      }
    }
  }

  private static final class StageResult {
    static final StageResult SKIPPED = new StageResult(null, null);

    final boolean skipped;
    final String source;
    final WorkerOutcome<EnrichmentFragment> outcome;

    StageResult(String source, WorkerOutcome<EnrichmentFragment> outcome) {
      this.skipped = outcome == null;
      this.source = source;
      this.outcome = outcome;
    }
  }

  private enum State {
    DONE,
    FAILED,
    QUOTA,
    UNDISPATCHED
  }

  private static final class RecordRun {
    final RawRecord record;
    final State state;
    final EnrichmentFragment fragment;
    final String error;
    final List<String> warnings;

    private RecordRun(
        RawRecord record,
        State state,
        EnrichmentFragment fragment,
        String error,
        List<String> warnings) {
      this.record = record;
      this.state = state;
      this.fragment = fragment;
      this.error = error;
      this.warnings = warnings;
    }

    static RecordRun done(RawRecord r, EnrichmentFragment f, List<String> warnings) {
      return new RecordRun(r, State.DONE, f, null, List.copyOf(warnings));
    }

    static RecordRun failed(RawRecord r, String error) {
      return new RecordRun(r, State.FAILED, null, error, List.of());
    }

    static RecordRun quotaHit(RawRecord r) {
      return new RecordRun(r, State.QUOTA, null, null, List.of());
    }

    static RecordRun undispatched(RawRecord r) {
      return new RecordRun(r, State.UNDISPATCHED, null, null, List.of());
    }
  }
}
