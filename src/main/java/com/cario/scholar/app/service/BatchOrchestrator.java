package com.cario.scholar.app.service;

import static com.cario.scholar.app.model.ProcessingStatus.API_EXHAUSTED;
import static com.cario.scholar.app.model.ProcessingStatus.COMPLETED;
import static com.cario.scholar.app.model.ProcessingStatus.FAILED;
import static com.cario.scholar.app.model.ProcessingStatus.IN_PROGRESS;
import static com.cario.scholar.app.model.ProcessingStatus.PAUSED;

import com.cario.scholar.app.model.EnrichedRecord;
import com.cario.scholar.app.model.IngestReport;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.Session;
import com.cario.scholar.app.model.UpsertResult;
import com.cario.scholar.app.repository.ProgressLedger;
import com.cario.scholar.app.repository.ProgressStore;
import com.cario.scholar.app.repository.jdbc.ScholarlyRecordRepository;
import com.cario.scholar.app.service.client.ArxivClient;
import com.cario.scholar.app.service.worker.CredentialPool;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Drives a batch session from its id list to a final status.
 *
 * <p>Ids are processed in slices, strictly one after another. For each slice the missing records
 * are fetched from the source, enriched through the {@link FanoutCoordinator}, written to the
 * relational store, and every item's status is recorded in the {@link ProgressStore}. A quota
 * signal stops the run with the session {@code api_exhausted}; an unreachable store stops it with
 * the session {@code failed}. Either way the session can be resumed, and a resumed run only sees
 * items that are still pending or failed. A session runs at most once at a time in this process.
 */
@Log4j2
public class BatchOrchestrator {

  private final ProgressStore store;
  private final ArxivClient source;
  private final FanoutCoordinator fanout;
  private final ScholarlyRecordRepository repository;
  private final List<CredentialPool> pools;
  private final int sliceSize;
  private final Clock clock;

  private final Set<String> pauseRequests = ConcurrentHashMap.newKeySet();
  private final Set<String> running = ConcurrentHashMap.newKeySet();

  public BatchOrchestrator(
      ProgressStore store,
      ArxivClient source,
      FanoutCoordinator fanout,
      ScholarlyRecordRepository repository,
      List<CredentialPool> pools,
      int sliceSize) {
    this(store, source, fanout, repository, pools, sliceSize, Clock.systemUTC());
  }

  BatchOrchestrator(
      ProgressStore store,
      ArxivClient source,
      FanoutCoordinator fanout,
      ScholarlyRecordRepository repository,
      List<CredentialPool> pools,
      int sliceSize,
      Clock clock) {
    if (sliceSize < 1) {
      throw new IllegalArgumentException("sliceSize must be >= 1");
    }
    this.store = Objects.requireNonNull(store, "store");
    this.source = Objects.requireNonNull(source, "source");
    this.fanout = Objects.requireNonNull(fanout, "fanout");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.pools = List.copyOf(pools);
    this.sliceSize = sliceSize;
    this.clock = clock;
  }

  // ---------------------------------------------------------------------
  // Entry points
  // ---------------------------------------------------------------------

  /** New session over explicit record ids; records are fetched slice by slice. */
  public IngestReport startSession(String sourceDescriptor, List<String> recordIds) {
    List<String> ids = distinctIds(recordIds);
    Session session = store.createSession(sourceDescriptor, ids);
    log.info("orchestrator.session.start session={} items={}", session.getSessionId(), ids.size());
    return exclusively(session.getSessionId(), () -> run(session.getSessionId(), ids, Map.of()));
  }

  /** New session over records already fetched, e.g. by a date-window query. */
  public IngestReport startSession(String sourceDescriptor, Collection<RawRecord> records) {
    Map<String, RawRecord> byId = new LinkedHashMap<>();
    for (RawRecord r : records) {
      byId.putIfAbsent(r.getId(), r);
    }
    List<String> ids = new ArrayList<>(byId.keySet());
    Session session = store.createSession(sourceDescriptor, ids);
    log.info(
        "orchestrator.session.start session={} items={} prefetched=true",
        session.getSessionId(),
        ids.size());
    return exclusively(session.getSessionId(), () -> run(session.getSessionId(), ids, byId));
  }

  /**
   * Continues a session from its pending and failed items.
   *
   * @throws IllegalArgumentException when the session does not exist
   * @throws IllegalStateException when the session is not in a resumable state or is running
   */
  public IngestReport resume(String sessionId) {
    Session session = requireSession(sessionId);
    if (!ProgressLedger.isResumable(session)) {
      throw new IllegalStateException(
          "Session " + sessionId + " is " + session.getStatus().wireName() + " and cannot be resumed");
    }
    return exclusively(
        sessionId,
        () -> {
          int requeued = store.requeueInterrupted(sessionId);
          pools.forEach(CredentialPool::reset);
          pauseRequests.remove(sessionId);
          List<String> ids = store.getPendingIds(sessionId);
          log.info(
              "orchestrator.session.resume session={} pending={} requeued={}",
              sessionId,
              ids.size(),
              requeued);
          return run(sessionId, ids, Map.of());
        });
  }

  public boolean isRunning(String sessionId) {
    return running.contains(sessionId);
  }

  /** Asks a running session to stop before its next slice. */
  public void requestPause(String sessionId) {
    requireSession(sessionId);
    pauseRequests.add(sessionId);
    log.info("orchestrator.pause.requested session={}", sessionId);
  }

  /** Fetches the last {@code days} of records in {@code categories} and runs them as a session. */
  public IngestReport ingestRecent(List<String> categories, int days, int maxResults) {
    if (categories == null || categories.isEmpty()) {
      throw new IllegalArgumentException("at least one category is required");
    }
    if (days < 1 || maxResults < 1) {
      throw new IllegalArgumentException("days and maxResults must be >= 1");
    }
    Instant end = clock.instant();
    Instant start = end.minus(Duration.ofDays(days));
    List<RawRecord> records = source.searchWindow(categories, start, end, maxResults);
    String descriptor = "arxiv:" + String.join(",", categories) + ":last-" + days + "d";
    if (records.isEmpty()) {
      Session session = store.createSession(descriptor, List.of());
      store.updateSessionStatus(session.getSessionId(), COMPLETED, null);
      log.info("orchestrator.ingest.empty session={} descriptor={}", session.getSessionId(), descriptor);
      return report(session.getSessionId(), Map.of());
    }
    return startSession(descriptor, records);
  }

  // ---------------------------------------------------------------------
  // Run loop
  // ---------------------------------------------------------------------

  private enum SliceEnd {
    CONTINUE,
    QUOTA,
    STORE_DOWN
  }

  private IngestReport exclusively(String sessionId, Supplier<IngestReport> body) {
    if (!running.add(sessionId)) {
      throw new IllegalStateException("Session " + sessionId + " is already running");
    }
    try {
      return body.get();
    } finally {
      running.remove(sessionId);
    }
  }

  private IngestReport run(String sessionId, List<String> ids, Map<String, RawRecord> prefetched) {
    store.updateSessionStatus(sessionId, IN_PROGRESS, null);
    Map<String, String> errors = new LinkedHashMap<>();

    for (int from = 0; from < ids.size(); from += sliceSize) {
      if (pauseRequests.remove(sessionId)) {
        store.updateSessionStatus(sessionId, PAUSED, null);
        log.info("orchestrator.session.paused session={} remaining={}", sessionId, ids.size() - from);
        return report(sessionId, errors);
      }
      List<String> slice = ids.subList(from, Math.min(ids.size(), from + sliceSize));
      SliceEnd end = runSlice(sessionId, slice, prefetched, errors);
      if (end != SliceEnd.CONTINUE) {
        return report(sessionId, errors);
      }
    }

    Session session = requireSession(sessionId);
    if (session.getStatus() == IN_PROGRESS) {
      store.updateSessionStatus(sessionId, COMPLETED, null);
    }
    IngestReport report = report(sessionId, errors);
    log.info(
        "orchestrator.session.done session={} status={} processed={} failed={} skipped={}",
        sessionId,
        report.getStatus().wireName(),
        report.getProcessed(),
        report.getFailed(),
        report.getSkipped());
    return report;
  }

  private SliceEnd runSlice(
      String sessionId,
      List<String> slice,
      Map<String, RawRecord> prefetched,
      Map<String, String> errors) {
    log.info("orchestrator.slice.start session={} size={}", sessionId, slice.size());
    Map<String, Long> startedAt = new ConcurrentHashMap<>();

    // fetching
    List<RawRecord> records = new ArrayList<>();
    List<String> toFetch = new ArrayList<>();
    for (String id : slice) {
      RawRecord r = prefetched.get(id);
      if (r != null) {
        records.add(r);
      } else {
        toFetch.add(id);
      }
    }
    if (!toFetch.isEmpty()) {
      try {
        Map<String, RawRecord> fetched = new LinkedHashMap<>();
        for (RawRecord r : source.fetchByIds(toFetch)) {
          fetched.putIfAbsent(r.getId(), r);
        }
        for (String id : toFetch) {
          RawRecord r = fetched.get(id);
          if (r == null) {
            settle(sessionId, id, PAUSED, "not found", startedAt);
          } else {
            records.add(r);
          }
        }
      } catch (RuntimeException e) {
        log.error("orchestrator.fetch failed session={} ids={}", sessionId, toFetch.size(), e);
        for (String id : toFetch) {
          String msg = "fetch failed: " + e.getMessage();
          settle(sessionId, id, FAILED, msg, startedAt);
          errors.put(id, msg);
        }
      }
    }

    // enriching
    FanoutResult result =
        fanout.run(
            records,
            id -> {
              startedAt.put(id, clock.millis());
              store.updateItemStatus(sessionId, id, IN_PROGRESS, null, null);
            });

    // persisting
    int inserted = 0;
    int updated = 0;
    for (EnrichedRecord er : result.getRecords()) {
      String id = er.getRecord().getId();
      try {
        UpsertResult u = repository.upsert(er);
        inserted += u.getPapersInserted();
        updated += u.getPapersSkipped();
        finish(sessionId, id, COMPLETED, result.getWarnings().get(id), startedAt);
      } catch (DataAccessResourceFailureException e) {
        log.error("orchestrator.persist unavailable session={} id={}", sessionId, id, e);
        store.updateSessionProgress(sessionId, inserted, updated);
        store.updateSessionStatus(sessionId, FAILED, "persistence unavailable: " + e.getMessage());
        return SliceEnd.STORE_DOWN;
      } catch (DataAccessException e) {
        log.error("orchestrator.persist failed session={} id={}", sessionId, id, e);
        String msg = "persist failed: " + e.getMessage();
        finish(sessionId, id, FAILED, msg, startedAt);
        errors.put(id, msg);
      }
    }
    for (Map.Entry<String, String> f : result.getFailures().entrySet()) {
      finish(sessionId, f.getKey(), FAILED, f.getValue(), startedAt);
      errors.put(f.getKey(), f.getValue());
    }
    for (String id : result.getQuotaHitIds()) {
      String msg = "quota exhausted: " + result.getExhaustedSource();
      finish(sessionId, id, FAILED, msg, startedAt);
      errors.put(id, msg);
    }
    store.updateSessionProgress(sessionId, inserted, updated);

    log.info(
        "orchestrator.slice.done session={} persisted={} failed={} quota={} undispatched={}",
        sessionId,
        result.getRecords().size(),
        result.getFailures().size() + result.getQuotaHitIds().size(),
        result.isQuotaExhausted(),
        result.getUndispatchedIds().size());

    if (result.isQuotaExhausted()) {
      store.markQuotaExhausted(sessionId, result.getCredentialIndex());
      log.warn(
          "orchestrator.session.quotaExhausted session={} source={} index={}",
          sessionId,
          result.getExhaustedSource(),
          result.getCredentialIndex());
      return SliceEnd.QUOTA;
    }
    return SliceEnd.CONTINUE;
  }

  /** Attempt that ends before enrichment: in_progress, then straight to {@code status}. */
  private void settle(
      String sessionId,
      String id,
      ProcessingStatus status,
      String error,
      Map<String, Long> startedAt) {
    startedAt.put(id, clock.millis());
    store.updateItemStatus(sessionId, id, IN_PROGRESS, null, null);
    finish(sessionId, id, status, error, startedAt);
  }

  private void finish(
      String sessionId,
      String id,
      ProcessingStatus status,
      String error,
      Map<String, Long> startedAt) {
    Long start = startedAt.get(id);
    Long duration = start == null ? null : clock.millis() - start;
    store.updateItemStatus(sessionId, id, status, error, duration);
  }

  // ---------------------------------------------------------------------
  // Reporting
  // ---------------------------------------------------------------------

  private IngestReport report(String sessionId, Map<String, String> errors) {
    Session s = requireSession(sessionId);
    boolean resumable = s.getStatus() != COMPLETED || s.getFailedCount() > 0;
    return IngestReport.builder()
        .sessionId(sessionId)
        .status(s.getStatus())
        .totalItems(s.getTotalItems())
        .processed(s.getProcessedCount())
        .failed(s.getFailedCount())
        .skipped(s.getSkippedCount())
        .inserted(s.getInsertedCount())
        .updated(s.getUpdatedCount())
        .itemErrors(errors)
        .resumeHint(resumable ? resumeHint(s) : null)
        .errorMessage(s.getErrorMessage())
        .build();
  }

  static String resumeHint(Session s) {
    String reason = s.getStatus() == API_EXHAUSTED ? "API quota exhausted. " : "";
    return reason + "Resume with POST /api/sessions/" + s.getSessionId() + "/resume";
  }

  private Session requireSession(String sessionId) {
    return store
        .getSession(sessionId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
  }

  /** Source ids without version suffix, so {@code 2401.00001v2} and {@code 2401.00001} are one item. */
  private static List<String> distinctIds(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      throw new IllegalArgumentException("recordIds must not be empty");
    }
    Set<String> out = new LinkedHashSet<>();
    for (String id : ids) {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("recordIds must not contain blank ids");
      }
      out.add(ArxivClient.withoutVersion(id));
    }
    return new ArrayList<>(out);
  }
}
