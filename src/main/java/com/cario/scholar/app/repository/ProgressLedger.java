package com.cario.scholar.app.repository;

import static com.cario.scholar.app.model.ProcessingStatus.*;

import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.ProgressSnapshot;
import com.cario.scholar.app.model.Session;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Item lifecycle rules and session counter bookkeeping shared by the store implementations.
 *
 * <p>Counters follow item transitions: completed items count as processed, failed as failed, paused
 * as skipped. A session turns {@code completed} exactly when those counts reach its total.
 *
 * <p>Items and session are written separately, so the counters can lag the items after a crash.
 * {@link #reconcileCounters} rebuilds them from the items.
 */
public final class ProgressLedger {

  private static final DateTimeFormatter SESSION_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private static final Map<ProcessingStatus, Set<ProcessingStatus>> ITEM_TRANSITIONS =
      Map.of(
          PENDING, EnumSet.of(IN_PROGRESS, PAUSED),
          IN_PROGRESS, EnumSet.of(COMPLETED, FAILED, PAUSED),
          FAILED, EnumSet.of(IN_PROGRESS),
          COMPLETED, EnumSet.noneOf(ProcessingStatus.class),
          PAUSED, EnumSet.noneOf(ProcessingStatus.class));

  private static final Set<ProcessingStatus> RESUMABLE =
      EnumSet.of(API_EXHAUSTED, PAUSED, FAILED, IN_PROGRESS);

  private ProgressLedger() {}

  public static String newSessionId(Instant now) {
    String ts = LocalDateTime.ofInstant(now, ZoneOffset.UTC).format(SESSION_TS);
    return "batch_" + ts + "_" + String.format("%06x", ThreadLocalRandom.current().nextInt(1 << 24));
  }

  public static Session newSession(String sourceDescriptor, int totalItems, Instant now) {
    return Session.builder()
        .sessionId(newSessionId(now))
        .sourceDescriptor(sourceDescriptor)
        .totalItems(totalItems)
        .status(PENDING)
        .createdAt(now)
        .updatedAt(now)
        .build();
  }

  public static boolean isResumable(Session session) {
    if (RESUMABLE.contains(session.getStatus())) {
      return true;
    }
    return session.getStatus() == COMPLETED && session.getFailedCount() > 0;
  }

  /**
   * Applies a status change to {@code item} and the counters of {@code session}.
   *
   * @throws IllegalStateException when the lifecycle does not allow the transition
   */
  public static void applyItemTransition(
      Session session,
      ItemRecord item,
      ProcessingStatus next,
      String error,
      Long durationMs,
      Instant now) {
    if (next == API_EXHAUSTED) {
      throw new IllegalArgumentException("api_exhausted is a session-only status");
    }
    ProcessingStatus current = item.getStatus();
    if (!ITEM_TRANSITIONS.get(current).contains(next)) {
      throw new IllegalStateException(
          "illegal item transition " + current + " -> " + next + " for " + item.getRecordId());
    }

    adjust(session, current, -1);
    adjust(session, next, +1);

    item.setStatus(next);
    if (next == IN_PROGRESS) {
      item.setAttempts(item.getAttempts() + 1);
      item.setLastAttemptAt(now);
      item.setErrorMessage(null);
    } else {
      item.setErrorMessage(error);
      if (durationMs != null) {
        item.setProcessingMillis(durationMs);
      }
    }

    session.setUpdatedAt(now);
    if (session.getTotalItems() > 0 && session.settledCount() >= session.getTotalItems()) {
      session.setStatus(COMPLETED);
    }
  }

  /**
   * Sets the processed, failed and skipped counters of {@code session} from the item statuses.
   *
   * @return true when any counter changed
   */
  public static boolean reconcileCounters(Session session, Collection<ItemRecord> items) {
    int processed = 0;
    int failed = 0;
    int skipped = 0;
    for (ItemRecord item : items) {
      switch (item.getStatus()) {
        case COMPLETED -> processed++;
        case FAILED -> failed++;
        case PAUSED -> skipped++;
        default -> {
          // pending and in_progress are not counted
        }
      }
    }
    boolean changed =
        processed != session.getProcessedCount()
            || failed != session.getFailedCount()
            || skipped != session.getSkippedCount();
    session.setProcessedCount(processed);
    session.setFailedCount(failed);
    session.setSkippedCount(skipped);
    return changed;
  }

  public static ProgressSnapshot snapshot(Session session, Collection<ItemRecord> items) {
    int pending = 0;
    int inProgress = 0;
    for (ItemRecord item : items) {
      if (item.getStatus() == PENDING) {
        pending++;
      } else if (item.getStatus() == IN_PROGRESS) {
        inProgress++;
      }
    }
    double pct =
        session.getTotalItems() == 0
            ? 0.0
            : Math.round(10000.0 * session.settledCount() / session.getTotalItems()) / 100.0;
    return ProgressSnapshot.builder()
        .session(session)
        .pendingItems(pending)
        .inProgressItems(inProgress)
        .progressPercentage(pct)
        .build();
  }

  private static void adjust(Session session, ProcessingStatus status, int delta) {
    switch (status) {
      case COMPLETED -> session.setProcessedCount(session.getProcessedCount() + delta);
      case FAILED -> session.setFailedCount(session.getFailedCount() + delta);
      case PAUSED -> session.setSkippedCount(session.getSkippedCount() + delta);
      default -> {
        // pending and in_progress are not counted
      }
    }
  }
}
