package com.cario.scholar.app.repository;

import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.ProgressSnapshot;
import com.cario.scholar.app.model.Session;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of batch sessions and the status of every item in them.
 *
 * <p>Every mutating call is persisted before it returns, so a fresh process can pick up a session
 * left behind by a previous one. Mutations are serialized by the implementation.
 */
public interface ProgressStore {

  /** Creates a {@code pending} session with one {@code pending} item per distinct id. */
  Session createSession(String sourceDescriptor, List<String> recordIds);

  Optional<Session> getSession(String sessionId);

  /** Sessions newest first, optionally restricted to one status. */
  List<Session> listSessions(ProcessingStatus filter);

  /** Ids of items that are {@code pending} or {@code failed}, in input order. */
  List<String> getPendingIds(String sessionId);

  /** Items in input order, optionally restricted to one status. */
  List<ItemRecord> getItems(String sessionId, ProcessingStatus filter);

  /**
   * Moves one item to {@code status} and adjusts the session counters. Entering {@code in_progress}
   * counts as an attempt.
   *
   * @throws IllegalStateException on a transition the item lifecycle does not allow
   */
  ItemRecord updateItemStatus(
      String sessionId, String recordId, ProcessingStatus status, String error, Long durationMs);

  /** Adds persisted-paper counts to the session. */
  Session updateSessionProgress(String sessionId, int inserted, int updated);

  Session updateSessionStatus(String sessionId, ProcessingStatus status, String error);

  /** Marks the session {@code api_exhausted} and records which credential was active. */
  Session markQuotaExhausted(String sessionId, int credentialIndex);

  /** Moves items stranded in {@code in_progress} by an interrupted run to {@code failed}. */
  int requeueInterrupted(String sessionId);

  boolean deleteSession(String sessionId);

  ProgressSnapshot getProgressSnapshot(String sessionId);

  /** Deletes completed sessions last updated more than {@code keep} ago. */
  int cleanupCompletedSessions(Duration keep);
}
