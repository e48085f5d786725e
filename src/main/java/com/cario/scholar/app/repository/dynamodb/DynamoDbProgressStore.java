package com.cario.scholar.app.repository.dynamodb;

import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.ProgressSnapshot;
import com.cario.scholar.app.model.Session;
import com.cario.scholar.app.repository.ProgressLedger;
import com.cario.scholar.app.repository.ProgressStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * {@link ProgressStore} over two DynamoDB tables: a session index and a per-session item table.
 *
 * <p>Writes are synchronous puts, so a returned call is durable. Mutations are serialized within
 * this process. A new session claims its id with a conditional put before any item is written.
 * Session counters are rebuilt from the items whenever interrupted items are requeued.
 */
@Log4j2
public class DynamoDbProgressStore implements ProgressStore {

  private static final Expression SESSION_ABSENT =
      Expression.builder().expression("attribute_not_exists(sessionId)").build();
  private static final int CREATE_ATTEMPTS = 3;

  private final DynamoDbTable<SessionItem> sessionTable;
  private final DynamoDbTable<ItemStatusItem> itemTable;
  private final Clock clock;

  public DynamoDbProgressStore(DynamoDbClient ddb, String sessionTableName, String itemTableName) {
    this(
        DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build(),
        sessionTableName,
        itemTableName,
        Clock.systemUTC());
  }

  DynamoDbProgressStore(
      DynamoDbEnhancedClient enhanced,
      String sessionTableName,
      String itemTableName,
      Clock clock) {
    this(
        enhanced.table(sessionTableName, TableSchema.fromBean(SessionItem.class)),
        enhanced.table(itemTableName, TableSchema.fromBean(ItemStatusItem.class)),
        clock);
  }

  DynamoDbProgressStore(
      DynamoDbTable<SessionItem> sessionTable, DynamoDbTable<ItemStatusItem> itemTable, Clock clock) {
    this.sessionTable = Objects.requireNonNull(sessionTable, "sessionTable");
    this.itemTable = Objects.requireNonNull(itemTable, "itemTable");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  // -------- Sessions --------

  @Override
  public synchronized Session createSession(String sourceDescriptor, List<String> recordIds) {
    Objects.requireNonNull(recordIds, "recordIds");
    LinkedHashSet<String> ids = new LinkedHashSet<>();
    for (String id : recordIds) {
      if (id != null && !id.isBlank()) {
        ids.add(id);
      }
    }
    Session session = claimSession(sourceDescriptor, ids.size());

    int seq = 0;
    for (String id : ids) {
      itemTable.putItem(toItem(session.getSessionId(), seq++, ItemRecord.pending(id)));
    }
    log.info(
        "progress.ddb.session.created id={} source={} total={}",
        session.getSessionId(),
        sourceDescriptor,
        session.getTotalItems());
    return session;
  }

  /** Writes a new session under an id no other session holds. */
  private Session claimSession(String sourceDescriptor, int total) {
    for (int attempt = 1; ; attempt++) {
      Session session = ProgressLedger.newSession(sourceDescriptor, total, clock.instant());
      try {
        sessionTable.putItem(
            PutItemEnhancedRequest.builder(SessionItem.class)
                .item(toItem(session))
                .conditionExpression(SESSION_ABSENT)
                .build());
        return session;
      } catch (ConditionalCheckFailedException e) {
        log.warn("progress.ddb.session.idTaken id={} attempt={}", session.getSessionId(), attempt);
        if (attempt >= CREATE_ATTEMPTS) {
          throw new IllegalStateException(
              "Could not allocate a free session id after " + attempt + " attempts", e);
        }
      }
    }
  }

  @Override
  public synchronized Optional<Session> getSession(String sessionId) {
    if (sessionId == null) return Optional.empty();
    return Optional.ofNullable(sessionTable.getItem(key(sessionId)))
        .map(DynamoDbProgressStore::fromItem);
  }

  @Override
  public synchronized List<Session> listSessions(ProcessingStatus filter) {
    List<Session> out = new ArrayList<>();
    for (SessionItem item : sessionTable.scan().items()) {
      Session s = fromItem(item);
      if (filter == null || s.getStatus() == filter) {
        out.add(s);
      }
    }
    out.sort(Comparator.comparing(Session::getCreatedAt).reversed());
    return out;
  }

  @Override
  public synchronized Session updateSessionProgress(String sessionId, int inserted, int updated) {
    Session session = require(sessionId);
    session.setInsertedCount(session.getInsertedCount() + inserted);
    session.setUpdatedCount(session.getUpdatedCount() + updated);
    session.setUpdatedAt(clock.instant());
    sessionTable.putItem(toItem(session));
    return session;
  }

  @Override
  public synchronized Session updateSessionStatus(
      String sessionId, ProcessingStatus status, String error) {
    Session session = require(sessionId);
    session.setStatus(Objects.requireNonNull(status, "status"));
    session.setErrorMessage(error);
    session.setUpdatedAt(clock.instant());
    sessionTable.putItem(toItem(session));
    log.info("progress.ddb.session.status id={} status={} err={}", sessionId, status, error);
    return session;
  }

  @Override
  public synchronized Session markQuotaExhausted(String sessionId, int credentialIndex) {
    Session session = require(sessionId);
    Instant now = clock.instant();
    session.setStatus(ProcessingStatus.API_EXHAUSTED);
    session.setActiveCredentialIndex(credentialIndex);
    session.setQuotaExhaustedAt(now);
    session.setUpdatedAt(now);
    sessionTable.putItem(toItem(session));
    log.warn(
        "progress.ddb.session.quotaExhausted id={} credentialIndex={}", sessionId, credentialIndex);
    return session;
  }

  @Override
  public synchronized boolean deleteSession(String sessionId) {
    if (getSession(sessionId).isEmpty()) {
      return false;
    }
    for (ItemStatusItem item : queryItems(sessionId)) {
      itemTable.deleteItem(
          Key.builder().partitionValue(sessionId).sortValue(item.getRecordId()).build());
    }
    sessionTable.deleteItem(key(sessionId));
    log.info("progress.ddb.session.deleted id={}", sessionId);
    return true;
  }

  @Override
  public synchronized int cleanupCompletedSessions(Duration keep) {
    Instant cutoff = clock.instant().minus(keep);
    int removed = 0;
    for (Session s : listSessions(ProcessingStatus.COMPLETED)) {
      if (s.getUpdatedAt() != null && s.getUpdatedAt().isBefore(cutoff)) {
        deleteSession(s.getSessionId());
        removed++;
      }
    }
    return removed;
  }

  // -------- Items --------

  @Override
  public synchronized List<String> getPendingIds(String sessionId) {
    require(sessionId);
    List<String> ids = new ArrayList<>();
    for (ItemStatusItem item : queryItems(sessionId)) {
      String status = item.getStatus();
      if ("pending".equals(status) || "failed".equals(status)) {
        ids.add(item.getRecordId());
      }
    }
    return ids;
  }

  @Override
  public synchronized List<ItemRecord> getItems(String sessionId, ProcessingStatus filter) {
    require(sessionId);
    return queryItems(sessionId).stream()
        .map(DynamoDbProgressStore::fromItem)
        .filter(i -> filter == null || i.getStatus() == filter)
        .toList();
  }

  @Override
  public synchronized ItemRecord updateItemStatus(
      String sessionId, String recordId, ProcessingStatus status, String error, Long durationMs) {
    Session session = require(sessionId);
    ItemStatusItem stored =
        itemTable.getItem(Key.builder().partitionValue(sessionId).sortValue(recordId).build());
    if (stored == null) {
      throw new IllegalArgumentException("Unknown record " + recordId + " in session " + sessionId);
    }
    ItemRecord item = fromItem(stored);
    ProgressLedger.applyItemTransition(session, item, status, error, durationMs, clock.instant());
    itemTable.putItem(toItem(sessionId, stored.getSeq(), item));
    sessionTable.putItem(toItem(session));
    return item;
  }

  @Override
  public synchronized int requeueInterrupted(String sessionId) {
    Session session = require(sessionId);
    List<ItemStatusItem> stored = queryItems(sessionId);
    boolean repaired =
        ProgressLedger.reconcileCounters(
            session, stored.stream().map(DynamoDbProgressStore::fromItem).toList());
    if (repaired) {
      log.warn(
          "progress.ddb.session.counters repaired id={} processed={} failed={} skipped={}",
          sessionId,
          session.getProcessedCount(),
          session.getFailedCount(),
          session.getSkippedCount());
    }
    int moved = 0;
    for (ItemStatusItem row : stored) {
      if ("in_progress".equals(row.getStatus())) {
        ItemRecord item = fromItem(row);
        ProgressLedger.applyItemTransition(
            session, item, ProcessingStatus.FAILED, "interrupted", null, clock.instant());
        itemTable.putItem(toItem(sessionId, row.getSeq(), item));
        moved++;
      }
    }
    if (moved > 0 || repaired) {
      sessionTable.putItem(toItem(session));
    }
    if (moved > 0) {
      log.info("progress.ddb.requeue id={} items={}", sessionId, moved);
    }
    return moved;
  }

  @Override
  public synchronized ProgressSnapshot getProgressSnapshot(String sessionId) {
    Session session = require(sessionId);
    List<ItemRecord> items = queryItems(sessionId).stream().map(DynamoDbProgressStore::fromItem).toList();
    return ProgressLedger.snapshot(session, items);
  }

  // -------- Mapping --------

  private Session require(String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
    SessionItem item = sessionTable.getItem(key(sessionId));
    if (item == null) {
      throw new IllegalArgumentException("Unknown session " + sessionId);
    }
    return fromItem(item);
  }

  private List<ItemStatusItem> queryItems(String sessionId) {
    List<ItemStatusItem> out = new ArrayList<>();
    itemTable
        .query(QueryConditional.keyEqualTo(key(sessionId)))
        .items()
        .forEach(out::add);
    out.sort(Comparator.comparing(i -> i.getSeq() == null ? Integer.MAX_VALUE : i.getSeq()));
    return out;
  }

  private static Key key(String sessionId) {
    return Key.builder().partitionValue(sessionId).build();
  }

  static SessionItem toItem(Session s) {
    return SessionItem.builder()
        .sessionId(s.getSessionId())
        .sourceDescriptor(s.getSourceDescriptor())
        .totalItems(s.getTotalItems())
        .processedCount(s.getProcessedCount())
        .failedCount(s.getFailedCount())
        .skippedCount(s.getSkippedCount())
        .insertedCount(s.getInsertedCount())
        .updatedCount(s.getUpdatedCount())
        .status(s.getStatus().wireName())
        .createdAt(s.getCreatedAt())
        .updatedAt(s.getUpdatedAt())
        .quotaExhaustedAt(s.getQuotaExhaustedAt())
        .activeCredentialIndex(s.getActiveCredentialIndex())
        .errorMessage(s.getErrorMessage())
        .build();
  }

  static Session fromItem(SessionItem i) {
    return Session.builder()
        .sessionId(i.getSessionId())
        .sourceDescriptor(i.getSourceDescriptor())
        .totalItems(nz(i.getTotalItems()))
        .processedCount(nz(i.getProcessedCount()))
        .failedCount(nz(i.getFailedCount()))
        .skippedCount(nz(i.getSkippedCount()))
        .insertedCount(nz(i.getInsertedCount()))
        .updatedCount(nz(i.getUpdatedCount()))
        .status(ProcessingStatus.fromWire(i.getStatus()))
        .createdAt(i.getCreatedAt())
        .updatedAt(i.getUpdatedAt())
        .quotaExhaustedAt(i.getQuotaExhaustedAt())
        .activeCredentialIndex(nz(i.getActiveCredentialIndex()))
        .errorMessage(i.getErrorMessage())
        .build();
  }

  static ItemStatusItem toItem(String sessionId, Integer seq, ItemRecord r) {
    return ItemStatusItem.builder()
        .sessionId(sessionId)
        .recordId(r.getRecordId())
        .seq(seq)
        .status(r.getStatus().wireName())
        .attempts(r.getAttempts())
        .lastAttemptAt(r.getLastAttemptAt())
        .errorMessage(r.getErrorMessage())
        .processingMillis(r.getProcessingMillis())
        .build();
  }

  static ItemRecord fromItem(ItemStatusItem i) {
    return ItemRecord.builder()
        .recordId(i.getRecordId())
        .status(ProcessingStatus.fromWire(i.getStatus()))
        .attempts(nz(i.getAttempts()))
        .lastAttemptAt(i.getLastAttemptAt())
        .errorMessage(i.getErrorMessage())
        .processingMillis(i.getProcessingMillis())
        .build();
  }

  private static int nz(Integer v) {
    return v == null ? 0 : v;
  }
}
