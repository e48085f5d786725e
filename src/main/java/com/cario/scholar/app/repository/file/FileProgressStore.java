package com.cario.scholar.app.repository.file;

import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.ProgressSnapshot;
import com.cario.scholar.app.model.Session;
import com.cario.scholar.app.repository.ProgressLedger;
import com.cario.scholar.app.repository.ProgressStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * {@link ProgressStore} over JSON files.
 *
 * <p>Layout under the base directory:
 *
 * <pre>
 *   sessions.json                      session index keyed by session id
 *   records/{sessionId}_records.json   item statuses of one session, in input order
 * </pre>
 *
 * Files are rewritten through a temp file and an atomic rename, synced before the call returns.
 */
@Log4j2
public class FileProgressStore implements ProgressStore {

  private static final String SESSIONS_FILE = "sessions.json";
  private static final String RECORDS_DIR = "records";

  private final Path baseDir;
  private final Clock clock;
  private final ObjectMapper om =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .build();

  private final Map<String, Session> sessions;
  private final Map<String, LinkedHashMap<String, ItemRecord>> itemsBySession = new HashMap<>();

  public FileProgressStore(Path baseDir) {
    this(baseDir, Clock.systemUTC());
  }

  public FileProgressStore(Path baseDir, Clock clock) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    this.clock = Objects.requireNonNull(clock, "clock");
    try {
      Files.createDirectories(baseDir.resolve(RECORDS_DIR));
    } catch (IOException e) {
      throw new RuntimeException("Cannot create progress directory " + baseDir, e);
    }
    this.sessions = loadSessions();
    int repaired = 0;
    for (Session session : sessions.values()) {
      if (session.getStatus() != ProcessingStatus.COMPLETED && reconcile(session)) {
        repaired++;
      }
    }
    if (repaired > 0) {
      writeSessions();
    }
    log.info("progress.file.init dir={} sessions={} repaired={}", baseDir, sessions.size(), repaired);
  }

  // -------- Sessions --------

  @Override
  public synchronized Session createSession(String sourceDescriptor, List<String> recordIds) {
    Objects.requireNonNull(recordIds, "recordIds");
    LinkedHashMap<String, ItemRecord> items = new LinkedHashMap<>();
    for (String id : recordIds) {
      if (id != null && !id.isBlank()) {
        items.putIfAbsent(id, ItemRecord.pending(id));
      }
    }
    Session session = ProgressLedger.newSession(sourceDescriptor, items.size(), clock.instant());
    while (sessions.containsKey(session.getSessionId())) {
      session = ProgressLedger.newSession(sourceDescriptor, items.size(), clock.instant());
    }

    itemsBySession.put(session.getSessionId(), items);
    writeItems(session.getSessionId(), items);
    sessions.put(session.getSessionId(), session);
    writeSessions();
    log.info(
        "progress.session.created id={} source={} total={}",
        session.getSessionId(),
        sourceDescriptor,
        session.getTotalItems());
    return copy(session);
  }

  @Override
  public synchronized Optional<Session> getSession(String sessionId) {
    return Optional.ofNullable(sessions.get(sessionId)).map(FileProgressStore::copy);
  }

  @Override
  public synchronized List<Session> listSessions(ProcessingStatus filter) {
    return sessions.values().stream()
        .filter(s -> filter == null || s.getStatus() == filter)
        .sorted(Comparator.comparing(Session::getCreatedAt).reversed())
        .map(FileProgressStore::copy)
        .toList();
  }

  @Override
  public synchronized Session updateSessionProgress(String sessionId, int inserted, int updated) {
    Session session = require(sessionId);
    session.setInsertedCount(session.getInsertedCount() + inserted);
    session.setUpdatedCount(session.getUpdatedCount() + updated);
    session.setUpdatedAt(clock.instant());
    writeSessions();
    return copy(session);
  }

  @Override
  public synchronized Session updateSessionStatus(
      String sessionId, ProcessingStatus status, String error) {
    Session session = require(sessionId);
    session.setStatus(Objects.requireNonNull(status, "status"));
    session.setErrorMessage(error);
    session.setUpdatedAt(clock.instant());
    writeSessions();
    log.info("progress.session.status id={} status={} err={}", sessionId, status, error);
    return copy(session);
  }

  @Override
  public synchronized Session markQuotaExhausted(String sessionId, int credentialIndex) {
    Session session = require(sessionId);
    Instant now = clock.instant();
    session.setStatus(ProcessingStatus.API_EXHAUSTED);
    session.setActiveCredentialIndex(credentialIndex);
    session.setQuotaExhaustedAt(now);
    session.setUpdatedAt(now);
    writeSessions();
    log.warn("progress.session.quotaExhausted id={} credentialIndex={}", sessionId, credentialIndex);
    return copy(session);
  }

  @Override
  public synchronized boolean deleteSession(String sessionId) {
    if (sessions.remove(sessionId) == null) {
      return false;
    }
    itemsBySession.remove(sessionId);
    writeSessions();
    try {
      Files.deleteIfExists(recordsPath(sessionId));
    } catch (IOException e) {
      log.error("progress.session.delete records file failed id={}", sessionId, e);
      throw new RuntimeException("Failed to delete records of session " + sessionId, e);
    }
    log.info("progress.session.deleted id={}", sessionId);
    return true;
  }

  @Override
  public synchronized int cleanupCompletedSessions(Duration keep) {
    Instant cutoff = clock.instant().minus(keep);
    List<String> expired =
        sessions.values().stream()
            .filter(s -> s.getStatus() == ProcessingStatus.COMPLETED)
            .filter(s -> s.getUpdatedAt() != null && s.getUpdatedAt().isBefore(cutoff))
            .map(Session::getSessionId)
            .toList();
    expired.forEach(this::deleteSession);
    if (!expired.isEmpty()) {
      log.info("progress.cleanup removed={} keep={}", expired.size(), keep);
    }
    return expired.size();
  }

  // -------- Items --------

  @Override
  public synchronized List<String> getPendingIds(String sessionId) {
    require(sessionId);
    List<String> ids = new ArrayList<>();
    for (ItemRecord item : items(sessionId).values()) {
      if (item.getStatus() == ProcessingStatus.PENDING
          || item.getStatus() == ProcessingStatus.FAILED) {
        ids.add(item.getRecordId());
      }
    }
    return ids;
  }

  @Override
  public synchronized List<ItemRecord> getItems(String sessionId, ProcessingStatus filter) {
    require(sessionId);
    return items(sessionId).values().stream()
        .filter(i -> filter == null || i.getStatus() == filter)
        .map(i -> i.toBuilder().build())
        .toList();
  }

  @Override
  public synchronized ItemRecord updateItemStatus(
      String sessionId, String recordId, ProcessingStatus status, String error, Long durationMs) {
    Session session = require(sessionId);
    LinkedHashMap<String, ItemRecord> items = items(sessionId);
    ItemRecord item = items.get(recordId);
    if (item == null) {
      throw new IllegalArgumentException("Unknown record " + recordId + " in session " + sessionId);
    }
    ProgressLedger.applyItemTransition(session, item, status, error, durationMs, clock.instant());
    writeItems(sessionId, items);
    writeSessions();
    log.debug("progress.item id={} record={} status={}", sessionId, recordId, status);
    return item.toBuilder().build();
  }

  @Override
  public synchronized int requeueInterrupted(String sessionId) {
    Session session = require(sessionId);
    LinkedHashMap<String, ItemRecord> items = items(sessionId);
    boolean repaired = reconcile(session);
    int moved = 0;
    for (ItemRecord item : items.values()) {
      if (item.getStatus() == ProcessingStatus.IN_PROGRESS) {
        ProgressLedger.applyItemTransition(
            session, item, ProcessingStatus.FAILED, "interrupted", null, clock.instant());
        moved++;
      }
    }
    if (moved > 0) {
      writeItems(sessionId, items);
      log.info("progress.requeue id={} items={}", sessionId, moved);
    }
    if (moved > 0 || repaired) {
      writeSessions();
    }
    return moved;
  }

  @Override
  public synchronized ProgressSnapshot getProgressSnapshot(String sessionId) {
    Session session = require(sessionId);
    return ProgressLedger.snapshot(copy(session), items(sessionId).values());
  }

  // -------- File helpers --------

  private Session require(String sessionId) {
    validateId(sessionId);
    Session session = sessions.get(sessionId);
    if (session == null) {
      throw new IllegalArgumentException("Unknown session " + sessionId);
    }
    return session;
  }

  private boolean reconcile(Session session) {
    boolean changed = ProgressLedger.reconcileCounters(session, items(session.getSessionId()).values());
    if (changed) {
      log.warn(
          "progress.session.counters repaired id={} processed={} failed={} skipped={}",
          session.getSessionId(),
          session.getProcessedCount(),
          session.getFailedCount(),
          session.getSkippedCount());
    }
    return changed;
  }

  private LinkedHashMap<String, ItemRecord> items(String sessionId) {
    return itemsBySession.computeIfAbsent(sessionId, this::loadItems);
  }

  private Map<String, Session> loadSessions() {
    Path path = baseDir.resolve(SESSIONS_FILE);
    if (!Files.exists(path)) {
      return new LinkedHashMap<>();
    }
    try {
      return om.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, Session>>() {});
    } catch (IOException e) {
      log.error("progress.file.read failed path={}", path, e);
      throw new RuntimeException("Failed to read session index " + path, e);
    }
  }

  private LinkedHashMap<String, ItemRecord> loadItems(String sessionId) {
    Path path = recordsPath(sessionId);
    LinkedHashMap<String, ItemRecord> out = new LinkedHashMap<>();
    if (!Files.exists(path)) {
      return out;
    }
    try {
      List<ItemRecord> list = om.readValue(path.toFile(), new TypeReference<List<ItemRecord>>() {});
      for (ItemRecord item : list) {
        out.put(item.getRecordId(), item);
      }
      return out;
    } catch (IOException e) {
      log.error("progress.file.read failed path={}", path, e);
      throw new RuntimeException("Failed to read items of session " + sessionId, e);
    }
  }

  private void writeSessions() {
    writeAtomically(baseDir.resolve(SESSIONS_FILE), sessions);
  }

  private void writeItems(String sessionId, LinkedHashMap<String, ItemRecord> items) {
    writeAtomically(recordsPath(sessionId), new ArrayList<>(items.values()));
  }

  private void writeAtomically(Path target, Object value) {
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      byte[] bytes = om.writeValueAsBytes(value);
      Files.write(
          tmp,
          bytes,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE,
          StandardOpenOption.SYNC);
      try {
        Files.move(
            tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      log.error("progress.file.write failed path={}", target, e);
      throw new RuntimeException("Failed to write " + target, e);
    }
  }

  private Path recordsPath(String sessionId) {
    return baseDir.resolve(RECORDS_DIR).resolve(sessionId + "_records.json");
  }

  private static Session copy(Session s) {
    return s.toBuilder().build();
  }

  private static void validateId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
  }
}
