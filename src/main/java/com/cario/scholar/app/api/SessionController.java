package com.cario.scholar.app.api;

import com.cario.scholar.app.model.IngestReport;
import com.cario.scholar.app.model.ItemRecord;
import com.cario.scholar.app.model.ProcessingStatus;
import com.cario.scholar.app.model.ProgressSnapshot;
import com.cario.scholar.app.model.Session;
import com.cario.scholar.app.repository.ProgressStore;
import com.cario.scholar.app.service.BatchOrchestrator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Batch sessions over HTTP. Runs are synchronous: a start or resume call returns once the session
 * has reached its next resting status.
 */
@Log4j2
@Validated
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final BatchOrchestrator orchestrator;
  private final ProgressStore progressStore;

  // ------------------------------------------------------------
  // POST /api/sessions
  // ------------------------------------------------------------
  @PostMapping(
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestReport> start(@RequestBody @Validated StartRequest req) {
    String descriptor =
        req.getSourceDescriptor() == null || req.getSourceDescriptor().isBlank()
            ? "ids:" + req.getRecordIds().size()
            : req.getSourceDescriptor();
    log.info("api.sessions.start descriptor={} ids={}", descriptor, req.getRecordIds().size());
    return ResponseEntity.ok(orchestrator.startSession(descriptor, req.getRecordIds()));
  }

  // ------------------------------------------------------------
  // POST /api/sessions/ingest
  // ------------------------------------------------------------
  @PostMapping(
      path = "/ingest",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestReport> ingestRecent(@RequestBody @Validated IngestRequest req) {
    log.info(
        "api.sessions.ingest categories={} days={} maxResults={}",
        req.getCategories(),
        req.getDays(),
        req.getMaxResults());
    return ResponseEntity.ok(
        orchestrator.ingestRecent(req.getCategories(), req.getDays(), req.getMaxResults()));
  }

  // ------------------------------------------------------------
  // POST /api/sessions/{id}/resume
  // ------------------------------------------------------------
  @PostMapping(path = "/{sessionId}/resume", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestReport> resume(@PathVariable("sessionId") String sessionId) {
    if (progressStore.getSession(sessionId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    log.info("api.sessions.resume session={}", sessionId);
    return ResponseEntity.ok(orchestrator.resume(sessionId));
  }

  // ------------------------------------------------------------
  // POST /api/sessions/{id}/pause
  // ------------------------------------------------------------
  @PostMapping(path = "/{sessionId}/pause")
  public ResponseEntity<Void> pause(@PathVariable("sessionId") String sessionId) {
    if (progressStore.getSession(sessionId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    orchestrator.requestPause(sessionId);
    return ResponseEntity.accepted().build();
  }

  // ------------------------------------------------------------
  // GET /api/sessions
  // ------------------------------------------------------------
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<Session>> list(
      @RequestParam(name = "status", required = false) String status) {
    return ResponseEntity.ok(progressStore.listSessions(parseStatus(status)));
  }

  // ------------------------------------------------------------
  // GET /api/sessions/{id}
  // ------------------------------------------------------------
  @GetMapping(path = "/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProgressSnapshot> get(@PathVariable("sessionId") String sessionId) {
    if (progressStore.getSession(sessionId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(progressStore.getProgressSnapshot(sessionId));
  }

  // ------------------------------------------------------------
  // GET /api/sessions/{id}/items
  // ------------------------------------------------------------
  @GetMapping(path = "/{sessionId}/items", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<ItemRecord>> items(
      @PathVariable("sessionId") String sessionId,
      @RequestParam(name = "status", required = false) String status) {
    if (progressStore.getSession(sessionId).isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(progressStore.getItems(sessionId, parseStatus(status)));
  }

  // ------------------------------------------------------------
  // DELETE /api/sessions/{id}
  // ------------------------------------------------------------
  @DeleteMapping(path = "/{sessionId}")
  public ResponseEntity<Void> delete(@PathVariable("sessionId") String sessionId) {
    boolean deleted = progressStore.deleteSession(sessionId);
    log.info("api.sessions.delete session={} deleted={}", sessionId, deleted);
    return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  // ============================================================
  // Errors
  // ============================================================
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
    log.warn("api.sessions.badRequest msg={}", ex.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<Map<String, String>> conflict(IllegalStateException ex) {
    log.warn("api.sessions.conflict msg={}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, String>> invalid(MethodArgumentNotValidException ex) {
    String msg =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .findFirst()
            .orElse("invalid request");
    return ResponseEntity.badRequest().body(Map.of("error", msg));
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class StartRequest {
    private String sourceDescriptor;
    @NotEmpty private List<String> recordIds;
  }

  @Data
  public static class IngestRequest {
    @NotEmpty private List<String> categories;

    @Min(1)
    @Max(30)
    private int days = 1;

    @Min(1)
    @Max(10000)
    private int maxResults = 500;
  }

  // ============================================================
  // Helpers
  // ============================================================
  private static ProcessingStatus parseStatus(String status) {
    return status == null || status.isBlank() ? null : ProcessingStatus.fromWire(status);
  }
}
