package com.cario.scholar.app.model;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** What a run of the orchestrator did to a session. */
@Value
@Builder
public class IngestReport {

  String sessionId;

  ProcessingStatus status;

  int totalItems;
  int processed;
  int failed;
  int skipped;
  int inserted;
  int updated;

  /** Error message per failed record id, for this run. */
  @Singular Map<String, String> itemErrors;

  /** Set when the session can be resumed later. */
  String resumeHint;

  String errorMessage;
}
