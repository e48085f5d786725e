package com.cario.scholar.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One resumable batch job. Mutated only through {@code ProgressStore}. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Session {

  private String sessionId;

  /** What the batch was built from, e.g. {@code arxiv:cs.AI,cs.CV:last-1d}. */
  private String sourceDescriptor;

  private int totalItems;

  /** Items completed. */
  private int processedCount;

  private int failedCount;

  /** Items paused (not available from the source). */
  private int skippedCount;

  /** Papers newly written. */
  private int insertedCount;

  /** Papers that already existed and were re-enriched. */
  private int updatedCount;

  private ProcessingStatus status;

  private Instant createdAt;

  private Instant updatedAt;

  private Instant quotaExhaustedAt;

  private int activeCredentialIndex;

  private String errorMessage;

  public int settledCount() {
    return processedCount + failedCount + skippedCount;
  }
}
