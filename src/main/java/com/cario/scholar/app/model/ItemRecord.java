package com.cario.scholar.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Processing status of one record within a session. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ItemRecord {

  private String recordId;

  private ProcessingStatus status;

  /** Only ever increases. */
  private int attempts;

  private Instant lastAttemptAt;

  private String errorMessage;

  private Long processingMillis;

  public static ItemRecord pending(String recordId) {
    return ItemRecord.builder().recordId(recordId).status(ProcessingStatus.PENDING).build();
  }
}
