package com.cario.scholar.app.repository.dynamodb;

import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Per-item status row. Partition key: session id; sort key: record id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ItemStatusItem {

  private String sessionId;

  private String recordId;

  /** Position in the session's input list. */
  private Integer seq;

  private String status;

  private Integer attempts;

  private Instant lastAttemptAt;

  private String errorMessage;

  private Long processingMillis;

  @DynamoDbPartitionKey
  @DynamoDbAttribute("sessionId")
  public String getSessionId() {
    return sessionId;
  }

  @DynamoDbSortKey
  @DynamoDbAttribute("recordId")
  public String getRecordId() {
    return recordId;
  }
}
