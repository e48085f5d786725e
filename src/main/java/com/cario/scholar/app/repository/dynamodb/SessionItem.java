package com.cario.scholar.app.repository.dynamodb;

import java.time.Instant;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** Session index row. Partition key: session id. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class SessionItem {

  private String sessionId;

  private String sourceDescriptor;

  private Integer totalItems;
  private Integer processedCount;
  private Integer failedCount;
  private Integer skippedCount;
  private Integer insertedCount;
  private Integer updatedCount;

  /** pending | in_progress | completed | failed | api_exhausted | paused. */
  private String status;

  private Instant createdAt;
  private Instant updatedAt;
  private Instant quotaExhaustedAt;

  private Integer activeCredentialIndex;

  private String errorMessage;

  @DynamoDbPartitionKey
  @DynamoDbAttribute("sessionId")
  public String getSessionId() {
    return sessionId;
  }
}
