package com.cario.scholar.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "progress")
public class ProgressProperties {

  /** {@code file} or {@code dynamodb}. */
  private String backend = "file";

  private String directory = "./progress";

  private String sessionTable = "EnrichmentSessions";

  private String itemTable = "EnrichmentSessionItems";

  /** Completed sessions older than this are removed by the cleanup job. */
  private Duration retention = Duration.ofDays(30);
}
