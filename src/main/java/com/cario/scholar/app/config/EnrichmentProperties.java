package com.cario.scholar.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tuning of the enrichment pipeline: slices, ceilings, thresholds, retries and prompts. */
@Data
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentProperties {

  private Batch batch = new Batch();
  private Concurrency concurrency = new Concurrency();
  private Matching matching = new Matching();
  private Retry retry = new Retry();
  private Registry registry = new Registry();
  private Llm llm = new Llm();
  private Document document = new Document();
  private Prompts prompts = new Prompts();
  private Cache cache = new Cache();
  private String directoryLocation = "classpath:reference/institutions.csv";

  @Data
  public static class Batch {
    private int sliceSize = 20;
  }

  /** Concurrent calls allowed per stage. */
  @Data
  public static class Concurrency {
    private int affiliation = 4;
    private int registry = 3;
    private int webRole = 3;
    private int metrics = 3;
    private int executorThreads = 16;
  }

  @Data
  public static class Matching {
    private double directoryThreshold = 0.84;
    private double roleThreshold = 0.86;
  }

  @Data
  public static class Retry {
    private int maxAttempts = 3;
    private Duration delay = Duration.ofSeconds(2);
  }

  @Data
  public static class Registry {
    private int searchRows = 10;
    private int expandedRows = 20;
    private int maxCandidates = 5;
  }

  @Data
  public static class Llm {
    private String model = "gpt-4o-mini";
    private boolean structuredOutput = true;
  }

  @Data
  public static class Document {
    private int maxBytes = 50 * 1024 * 1024;
    private int maxChars = 20_000;
  }

  @Data
  public static class Prompts {
    private String affiliation = "classpath:prompts/affiliation-prompts.yaml";
    private String role = "classpath:prompts/role-prompts.yaml";
  }

  @Data
  public static class Cache {
    private long maxNames = 50_000;
    private Duration registryTtl = Duration.ofHours(6);
  }
}
