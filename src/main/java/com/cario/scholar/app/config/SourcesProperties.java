package com.cario.scholar.app.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Endpoints and credentials of the external sources. */
@Data
@ConfigurationProperties(prefix = "sources")
public class SourcesProperties {

  private Arxiv arxiv = new Arxiv();
  private Orcid orcid = new Orcid();
  private Tavily tavily = new Tavily();
  private OpenAlex openalex = new OpenAlex();

  @Data
  public static class Arxiv {
    private String baseUrl = "https://export.arxiv.org";
    private int pageSize = 100;
    private int idBatchSize = 50;
    private Duration pageDelay = Duration.ofSeconds(3);
    private int maxRetries = 3;
  }

  @Data
  public static class Orcid {
    private String baseUrl = "https://pub.orcid.org/v3.0";
  }

  @Data
  public static class Tavily {
    private String baseUrl = "https://api.tavily.com";
    /** Rotated in order when one hits its usage limit. */
    private List<String> apiKeys = new ArrayList<>();
    private String searchDepth = "advanced";
    private int maxResults = 5;
  }

  @Data
  public static class OpenAlex {
    private String baseUrl = "https://api.openalex.org";
    private String mailto;
  }
}
