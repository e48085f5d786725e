package com.cario.scholar.app.service.client;

import com.cario.scholar.app.model.AcademicMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Author citation metrics from OpenAlex, looked up by ORCID iD. */
@Log4j2
public class OpenAlexClient {

  private final WebClient webClient;
  private final String mailto;

  public OpenAlexClient(WebClient.Builder builder, String baseUrl, String mailto) {
    this.webClient = builder.clone().baseUrl(baseUrl).build();
    this.mailto = mailto;
  }

  /** Metrics of the author with this ORCID iD; empty when OpenAlex does not know the iD. */
  public Optional<AcademicMetrics> metricsForOrcid(String orcidId) {
    JsonNode author;
    try {
      author =
          webClient
              .get()
              .uri(
                  uri -> {
                    uri.path("/authors/orcid:{id}");
                    if (mailto != null && !mailto.isBlank()) {
                      uri.queryParam("mailto", mailto);
                    }
                    return uri.build(orcidId);
                  })
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block();
    } catch (WebClientResponseException.NotFound e) {
      log.info("openalex.author.notFound orcid={}", orcidId);
      return Optional.empty();
    }
    if (author == null) {
      return Optional.empty();
    }
    JsonNode stats = author.path("summary_stats");
    AcademicMetrics metrics =
        AcademicMetrics.builder()
            .citations(intOrNull(author.path("cited_by_count")))
            .hIndex(intOrNull(stats.path("h_index")))
            .i10Index(intOrNull(stats.path("i10_index")))
            .build();
    log.debug(
        "openalex.author orcid={} citations={} h={}",
        orcidId,
        metrics.getCitations(),
        metrics.getHIndex());
    return Optional.of(metrics);
  }

  private static Integer intOrNull(JsonNode n) {
    return n.isNumber() ? n.asInt() : null;
  }
}
