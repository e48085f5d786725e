package com.cario.scholar.app.service.client;

import com.cario.scholar.app.model.WebSearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/** Web search over the Tavily API. The API key is passed per call so callers can rotate keys. */
@Log4j2
public class TavilySearchClient {

  private final WebClient webClient;
  private final String searchDepth;
  private final int maxResults;

  public TavilySearchClient(
      WebClient.Builder builder, String baseUrl, String searchDepth, int maxResults) {
    this.webClient =
        builder
            .clone()
            .baseUrl(baseUrl)
            .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
            .build();
    this.searchDepth = searchDepth;
    this.maxResults = maxResults;
  }

  public WebSearchResult search(String query, String apiKey) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("query", query);
    body.put("search_depth", searchDepth);
    body.put("include_answer", true);
    body.put("max_results", maxResults);

    JsonNode resp =
        webClient
            .post()
            .uri("/search")
            .header("Authorization", "Bearer " + apiKey)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnError(e -> log.error("tavily.request failed err={}", e.getMessage()))
            .block();

    WebSearchResult.WebSearchResultBuilder b = WebSearchResult.builder();
    if (resp != null) {
      JsonNode answer = resp.path("answer");
      b.answer(answer.isTextual() ? answer.asText() : null);
      for (JsonNode r : resp.path("results")) {
        b.hit(
            WebSearchResult.Hit.builder()
                .title(r.path("title").asText(""))
                .url(r.path("url").asText(""))
                .content(r.path("content").asText(""))
                .build());
      }
    }
    WebSearchResult result = b.build();
    log.info("tavily.search query={} hits={}", query, result.getHits().size());
    return result;
  }
}
