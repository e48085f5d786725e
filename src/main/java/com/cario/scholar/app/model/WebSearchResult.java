package com.cario.scholar.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Answer summary plus ranked hits returned by the web search capability. */
@Value
@Builder
public class WebSearchResult {

  String answer;

  @Singular List<Hit> hits;

  @Value
  @Builder
  public static class Hit {
    String title;
    String url;
    String content;
  }
}
