package com.cario.scholar.app.service.worker;

import java.util.List;
import java.util.Locale;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Decides whether a failure means a usage quota or rate limit was hit.
 *
 * <p>Matches a fixed vocabulary against the message of every cause in the chain and, for HTTP
 * errors, the status line and response body.
 */
public class QuotaErrorClassifier {

  public static final List<String> DEFAULT_PATTERNS =
      List.of(
          "quota",
          "limit",
          "exceeded",
          "rate limit",
          "usage limit",
          "monthly limit",
          "daily limit",
          "429",
          "too many requests");

  private final List<String> patterns;

  public QuotaErrorClassifier() {
    this(DEFAULT_PATTERNS);
  }

  public QuotaErrorClassifier(List<String> patterns) {
    this.patterns =
        (patterns == null || patterns.isEmpty() ? DEFAULT_PATTERNS : patterns)
            .stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
  }

  public boolean isQuotaError(Throwable error) {
    Throwable t = error;
    int depth = 0;
    while (t != null && depth++ < 10) {
      if (t instanceof WebClientResponseException w) {
        if (w.getStatusCode().value() == 429 || matches(w.getResponseBodyAsString())) {
          return true;
        }
      }
      if (matches(t.getMessage())) {
        return true;
      }
      t = t.getCause();
    }
    return false;
  }

  private boolean matches(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String p : patterns) {
      if (lower.contains(p)) {
        return true;
      }
    }
    return false;
  }
}
