package com.cario.scholar.app.util;

/** Cleanup of model output before it reaches a JSON parser. */
public final class LlmJson {

  private static final String FENCE = "```";

  private LlmJson() {}

  /**
   * Removes a surrounding Markdown code fence and a leading {@code json} language tag.
   *
   * <p>{@code "```json\n{...}\n```"} becomes {@code "{...}"}. Text without a fence is only trimmed.
   */
  public static String stripCodeFences(String raw) {
    if (raw == null) {
      return "";
    }
    String s = raw.trim();
    if (s.startsWith(FENCE)) {
      s = s.substring(FENCE.length());
      int end = s.lastIndexOf(FENCE);
      if (end >= 0) {
        s = s.substring(0, end);
      }
      s = s.trim();
    }
    if (s.regionMatches(true, 0, "json", 0, 4)) {
      s = s.substring(4).trim();
    }
    return s;
  }
}
