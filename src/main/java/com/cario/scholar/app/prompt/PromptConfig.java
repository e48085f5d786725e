package com.cario.scholar.app.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/** One prompt file: system and user templates plus named rule snippets shared by both. */
@Data
public class PromptConfig {

  @JsonProperty("system")
  private String systemTemplate;

  @JsonProperty("user")
  private String userTemplate;

  @JsonProperty("rules")
  private Map<String, String> rules = Map.of();

  /** Template variables: the rules first, then {@code extra}, which wins on key clashes. */
  public Map<String, Object> variables(Map<String, ?> extra) {
    Map<String, Object> vars = new LinkedHashMap<>();
    if (rules != null) {
      vars.putAll(rules);
    }
    vars.putAll(extra);
    return vars;
  }

  /** Rejects prompt files without both templates. */
  public void validate(String location) {
    if (systemTemplate == null || systemTemplate.isBlank()) {
      throw new IllegalArgumentException("prompt " + location + " has no system template");
    }
    if (userTemplate == null || userTemplate.isBlank()) {
      throw new IllegalArgumentException("prompt " + location + " has no user template");
    }
  }
}
