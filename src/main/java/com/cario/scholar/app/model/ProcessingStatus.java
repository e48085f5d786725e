package com.cario.scholar.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle status shared by sessions and their items. */
public enum ProcessingStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  /** Session only: every credential of some source hit its usage limit. */
  API_EXHAUSTED,
  PAUSED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ProcessingStatus fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    return ProcessingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
