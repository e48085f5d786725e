package com.cario.scholar.app.model;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** One row of the institution reference directory. */
@Value
@Builder
public class InstitutionRecord {

  /** Canonical display name. */
  String name;

  String country;

  /** Rank per ranking system, e.g. "QS 2025" -> 47. */
  @Singular Map<String, Integer> ranks;
}
