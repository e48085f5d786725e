package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** One employment or education entry of a registry profile. */
@Value
@Builder
public class ProfileEntry {
  String organization;
  String department;
  String roleTitle;

  /** Normalized YYYY-MM-DD / YYYY-MM / YYYY, or null. */
  String startDate;

  String endDate;
}
