package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** Role of a person at one institution. Dates use YYYY-MM-DD, YYYY-MM or YYYY. */
@Value
@Builder(toBuilder = true)
public class RoleAssignment {

  String role;
  String department;
  String startDate;
  String endDate;

  /** Where the role came from. */
  RoleSource source;

  public enum RoleSource {
    REGISTRY_EMPLOYMENT,
    REGISTRY_EDUCATION,
    WEB_SEARCH
  }
}
