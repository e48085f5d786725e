package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** The profile entry that best matched an affiliation string, with its score. */
@Value
@Builder
public class MatchedAffiliation {

  ProfileEntry entry;

  AffiliationKind kind;

  double score;

  public String getStartDate() {
    return entry.getStartDate();
  }

  public String getEndDate() {
    return entry.getEndDate();
  }
}
