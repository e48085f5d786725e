package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** Row counts written while persisting records. */
@Value
@Builder(toBuilder = true)
public class UpsertResult {

  public static final UpsertResult NONE = UpsertResult.builder().build();

  int papersInserted;

  /** Papers whose external id already existed. */
  int papersSkipped;

  int authorsInserted;
  int institutionsInserted;
  int authorAffiliationsInserted;
  int authorAffiliationsUpdated;

  public UpsertResult plus(UpsertResult o) {
    return UpsertResult.builder()
        .papersInserted(papersInserted + o.papersInserted)
        .papersSkipped(papersSkipped + o.papersSkipped)
        .authorsInserted(authorsInserted + o.authorsInserted)
        .institutionsInserted(institutionsInserted + o.institutionsInserted)
        .authorAffiliationsInserted(authorAffiliationsInserted + o.authorAffiliationsInserted)
        .authorAffiliationsUpdated(authorAffiliationsUpdated + o.authorAffiliationsUpdated)
        .build();
  }
}
