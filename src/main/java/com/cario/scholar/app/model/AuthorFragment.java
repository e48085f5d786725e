package com.cario.scholar.app.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Enrichment data gathered for one author of one record. Every field is optional. */
@Value
@Builder(toBuilder = true)
public class AuthorFragment {

  /** Author name exactly as it appears in the record's author list. */
  String name;

  /** Free-text affiliation strings, in the order the source reported them. */
  @Builder.Default List<String> affiliations = List.of();

  String email;

  /** Identity-registry id (ORCID iD). */
  String registryId;

  /** Role data keyed by the affiliation string it was matched against. */
  @Builder.Default Map<String, RoleAssignment> roles = Map.of();

  AcademicMetrics metrics;

  public static AuthorFragment named(String name) {
    return AuthorFragment.builder().name(name).build();
  }
}
