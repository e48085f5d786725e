package com.cario.scholar.app.model;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** What the relational store already holds about an author. */
@Value
@Builder
public class KnownAuthor {

  String registryId;

  String email;

  /** Stored roles keyed by institution name. */
  @Singular Map<String, RoleAssignment> roles;
}
