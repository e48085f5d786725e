package com.cario.scholar.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Public profile of a person in the identity registry. */
@Value
@Builder
public class PersonProfile {

  String registryId;

  String givenNames;

  String familyName;

  /** Published display name, if the person set one. */
  String creditName;

  @Singular List<String> otherNames;

  @Singular List<String> emails;

  @Singular List<ProfileEntry> employments;

  @Singular List<ProfileEntry> educations;
}
