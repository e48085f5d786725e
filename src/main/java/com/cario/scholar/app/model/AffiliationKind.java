package com.cario.scholar.app.model;

/** Which history list of a person profile an entry came from. */
public enum AffiliationKind {
  EMPLOYMENT,
  EDUCATION
}
