package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** Citation metrics for an author. */
@Value
@Builder(toBuilder = true)
public class AcademicMetrics {
  Integer citations;
  Integer hIndex;
  Integer i10Index;
}
