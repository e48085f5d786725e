package com.cario.scholar.app.model;

import lombok.Builder;
import lombok.Value;

/** Session counters plus derived pending count and completion percentage. */
@Value
@Builder
public class ProgressSnapshot {
  Session session;
  int pendingItems;
  int inProgressItems;
  double progressPercentage;
}
