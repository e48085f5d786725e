package com.cario.scholar.app.service;

import com.cario.scholar.app.model.EnrichedRecord;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Outcome of one fan-out over a slice of records. */
@Value
@Builder
public class FanoutResult {

  /** Records whose every stage completed, in input order. */
  @Singular List<EnrichedRecord> records;

  boolean quotaExhausted;

  /** Source whose credentials ran out first; null without a quota signal. */
  String exhaustedSource;

  int credentialIndex;

  /** Record id to the reasons of the stages that gave up on an otherwise completed record. */
  @Singular Map<String, String> warnings;

  /** Record id to failure reason, for records whose chain broke unexpectedly. */
  @Singular Map<String, String> failures;

  /** Records that were dispatched but cut short by the quota signal. */
  @Singular List<String> quotaHitIds;

  /** Records never dispatched because the quota signal came first. */
  @Singular List<String> undispatchedIds;
}
