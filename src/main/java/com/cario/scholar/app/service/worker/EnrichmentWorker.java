package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.WorkerOutcome;

/**
 * One enrichment source. Implementations never throw: every error ends up in the returned
 * outcome.
 */
public interface EnrichmentWorker {

  /** Short source name used in logs and quota reports. */
  String source();

  /**
   * @param current everything gathered for the record by earlier stages; empty for the first
   * @return data this source adds, to be merged by the caller
   */
  WorkerOutcome<EnrichmentFragment> enrich(RawRecord record, EnrichmentFragment current);
}
