package com.cario.scholar.app.model;

import lombok.Value;

/** A fetched record joined with its merged enrichment. */
@Value
public class EnrichedRecord {
  RawRecord record;
  EnrichmentFragment fragment;
}
