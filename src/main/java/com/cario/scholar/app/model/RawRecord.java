package com.cario.scholar.app.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A bibliographic record as fetched from the source feed, before enrichment.
 *
 * <p>The author list is authoritative: enrichment attaches data to these names but never adds,
 * removes or reorders them.
 */
@Value
@Builder
public class RawRecord {

  /** Stable source identifier, e.g. {@code 2401.01234} (version suffix stripped). */
  String id;

  String title;

  /** Abstract text. */
  String summary;

  /** Ordered author display names. */
  @Singular List<String> authors;

  /** Primary category first, then the rest, deduplicated. */
  @Singular List<String> categories;

  /** Locator of the full document (pdf). */
  String pdfUrl;

  String doi;

  Instant published;

  Instant updated;
}
