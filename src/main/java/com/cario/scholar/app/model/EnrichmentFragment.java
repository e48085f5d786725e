package com.cario.scholar.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Partial enrichment produced by one worker for one record, keyed by author name.
 *
 * <p>Authors keep the order in which they were added. Fragments are combined with {@code
 * FragmentMerger}, never overwritten.
 */
@Value
public class EnrichmentFragment {

  String recordId;

  Map<String, AuthorFragment> authors;

  private EnrichmentFragment(String recordId, Map<String, AuthorFragment> authors) {
    this.recordId = recordId;
    this.authors = Collections.unmodifiableMap(new LinkedHashMap<>(authors));
  }

  public static EnrichmentFragment empty(String recordId) {
    return new EnrichmentFragment(recordId, Map.of());
  }

  public static EnrichmentFragment of(String recordId, List<AuthorFragment> authors) {
    Map<String, AuthorFragment> byName = new LinkedHashMap<>();
    for (AuthorFragment a : authors) {
      byName.putIfAbsent(a.getName(), a);
    }
    return new EnrichmentFragment(recordId, byName);
  }

  public static EnrichmentFragment of(String recordId, Map<String, AuthorFragment> authors) {
    return new EnrichmentFragment(recordId, authors);
  }

  public AuthorFragment author(String name) {
    return authors.get(name);
  }

  /** True when at least one author carries a non-empty affiliation list. */
  public boolean hasAffiliations() {
    return authors.values().stream().anyMatch(a -> !a.getAffiliations().isEmpty());
  }
}
