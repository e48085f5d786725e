package com.cario.scholar.app.service.matching;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Folded comparison keys of one name.
 *
 * @param variants folded text variants, in generation order
 * @param acronym folded acronym, empty when the name has fewer than two significant tokens
 * @param afterFirstComma folded text after the first comma, empty when there is none
 */
public record NameKeys(Set<String> variants, String acronym, String afterFirstComma) {

  public NameKeys {
    variants = Collections.unmodifiableSet(new LinkedHashSet<>(variants));
  }

  public boolean isEmpty() {
    return variants.isEmpty() && acronym.isEmpty();
  }

  /** Keys compared by the fuzzy pass: the variants, then the text after the first comma and the acronym. */
  public Set<String> fuzzyKeys() {
    Set<String> out = new LinkedHashSet<>(variants);
    if (!afterFirstComma.isEmpty()) {
      out.add(afterFirstComma);
    }
    if (!acronym.isEmpty()) {
      out.add(acronym);
    }
    return out;
  }
}
