package com.cario.scholar.app.service;

import com.cario.scholar.app.model.AcademicMetrics;
import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.RoleAssignment;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines fragments of the same record.
 *
 * <p>Field rule: the first non-null value wins and later values never overwrite it. An empty
 * affiliation list counts as null. Authors are keyed by name; the first fragment's author order is
 * kept and authors only present in the second are appended.
 */
public final class FragmentMerger {

  private FragmentMerger() {}

  public static EnrichmentFragment merge(EnrichmentFragment first, EnrichmentFragment second) {
    if (first == null) return second;
    if (second == null) return first;
    if (!Objects.equals(first.getRecordId(), second.getRecordId())) {
      throw new IllegalArgumentException(
          "cannot merge fragments of " + first.getRecordId() + " and " + second.getRecordId());
    }
    Map<String, AuthorFragment> merged = new LinkedHashMap<>(first.getAuthors());
    for (AuthorFragment b : second.getAuthors().values()) {
      merged.merge(b.getName(), b, FragmentMerger::mergeAuthor);
    }
    return EnrichmentFragment.of(first.getRecordId(), merged);
  }

  public static EnrichmentFragment mergeAll(String recordId, List<EnrichmentFragment> fragments) {
    EnrichmentFragment acc = EnrichmentFragment.empty(recordId);
    for (EnrichmentFragment f : fragments) {
      acc = merge(acc, f);
    }
    return acc;
  }

  public static AuthorFragment mergeAuthor(AuthorFragment a, AuthorFragment b) {
    Map<String, RoleAssignment> roles = new LinkedHashMap<>(a.getRoles());
    b.getRoles().forEach((aff, role) -> roles.merge(aff, role, FragmentMerger::mergeRole));
    return AuthorFragment.builder()
        .name(a.getName())
        .affiliations(a.getAffiliations().isEmpty() ? b.getAffiliations() : a.getAffiliations())
        .email(firstNonNull(a.getEmail(), b.getEmail()))
        .registryId(firstNonNull(a.getRegistryId(), b.getRegistryId()))
        .roles(roles)
        .metrics(mergeMetrics(a.getMetrics(), b.getMetrics()))
        .build();
  }

  static RoleAssignment mergeRole(RoleAssignment a, RoleAssignment b) {
    return RoleAssignment.builder()
        .role(firstNonNull(a.getRole(), b.getRole()))
        .department(firstNonNull(a.getDepartment(), b.getDepartment()))
        .startDate(firstNonNull(a.getStartDate(), b.getStartDate()))
        .endDate(firstNonNull(a.getEndDate(), b.getEndDate()))
        .source(firstNonNull(a.getSource(), b.getSource()))
        .build();
  }

  static AcademicMetrics mergeMetrics(AcademicMetrics a, AcademicMetrics b) {
    if (a == null) return b;
    if (b == null) return a;
    return AcademicMetrics.builder()
        .citations(firstNonNull(a.getCitations(), b.getCitations()))
        .hIndex(firstNonNull(a.getHIndex(), b.getHIndex()))
        .i10Index(firstNonNull(a.getI10Index(), b.getI10Index()))
        .build();
  }

  private static <T> T firstNonNull(T a, T b) {
    return a != null ? a : b;
  }
}
