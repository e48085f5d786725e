package com.cario.scholar.app.service.matching;

import com.cario.scholar.app.model.AffiliationKind;
import com.cario.scholar.app.model.MatchedAffiliation;
import com.cario.scholar.app.model.PersonProfile;
import com.cario.scholar.app.model.ProfileEntry;
import com.cario.scholar.app.service.CacheState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;

/**
 * Resolves free-text institution names against candidate pools.
 *
 * <p>Matching is tiered. A candidate sharing a folded variant with the target wins outright. Next,
 * a candidate with the same acronym, or whose acronym is written out by the other side ("MIT"
 * against "Massachusetts Institute of Technology"), wins. Otherwise the candidate with the highest
 * pairwise similarity wins, provided it reaches the threshold. The fuzzy pass also compares the
 * text after the first comma and the acronym.
 */
@Log4j2
public class IdentityResolver {

  private final double directoryThreshold;
  private final double roleThreshold;
  private final CacheState cache;

  public IdentityResolver(double directoryThreshold, double roleThreshold, CacheState cache) {
    if (directoryThreshold <= 0 || directoryThreshold > 1 || roleThreshold <= 0 || roleThreshold > 1) {
      throw new IllegalArgumentException("thresholds must be in (0, 1]");
    }
    this.directoryThreshold = directoryThreshold;
    this.roleThreshold = roleThreshold;
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public double getDirectoryThreshold() {
    return directoryThreshold;
  }

  public double getRoleThreshold() {
    return roleThreshold;
  }

  // ---------------------------------------------------------------------
  // Directory lookup
  // ---------------------------------------------------------------------

  /** {@link #bestMatch} at the directory threshold. */
  public <T> Optional<T> bestDirectoryMatch(
      String target, List<T> candidates, Function<T, String> keyFn) {
    return bestMatch(target, candidates, keyFn, directoryThreshold);
  }

  /**
   * Best candidate for {@code target}, or empty when nothing reaches {@code threshold}.
   *
   * @param keyFn extracts the comparison string of a candidate
   */
  public <T> Optional<T> bestMatch(
      String target, List<T> candidates, Function<T, String> keyFn, double threshold) {
    NameKeys t = cache.keys(target);
    if (t.isEmpty() || candidates == null || candidates.isEmpty()) {
      return Optional.empty();
    }

    for (T c : candidates) {
      if (sharesVariant(t, cache.keys(keyFn.apply(c)))) {
        return Optional.of(c);
      }
    }
    for (T c : candidates) {
      if (acronymHit(t, cache.keys(keyFn.apply(c)))) {
        return Optional.of(c);
      }
    }

    T best = null;
    double bestScore = -1.0;
    for (T c : candidates) {
      double score = fuzzyScore(t, cache.keys(keyFn.apply(c)), bestScore);
      if (score > bestScore) {
        bestScore = score;
        best = c;
      }
    }
    if (best != null && bestScore >= threshold) {
      log.debug("resolver.fuzzy target={} score={}", target, bestScore);
      return Optional.of(best);
    }
    return Optional.empty();
  }

  // ---------------------------------------------------------------------
  // Registry profile lookup
  // ---------------------------------------------------------------------

  /**
   * Profile entry that best corroborates {@code affiliation}. Employment beats education when both
   * reach the role threshold.
   */
  public Optional<MatchedAffiliation> bestRoleMatch(String affiliation, PersonProfile profile) {
    NameKeys t = cache.keys(affiliation);
    if (t.isEmpty() || profile == null) {
      return Optional.empty();
    }
    Optional<MatchedAffiliation> employment =
        bestEntry(t, profile.getEmployments(), AffiliationKind.EMPLOYMENT);
    if (employment.isPresent() && employment.get().getScore() >= roleThreshold) {
      return employment;
    }
    Optional<MatchedAffiliation> education =
        bestEntry(t, profile.getEducations(), AffiliationKind.EDUCATION);
    if (education.isPresent() && education.get().getScore() >= roleThreshold) {
      return education;
    }
    return Optional.empty();
  }

  private Optional<MatchedAffiliation> bestEntry(
      NameKeys target, List<ProfileEntry> entries, AffiliationKind kind) {
    ProfileEntry best = null;
    double bestScore = -1.0;
    for (ProfileEntry e : entries) {
      double score =
          Math.max(similarity(target, e.getOrganization()), similarity(target, e.getDepartment()));
      if (score > bestScore) {
        bestScore = score;
        best = e;
      }
    }
    if (best == null) {
      return Optional.empty();
    }
    return Optional.of(MatchedAffiliation.builder().entry(best).kind(kind).score(bestScore).build());
  }

  // ---------------------------------------------------------------------
  // Scoring
  // ---------------------------------------------------------------------

  /** Similarity in [0, 1]; exact and acronym hits score 1. */
  public double similarity(String a, String b) {
    return similarity(cache.keys(a), b);
  }

  private double similarity(NameKeys target, String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return 0.0;
    }
    NameKeys c = cache.keys(candidate);
    if (sharesVariant(target, c) || acronymHit(target, c)) {
      return 1.0;
    }
    return Math.max(0.0, fuzzyScore(target, c, -1.0));
  }

  static boolean sharesVariant(NameKeys a, NameKeys b) {
    for (String v : a.variants()) {
      if (b.variants().contains(v)) {
        return true;
      }
    }
    return false;
  }

  static boolean acronymHit(NameKeys a, NameKeys b) {
    return (!b.acronym().isEmpty() && a.variants().contains(b.acronym()))
        || (!a.acronym().isEmpty() && b.variants().contains(a.acronym()))
        || (!a.acronym().isEmpty() && a.acronym().equals(b.acronym()));
  }

  /**
   * Highest ratio over all pairs of fuzzy keys. Pairs whose length bound cannot beat {@code floor} are
   * skipped; the result is then at most {@code floor}.
   */
  static double fuzzyScore(NameKeys a, NameKeys b, double floor) {
    double best = floor;
    Set<String> ys = b.fuzzyKeys();
    for (String x : a.fuzzyKeys()) {
      for (String y : ys) {
        double bound = 2.0 * Math.min(x.length(), y.length()) / (x.length() + y.length());
        if (bound <= best) {
          continue;
        }
        double r = SimilarityRatio.ratio(x, y);
        if (r > best) {
          best = r;
        }
      }
    }
    return best;
  }
}
