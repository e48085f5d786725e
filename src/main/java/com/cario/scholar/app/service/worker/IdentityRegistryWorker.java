package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.AffiliationKind;
import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.KnownAuthor;
import com.cario.scholar.app.model.MatchedAffiliation;
import com.cario.scholar.app.model.PersonProfile;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.RoleAssignment;
import com.cario.scholar.app.model.RoleAssignment.RoleSource;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.service.CacheState;
import com.cario.scholar.app.service.client.OrcidClient;
import com.cario.scholar.app.service.matching.IdentityResolver;
import com.cario.scholar.app.service.matching.PersonNameMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;

/**
 * Looks authors up in the ORCID registry and keeps the roles whose institution corroborates one of
 * the author's extracted affiliations.
 *
 * <p>A registry id is only attached when at least one affiliation was corroborated; a name match
 * alone is never enough. Authors the store already knows completely are answered from the store.
 */
@Log4j2
public class IdentityRegistryWorker implements EnrichmentWorker {

  private final OrcidClient orcid;
  private final IdentityResolver resolver;
  private final CacheState cache;
  private final AuthorKnowledge knowledge;
  private final ResilientCallExecutor executor;
  private final CredentialPool pool;
  private final int searchRows;
  private final int expandedRows;
  private final int maxCandidates;

  public IdentityRegistryWorker(
      OrcidClient orcid,
      IdentityResolver resolver,
      CacheState cache,
      AuthorKnowledge knowledge,
      ResilientCallExecutor executor,
      CredentialPool pool,
      int searchRows,
      int expandedRows,
      int maxCandidates) {
    this.orcid = orcid;
    this.resolver = resolver;
    this.cache = cache;
    this.knowledge = knowledge == null ? AuthorKnowledge.NONE : knowledge;
    this.executor = executor;
    this.pool = pool;
    this.searchRows = searchRows;
    this.expandedRows = expandedRows;
    this.maxCandidates = maxCandidates;
  }

  @Override
  public String source() {
    return pool.getSource();
  }

  @Override
  public WorkerOutcome<EnrichmentFragment> enrich(RawRecord record, EnrichmentFragment current) {
    List<AuthorFragment> out = new ArrayList<>();
    try {
      for (AuthorFragment author : current.getAuthors().values()) {
        if (author.getAffiliations().isEmpty()) {
          continue;
        }
        Optional<AuthorFragment> known = fromKnowledge(author);
        if (known.isPresent()) {
          out.add(known.get());
          continue;
        }
        WorkerOutcome<List<PersonProfile>> profiles = candidates(author.getName());
        if (!profiles.isOk()) {
          return profiles.propagate();
        }
        corroborate(author, profiles.orElse(List.of())).ifPresent(out::add);
      }
    } catch (RuntimeException e) {
      log.error("registry.enrich failed id={}", record.getId(), e);
      return WorkerOutcome.failed("registry lookup failed: " + e.getMessage());
    }
    log.info("registry.done id={} corroborated={}", record.getId(), out.size());
    return WorkerOutcome.ok(EnrichmentFragment.of(record.getId(), out));
  }

  // ---------------------------------------------------------------------
  // Stored knowledge
  // ---------------------------------------------------------------------

  /** Stored data when it already covers every affiliation of the author. */
  Optional<AuthorFragment> fromKnowledge(AuthorFragment author) {
    Optional<KnownAuthor> stored = knowledge.find(author.getName());
    if (stored.isEmpty() || stored.get().getRegistryId() == null) {
      return Optional.empty();
    }
    KnownAuthor k = stored.get();
    List<String> storedNames = new ArrayList<>(k.getRoles().keySet());
    Map<String, RoleAssignment> roles = new LinkedHashMap<>();
    for (String aff : author.getAffiliations()) {
      Optional<String> hit = resolver.bestDirectoryMatch(aff, storedNames, Function.identity());
      RoleAssignment role = hit.map(k.getRoles()::get).orElse(null);
      if (role == null) {
        return Optional.empty();
      }
      roles.put(aff, role);
    }
    log.debug("registry.known name={} orcid={}", author.getName(), k.getRegistryId());
    return Optional.of(
        AuthorFragment.builder()
            .name(author.getName())
            .registryId(k.getRegistryId())
            .email(k.getEmail())
            .roles(roles)
            .build());
  }

  // ---------------------------------------------------------------------
  // Candidate search
  // ---------------------------------------------------------------------

  /** Name-checked profiles for {@code name}, from cache or the registry. */
  WorkerOutcome<List<PersonProfile>> candidates(String name) {
    List<PersonProfile> cached = cache.registryProfiles(name);
    if (cached != null) {
      return WorkerOutcome.ok(cached);
    }
    WorkerOutcome<List<String>> ids =
        executor.call("orcid.search", pool, c -> orcid.searchIds(name, searchRows));
    if (!ids.isOk()) {
      return ids.propagate();
    }
    List<String> found = ids.orElse(List.of());
    if (found.isEmpty()) {
      ids = executor.call("orcid.expandedSearch", pool, c -> orcid.expandedSearchIds(name, expandedRows));
      if (!ids.isOk()) {
        return ids.propagate();
      }
      found = ids.orElse(List.of());
    }

    List<PersonProfile> profiles = new ArrayList<>();
    for (String id : found.stream().distinct().limit(maxCandidates).toList()) {
      WorkerOutcome<PersonProfile> p = executor.call("orcid.profile", pool, c -> orcid.fetchProfile(id));
      if (!p.isOk()) {
        return p.propagate();
      }
      PersonProfile profile = p.orElse(null);
      if (PersonNameMatcher.matches(name, profile)) {
        profiles.add(profile);
      }
    }
    log.debug("registry.candidates name={} ids={} kept={}", name, found.size(), profiles.size());
    cache.putRegistryProfiles(name, profiles);
    return WorkerOutcome.ok(profiles);
  }

  // ---------------------------------------------------------------------
  // Corroboration
  // ---------------------------------------------------------------------

  /**
   * Best role per affiliation across all candidates. The registry id and email come from the
   * candidate holding the single highest-scoring match.
   */
  Optional<AuthorFragment> corroborate(AuthorFragment author, List<PersonProfile> profiles) {
    Map<String, RoleAssignment> roles = new LinkedHashMap<>();
    PersonProfile bestProfile = null;
    double bestScore = -1.0;

    for (String aff : author.getAffiliations()) {
      MatchedAffiliation affBest = null;
      for (PersonProfile p : profiles) {
        Optional<MatchedAffiliation> m = resolver.bestRoleMatch(aff, p);
        if (m.isPresent() && (affBest == null || m.get().getScore() > affBest.getScore())) {
          affBest = m.get();
          if (affBest.getScore() > bestScore) {
            bestScore = affBest.getScore();
            bestProfile = p;
          }
        }
      }
      if (affBest != null) {
        roles.put(aff, toRole(affBest));
      }
    }
    if (bestProfile == null) {
      return Optional.empty();
    }
    log.info(
        "registry.corroborated name={} orcid={} roles={}",
        author.getName(),
        bestProfile.getRegistryId(),
        roles.size());
    return Optional.of(
        AuthorFragment.builder()
            .name(author.getName())
            .registryId(bestProfile.getRegistryId())
            .email(bestProfile.getEmails().isEmpty() ? null : bestProfile.getEmails().get(0))
            .roles(roles)
            .build());
  }

  static RoleAssignment toRole(MatchedAffiliation m) {
    return RoleAssignment.builder()
        .role(m.getEntry().getRoleTitle())
        .department(m.getEntry().getDepartment())
        .startDate(m.getStartDate())
        .endDate(m.getEndDate())
        .source(
            m.getKind() == AffiliationKind.EMPLOYMENT
                ? RoleSource.REGISTRY_EMPLOYMENT
                : RoleSource.REGISTRY_EDUCATION)
        .build();
  }
}
