package com.cario.scholar.app.service;

import com.cario.scholar.app.model.InstitutionRecord;
import com.cario.scholar.app.model.PersonProfile;
import com.cario.scholar.app.service.matching.NameKeys;
import com.cario.scholar.app.service.matching.NameNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lookup caches shared by the resolver and the workers of one process.
 *
 * <p>Entries are computed once per key and only read afterwards, so concurrent readers need no
 * extra locking.
 */
public class CacheState {

  private final Cache<String, NameKeys> nameKeys;
  private final Cache<String, List<PersonProfile>> registryProfiles;
  private final Cache<String, Optional<InstitutionRecord>> directoryMatches;

  public CacheState(long maxNames, Duration registryTtl) {
    this.nameKeys = Caffeine.newBuilder().maximumSize(maxNames).build();
    this.registryProfiles =
        Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(registryTtl).build();
    this.directoryMatches = Caffeine.newBuilder().maximumSize(maxNames).build();
  }

  public static CacheState defaults() {
    return new CacheState(50_000, Duration.ofHours(6));
  }

  /** Memoized {@link NameNormalizer#keys(String)}. */
  public NameKeys keys(String name) {
    if (name == null) {
      return NameNormalizer.keys(null);
    }
    return nameKeys.get(name, NameNormalizer::keys);
  }

  /** Registry profiles already fetched for a folded person name, or null. */
  public List<PersonProfile> registryProfiles(String personName) {
    return registryProfiles.getIfPresent(NameNormalizer.fold(personName));
  }

  public void putRegistryProfiles(String personName, List<PersonProfile> profiles) {
    registryProfiles.put(NameNormalizer.fold(personName), List.copyOf(profiles));
  }

  public Optional<InstitutionRecord> directoryMatch(
      String affiliation, Function<String, Optional<InstitutionRecord>> loader) {
    return directoryMatches.get(affiliation, loader);
  }
}
