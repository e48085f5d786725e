package com.cario.scholar.app.service.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.KnownAuthor;
import com.cario.scholar.app.model.PersonProfile;
import com.cario.scholar.app.model.ProfileEntry;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.RoleAssignment;
import com.cario.scholar.app.model.WorkerOutcome;
import com.cario.scholar.app.service.CacheState;
import com.cario.scholar.app.service.client.OrcidClient;
import com.cario.scholar.app.service.matching.IdentityResolver;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IdentityRegistryWorkerTest {

  private static final String ID = "2401.00001";

  private OrcidClient orcid;
  private CacheState cache;
  private IdentityResolver resolver;

  private final RawRecord record =
      RawRecord.builder().id(ID).author("Alice Smith").author("Bob Lee").build();

  private final EnrichmentFragment afterExtraction =
      EnrichmentFragment.of(
          ID,
          List.of(
              AuthorFragment.builder().name("Alice Smith").affiliations(List.of("MIT")).build(),
              AuthorFragment.named("Bob Lee")));

  @BeforeEach
  void setUp() {
    orcid = mock(OrcidClient.class);
    cache = CacheState.defaults();
    resolver = new IdentityResolver(0.84, 0.86, cache);
  }

  private IdentityRegistryWorker worker(AuthorKnowledge knowledge) {
    return new IdentityRegistryWorker(
        orcid,
        resolver,
        cache,
        knowledge,
        new ResilientCallExecutor(2, Duration.ZERO, new QuotaErrorClassifier()),
        CredentialPool.single("orcid"),
        10,
        20,
        5);
  }

  private static PersonProfile alice(String id, String org) {
    return PersonProfile.builder()
        .registryId(id)
        .givenNames("Alice")
        .familyName("Smith")
        .email("alice@mit.edu")
        .employment(
            ProfileEntry.builder()
                .organization(org)
                .roleTitle("Associate Professor")
                .startDate("2018-07")
                .build())
        .build();
  }

  @Test
  void corroboratedCandidateGivesIdAndRole() {
    when(orcid.searchIds("Alice Smith", 10)).thenReturn(List.of("0000-0001", "0000-0002"));
    when(orcid.fetchProfile("0000-0001")).thenReturn(alice("0000-0001", "University of Oxford"));
    when(orcid.fetchProfile("0000-0002"))
        .thenReturn(alice("0000-0002", "Massachusetts Institute of Technology"));

    WorkerOutcome<EnrichmentFragment> out = worker(AuthorKnowledge.NONE).enrich(record, afterExtraction);

    AuthorFragment a = out.orElse(null).author("Alice Smith");
    assertThat(a.getRegistryId()).isEqualTo("0000-0002");
    assertThat(a.getEmail()).isEqualTo("alice@mit.edu");
    RoleAssignment role = a.getRoles().get("MIT");
    assertThat(role.getRole()).isEqualTo("Associate Professor");
    assertThat(role.getStartDate()).isEqualTo("2018-07");
    assertThat(role.getSource()).isEqualTo(RoleAssignment.RoleSource.REGISTRY_EMPLOYMENT);
    assertThat(out.orElse(null).author("Bob Lee")).isNull();
  }

  @Test
  void nameMismatchIsDiscardedBeforeInstitutionMatching() {
    PersonProfile other =
        PersonProfile.builder()
            .registryId("0000-0003")
            .givenNames("Alicia")
            .familyName("Smithson")
            .employment(
                ProfileEntry.builder().organization("Massachusetts Institute of Technology").build())
            .build();
    when(orcid.searchIds("Alice Smith", 10)).thenReturn(List.of("0000-0003"));
    when(orcid.fetchProfile("0000-0003")).thenReturn(other);

    WorkerOutcome<EnrichmentFragment> out = worker(AuthorKnowledge.NONE).enrich(record, afterExtraction);

    assertThat(out.orElse(null).getAuthors()).isEmpty();
  }

  @Test
  void expandedSearchIsTriedWhenPlainSearchFindsNothing() {
    when(orcid.searchIds("Alice Smith", 10)).thenReturn(List.of());
    when(orcid.expandedSearchIds("Alice Smith", 20)).thenReturn(List.of("0000-0002"));
    when(orcid.fetchProfile("0000-0002"))
        .thenReturn(alice("0000-0002", "Massachusetts Institute of Technology"));

    WorkerOutcome<EnrichmentFragment> out = worker(AuthorKnowledge.NONE).enrich(record, afterExtraction);

    assertThat(out.orElse(null).author("Alice Smith").getRegistryId()).isEqualTo("0000-0002");
  }

  @Test
  void profilesAreCachedPerName() {
    when(orcid.searchIds("Alice Smith", 10)).thenReturn(List.of("0000-0002"));
    when(orcid.fetchProfile("0000-0002"))
        .thenReturn(alice("0000-0002", "Massachusetts Institute of Technology"));
    IdentityRegistryWorker w = worker(AuthorKnowledge.NONE);

    w.enrich(record, afterExtraction);
    w.enrich(record, afterExtraction);

    verify(orcid, times(1)).searchIds("Alice Smith", 10);
    verify(orcid, times(1)).fetchProfile("0000-0002");
  }

  @Test
  void fullyKnownAuthorIsNeverQueried() {
    KnownAuthor stored =
        KnownAuthor.builder()
            .registryId("0000-0009")
            .email("alice@mit.edu")
            .role(
                "Massachusetts Institute of Technology (MIT)",
                RoleAssignment.builder().role("Professor").build())
            .build();

    WorkerOutcome<EnrichmentFragment> out =
        worker(name -> "Alice Smith".equals(name) ? Optional.of(stored) : Optional.empty())
            .enrich(record, afterExtraction);

    AuthorFragment a = out.orElse(null).author("Alice Smith");
    assertThat(a.getRegistryId()).isEqualTo("0000-0009");
    assertThat(a.getRoles().get("MIT").getRole()).isEqualTo("Professor");
    verify(orcid, never()).searchIds(anyString(), anyInt());
  }

  @Test
  void knownAuthorWithUncoveredAffiliationIsLookedUp() {
    KnownAuthor stored =
        KnownAuthor.builder()
            .registryId("0000-0009")
            .role("University of Oxford", RoleAssignment.builder().role("Lecturer").build())
            .build();
    when(orcid.searchIds("Alice Smith", 10)).thenReturn(List.of());
    when(orcid.expandedSearchIds("Alice Smith", 20)).thenReturn(List.of());

    worker(name -> Optional.of(stored)).enrich(record, afterExtraction);

    verify(orcid).searchIds("Alice Smith", 10);
  }

  @Test
  void registryFailureEndsInFailedOutcome() {
    when(orcid.searchIds("Alice Smith", 10)).thenThrow(new RuntimeException("502 Bad Gateway"));

    WorkerOutcome<EnrichmentFragment> out = worker(AuthorKnowledge.NONE).enrich(record, afterExtraction);

    assertThat(out).isInstanceOf(WorkerOutcome.Failed.class);
  }
}
