package com.cario.scholar.app.repository.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.scholar.app.model.AcademicMetrics;
import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichedRecord;
import com.cario.scholar.app.model.EnrichmentFragment;
import com.cario.scholar.app.model.InstitutionRecord;
import com.cario.scholar.app.model.KnownAuthor;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.RoleAssignment;
import com.cario.scholar.app.model.UpsertResult;
import com.cario.scholar.app.service.CacheState;
import com.cario.scholar.app.service.matching.IdentityResolver;
import com.cario.scholar.app.service.matching.InstitutionDirectory;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

class ScholarlyRecordRepositoryTest {

  private static final String MIT = "Massachusetts Institute of Technology (MIT)";

  private JdbcTemplate jdbc;
  private ScholarlyRecordRepository repository;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource ds =
        new DriverManagerDataSource(
            "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
            "sa",
            "");
    new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(ds);
    jdbc = new JdbcTemplate(ds);

    CacheState cache = CacheState.defaults();
    InstitutionDirectory directory =
        new InstitutionDirectory(
            List.of(
                InstitutionRecord.builder()
                    .name(MIT)
                    .country("United States")
                    .rank("QS 2025", 1)
                    .rank("QS 2024", 1)
                    .build()),
            new IdentityResolver(0.84, 0.86, cache),
            cache);
    repository =
        new ScholarlyRecordRepository(jdbc, new DataSourceTransactionManager(ds), directory);
  }

  private static RawRecord record(String id, String title, String published) {
    return RawRecord.builder()
        .id(id)
        .title(title)
        .summary("abstract of " + id)
        .author("Alice Smith")
        .author("Bob Lee")
        .category("cs.AI")
        .category("cs.CL")
        .pdfUrl("https://arxiv.org/pdf/" + id)
        .published(Instant.parse(published))
        .build();
  }

  private static EnrichedRecord enriched(RawRecord r, RoleAssignment aliceRole) {
    AuthorFragment alice =
        AuthorFragment.builder()
            .name("Alice Smith")
            .affiliations(List.of("MIT"))
            .email("alice@mit.edu")
            .registryId("0000-0002-1825-0097")
            .roles(aliceRole == null ? Map.of() : Map.of("MIT", aliceRole))
            .metrics(AcademicMetrics.builder().citations(120).hIndex(6).i10Index(4).build())
            .build();
    return new EnrichedRecord(
        r, EnrichmentFragment.of(r.getId(), List.of(alice, AuthorFragment.named("Bob Lee"))));
  }

  private int count(String table) {
    return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
  }

  @Test
  void writesPaperAuthorsAndAffiliation() {
    RoleAssignment role =
        RoleAssignment.builder().role("Professor").department("EECS").startDate("2015-09").build();

    UpsertResult result =
        repository.upsert(enriched(record("2401.00001", "Linking", "2024-01-02T09:30:00Z"), role));

    assertThat(result.getPapersInserted()).isEqualTo(1);
    assertThat(result.getAuthorsInserted()).isEqualTo(2);
    assertThat(result.getInstitutionsInserted()).isEqualTo(1);
    assertThat(result.getAuthorAffiliationsInserted()).isEqualTo(1);

    List<Map<String, Object>> order =
        jdbc.queryForList(
            "SELECT a.author_name_en AS name, ap.author_order AS pos, ap.is_corresponding AS corr "
                + "FROM author_paper ap JOIN authors a ON a.id = ap.author_id ORDER BY ap.author_order");
    assertThat(order).extracting(m -> m.get("name")).containsExactly("Alice Smith", "Bob Lee");
    assertThat(order).extracting(m -> ((Number) m.get("pos")).intValue()).containsExactly(1, 2);
    assertThat(order).extracting(m -> m.get("corr")).containsExactly(true, false);

    Map<String, Object> aff =
        jdbc.queryForMap(
            "SELECT af.aff_name AS name, af.country AS country, aa.role AS role, "
                + "aa.department AS dept, aa.start_date AS start_date, aa.latest_time AS latest "
                + "FROM author_affiliation aa JOIN affiliations af ON af.id = aa.affiliation_id");
    assertThat(aff.get("name")).isEqualTo(MIT);
    assertThat(aff.get("country")).isEqualTo("United States");
    assertThat(aff.get("role")).isEqualTo("Professor");
    assertThat(aff.get("dept")).isEqualTo("EECS");
    assertThat(aff.get("start_date").toString()).isEqualTo("2015-09-01");
    assertThat(aff.get("latest").toString()).isEqualTo("2024-01-02");

    assertThat(count("categories")).isEqualTo(2);
    assertThat(count("paper_category")).isEqualTo(2);
    assertThat(count("affiliation_rankings")).isEqualTo(2);
    assertThat(
            jdbc.queryForObject(
                "SELECT citations FROM authors WHERE orcid = ?", Integer.class, "0000-0002-1825-0097"))
        .isEqualTo(120);
  }

  @Test
  void upsertingTheSameRecordTwiceAddsNoRows() {
    EnrichedRecord e = enriched(record("2401.00001", "Linking", "2024-01-02T09:30:00Z"), null);
    repository.upsert(e);

    UpsertResult again = repository.upsert(e);

    assertThat(again.getPapersInserted()).isZero();
    assertThat(again.getPapersSkipped()).isEqualTo(1);
    assertThat(again.getAuthorsInserted()).isZero();
    assertThat(again.getInstitutionsInserted()).isZero();
    assertThat(again.getAuthorAffiliationsUpdated()).isEqualTo(1);
    assertThat(count("papers")).isEqualTo(1);
    assertThat(count("authors")).isEqualTo(2);
    assertThat(count("author_paper")).isEqualTo(2);
    assertThat(count("author_affiliation")).isEqualTo(1);
  }

  @Test
  void roleDatesWidenAcrossPapers() {
    repository.upsert(
        enriched(
            record("2401.00001", "First", "2024-01-02T00:00:00Z"),
            RoleAssignment.builder().role("Professor").startDate("2015-09").build()));
    repository.upsert(
        enriched(
            record("2305.00002", "Second", "2023-05-10T00:00:00Z"),
            RoleAssignment.builder().role("Lecturer").startDate("2012").endDate("2020-01").build()));

    Map<String, Object> row =
        jdbc.queryForMap(
            "SELECT role, start_date, end_date, latest_time FROM author_affiliation");
    assertThat(row.get("role")).isEqualTo("Professor");
    assertThat(row.get("start_date").toString()).isEqualTo("2012-01-01");
    assertThat(row.get("end_date").toString()).isEqualTo("2020-01-01");
    assertThat(row.get("latest_time").toString()).isEqualTo("2024-01-02");
    assertThat(count("authors")).isEqualTo(2);
  }

  @Test
  void storedRolesAreReturnedAsKnownAuthor() {
    repository.upsert(
        enriched(
            record("2401.00001", "Linking", "2024-01-02T09:30:00Z"),
            RoleAssignment.builder().role("Professor").startDate("2015-09-01").build()));

    KnownAuthor alice = repository.find("Alice Smith").orElseThrow();

    assertThat(alice.getRegistryId()).isEqualTo("0000-0002-1825-0097");
    assertThat(alice.getEmail()).isEqualTo("alice@mit.edu");
    assertThat(alice.getRoles()).containsOnlyKeys(MIT);
    assertThat(alice.getRoles().get(MIT).getStartDate()).isEqualTo("2015-09-01");
    assertThat(repository.find("Bob Lee").orElseThrow().getRoles()).isEmpty();
    assertThat(repository.find("Nobody")).isEmpty();
  }

  @Test
  void blankRecordIdIsRejected() {
    EnrichedRecord e = enriched(record(" ", "Linking", "2024-01-02T09:30:00Z"), null);

    assertThatThrownBy(() -> repository.upsert(e)).isInstanceOf(IllegalArgumentException.class);
    assertThat(count("papers")).isZero();
  }

  @Test
  void partialDatesAndBounds() {
    assertThat(ScholarlyRecordRepository.parsePartialDate("2019")).isEqualTo(LocalDate.of(2019, 1, 1));
    assertThat(ScholarlyRecordRepository.parsePartialDate("2019-07")).isEqualTo(LocalDate.of(2019, 7, 1));
    assertThat(ScholarlyRecordRepository.parsePartialDate("2019-07-15"))
        .isEqualTo(LocalDate.of(2019, 7, 15));
    assertThat(ScholarlyRecordRepository.parsePartialDate("present")).isNull();
    assertThat(ScholarlyRecordRepository.parsePartialDate(null)).isNull();

    LocalDate a = LocalDate.of(2020, 1, 1);
    LocalDate b = LocalDate.of(2021, 1, 1);
    assertThat(ScholarlyRecordRepository.earliest(a, b)).isEqualTo(a);
    assertThat(ScholarlyRecordRepository.latest(a, b)).isEqualTo(b);
    assertThat(ScholarlyRecordRepository.earliest(null, b)).isEqualTo(b);
    assertThat(ScholarlyRecordRepository.latest(a, null)).isEqualTo(a);
  }
}
