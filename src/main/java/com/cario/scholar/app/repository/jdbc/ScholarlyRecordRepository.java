package com.cario.scholar.app.repository.jdbc;

import com.cario.scholar.app.model.AuthorFragment;
import com.cario.scholar.app.model.EnrichedRecord;
import com.cario.scholar.app.model.InstitutionRecord;
import com.cario.scholar.app.model.KnownAuthor;
import com.cario.scholar.app.model.RawRecord;
import com.cario.scholar.app.model.RoleAssignment;
import com.cario.scholar.app.model.UpsertResult;
import com.cario.scholar.app.service.matching.InstitutionDirectory;
import com.cario.scholar.app.service.matching.NameNormalizer;
import com.cario.scholar.app.service.worker.AuthorKnowledge;
import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes enriched records into the normalized relational schema.
 *
 * <p>Every insert is {@code ON CONFLICT DO NOTHING} on a natural key, and an affected-row count of
 * zero means the row was already there. Existing rows are only ever filled in ({@code
 * COALESCE(existing, new)}), except role dates: the earliest start, the latest end and the most
 * recent paper date are kept. One record is written in one transaction.
 */
@Log4j2
public class ScholarlyRecordRepository implements AuthorKnowledge {

  private static final Pattern YEAR = Pattern.compile("(\\d{4})\\s*$");

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final InstitutionDirectory directory;

  public ScholarlyRecordRepository(
      JdbcTemplate jdbc, PlatformTransactionManager txManager, InstitutionDirectory directory) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.tx = new TransactionTemplate(Objects.requireNonNull(txManager, "txManager"));
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * Upserts one record with all its authors, institutions and categories.
   *
   * @throws org.springframework.dao.DataAccessException when the store rejects the write
   */
  public UpsertResult upsert(EnrichedRecord enriched) {
    RawRecord record = enriched.getRecord();
    validateId(record.getId());
    UpsertResult result = tx.execute(status -> write(enriched));
    log.info(
        "repository.upsert id={} paperInserted={} authorsInserted={} institutionsInserted={} "
            + "authorAffInserted={} authorAffUpdated={}",
        record.getId(),
        result.getPapersInserted(),
        result.getAuthorsInserted(),
        result.getInstitutionsInserted(),
        result.getAuthorAffiliationsInserted(),
        result.getAuthorAffiliationsUpdated());
    return result;
  }

  private UpsertResult write(EnrichedRecord enriched) {
    RawRecord r = enriched.getRecord();
    UpsertResult.UpsertResultBuilder out = UpsertResult.builder();

    LocalDate published = toDate(r.getPublished());
    LocalDate paperDate = published != null ? published : toDate(r.getUpdated());

    int inserted =
        jdbc.update(
            "INSERT INTO papers (paper_title, published, updated, abstract, doi, pdf_source, arxiv_entry) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
            r.getTitle(),
            sqlDate(published),
            sqlDate(toDate(r.getUpdated())),
            r.getSummary(),
            r.getDoi(),
            r.getPdfUrl(),
            r.getId());
    long paperId = paperId(r, published);
    if (inserted > 0) {
      out.papersInserted(1);
    } else {
      out.papersSkipped(1);
      jdbc.update(
          "UPDATE papers SET doi = COALESCE(doi, ?), abstract = COALESCE(abstract, ?), "
              + "pdf_source = COALESCE(pdf_source, ?), updated = COALESCE(updated, ?) WHERE id = ?",
          r.getDoi(),
          r.getSummary(),
          r.getPdfUrl(),
          sqlDate(toDate(r.getUpdated())),
          paperId);
    }

    for (String category : r.getCategories()) {
      long categoryId = ensureCategory(category);
      jdbc.update(
          "INSERT INTO paper_category (paper_id, category_id) VALUES (?, ?) ON CONFLICT DO NOTHING",
          paperId,
          categoryId);
    }

    int order = 0;
    int authorsInserted = 0;
    int institutionsInserted = 0;
    int affInserted = 0;
    int affUpdated = 0;
    for (String name : r.getAuthors()) {
      order++;
      AuthorFragment a = enriched.getFragment().author(name);
      if (a == null) {
        a = AuthorFragment.named(name);
      }
      Long authorId = findAuthor(name, a.getEmail(), a.getRegistryId());
      if (authorId == null) {
        authorsInserted += insertAuthor(a);
        authorId = findAuthor(name, a.getEmail(), a.getRegistryId());
        if (authorId == null) {
          throw new IllegalStateException("author row missing after insert: " + name);
        }
      }
      fillAuthor(authorId, a);

      jdbc.update(
          "INSERT INTO author_paper (author_id, paper_id, author_order, is_corresponding) "
              + "VALUES (?, ?, ?, ?) ON CONFLICT DO NOTHING",
          authorId,
          paperId,
          order,
          a.getEmail() != null);

      for (String aff : a.getAffiliations()) {
        Optional<InstitutionRecord> match = directory.match(aff);
        String canonical = match.map(InstitutionRecord::getName).orElse(aff.trim());
        String key = NameNormalizer.fold(canonical);
        if (key.isEmpty()) {
          continue;
        }
        institutionsInserted +=
            jdbc.update(
                "INSERT INTO affiliations (aff_name, name_key) VALUES (?, ?) ON CONFLICT DO NOTHING",
                canonical,
                key);
        long affId =
            jdbc.queryForObject("SELECT id FROM affiliations WHERE name_key = ?", Long.class, key);
        match.ifPresent(inst -> applyDirectoryData(affId, inst));

        if (mergeAuthorAffiliation(authorId, affId, a.getRoles().get(aff), paperDate)) {
          affInserted++;
        } else {
          affUpdated++;
        }
      }
    }
    return out.authorsInserted(authorsInserted)
        .institutionsInserted(institutionsInserted)
        .authorAffiliationsInserted(affInserted)
        .authorAffiliationsUpdated(affUpdated)
        .build();
  }

  // ---------------------------------------------------------------------
  // Papers and categories
  // ---------------------------------------------------------------------

  private long paperId(RawRecord r, LocalDate published) {
    List<Long> ids =
        jdbc.queryForList("SELECT id FROM papers WHERE arxiv_entry = ?", Long.class, r.getId());
    if (ids.isEmpty()) {
      // same title and date under another external id
      ids =
          jdbc.queryForList(
              "SELECT id FROM papers WHERE paper_title = ? AND published = ?",
              Long.class,
              r.getTitle(),
              sqlDate(published));
    }
    if (ids.isEmpty()) {
      throw new IllegalStateException("paper row missing after insert: " + r.getId());
    }
    return ids.get(0);
  }

  private long ensureCategory(String category) {
    jdbc.update("INSERT INTO categories (category) VALUES (?) ON CONFLICT DO NOTHING", category);
    return jdbc.queryForObject("SELECT id FROM categories WHERE category = ?", Long.class, category);
  }

  // ---------------------------------------------------------------------
  // Authors
  // ---------------------------------------------------------------------

  /**
   * Existing author by registry id, then email, then exact name. A name match is only accepted
   * when the row's registry id and email do not contradict the given ones.
   */
  Long findAuthor(String name, String email, String orcid) {
    if (orcid != null) {
      List<Long> ids = jdbc.queryForList("SELECT id FROM authors WHERE orcid = ?", Long.class, orcid);
      if (!ids.isEmpty()) {
        return ids.get(0);
      }
    }
    if (email != null) {
      List<Long> ids = jdbc.queryForList("SELECT id FROM authors WHERE email = ?", Long.class, email);
      if (!ids.isEmpty()) {
        return ids.get(0);
      }
    }
    List<Map<String, Object>> rows =
        jdbc.queryForList(
            "SELECT id, email, orcid FROM authors WHERE author_name_en = ? ORDER BY id", name);
    for (Map<String, Object> row : rows) {
      if (compatible((String) row.get("orcid"), orcid) && compatible((String) row.get("email"), email)) {
        return ((Number) row.get("id")).longValue();
      }
    }
    return null;
  }

  private int insertAuthor(AuthorFragment a) {
    return jdbc.update(
        "INSERT INTO authors (author_name_en, email, orcid, citations, h_index, i10_index) "
            + "VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
        a.getName(),
        a.getEmail(),
        a.getRegistryId(),
        a.getMetrics() == null ? null : a.getMetrics().getCitations(),
        a.getMetrics() == null ? null : a.getMetrics().getHIndex(),
        a.getMetrics() == null ? null : a.getMetrics().getI10Index());
  }

  /** Fills identity and metric columns that are still empty. */
  private void fillAuthor(long authorId, AuthorFragment a) {
    if (a.getRegistryId() != null) {
      jdbc.update(
          "UPDATE authors SET orcid = COALESCE(orcid, ?) WHERE id = ? "
              + "AND NOT EXISTS (SELECT 1 FROM authors o WHERE o.orcid = ? AND o.id <> ?)",
          a.getRegistryId(),
          authorId,
          a.getRegistryId(),
          authorId);
    }
    if (a.getEmail() != null) {
      jdbc.update(
          "UPDATE authors SET email = COALESCE(email, ?) WHERE id = ? "
              + "AND NOT EXISTS (SELECT 1 FROM authors o WHERE o.email = ? AND o.id <> ?)",
          a.getEmail(),
          authorId,
          a.getEmail(),
          authorId);
    }
    if (a.getMetrics() != null) {
      jdbc.update(
          "UPDATE authors SET citations = COALESCE(citations, ?), h_index = COALESCE(h_index, ?), "
              + "i10_index = COALESCE(i10_index, ?) WHERE id = ?",
          a.getMetrics().getCitations(),
          a.getMetrics().getHIndex(),
          a.getMetrics().getI10Index(),
          authorId);
    }
  }

  private static boolean compatible(String stored, String incoming) {
    return stored == null || incoming == null || stored.equals(incoming);
  }

  // ---------------------------------------------------------------------
  // Institutions
  // ---------------------------------------------------------------------

  private void applyDirectoryData(long affId, InstitutionRecord inst) {
    if (inst.getCountry() != null && !inst.getCountry().isBlank()) {
      jdbc.update(
          "UPDATE affiliations SET country = COALESCE(NULLIF(country, ''), ?) WHERE id = ?",
          inst.getCountry().trim(),
          affId);
    }
    for (Map.Entry<String, Integer> rank : inst.getRanks().entrySet()) {
      Matcher m = YEAR.matcher(rank.getKey());
      if (rank.getValue() == null || !m.find()) {
        continue;
      }
      long systemId = ensureRankingSystem(rank.getKey());
      jdbc.update(
          "INSERT INTO affiliation_rankings (aff_id, rank_system_id, rank_value, rank_year) "
              + "VALUES (?, ?, ?, ?) ON CONFLICT DO NOTHING",
          affId,
          systemId,
          rank.getValue(),
          Integer.parseInt(m.group(1)));
    }
  }

  private long ensureRankingSystem(String name) {
    jdbc.update(
        "INSERT INTO ranking_systems (system_name, update_frequency) VALUES (?, 1) ON CONFLICT DO NOTHING",
        name);
    return jdbc.queryForObject("SELECT id FROM ranking_systems WHERE system_name = ?", Long.class, name);
  }

  /**
   * @return true when a new link row was inserted, false when an existing one was merged
   */
  private boolean mergeAuthorAffiliation(
      long authorId, long affId, RoleAssignment role, LocalDate paperDate) {
    String newRole = role == null ? null : role.getRole();
    String newDept = role == null ? null : role.getDepartment();
    LocalDate newStart = role == null ? null : parsePartialDate(role.getStartDate());
    LocalDate newEnd = role == null ? null : parsePartialDate(role.getEndDate());

    List<Map<String, Object>> rows =
        jdbc.queryForList(
            "SELECT role, department, start_date, end_date, latest_time FROM author_affiliation "
                + "WHERE author_id = ? AND affiliation_id = ?",
            authorId,
            affId);
    if (rows.isEmpty()) {
      int n =
          jdbc.update(
              "INSERT INTO author_affiliation "
                  + "(author_id, affiliation_id, role, department, start_date, end_date, latest_time) "
                  + "VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING",
              authorId,
              affId,
              newRole,
              newDept,
              sqlDate(newStart),
              sqlDate(newEnd),
              sqlDate(paperDate));
      if (n > 0) {
        return true;
      }
      rows =
          jdbc.queryForList(
              "SELECT role, department, start_date, end_date, latest_time FROM author_affiliation "
                  + "WHERE author_id = ? AND affiliation_id = ?",
              authorId,
              affId);
    }
    Map<String, Object> row = rows.get(0);
    jdbc.update(
        "UPDATE author_affiliation SET role = ?, department = ?, start_date = ?, end_date = ?, "
            + "latest_time = ? WHERE author_id = ? AND affiliation_id = ?",
        firstNonNull((String) row.get("role"), newRole),
        firstNonNull((String) row.get("department"), newDept),
        sqlDate(earliest(localDate(row.get("start_date")), newStart)),
        sqlDate(latest(localDate(row.get("end_date")), newEnd)),
        sqlDate(latest(localDate(row.get("latest_time")), paperDate)),
        authorId,
        affId);
    return false;
  }

  // ---------------------------------------------------------------------
  // Stored author knowledge
  // ---------------------------------------------------------------------

  /** The best-identified author row with this exact name, with the roles stored for it. */
  @Override
  public Optional<KnownAuthor> find(String authorName) {
    List<Map<String, Object>> rows =
        jdbc.queryForList(
            "SELECT id, email, orcid FROM authors WHERE author_name_en = ? "
                + "ORDER BY CASE WHEN orcid IS NULL THEN 1 ELSE 0 END, id",
            authorName);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    Map<String, Object> author = rows.get(0);
    long authorId = ((Number) author.get("id")).longValue();
    KnownAuthor.KnownAuthorBuilder b =
        KnownAuthor.builder()
            .registryId((String) author.get("orcid"))
            .email((String) author.get("email"));
    jdbc.query(
        "SELECT a.aff_name, aa.role, aa.department, aa.start_date, aa.end_date "
            + "FROM author_affiliation aa JOIN affiliations a ON a.id = aa.affiliation_id "
            + "WHERE aa.author_id = ? AND aa.role IS NOT NULL ORDER BY aa.id",
        (RowCallbackHandler)
            rs -> {
              b.role(
                  rs.getString("aff_name"),
                  RoleAssignment.builder()
                      .role(rs.getString("role"))
                      .department(rs.getString("department"))
                      .startDate(isoOrNull(rs.getDate("start_date")))
                      .endDate(isoOrNull(rs.getDate("end_date")))
                      .build());
            },
        authorId);
    return Optional.of(b.build());
  }

  // ---------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------

  /** YYYY-MM-DD, YYYY-MM or YYYY; missing parts default to the first month or day. */
  static LocalDate parsePartialDate(String s) {
    if (s == null || s.isBlank()) {
      return null;
    }
    String[] parts = s.trim().split("-");
    try {
      int year = Integer.parseInt(parts[0]);
      int month = parts.length > 1 ? Integer.parseInt(parts[1]) : 1;
      int day = parts.length > 2 ? Integer.parseInt(parts[2]) : 1;
      return LocalDate.of(year, month, day);
    } catch (RuntimeException e) {
      log.warn("repository.date unparseable value={}", s);
      return null;
    }
  }

  static LocalDate earliest(LocalDate a, LocalDate b) {
    if (a == null) return b;
    if (b == null) return a;
    return a.isBefore(b) ? a : b;
  }

  static LocalDate latest(LocalDate a, LocalDate b) {
    if (a == null) return b;
    if (b == null) return a;
    return a.isAfter(b) ? a : b;
  }

  private static LocalDate localDate(Object v) {
    if (v == null) return null;
    if (v instanceof Date d) return d.toLocalDate();
    if (v instanceof LocalDate d) return d;
    return LocalDate.parse(v.toString());
  }

  private static String firstNonNull(String a, String b) {
    return a != null ? a : b;
  }

  private static LocalDate toDate(Instant i) {
    return i == null ? null : i.atOffset(ZoneOffset.UTC).toLocalDate();
  }

  private static Date sqlDate(LocalDate d) {
    return d == null ? null : Date.valueOf(d);
  }

  private static String isoOrNull(Date d) {
    return d == null ? null : d.toLocalDate().toString();
  }

  private static void validateId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("record id must not be blank");
    }
  }
}
