package com.cario.scholar.app.service.matching;

import com.cario.scholar.app.model.InstitutionRecord;
import com.cario.scholar.app.service.CacheState;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.Resource;

/**
 * Reference directory of ranked institutions, loaded once from a CSV export of the QS rankings.
 *
 * <p>Expected columns: {@code Institution Name}, one of {@code Location Full} / {@code Location} /
 * {@code Country}, and any number of {@code <year> Rank} columns. Rank cells such as {@code =47},
 * {@code 601-650} or {@code 1401+} are reduced to their first number.
 */
@Log4j2
public class InstitutionDirectory {

  private static final Pattern RANK_COLUMN = Pattern.compile("^(\\d{4})\\s+Rank$");
  private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d+)");
  private static final String RANK_SYSTEM_PREFIX = "QS ";

  private final List<InstitutionRecord> rows;
  private final IdentityResolver resolver;
  private final CacheState cache;

  public InstitutionDirectory(
      List<InstitutionRecord> rows, IdentityResolver resolver, CacheState cache) {
    this.rows = List.copyOf(rows);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  public static InstitutionDirectory fromCsv(
      Resource csv, IdentityResolver resolver, CacheState cache) {
    if (csv == null || !csv.exists()) {
      log.warn("directory.csv missing resource={}, directory is empty", csv);
      return new InstitutionDirectory(List.of(), resolver, cache);
    }
    try (InputStream in = csv.getInputStream()) {
      List<InstitutionRecord> rows = parse(in);
      log.info("directory.loaded resource={} rows={}", csv.getDescription(), rows.size());
      return new InstitutionDirectory(rows, resolver, cache);
    } catch (IOException e) {
      log.error("directory.load failed resource={}", csv.getDescription(), e);
      throw new RuntimeException("Failed to load institution directory " + csv, e);
    }
  }

  static List<InstitutionRecord> parse(InputStream in) throws IOException {
    CsvMapper mapper = new CsvMapper();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<InstitutionRecord> out = new ArrayList<>();
    try (MappingIterator<Map<String, String>> it =
        mapper.readerForMapOf(String.class).with(schema).readValues(in)) {
      while (it.hasNext()) {
        Map<String, String> row = it.next();
        String name = trimToNull(row.get("Institution Name"));
        if (name == null) {
          continue;
        }
        InstitutionRecord.InstitutionRecordBuilder b =
            InstitutionRecord.builder().name(name).country(location(row));
        for (Map.Entry<String, String> e : row.entrySet()) {
          Matcher col = RANK_COLUMN.matcher(e.getKey().trim());
          Integer rank = parseRank(e.getValue());
          if (col.matches() && rank != null) {
            b.rank(RANK_SYSTEM_PREFIX + col.group(1), rank);
          }
        }
        out.add(b.build());
      }
    }
    return out;
  }

  /** Canonical directory row for a free-text affiliation, if one clears the threshold. */
  public Optional<InstitutionRecord> match(String affiliation) {
    if (affiliation == null || affiliation.isBlank() || rows.isEmpty()) {
      return Optional.empty();
    }
    return cache.directoryMatch(
        affiliation, a -> resolver.bestDirectoryMatch(a, rows, InstitutionRecord::getName));
  }

  public int size() {
    return rows.size();
  }

  static Integer parseRank(String cell) {
    if (cell == null) {
      return null;
    }
    Matcher m = FIRST_NUMBER.matcher(cell);
    return m.find() ? Integer.valueOf(m.group(1)) : null;
  }

  private static String location(Map<String, String> row) {
    for (String col : List.of("Location Full", "Location", "Country")) {
      String v = trimToNull(row.get(col));
      if (v != null) {
        return v;
      }
    }
    return null;
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
