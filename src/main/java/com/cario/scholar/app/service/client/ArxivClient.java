package com.cario.scholar.app.service.client;

import com.cario.scholar.app.model.RawRecord;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.log4j.Log4j2;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import reactor.util.retry.Retry;

/**
 * Client for the arXiv Atom query API.
 *
 * <p>Supports a submitted/updated date window over a set of categories (paged, newest first) and
 * lookup by id list (batched). Entry ids are reduced to the bare arXiv id without version suffix.
 */
@Log4j2
public class ArxivClient {

  static final String ATOM_NS = "http://www.w3.org/2005/Atom";
  static final String ARXIV_NS = "http://arxiv.org/schemas/atom";

  private static final DateTimeFormatter QUERY_TS =
      DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);
  private static final Pattern VERSION_SUFFIX = Pattern.compile("v\\d+$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final WebClient webClient;
  private final int pageSize;
  private final int idBatchSize;
  private final Duration pageDelay;
  private final int maxRetries;

  public ArxivClient(
      WebClient.Builder builder,
      String baseUrl,
      int pageSize,
      int idBatchSize,
      Duration pageDelay,
      int maxRetries) {
    this.webClient = builder.clone().baseUrl(baseUrl).build();
    this.pageSize = pageSize;
    this.idBatchSize = idBatchSize;
    this.pageDelay = Objects.requireNonNull(pageDelay, "pageDelay");
    this.maxRetries = maxRetries;
  }

  // ---------------------------------------------------------------------
  // Queries
  // ---------------------------------------------------------------------

  /** Records submitted or updated inside {@code [start, end]} in any of {@code categories}. */
  public List<RawRecord> searchWindow(
      List<String> categories, Instant start, Instant end, int maxResults) {
    String query = windowQuery(categories, start, end);
    log.info("arxiv.search query={} maxResults={}", query, maxResults);

    List<RawRecord> out = new ArrayList<>();
    int offset = 0;
    while (out.size() < maxResults) {
      int size = Math.min(pageSize, maxResults - out.size());
      final int pageStart = offset;
      String xml =
          get(
              uri ->
                  uri.path("/api/query")
                      .queryParam("search_query", "{q}")
                      .queryParam("start", pageStart)
                      .queryParam("max_results", size)
                      .queryParam("sortBy", "submittedDate")
                      .queryParam("sortOrder", "descending")
                      .build(query));
      List<RawRecord> page = parseFeed(xml);
      out.addAll(page);
      log.info("arxiv.search.page start={} got={} total={}", pageStart, page.size(), out.size());
      if (page.size() < size) {
        break;
      }
      offset += page.size();
      pause();
    }
    return out;
  }

  /** Records for the given ids; ids unknown to arXiv are simply absent from the result. */
  public List<RawRecord> fetchByIds(List<String> ids) {
    List<RawRecord> out = new ArrayList<>();
    for (int i = 0; i < ids.size(); i += idBatchSize) {
      List<String> batch = ids.subList(i, Math.min(ids.size(), i + idBatchSize));
      String joined = String.join(",", batch);
      String xml =
          get(
              uri ->
                  uri.path("/api/query")
                      .queryParam("id_list", "{ids}")
                      .queryParam("max_results", batch.size())
                      .build(joined));
      List<RawRecord> page = parseFeed(xml);
      out.addAll(page);
      log.info("arxiv.fetch batch={} got={}", batch.size(), page.size());
      if (i + idBatchSize < ids.size()) {
        pause();
      }
    }
    return out;
  }

  static String windowQuery(List<String> categories, Instant start, Instant end) {
    String s = QUERY_TS.format(start);
    String e = QUERY_TS.format(end);
    String dates = "(submittedDate:[" + s + " TO " + e + "] OR lastUpdatedDate:[" + s + " TO " + e + "])";
    if (categories == null || categories.isEmpty()) {
      return dates;
    }
    String cats =
        categories.stream().map(c -> "cat:" + c.trim()).collect(Collectors.joining(" OR "));
    return dates + " AND (" + cats + ")";
  }

  // ---------------------------------------------------------------------
  // Atom parsing
  // ---------------------------------------------------------------------

  static List<RawRecord> parseFeed(String xml) {
    if (xml == null || xml.isBlank()) {
      return List.of();
    }
    try {
      DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
      f.setNamespaceAware(true);
      f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      DocumentBuilder db = f.newDocumentBuilder();
      Document doc = db.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

      List<RawRecord> out = new ArrayList<>();
      NodeList entries = doc.getElementsByTagNameNS(ATOM_NS, "entry");
      for (int i = 0; i < entries.getLength(); i++) {
        RawRecord r = parseEntry((Element) entries.item(i));
        if (r != null) {
          out.add(r);
        }
      }
      return out;
    } catch (Exception e) {
      log.error("arxiv.parse failed", e);
      throw new RuntimeException("arXiv feed parse failed", e);
    }
  }

  private static RawRecord parseEntry(Element entry) {
    String rawId = text(entry, ATOM_NS, "id");
    if (rawId == null || rawId.contains("/api/errors")) {
      log.warn("arxiv.entry.skip id={} title={}", rawId, text(entry, ATOM_NS, "title"));
      return null;
    }
    String id = shortId(rawId);

    RawRecord.RawRecordBuilder b =
        RawRecord.builder()
            .id(id)
            .title(collapse(text(entry, ATOM_NS, "title")))
            .summary(collapse(text(entry, ATOM_NS, "summary")))
            .doi(collapse(text(entry, ARXIV_NS, "doi")))
            .published(instant(text(entry, ATOM_NS, "published")))
            .updated(instant(text(entry, ATOM_NS, "updated")));

    NodeList authors = entry.getElementsByTagNameNS(ATOM_NS, "author");
    for (int i = 0; i < authors.getLength(); i++) {
      String name = collapse(text((Element) authors.item(i), ATOM_NS, "name"));
      if (name != null) {
        b.author(name);
      }
    }

    Set<String> categories = new LinkedHashSet<>();
    NodeList primary = entry.getElementsByTagNameNS(ARXIV_NS, "primary_category");
    if (primary.getLength() > 0) {
      categories.add(((Element) primary.item(0)).getAttribute("term"));
    }
    NodeList cats = entry.getElementsByTagNameNS(ATOM_NS, "category");
    for (int i = 0; i < cats.getLength(); i++) {
      categories.add(((Element) cats.item(i)).getAttribute("term"));
    }
    categories.remove("");
    b.categories(categories);

    String pdf = null;
    NodeList links = entry.getElementsByTagNameNS(ATOM_NS, "link");
    for (int i = 0; i < links.getLength(); i++) {
      Element link = (Element) links.item(i);
      if ("application/pdf".equals(link.getAttribute("type"))) {
        pdf = link.getAttribute("href");
        break;
      }
    }
    if (pdf == null || pdf.isBlank()) {
      pdf = "https://arxiv.org/pdf/" + id;
    }
    b.pdfUrl(pdf.replaceFirst("^http://", "https://"));
    return b.build();
  }

  /** {@code http://arxiv.org/abs/2401.01234v2} becomes {@code 2401.01234}. */
  static String shortId(String entryId) {
    String s = entryId.trim();
    int abs = s.indexOf("/abs/");
    s = abs >= 0 ? s.substring(abs + 5) : s.substring(s.lastIndexOf('/') + 1);
    return withoutVersion(s);
  }

  /** {@code 2401.01234v2} becomes {@code 2401.01234}; old-style ids keep their archive prefix. */
  public static String withoutVersion(String id) {
    return VERSION_SUFFIX.matcher(id.trim()).replaceFirst("");
  }

  // ---------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------

  private String get(Function<UriBuilder, URI> uri) {
    return webClient
        .get()
        .uri(uri)
        .retrieve()
        .bodyToMono(String.class)
        .retryWhen(
            Retry.backoff(maxRetries, Duration.ofMillis(500)).filter(ArxivClient::isTransient))
        .doOnError(e -> log.error("arxiv.request failed: {}", e.getMessage()))
        .block();
  }

  private static boolean isTransient(Throwable t) {
    if (t instanceof WebClientResponseException w) {
      return w.getStatusCode().is5xxServerError();
    }
    return t instanceof WebClientRequestException;
  }

  private void pause() {
    if (pageDelay.isZero()) {
      return;
    }
    try {
      Thread.sleep(pageDelay.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("arXiv paging interrupted", ie);
    }
  }

  private static String text(Element parent, String ns, String local) {
    NodeList nl = parent.getElementsByTagNameNS(ns, local);
    if (nl.getLength() == 0) {
      return null;
    }
    return nl.item(0).getTextContent();
  }

  private static String collapse(String s) {
    if (s == null) return null;
    String t = WHITESPACE.matcher(s).replaceAll(" ").trim();
    return t.isEmpty() ? null : t;
  }

  private static Instant instant(String s) {
    if (s == null || s.isBlank()) return null;
    return Instant.parse(s.trim());
  }
}
