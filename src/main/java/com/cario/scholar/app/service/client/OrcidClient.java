package com.cario.scholar.app.service.client;

import com.cario.scholar.app.model.PersonProfile;
import com.cario.scholar.app.model.ProfileEntry;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Read-only client for the ORCID public API (v3.0).
 *
 * <p>Name search returns candidate iDs; a profile is assembled from the {@code person}, {@code
 * employments} and {@code educations} sub-resources.
 */
@Log4j2
public class OrcidClient {

  private final WebClient webClient;

  public OrcidClient(WebClient.Builder builder, String baseUrl) {
    this.webClient =
        builder
            .clone()
            .baseUrl(baseUrl)
            .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
            .build();
  }

  // ---------------------------------------------------------------------
  // Search
  // ---------------------------------------------------------------------

  /** Candidate iDs for a display name, best first. */
  public List<String> searchIds(String name, int rows) {
    String q = nameQuery(name);
    JsonNode body = getJson("/search", q, rows);
    List<String> ids = new ArrayList<>();
    if (body != null) {
      for (JsonNode r : body.path("result")) {
        String id = r.path("orcid-identifier").path("path").asText(null);
        if (id != null && !id.isBlank()) {
          ids.add(id);
        }
      }
    }
    log.info("orcid.search name={} hits={}", name, ids.size());
    return ids;
  }

  /** Fallback search on the expanded endpoint with split given/family names. */
  public List<String> expandedSearchIds(String name, int rows) {
    String[] parts = splitName(name);
    if (parts[0].isEmpty() || parts[1].isEmpty()) {
      return List.of();
    }
    String q = "given-names:" + parts[0] + " AND family-name:" + parts[1];
    JsonNode body = getJson("/expanded-search", q, rows);
    List<String> ids = new ArrayList<>();
    if (body != null) {
      for (JsonNode r : body.path("expanded-result")) {
        String id = r.path("orcid-id").asText(null);
        if (id != null && !id.isBlank()) {
          ids.add(id);
        }
      }
    }
    log.info("orcid.expandedSearch name={} hits={}", name, ids.size());
    return ids;
  }

  /**
   * Query matching the exact given/family split, or the full name in any name field.
   *
   * <p>{@code Alice B Smith} becomes {@code (given-names:"Alice B" AND family-name:"Smith") OR
   * (given-names:"Alice B Smith" OR family-name:"Alice B Smith" OR other-names:"Alice B Smith")}.
   */
  static String nameQuery(String name) {
    String full = name.trim().replace("\"", "");
    String[] parts = splitName(full);
    String any =
        "(given-names:\"" + full + "\" OR family-name:\"" + full + "\" OR other-names:\"" + full + "\")";
    if (parts[0].isEmpty() || parts[1].isEmpty()) {
      return any;
    }
    return "(given-names:\"" + parts[0] + "\" AND family-name:\"" + parts[1] + "\") OR " + any;
  }

  /** {given, family}; family is the last token. */
  static String[] splitName(String name) {
    String[] tokens = name.trim().split("\\s+");
    if (tokens.length < 2) {
      return new String[] {"", tokens.length == 1 ? tokens[0] : ""};
    }
    String given = String.join(" ", Arrays.copyOf(tokens, tokens.length - 1));
    return new String[] {given, tokens[tokens.length - 1]};
  }

  // ---------------------------------------------------------------------
  // Profile
  // ---------------------------------------------------------------------

  public PersonProfile fetchProfile(String orcidId) {
    JsonNode person = getJson("/" + orcidId + "/person");
    JsonNode employments = getJson("/" + orcidId + "/employments");
    JsonNode educations = getJson("/" + orcidId + "/educations");

    PersonProfile.PersonProfileBuilder b = PersonProfile.builder().registryId(orcidId);
    if (person != null) {
      JsonNode name = person.path("name");
      b.givenNames(value(name.path("given-names")));
      b.familyName(value(name.path("family-name")));
      b.creditName(value(name.path("credit-name")));
      for (JsonNode other : person.path("other-names").path("other-name")) {
        String content = other.path("content").asText(null);
        if (content != null && !content.isBlank()) {
          b.otherName(content);
        }
      }
      for (JsonNode email : person.path("emails").path("email")) {
        String e = email.path("email").asText(null);
        if (e != null && !e.isBlank()) {
          b.email(e);
        }
      }
    }
    b.employments(entries(employments, "employment-summary"));
    b.educations(entries(educations, "education-summary"));
    return b.build();
  }

  static List<ProfileEntry> entries(JsonNode history, String summaryKey) {
    List<ProfileEntry> out = new ArrayList<>();
    if (history == null) {
      return out;
    }
    for (JsonNode group : history.path("affiliation-group")) {
      for (JsonNode summary : group.path("summaries")) {
        JsonNode s = summary.path(summaryKey);
        if (s.isMissingNode() || s.isNull()) {
          continue;
        }
        out.add(
            ProfileEntry.builder()
                .organization(textOrNull(s.path("organization").path("name")))
                .department(textOrNull(s.path("department-name")))
                .roleTitle(textOrNull(s.path("role-title")))
                .startDate(formatDate(s.path("start-date")))
                .endDate(formatDate(s.path("end-date")))
                .build());
      }
    }
    return out;
  }

  /** {year, month, day} value objects to YYYY-MM-DD, YYYY-MM or YYYY; null without a year. */
  static String formatDate(JsonNode date) {
    if (date == null || date.isMissingNode() || date.isNull()) {
      return null;
    }
    String year = value(date.path("year"));
    if (year == null) {
      return null;
    }
    String month = value(date.path("month"));
    String day = value(date.path("day"));
    if (month == null) {
      return year;
    }
    String mm = month.length() == 1 ? "0" + month : month;
    if (day == null) {
      return year + "-" + mm;
    }
    String dd = day.length() == 1 ? "0" + day : day;
    return year + "-" + mm + "-" + dd;
  }

  // ---------------------------------------------------------------------
  // Helpers
  // ---------------------------------------------------------------------

  private JsonNode getJson(String path, String q, int rows) {
    return webClient
        .get()
        .uri(uri -> uri.path(path).queryParam("q", "{q}").queryParam("rows", rows).build(q))
        .retrieve()
        .bodyToMono(JsonNode.class)
        .doOnError(e -> log.error("orcid.request failed path={} err={}", path, e.getMessage()))
        .block();
  }

  private JsonNode getJson(String path) {
    return webClient
        .get()
        .uri(path)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .doOnError(e -> log.error("orcid.request failed path={} err={}", path, e.getMessage()))
        .block();
  }

  private static String value(JsonNode node) {
    return textOrNull(node.path("value"));
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    String t = node.asText().trim();
    return t.isEmpty() ? null : t;
  }
}
