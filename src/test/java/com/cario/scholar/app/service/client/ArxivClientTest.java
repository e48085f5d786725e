package com.cario.scholar.app.service.client;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

import com.cario.scholar.app.model.RawRecord;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

class ArxivClientTest {

  private WireMockServer server;
  private ArxivClient client;

  @BeforeEach
  void start() {
    server = new WireMockServer(wireMockConfig().dynamicPort());
    server.start();
    client = new ArxivClient(WebClient.builder(), server.baseUrl(), 2, 50, Duration.ZERO, 2);
  }

  @AfterEach
  void stop() {
    server.stop();
  }

  static String entry(String id, String title, String... authors) {
    StringBuilder sb = new StringBuilder();
    sb.append("<entry>")
        .append("<id>http://arxiv.org/abs/").append(id).append("v2</id>")
        .append("<updated>2024-01-03T10:00:00Z</updated>")
        .append("<published>2024-01-02T09:30:00Z</published>")
        .append("<title>").append(title).append("</title>")
        .append("<summary>  An abstract\n  spread over lines. </summary>");
    for (String a : authors) {
      sb.append("<author><name>").append(a).append("</name></author>");
    }
    sb.append("<arxiv:doi>10.1000/xyz</arxiv:doi>")
        .append("<link href=\"http://arxiv.org/abs/").append(id).append("v2\" rel=\"alternate\" type=\"text/html\"/>")
        .append("<link title=\"pdf\" href=\"http://arxiv.org/pdf/").append(id).append("v2\" rel=\"related\" type=\"application/pdf\"/>")
        .append("<arxiv:primary_category term=\"cs.CL\" scheme=\"http://arxiv.org/schemas/atom\"/>")
        .append("<category term=\"cs.AI\" scheme=\"http://arxiv.org/schemas/atom\"/>")
        .append("<category term=\"cs.CL\" scheme=\"http://arxiv.org/schemas/atom\"/>")
        .append("</entry>");
    return sb.toString();
  }

  static String feed(String... entries) {
    return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<feed xmlns=\"http://www.w3.org/2005/Atom\" xmlns:arxiv=\"http://arxiv.org/schemas/atom\">"
        + String.join("", entries)
        + "</feed>";
  }

  @Test
  void fetchByIdsParsesEntries() {
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .withQueryParam("id_list", equalTo("2401.00001"))
            .willReturn(
                aResponse()
                    .withHeader("Content-Type", "application/atom+xml")
                    .withBody(feed(entry("2401.00001", "Linking  Authors\n to Places", "Alice Smith", "Bob Lee")))));

    List<RawRecord> records = client.fetchByIds(List.of("2401.00001"));

    assertThat(records).hasSize(1);
    RawRecord r = records.get(0);
    assertThat(r.getId()).isEqualTo("2401.00001");
    assertThat(r.getTitle()).isEqualTo("Linking Authors to Places");
    assertThat(r.getSummary()).isEqualTo("An abstract spread over lines.");
    assertThat(r.getAuthors()).containsExactly("Alice Smith", "Bob Lee");
    assertThat(r.getCategories()).containsExactly("cs.CL", "cs.AI");
    assertThat(r.getPdfUrl()).isEqualTo("https://arxiv.org/pdf/2401.00001v2");
    assertThat(r.getDoi()).isEqualTo("10.1000/xyz");
    assertThat(r.getPublished()).isEqualTo(Instant.parse("2024-01-02T09:30:00Z"));
  }

  @Test
  void errorEntriesAreSkipped() {
    String error =
        "<entry><id>http://arxiv.org/api/errors#incorrect_id_format_for_bad</id>"
            + "<title>Error</title></entry>";
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .willReturn(aResponse().withBody(feed(error, entry("2401.00002", "Ok", "Carol")))));

    List<RawRecord> records = client.fetchByIds(List.of("bad", "2401.00002"));

    assertThat(records).extracting(RawRecord::getId).containsExactly("2401.00002");
  }

  @Test
  void serverErrorIsRetried() {
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .inScenario("flaky")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(503))
            .willSetStateTo("up"));
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .inScenario("flaky")
            .whenScenarioStateIs("up")
            .willReturn(aResponse().withBody(feed(entry("2401.00003", "Retry", "Dan")))));

    List<RawRecord> records = client.fetchByIds(List.of("2401.00003"));

    assertThat(records).hasSize(1);
    server.verify(2, getRequestedFor(urlPathEqualTo("/api/query")));
  }

  @Test
  void windowSearchPagesUntilMaxResults() {
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .withQueryParam("start", equalTo("0"))
            .willReturn(
                aResponse().withBody(feed(entry("2401.00010", "A", "X"), entry("2401.00011", "B", "Y")))));
    server.stubFor(
        get(urlPathEqualTo("/api/query"))
            .withQueryParam("start", equalTo("2"))
            .withQueryParam("max_results", equalTo("1"))
            .willReturn(aResponse().withBody(feed(entry("2401.00012", "C", "Z")))));

    List<RawRecord> records =
        client.searchWindow(
            List.of("cs.AI"),
            Instant.parse("2024-01-01T00:00:00Z"),
            Instant.parse("2024-01-02T00:00:00Z"),
            3);

    assertThat(records)
        .extracting(RawRecord::getId)
        .containsExactly("2401.00010", "2401.00011", "2401.00012");
    server.verify(
        getRequestedFor(urlPathEqualTo("/api/query"))
            .withQueryParam("sortBy", equalTo("submittedDate"))
            .withQueryParam("sortOrder", equalTo("descending")));
  }

  @Test
  void windowQueryCombinesDatesAndCategories() {
    String q =
        ArxivClient.windowQuery(
            List.of("cs.AI", "cs.CV"),
            Instant.parse("2024-01-01T00:00:00Z"),
            Instant.parse("2024-01-02T12:30:00Z"));

    assertThat(q)
        .isEqualTo(
            "(submittedDate:[202401010000 TO 202401021230] OR lastUpdatedDate:[202401010000 TO 202401021230])"
                + " AND (cat:cs.AI OR cat:cs.CV)");
  }

  @Test
  void shortIdDropsPrefixAndVersion() {
    assertThat(ArxivClient.shortId("http://arxiv.org/abs/2401.01234v3")).isEqualTo("2401.01234");
    assertThat(ArxivClient.shortId("http://arxiv.org/abs/hep-th/9901001v1")).isEqualTo("hep-th/9901001");
  }

  @Test
  void versionIsDroppedFromUserIds() {
    assertThat(ArxivClient.withoutVersion(" 2401.00001v12 ")).isEqualTo("2401.00001");
    assertThat(ArxivClient.withoutVersion("hep-th/9901001v1")).isEqualTo("hep-th/9901001");
    assertThat(ArxivClient.withoutVersion("2401.00001")).isEqualTo("2401.00001");
  }
}
