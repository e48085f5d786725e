package com.cario.scholar.app.service.client;

import java.io.IOException;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.web.reactive.function.client.WebClient;

/** Downloads a pdf and extracts the text of its first page with PDFBox. */
@Log4j2
public class DocumentTextService {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final WebClient webClient;
  private final int maxChars;

  public DocumentTextService(WebClient.Builder builder, int maxBytes, int maxChars) {
    this.webClient =
        builder
            .clone()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(maxBytes))
            .build();
    this.maxChars = maxChars;
  }

  /**
   * First-page text with whitespace collapsed, truncated to the configured length.
   *
   * @return the text, or an empty string when the pdf cannot be parsed
   * @throws RuntimeException when the download fails
   */
  public String firstPageText(String pdfUrl) {
    if (pdfUrl == null || pdfUrl.isBlank()) {
      return "";
    }
    byte[] bytes =
        webClient
            .get()
            .uri(pdfUrl)
            .retrieve()
            .bodyToMono(byte[].class)
            .doOnError(e -> log.error("document.download failed url={} err={}", pdfUrl, e.getMessage()))
            .block();
    if (bytes == null || bytes.length == 0) {
      log.warn("document.empty url={}", pdfUrl);
      return "";
    }
    return extractFirstPage(bytes, pdfUrl);
  }

  String extractFirstPage(byte[] pdf, String source) {
    try (PDDocument doc = PDDocument.load(pdf)) {
      if (doc.getNumberOfPages() == 0) {
        return "";
      }
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setStartPage(1);
      stripper.setEndPage(1);
      String text = WHITESPACE.matcher(stripper.getText(doc)).replaceAll(" ").trim();
      log.debug("document.text source={} chars={}", source, text.length());
      return text.length() > maxChars ? text.substring(0, maxChars) : text;
    } catch (IOException e) {
      log.warn("document.parse failed source={} err={}", source, e.getMessage());
      return "";
    }
  }
}
