package com.cario.scholar.app.scheduler;

import com.cario.scholar.app.model.IngestReport;
import com.cario.scholar.app.service.BatchOrchestrator;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;

/** Daily ingest of the most recent records in the configured categories. */
@Log4j2
@RequiredArgsConstructor
public class ArxivIngestScheduler {

  private final BatchOrchestrator orchestrator;

  @Value("${scheduled.ingest.categories:cs.AI}")
  private String categories;

  @Value("${scheduled.ingest.days:1}")
  private int days;

  @Value("${scheduled.ingest.max-results:500}")
  private int maxResults;

  @Scheduled(cron = "${scheduled.ingest.cron:0 0 2 * * *}")
  public void ingestRecent() {
    List<String> cats = parseCategories(categories);
    log.info("scheduler.ingest.start categories={} days={} maxResults={}", cats, days, maxResults);
    try {
      IngestReport report = orchestrator.ingestRecent(cats, days, maxResults);
      log.info(
          "scheduler.ingest.finish session={} status={} processed={} failed={}",
          report.getSessionId(),
          report.getStatus().wireName(),
          report.getProcessed(),
          report.getFailed());
      if (report.getResumeHint() != null) {
        log.warn("scheduler.ingest.incomplete session={} hint={}", report.getSessionId(), report.getResumeHint());
      }
    } catch (RuntimeException ex) {
      log.error("scheduler.ingest.error categories={} msg={}", cats, ex.getMessage(), ex);
    }
  }

  static List<String> parseCategories(String raw) {
    if (raw == null) {
      return List.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }
}
