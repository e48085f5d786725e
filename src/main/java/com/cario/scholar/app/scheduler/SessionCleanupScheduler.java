package com.cario.scholar.app.scheduler;

import com.cario.scholar.app.repository.ProgressStore;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

@Log4j2
@RequiredArgsConstructor
public class SessionCleanupScheduler {

  private final ProgressStore store;
  private final Duration retention;

  @Scheduled(cron = "${scheduled.cleanup.cron:0 30 3 * * *}")
  public void removeOldSessions() {
    int removed = store.cleanupCompletedSessions(retention);
    log.info("scheduler.cleanup removed={} retention={}", removed, retention);
  }
}
