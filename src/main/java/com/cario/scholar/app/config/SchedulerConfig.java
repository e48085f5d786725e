package com.cario.scholar.app.config;

import com.cario.scholar.app.repository.ProgressStore;
import com.cario.scholar.app.scheduler.ArxivIngestScheduler;
import com.cario.scholar.app.scheduler.SessionCleanupScheduler;
import com.cario.scholar.app.service.BatchOrchestrator;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("scholar-scheduler-");

    scheduler.setErrorHandler(t -> log.error("scheduler.uncaught", t));

    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);

    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);

    scheduler.initialize();
    log.info(
        "scheduler.init poolSize={} awaitTerminationSeconds={}", poolSize, awaitTerminationSeconds);
    return scheduler;
  }

  /** Runs the per-record enrichment chains; stage ceilings are enforced inside the chains. */
  @Bean
  public ThreadPoolTaskExecutor enrichmentExecutor(EnrichmentProperties enrichment) {
    int threads = enrichment.getConcurrency().getExecutorThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("enrichment-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    log.info("executor.init name=enrichment threads={}", threads);
    return executor;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "scheduled.ingest",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public ArxivIngestScheduler arxivIngestScheduler(BatchOrchestrator orchestrator) {
    return new ArxivIngestScheduler(orchestrator);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "scheduled.cleanup",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public SessionCleanupScheduler sessionCleanupScheduler(
      ProgressStore store, ProgressProperties progress) {
    return new SessionCleanupScheduler(store, progress.getRetention());
  }
}
