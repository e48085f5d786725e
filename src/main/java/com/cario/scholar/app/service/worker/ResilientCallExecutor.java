package com.cario.scholar.app.service.worker;

import com.cario.scholar.app.model.WorkerOutcome;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;

/**
 * Runs one external call with a retry budget and credential rotation.
 *
 * <p>Ordinary failures are retried up to {@code maxAttempts} times with linear backoff ({@code
 * retryDelay * attempt}). A failure classified as quota exhaustion retires the active credential
 * and retries immediately with the next one without spending the retry budget; once the pool is
 * empty the call ends as {@link WorkerOutcome.QuotaExhausted}.
 */
@Log4j2
public class ResilientCallExecutor {

  private final int maxAttempts;
  private final Duration retryDelay;
  private final QuotaErrorClassifier classifier;

  public ResilientCallExecutor(int maxAttempts, Duration retryDelay, QuotaErrorClassifier classifier) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  /**
   * @param operation short name for logs, e.g. {@code orcid.search}
   * @param pool credentials of the source being called
   * @param call receives the active credential
   */
  public <T> WorkerOutcome<T> call(String operation, CredentialPool pool, Function<String, T> call) {
    int attempt = 0;
    String lastError = null;
    while (attempt < maxAttempts) {
      String credential = pool.current();
      if (credential == null) {
        return WorkerOutcome.quotaExhausted(pool.getSource(), pool.currentIndex());
      }
      try {
        return WorkerOutcome.ok(call.apply(credential));
      } catch (RuntimeException e) {
        lastError = describe(e);
        if (pool.isMetered() && classifier.isQuotaError(e)) {
          log.warn(
              "call.quota op={} source={} index={} err={}",
              operation,
              pool.getSource(),
              pool.currentIndex(),
              lastError);
          if (!pool.rotateFrom(credential)) {
            return WorkerOutcome.quotaExhausted(pool.getSource(), pool.currentIndex());
          }
          continue;
        }
        attempt++;
        log.warn("call.retry op={} attempt={}/{} err={}", operation, attempt, maxAttempts, lastError);
        if (attempt < maxAttempts && !sleep(retryDelay.multipliedBy(attempt))) {
          return WorkerOutcome.failed(operation + " interrupted");
        }
      }
    }
    log.error("call.failed op={} attempts={} err={}", operation, maxAttempts, lastError);
    return WorkerOutcome.failed(operation + " failed after " + maxAttempts + " attempts: " + lastError);
  }

  private static boolean sleep(Duration d) {
    if (d.isZero() || d.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(d.toMillis());
      return true;
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String describe(Throwable e) {
    String msg = e.getMessage();
    return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
  }
}
