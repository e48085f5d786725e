package com.cario.scholar.app.service.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.cario.scholar.app.model.WorkerOutcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ResilientCallExecutorTest {

  private final ResilientCallExecutor executor =
      new ResilientCallExecutor(3, Duration.ZERO, new QuotaErrorClassifier());

  @Test
  void transientFailureIsRetried() {
    AtomicInteger calls = new AtomicInteger();

    WorkerOutcome<String> out =
        executor.call(
            "test.op",
            CredentialPool.single("llm"),
            key -> {
              if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
              }
              return "ok";
            });

    assertThat(out).isEqualTo(WorkerOutcome.ok("ok"));
    assertThat(calls).hasValue(2);
  }

  @Test
  void retryBudgetEndsInFailed() {
    AtomicInteger calls = new AtomicInteger();

    WorkerOutcome<String> out =
        executor.call(
            "test.op",
            CredentialPool.single("llm"),
            key -> {
              calls.incrementAndGet();
              throw new IllegalStateException("503 Service Unavailable");
            });

    assertThat(out).isInstanceOf(WorkerOutcome.Failed.class);
    assertThat(((WorkerOutcome.Failed<String>) out).reason()).contains("after 3 attempts");
    assertThat(calls).hasValue(3);
  }

  @Test
  void threeQuotaErrorsAcrossThreeKeysExhaustThePool() {
    CredentialPool pool = new CredentialPool("tavily", List.of("k1", "k2", "k3"));
    List<String> used = new ArrayList<>();

    WorkerOutcome<String> out =
        executor.call(
            "tavily.search",
            pool,
            key -> {
              used.add(key);
              throw new IllegalStateException("This request exceeds your plan's set usage limit");
            });

    assertThat(used).containsExactly("k1", "k2", "k3");
    assertThat(out).isInstanceOf(WorkerOutcome.QuotaExhausted.class);
    WorkerOutcome.QuotaExhausted<String> q = (WorkerOutcome.QuotaExhausted<String>) out;
    assertThat(q.source()).isEqualTo("tavily");
    assertThat(q.credentialIndex()).isEqualTo(3);
  }

  @Test
  void quotaErrorRotatesWithoutSpendingRetries() {
    CredentialPool pool = new CredentialPool("tavily", List.of("k1", "k2"));

    WorkerOutcome<String> out =
        executor.call(
            "tavily.search",
            pool,
            key -> {
              if (key.equals("k1")) {
                throw new IllegalStateException("429 Too Many Requests");
              }
              return "answer from " + key;
            });

    assertThat(out.orElse(null)).isEqualTo("answer from k2");
  }

  @Test
  void unmeteredSourceTreatsQuotaWordsAsOrdinaryErrors() {
    CredentialPool pool = CredentialPool.unmetered("pdf");
    AtomicInteger calls = new AtomicInteger();

    WorkerOutcome<String> out =
        executor.call(
            "pdf.fetch",
            pool,
            key -> {
              calls.incrementAndGet();
              throw new IllegalStateException("size limit exceeded");
            });

    assertThat(out).isInstanceOf(WorkerOutcome.Failed.class);
    assertThat(calls).hasValue(3);
    assertThat(pool.isExhausted()).isFalse();
  }
}
