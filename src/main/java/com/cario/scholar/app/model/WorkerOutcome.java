package com.cario.scholar.app.model;

/**
 * Result of one call to an external enrichment source.
 *
 * <p>Absence of a match is an {@link Ok} carrying an empty value. {@link QuotaExhausted} means every
 * credential for the source has hit its usage limit; {@link Failed} means the retry budget ran out
 * on ordinary errors.
 */
public sealed interface WorkerOutcome<T>
    permits WorkerOutcome.Ok, WorkerOutcome.QuotaExhausted, WorkerOutcome.Failed {

  static <T> WorkerOutcome<T> ok(T value) {
    return new Ok<>(value);
  }

  static <T> WorkerOutcome<T> quotaExhausted(String source, int credentialIndex) {
    return new QuotaExhausted<>(source, credentialIndex);
  }

  static <T> WorkerOutcome<T> failed(String reason) {
    return new Failed<>(reason);
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  default boolean isQuotaExhausted() {
    return this instanceof QuotaExhausted;
  }

  /** Value of an {@link Ok}, otherwise {@code fallback}. */
  default T orElse(T fallback) {
    return this instanceof Ok<T> ok ? ok.value() : fallback;
  }

  /** Re-types a non-Ok outcome; fails for {@link Ok}. */
  @SuppressWarnings("unchecked")
  default <R> WorkerOutcome<R> propagate() {
    if (this instanceof Ok) {
      throw new IllegalStateException("cannot propagate a successful outcome");
    }
    return (WorkerOutcome<R>) this;
  }

  record Ok<T>(T value) implements WorkerOutcome<T> {}

  record QuotaExhausted<T>(String source, int credentialIndex) implements WorkerOutcome<T> {}

  record Failed<T>(String reason) implements WorkerOutcome<T> {}
}
