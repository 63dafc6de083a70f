package com.copytrading.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Backoff of {@code initial * multiplier^(attempt - 1)} capped at {@code maxBackoff}. A multiplier
 * of 1 gives a fixed backoff.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double multiplier;
  private final Predicate<Exception> retryable;

  public ExponentialBackoffRetryPolicy(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    this(maxAttempts, initialBackoff, maxBackoff, multiplier, exception -> true);
  }

  public ExponentialBackoffRetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      double multiplier,
      Predicate<Exception> retryable) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    this.multiplier = Math.max(1.0d, multiplier);
    this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
  }

  public static ExponentialBackoffRetryPolicy fixed(int maxAttempts, Duration backoff) {
    return new ExponentialBackoffRetryPolicy(maxAttempts, backoff, backoff, 1.0d);
  }

  public ExponentialBackoffRetryPolicy retryingOnly(Predicate<Exception> predicate) {
    return new ExponentialBackoffRetryPolicy(
        maxAttempts, initialBackoff, maxBackoff, multiplier, predicate);
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public boolean isRetryable(Exception exception) {
    return exception != null && retryable.test(exception);
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    long initialMillis = Math.max(0L, initialBackoff.toMillis());
    long maxMillis = Math.max(initialMillis, maxBackoff.toMillis());
    if (initialMillis == 0L) {
      return Duration.ZERO;
    }
    int exponent = Math.max(0, attempt - 1);
    double scaled = initialMillis * Math.pow(multiplier, exponent);
    return Duration.ofMillis((long) Math.min(maxMillis, scaled));
  }
}
