package com.copytrading.integration.polymarket;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Doubling backoff capped at a maximum, with optional full jitter. */
public class JitteredExponentialBackoff {
  private final Duration base;
  private final Duration max;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public JitteredExponentialBackoff(Duration base, Duration max, boolean jitterEnabled) {
    this(base, max, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      Duration base, Duration max, boolean jitterEnabled, DoubleSupplier jitterSource) {
    this.base = nonNegative(base);
    this.max = nonNegative(max).compareTo(this.base) < 0 ? this.base : nonNegative(max);
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public Duration backoffForAttempt(int attempt) {
    long ceilingMs = ceilingForAttempt(attempt);
    if (!jitterEnabled || ceilingMs == 0L) {
      return Duration.ofMillis(ceilingMs);
    }
    double factor = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    return Duration.ofMillis(Math.round(factor * ceilingMs));
  }

  public Duration maxBackoff() {
    return max;
  }

  private long ceilingForAttempt(int attempt) {
    long baseMs = base.toMillis();
    if (baseMs == 0L) {
      return 0L;
    }
    int shift = Math.min(30, Math.max(0, attempt - 1));
    long scaled = baseMs << shift;
    if (scaled < 0L || scaled > max.toMillis()) {
      return max.toMillis();
    }
    return scaled;
  }

  private static Duration nonNegative(Duration value) {
    return value == null || value.isNegative() ? Duration.ZERO : value;
  }
}
