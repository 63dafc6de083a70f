package com.copytrading.engine.order;

import com.copytrading.integration.polymarket.ExchangeException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Retry schedule for exchange calls: {@code 1 + maxRetries} attempts, exponential backoff from the
 * initial delay, only for transient {@link ExchangeException}s.
 */
@Component
public class ExchangeRetryPolicy {
  private static final Logger log = LoggerFactory.getLogger(ExchangeRetryPolicy.class);

  private final int maxRetries;
  private final long initialBackoffMs;
  private final double multiplier;
  private final Sleeper sleeper;

  @Autowired
  public ExchangeRetryPolicy(ExecutionProperties properties) {
    this(
        properties.getMaxRetries(),
        properties.getInitialBackoffMs(),
        properties.getBackoffMultiplier(),
        Sleeper.THREAD);
  }

  ExchangeRetryPolicy(int maxRetries, long initialBackoffMs, double multiplier, Sleeper sleeper) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (initialBackoffMs < 0) {
      throw new IllegalArgumentException("initialBackoffMs must be >= 0");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    this.maxRetries = maxRetries;
    this.initialBackoffMs = initialBackoffMs;
    this.multiplier = multiplier;
    this.sleeper = sleeper;
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }

  public boolean isRetryable(RuntimeException ex) {
    return ex instanceof ExchangeException exchangeException && exchangeException.isTransient();
  }

  /** Delay before retry number {@code retry} (1-based): 1s, 2s, 4s with the defaults. */
  public Duration backoffForRetry(int retry) {
    double delay = initialBackoffMs * Math.pow(multiplier, Math.max(0, retry - 1));
    return Duration.ofMillis((long) delay);
  }

  public void pause(Duration backoff) {
    if (backoff.isZero() || backoff.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while backing off", ex);
    }
  }

  /** Runs an idempotent exchange call such as a cancel or a poll under this policy. */
  public <T> T execute(String operation, Supplier<T> call) {
    int attempt = 1;
    while (true) {
      try {
        return call.get();
      } catch (RuntimeException ex) {
        if (!isRetryable(ex) || attempt >= maxAttempts()) {
          throw ex;
        }
        Duration backoff = backoffForRetry(attempt);
        log.warn(
            "Retrying exchange call operation={} attempt={} backoffMs={} error={}",
            operation,
            attempt,
            backoff.toMillis(),
            ex.getMessage());
        pause(backoff);
        attempt++;
      }
    }
  }
}
