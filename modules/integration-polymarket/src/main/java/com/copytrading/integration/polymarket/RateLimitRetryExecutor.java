package com.copytrading.integration.polymarket;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a single exchange call while the exchange answers with a rate-limit error, honouring
 * {@code Retry-After} up to the backoff maximum. Other errors propagate untouched so the caller's
 * own retry policy decides.
 */
public class RateLimitRetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RateLimitRetryExecutor.class);

  static final String RETRY_COUNTER = "connector.polymarket.rate_limit.retry";
  static final String EXHAUSTED_COUNTER = "connector.polymarket.rate_limit.exhausted";

  private final int maxAttempts;
  private final RetryAfterParser retryAfterParser;
  private final JitteredExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RateLimitRetryExecutor(
      int maxAttempts,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      MeterRegistry meterRegistry) {
    this(maxAttempts, retryAfterParser, backoff, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RateLimitRetryExecutor(
      int maxAttempts,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String operationName, Operation<T> operation) {
    for (int attempt = 1; ; attempt++) {
      try {
        return operation.run();
      } catch (ExchangeException ex) {
        if (!ex.isRateLimitError()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "operation", operationName).increment();
          throw ex;
        }
        Duration wait = waitFor(ex, attempt);
        meterRegistry.counter(RETRY_COUNTER, "operation", operationName).increment();
        log.warn(
            "Exchange rate limited operation={} attempt={} waitMs={}",
            operationName,
            attempt,
            wait.toMillis());
        sleep(wait);
      }
    }
  }

  private Duration waitFor(ExchangeException ex, int attempt) {
    return ex.retryAfterHeader()
        .flatMap(retryAfterParser::parse)
        .map(retryAfter -> retryAfter.compareTo(backoff.maxBackoff()) <= 0 ? retryAfter : backoff.maxBackoff())
        .orElseGet(() -> backoff.backoffForAttempt(attempt));
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new ExchangeException(
          ExchangeErrorCode.RATE_LIMITED, "Interrupted during rate-limit backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
