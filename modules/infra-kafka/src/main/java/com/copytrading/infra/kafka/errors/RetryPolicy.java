package com.copytrading.infra.kafka.errors;

import java.time.Duration;

public interface RetryPolicy {
  int maxAttempts();

  Duration backoffForAttempt(int attempt);

  default boolean isRetryable(Exception exception) {
    return true;
  }

  default boolean shouldRetry(int attempt, Exception exception) {
    return attempt < maxAttempts() && isRetryable(exception);
  }
}
