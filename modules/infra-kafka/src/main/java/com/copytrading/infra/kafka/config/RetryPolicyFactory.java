package com.copytrading.infra.kafka.config;

import com.copytrading.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.copytrading.infra.kafka.errors.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

public final class RetryPolicyFactory {
  private RetryPolicyFactory() {}

  public static RetryPolicy create(InfraKafkaProperties.Retry retry) {
    if (retry == null) {
      return ExponentialBackoffRetryPolicy.fixed(1, Duration.ZERO);
    }

    String mode = retry.getMode() == null ? "fixed" : retry.getMode().trim().toLowerCase(Locale.ROOT);
    double multiplier;
    if ("exponential".equals(mode)) {
      multiplier = retry.getMultiplier();
    } else if ("fixed".equals(mode)) {
      multiplier = 1.0d;
    } else {
      throw new IllegalArgumentException("Unsupported infra.kafka.retry.mode: " + retry.getMode());
    }

    ExponentialBackoffRetryPolicy policy =
        new ExponentialBackoffRetryPolicy(
            retry.getMaxAttempts(),
            Duration.ofMillis(Math.max(0L, retry.getInitialBackoffMs())),
            Duration.ofMillis(Math.max(0L, retry.getMaxBackoffMs())),
            multiplier);

    List<Class<? extends Throwable>> retryableTypes = resolveTypes(retry.getRetryableExceptions());
    if (retryableTypes.isEmpty()) {
      return policy;
    }
    return policy.retryingOnly(causeChainMatches(retryableTypes));
  }

  private static Predicate<Exception> causeChainMatches(List<Class<? extends Throwable>> types) {
    return exception -> {
      for (Throwable candidate = exception; candidate != null; candidate = candidate.getCause()) {
        for (Class<? extends Throwable> type : types) {
          if (type.isInstance(candidate)) {
            return true;
          }
        }
      }
      return false;
    };
  }

  private static List<Class<? extends Throwable>> resolveTypes(List<String> configuredTypes) {
    List<Class<? extends Throwable>> resolved = new ArrayList<>();
    if (configuredTypes == null) {
      return resolved;
    }
    for (String configuredType : configuredTypes) {
      if (configuredType == null || configuredType.isBlank()) {
        continue;
      }
      Class<?> clazz;
      try {
        clazz = Class.forName(configuredType.trim());
      } catch (ClassNotFoundException ex) {
        throw new IllegalArgumentException(
            "Retryable exception type not found: " + configuredType, ex);
      }
      if (!Throwable.class.isAssignableFrom(clazz)) {
        throw new IllegalArgumentException(
            "Retryable exception type is not a Throwable: " + configuredType);
      }
      resolved.add(clazz.asSubclass(Throwable.class));
    }
    return resolved;
  }
}
