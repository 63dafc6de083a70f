package com.copytrading.infra.kafka.observability;

/** Hooks for publish and consume outcomes. The default methods record nothing. */
public interface KafkaTelemetry {
  KafkaTelemetry NOOP = new KafkaTelemetry() {};

  default void onPublishSuccess(String topic, String eventType, long durationNanos) {}

  default void onPublishFailure(String topic, String eventType, Throwable error) {}

  default void onConsumeSuccess(String topic, String eventType, long durationNanos) {}

  default void onConsumeFailure(String topic, String eventType, Throwable error) {}

  default void onRetry(String topic, String eventType, int attempt) {}

  default void onDeadLetter(String topic, Throwable error) {}
}
