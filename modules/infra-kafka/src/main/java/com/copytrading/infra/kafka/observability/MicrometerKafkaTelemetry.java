package com.copytrading.infra.kafka.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  static final String PUBLISH_TOTAL = "infra.kafka.publish.total";
  static final String PUBLISH_DURATION = "infra.kafka.publish.duration";
  static final String CONSUME_TOTAL = "infra.kafka.consume.total";
  static final String CONSUME_DURATION = "infra.kafka.consume.duration";
  static final String RETRY_TOTAL = "infra.kafka.consume.retry.total";
  static final String DEAD_LETTER_TOTAL = "infra.kafka.deadletter.total";

  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {
    meterRegistry
        .counter(PUBLISH_TOTAL, "topic", safe(topic), "event_type", safe(eventType), "outcome", "success")
        .increment();
    timer(PUBLISH_DURATION, topic, eventType).record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {
    meterRegistry
        .counter(
            PUBLISH_TOTAL,
            "topic", safe(topic),
            "event_type", safe(eventType),
            "outcome", "failure",
            "error", errorName(error))
        .increment();
  }

  @Override
  public void onConsumeSuccess(String topic, String eventType, long durationNanos) {
    meterRegistry
        .counter(CONSUME_TOTAL, "topic", safe(topic), "event_type", safe(eventType), "outcome", "success")
        .increment();
    timer(CONSUME_DURATION, topic, eventType).record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onConsumeFailure(String topic, String eventType, Throwable error) {
    meterRegistry
        .counter(
            CONSUME_TOTAL,
            "topic", safe(topic),
            "event_type", safe(eventType),
            "outcome", "failure",
            "error", errorName(error))
        .increment();
  }

  @Override
  public void onRetry(String topic, String eventType, int attempt) {
    meterRegistry.counter(RETRY_TOTAL, "topic", safe(topic), "event_type", safe(eventType)).increment();
  }

  @Override
  public void onDeadLetter(String topic, Throwable error) {
    meterRegistry.counter(DEAD_LETTER_TOTAL, "topic", safe(topic), "error", errorName(error)).increment();
  }

  private Timer timer(String name, String topic, String eventType) {
    return Timer.builder(name)
        .tag("topic", safe(topic))
        .tag("event_type", safe(eventType))
        .register(meterRegistry);
  }

  private static String safe(String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }

  private static String errorName(Throwable error) {
    return error == null ? "none" : error.getClass().getSimpleName();
  }
}
