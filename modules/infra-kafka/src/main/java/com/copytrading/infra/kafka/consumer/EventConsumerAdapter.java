package com.copytrading.infra.kafka.consumer;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventHeaders;
import com.copytrading.infra.kafka.errors.DeadLetterPublisher;
import com.copytrading.infra.kafka.errors.InvalidEventMetadataException;
import com.copytrading.infra.kafka.errors.RetryPolicy;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates, decodes and dispatches one record to a typed handler. Handler failures are retried
 * in place per the {@link RetryPolicy}; records that cannot be decoded or that exhaust their
 * attempts go to the {@link DeadLetterPublisher}. The method never throws, so the listener can
 * acknowledge the offset unconditionally.
 */
public class EventConsumerAdapter<T> {
  private static final Logger log = LoggerFactory.getLogger(EventConsumerAdapter.class);

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final Class<T> payloadType;
  private final String expectedEventType;
  private final int expectedEventVersion;
  private final EventEnvelopeJsonCodec codec;
  private final EventHandler<T> handler;
  private final DeadLetterPublisher deadLetterPublisher;
  private final RetryPolicy retryPolicy;
  private final KafkaTelemetry telemetry;
  private final Sleeper sleeper;

  public EventConsumerAdapter(
      Class<T> payloadType,
      String expectedEventType,
      int expectedEventVersion,
      EventEnvelopeJsonCodec codec,
      EventHandler<T> handler,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry) {
    this(
        payloadType,
        expectedEventType,
        expectedEventVersion,
        codec,
        handler,
        deadLetterPublisher,
        retryPolicy,
        telemetry,
        duration -> Thread.sleep(duration.toMillis()));
  }

  public EventConsumerAdapter(
      Class<T> payloadType,
      String expectedEventType,
      int expectedEventVersion,
      EventEnvelopeJsonCodec codec,
      EventHandler<T> handler,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry,
      Sleeper sleeper) {
    this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
    this.expectedEventType = expectedEventType;
    this.expectedEventVersion = expectedEventVersion;
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.handler = Objects.requireNonNull(handler, "handler must not be null");
    this.deadLetterPublisher =
        Objects.requireNonNull(deadLetterPublisher, "deadLetterPublisher must not be null");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    this.telemetry = telemetry == null ? KafkaTelemetry.NOOP : telemetry;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public void process(ConsumerRecord<String, String> record) {
    long started = System.nanoTime();

    EventEnvelope<T> envelope;
    try {
      validateMetadataHeaders(record.headers());
      envelope = codec.decode(record.value(), payloadType);
      validateEnvelopeIdentity(envelope);
    } catch (RuntimeException ex) {
      telemetry.onConsumeFailure(
          record.topic(), headerValue(record.headers(), EventHeaders.X_EVENT_TYPE), ex);
      deadLetter(record, 1, ex);
      return;
    }

    int attempt = 1;
    while (true) {
      try {
        handler.handle(envelope);
        telemetry.onConsumeSuccess(record.topic(), envelope.eventType(), System.nanoTime() - started);
        return;
      } catch (Exception ex) {
        telemetry.onConsumeFailure(record.topic(), envelope.eventType(), ex);
        if (ex instanceof InvalidEventMetadataException || !retryPolicy.shouldRetry(attempt, ex)) {
          deadLetter(record, attempt, ex);
          return;
        }
        Duration backoff = retryPolicy.backoffForAttempt(attempt);
        log.warn(
            "Retrying event topic={} key={} eventType={} attempt={} backoffMs={} error={}",
            record.topic(),
            record.key(),
            envelope.eventType(),
            attempt,
            backoff.toMillis(),
            ex.getMessage());
        telemetry.onRetry(record.topic(), envelope.eventType(), attempt);
        if (!pause(backoff)) {
          deadLetter(record, attempt, new IllegalStateException("Interrupted while backing off", ex));
          return;
        }
        attempt++;
      }
    }
  }

  private void deadLetter(ConsumerRecord<String, String> record, int attempts, Exception ex) {
    deadLetterPublisher.publish(record, attempts, ex);
    telemetry.onDeadLetter(record.topic(), ex);
  }

  private boolean pause(Duration backoff) {
    if (backoff == null || backoff.isZero() || backoff.isNegative()) {
      return true;
    }
    try {
      sleeper.sleep(backoff);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void validateMetadataHeaders(Headers headers) {
    requireHeader(headers, EventHeaders.X_EVENT_TYPE);
    String versionRaw = requireHeader(headers, EventHeaders.X_EVENT_VERSION);
    int version;
    try {
      version = Integer.parseInt(versionRaw.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidEventMetadataException(
          "Header " + EventHeaders.X_EVENT_VERSION + " is not a valid integer: " + versionRaw);
    }
    if (version < 1) {
      throw new InvalidEventMetadataException(
          "Header " + EventHeaders.X_EVENT_VERSION + " must be >= 1");
    }
    requireHeader(headers, EventHeaders.X_CORRELATION_ID);
  }

  private void validateEnvelopeIdentity(EventEnvelope<T> envelope) {
    if (!expectedEventType.equals(envelope.eventType())) {
      throw new InvalidEventMetadataException(
          "Unexpected event type: expected=" + expectedEventType + " actual=" + envelope.eventType());
    }
    if (expectedEventVersion != envelope.eventVersion()) {
      throw new InvalidEventMetadataException(
          "Unexpected event version: expected="
              + expectedEventVersion
              + " actual="
              + envelope.eventVersion());
    }
  }

  private static String requireHeader(Headers headers, String name) {
    String value = headerValue(headers, name);
    if (value == null || value.isBlank()) {
      throw new InvalidEventMetadataException("Missing required header: " + name);
    }
    return value;
  }

  private static String headerValue(Headers headers, String name) {
    Header header = headers.lastHeader(name);
    if (header == null || header.value() == null) {
      return null;
    }
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
