package com.copytrading.infra.kafka.producer;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventHeaders;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.copytrading.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = telemetry == null ? KafkaTelemetry.NOOP : telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, EventEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    Objects.requireNonNull(envelope, "envelope must not be null");

    long started = System.nanoTime();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, envelope.key(), codec.encode(envelope));
    addHeaders(record.headers(), envelope);

    CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sendFuture = sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<SendResult<String, String>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, envelope.eventType(), System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }
          KafkaPublishException failure = wrap(topic, envelope, throwable);
          telemetry.onPublishFailure(topic, envelope.eventType(), failure);
          result.completeExceptionally(failure);
        });
    return result;
  }

  private static KafkaPublishException wrap(
      String topic, EventEnvelope<?> envelope, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      cause = throwable.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    String verb = cause instanceof TimeoutException ? "Timed out publishing" : "Failed to publish";
    return new KafkaPublishException(
        topic,
        envelope.key(),
        envelope.eventType(),
        verb + " event topic=" + topic + " key=" + envelope.key() + " eventType=" + envelope.eventType(),
        cause);
  }

  private static void addHeaders(Headers headers, EventEnvelope<?> envelope) {
    headers.add(EventHeaders.X_EVENT_TYPE, bytes(envelope.eventType()));
    headers.add(EventHeaders.X_EVENT_VERSION, bytes(Integer.toString(envelope.eventVersion())));
    headers.add(EventHeaders.X_CORRELATION_ID, bytes(envelope.correlationId()));
    headers.add(EventHeaders.CONTENT_TYPE, bytes(EventHeaders.APPLICATION_JSON));
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
