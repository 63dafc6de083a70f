package com.copytrading.infra.kafka.producer;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.OrderUpdatedV1;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class OrderEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;
  private final Clock clock;

  public OrderEventProducer(EventPublisher eventPublisher, String producerName, Clock clock) {
    this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
    this.producerName = producerName;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Keyed by order id; correlated by the root idempotency key so child orders share a trace. */
  public CompletableFuture<SendResult<String, String>> publishOrderUpdated(OrderUpdatedV1 payload) {
    String key = requireText(payload.orderId(), "payload.orderId");
    String correlationId = requireText(payload.idempotencyKey(), "payload.idempotencyKey");
    int childMarker = correlationId.indexOf(":child:");
    if (childMarker > 0) {
      correlationId = correlationId.substring(0, childMarker);
    }
    EventEnvelope<OrderUpdatedV1> envelope =
        EventEnvelope.of(
            EventTypes.ORDER_UPDATED,
            EVENT_VERSION_V1,
            producerName,
            correlationId,
            key,
            clock.instant(),
            payload);
    return eventPublisher.publish(TopicNames.ORDERS_UPDATED_V1, envelope);
  }

  private static String requireText(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}
