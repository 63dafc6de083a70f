package com.copytrading.infra.kafka.producer;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.PositionUpdatedV1;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class PositionEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;
  private final Clock clock;

  public PositionEventProducer(EventPublisher eventPublisher, String producerName, Clock clock) {
    this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
    this.producerName = producerName;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public CompletableFuture<SendResult<String, String>> publishPositionUpdated(
      PositionUpdatedV1 payload) {
    if (payload.positionId() == null || payload.positionId().isBlank()) {
      throw new IllegalArgumentException("payload.positionId must not be blank");
    }
    EventEnvelope<PositionUpdatedV1> envelope =
        EventEnvelope.of(
            EventTypes.POSITION_UPDATED,
            EVENT_VERSION_V1,
            producerName,
            payload.positionId(),
            payload.positionId(),
            clock.instant(),
            payload);
    return eventPublisher.publish(TopicNames.POSITIONS_UPDATED_V1, envelope);
  }
}
