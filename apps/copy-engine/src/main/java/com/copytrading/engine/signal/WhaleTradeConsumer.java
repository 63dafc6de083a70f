package com.copytrading.engine.signal;

import com.copytrading.domain.orders.OrderSide;
import com.copytrading.infra.kafka.consumer.EventConsumerAdapter;
import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.WhaleTradeDetectedV1;
import com.copytrading.infra.kafka.errors.DeadLetterPublisher;
import com.copytrading.infra.kafka.errors.RetryPolicy;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.util.Locale;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/** Entry point of the copy path. A malformed trade fails validation and ends up dead-lettered. */
@Component
@ConditionalOnProperty(
    prefix = "infra.kafka",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class WhaleTradeConsumer {
  private final EventConsumerAdapter<WhaleTradeDetectedV1> adapter;
  private final CopyTradeCoordinator coordinator;

  public WhaleTradeConsumer(
      EventEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry,
      CopyTradeCoordinator coordinator) {
    this.coordinator = coordinator;
    this.adapter =
        new EventConsumerAdapter<>(
            WhaleTradeDetectedV1.class,
            EventTypes.WHALE_TRADE_DETECTED,
            1,
            codec,
            this::handleEvent,
            deadLetterPublisher,
            retryPolicy,
            telemetry);
  }

  @KafkaListener(
      topics = TopicNames.WHALE_TRADES_V1,
      groupId = "${infra.kafka.consumer.group-id:cg-copy-engine}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }

  private void handleEvent(EventEnvelope<WhaleTradeDetectedV1> envelope) {
    coordinator.onWhaleTrade(toSignal(envelope.payload(), envelope));
  }

  static WhaleSignal toSignal(
      WhaleTradeDetectedV1 payload, EventEnvelope<WhaleTradeDetectedV1> envelope) {
    if (payload.side() == null) {
      throw new IllegalArgumentException("side must not be null");
    }
    return new WhaleSignal(
        payload.tradeId(),
        payload.whaleAddress(),
        payload.tokenId(),
        payload.marketId(),
        payload.category(),
        OrderSide.valueOf(payload.side().toUpperCase(Locale.ROOT)),
        payload.size(),
        payload.price(),
        payload.lastPrice(),
        payload.marketEndsAt(),
        payload.tradedAt() == null ? envelope.occurredAt() : payload.tradedAt(),
        new WhaleMetrics(
            payload.whaleScore(),
            payload.sharpe30d(),
            payload.sharpe90d(),
            payload.currentDrawdown(),
            payload.winRate()));
  }
}
