package com.copytrading.engine.position;

import com.copytrading.engine.sizing.VolatilityTracker;
import com.copytrading.infra.kafka.consumer.EventConsumerAdapter;
import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.MarketPriceTickedV1;
import com.copytrading.infra.kafka.errors.DeadLetterPublisher;
import com.copytrading.infra.kafka.errors.RetryPolicy;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.copytrading.infra.kafka.topics.TopicNames;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "infra.kafka",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PriceTickConsumer {
  private final EventConsumerAdapter<MarketPriceTickedV1> adapter;
  private final ExitCoordinator exitCoordinator;
  private final VolatilityTracker volatilityTracker;

  public PriceTickConsumer(
      EventEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry,
      ExitCoordinator exitCoordinator,
      VolatilityTracker volatilityTracker) {
    this.exitCoordinator = exitCoordinator;
    this.volatilityTracker = volatilityTracker;
    this.adapter =
        new EventConsumerAdapter<>(
            MarketPriceTickedV1.class,
            EventTypes.MARKET_PRICE_TICKED,
            1,
            codec,
            this::handleEvent,
            deadLetterPublisher,
            retryPolicy,
            telemetry);
  }

  @KafkaListener(
      topics = TopicNames.MARKET_PRICES_V1,
      groupId = "${infra.kafka.consumer.group-id:cg-copy-engine}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }

  private void handleEvent(EventEnvelope<MarketPriceTickedV1> envelope) {
    MarketPriceTickedV1 payload = envelope.payload();
    volatilityTracker.onPrice(payload.tokenId(), payload.price());
    exitCoordinator.onPriceTick(payload.tokenId(), payload.price());
  }
}
