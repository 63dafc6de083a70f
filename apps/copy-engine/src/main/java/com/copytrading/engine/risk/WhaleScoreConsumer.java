package com.copytrading.engine.risk;

import com.copytrading.infra.kafka.consumer.EventConsumerAdapter;
import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.WhaleScoreUpdatedV1;
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
public class WhaleScoreConsumer {
  private final EventConsumerAdapter<WhaleScoreUpdatedV1> adapter;
  private final WhaleQuarantineService quarantineService;

  public WhaleScoreConsumer(
      EventEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry,
      WhaleQuarantineService quarantineService) {
    this.quarantineService = quarantineService;
    this.adapter =
        new EventConsumerAdapter<>(
            WhaleScoreUpdatedV1.class,
            EventTypes.WHALE_SCORE_UPDATED,
            1,
            codec,
            this::handleEvent,
            deadLetterPublisher,
            retryPolicy,
            telemetry);
  }

  @KafkaListener(
      topics = TopicNames.WHALE_SCORES_V1,
      groupId = "${infra.kafka.consumer.group-id:cg-copy-engine}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }

  private void handleEvent(EventEnvelope<WhaleScoreUpdatedV1> envelope) {
    WhaleScoreUpdatedV1 payload = envelope.payload();
    quarantineService.onScoreUpdate(
        new WhaleScoreObservation(
            payload.whaleAddress(),
            payload.score(),
            payload.currentDrawdown(),
            payload.observedAt() == null ? envelope.occurredAt() : payload.observedAt()));
  }
}
