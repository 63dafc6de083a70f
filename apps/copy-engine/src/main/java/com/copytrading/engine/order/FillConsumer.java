package com.copytrading.engine.order;

import com.copytrading.infra.kafka.consumer.EventConsumerAdapter;
import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.FillReportedV1;
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

/**
 * Pushed fills. A fill for an exchange order id that is not recorded yet throws, so the adapter
 * retries it while the submit transaction commits.
 */
@Component
@ConditionalOnProperty(
    prefix = "infra.kafka",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class FillConsumer {
  private final EventConsumerAdapter<FillReportedV1> adapter;
  private final OrderExecutor orderExecutor;

  public FillConsumer(
      EventEnvelopeJsonCodec codec,
      DeadLetterPublisher deadLetterPublisher,
      RetryPolicy retryPolicy,
      KafkaTelemetry telemetry,
      OrderExecutor orderExecutor) {
    this.orderExecutor = orderExecutor;
    this.adapter =
        new EventConsumerAdapter<>(
            FillReportedV1.class,
            EventTypes.FILL_REPORTED,
            1,
            codec,
            this::handleEvent,
            deadLetterPublisher,
            retryPolicy,
            telemetry);
  }

  @KafkaListener(
      topics = TopicNames.EXCHANGE_FILLS_V1,
      groupId = "${infra.kafka.consumer.group-id:cg-copy-engine}",
      containerFactory = "infraKafkaListenerContainerFactory")
  public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
    adapter.process(record);
    ack.acknowledge();
  }

  private void handleEvent(EventEnvelope<FillReportedV1> envelope) {
    FillReportedV1 payload = envelope.payload();
    orderExecutor.onFill(
        new FillEvent(
            payload.exchangeOrderId(),
            payload.fillSequence(),
            payload.size(),
            payload.price(),
            payload.filledAt() == null ? envelope.occurredAt() : payload.filledAt(),
            FillSource.FEED));
  }
}
