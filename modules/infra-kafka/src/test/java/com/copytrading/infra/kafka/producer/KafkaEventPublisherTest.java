package com.copytrading.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrading.infra.kafka.contract.EventHeaders;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.OrderUpdatedV1;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.copytrading.infra.kafka.serde.EventObjectMapperFactory;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

  @SuppressWarnings("unchecked")
  private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);

  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldPublishOrderUpdateWithHeadersAndRootCorrelation() throws Exception {
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));
    OrderEventProducer producer =
        new OrderEventProducer(
            new KafkaEventPublisher(kafkaTemplate, codec, KafkaTelemetry.NOOP, Duration.ZERO),
            "copy-engine",
            CLOCK);

    producer.publishOrderUpdated(orderUpdate("ord-2", "whale-0xA-t1:child:1")).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> record = captor.getValue();

    assertEquals(TopicNames.ORDERS_UPDATED_V1, record.topic());
    assertEquals("ord-2", record.key());
    assertNotNull(record.value());
    assertEquals(EventTypes.ORDER_UPDATED, headerValue(record, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(record, EventHeaders.X_EVENT_VERSION));
    assertEquals("whale-0xA-t1", headerValue(record, EventHeaders.X_CORRELATION_ID));
    assertEquals(EventHeaders.APPLICATION_JSON, headerValue(record, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldWrapPublishFailureWithKafkaPublishException() {
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failed);
    OrderEventProducer producer =
        new OrderEventProducer(
            new KafkaEventPublisher(kafkaTemplate, codec, KafkaTelemetry.NOOP, Duration.ZERO),
            "copy-engine",
            CLOCK);

    ExecutionException thrown =
        assertThrows(
            ExecutionException.class,
            () -> producer.publishOrderUpdated(orderUpdate("ord-1", "key-1")).get());

    KafkaPublishException publishException =
        assertInstanceOf(KafkaPublishException.class, thrown.getCause());
    assertEquals(TopicNames.ORDERS_UPDATED_V1, publishException.getTopic());
    assertEquals("ord-1", publishException.getKey());
  }

  @Test
  void shouldRejectInvalidTopic() {
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, KafkaTelemetry.NOOP, Duration.ZERO);

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("Orders", null));
  }

  private static OrderUpdatedV1 orderUpdate(String orderId, String idempotencyKey) {
    return new OrderUpdatedV1(
        orderId,
        idempotencyKey,
        "tok-1",
        "BUY",
        "SUBMITTED",
        new BigDecimal("100"),
        BigDecimal.ZERO,
        null,
        "ex-1",
        "0xA",
        Instant.parse("2026-03-01T12:00:00Z"));
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
