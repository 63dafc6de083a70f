package com.copytrading.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.PositionUpdatedV1;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PositionEventProducerTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final EventPublisher publisher = mock(EventPublisher.class);
  private final PositionEventProducer producer =
      new PositionEventProducer(publisher, "copy-engine", Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  @SuppressWarnings("unchecked")
  void shouldKeyAndCorrelateByPositionId() {
    when(publisher.publish(any(), any())).thenReturn(CompletableFuture.completedFuture(null));

    producer.publishPositionUpdated(update("pos-1"));

    ArgumentCaptor<EventEnvelope<PositionUpdatedV1>> captor =
        ArgumentCaptor.forClass(EventEnvelope.class);
    verify(publisher).publish(eq(TopicNames.POSITIONS_UPDATED_V1), captor.capture());
    EventEnvelope<PositionUpdatedV1> envelope = captor.getValue();
    assertEquals("pos-1", envelope.key());
    assertEquals("pos-1", envelope.correlationId());
    assertEquals(EventTypes.POSITION_UPDATED, envelope.eventType());
    assertEquals("copy-engine", envelope.producer());
    assertEquals(NOW, envelope.occurredAt());
    assertNull(envelope.causationId());
  }

  @Test
  void shouldRejectBlankPositionId() {
    assertThrows(IllegalArgumentException.class, () -> producer.publishPositionUpdated(update(" ")));
    verifyNoInteractions(publisher);
  }

  private static PositionUpdatedV1 update(String positionId) {
    return new PositionUpdatedV1(
        positionId,
        "0xA",
        "tok-1",
        "YES",
        "CLOSED",
        "CLOSED",
        BigDecimal.ZERO,
        new BigDecimal("0.70"),
        BigDecimal.ZERO,
        new BigDecimal("27.27"),
        "TAKE_PROFIT",
        NOW);
  }
}
