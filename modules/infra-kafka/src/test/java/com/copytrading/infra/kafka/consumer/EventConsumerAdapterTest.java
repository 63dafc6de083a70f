package com.copytrading.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import com.copytrading.infra.kafka.contract.EventHeaders;
import com.copytrading.infra.kafka.contract.EventTypes;
import com.copytrading.infra.kafka.contract.payload.MarketPriceTickedV1;
import com.copytrading.infra.kafka.errors.DeadLetterPublisher;
import com.copytrading.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.copytrading.infra.kafka.errors.InvalidEventMetadataException;
import com.copytrading.infra.kafka.observability.KafkaTelemetry;
import com.copytrading.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.copytrading.infra.kafka.serde.EventObjectMapperFactory;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

class EventConsumerAdapterTest {
  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());
  private final DeadLetterPublisher deadLetterPublisher = mock(DeadLetterPublisher.class);
  private final List<Duration> sleeps = new ArrayList<>();

  @Test
  void shouldRouteValidMessageToHandler() throws Exception {
    @SuppressWarnings("unchecked")
    EventHandler<MarketPriceTickedV1> handler = mock(EventHandler.class);
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        adapter(handler, ExponentialBackoffRetryPolicy.fixed(1, Duration.ZERO));

    adapter.process(createRecord(true));

    verify(handler).handle(any());
    verify(deadLetterPublisher, never()).publish(any(), anyInt(), any());
  }

  @Test
  void shouldDeadLetterWhenMetadataIsMissing() throws Exception {
    @SuppressWarnings("unchecked")
    EventHandler<MarketPriceTickedV1> handler = mock(EventHandler.class);
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        adapter(handler, ExponentialBackoffRetryPolicy.fixed(3, Duration.ofMillis(10)));
    ConsumerRecord<String, String> record = createRecord(false);

    adapter.process(record);

    verify(handler, never()).handle(any());
    verify(deadLetterPublisher).publish(eq(record), eq(1), any(InvalidEventMetadataException.class));
  }

  @Test
  void shouldDeadLetterMalformedBodyWithoutRetrying() throws Exception {
    @SuppressWarnings("unchecked")
    EventHandler<MarketPriceTickedV1> handler = mock(EventHandler.class);
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        adapter(handler, ExponentialBackoffRetryPolicy.fixed(3, Duration.ofMillis(10)));
    ConsumerRecord<String, String> record =
        withHeaders(new ConsumerRecord<>(TopicNames.MARKET_PRICES_V1, 0, 7L, "tok-1", "{not-json"), true);

    adapter.process(record);

    verify(handler, never()).handle(any());
    verify(deadLetterPublisher).publish(eq(record), eq(1), any(InvalidEventMetadataException.class));
    assertEquals(List.of(), sleeps);
  }

  @Test
  void shouldRetryHandlerFailureAndSucceed() {
    AtomicInteger calls = new AtomicInteger();
    EventHandler<MarketPriceTickedV1> handler =
        envelope -> {
          if (calls.incrementAndGet() < 3) {
            throw new IllegalStateException("database unavailable");
          }
        };
    KafkaTelemetry telemetry = mock(KafkaTelemetry.class);
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        new EventConsumerAdapter<>(
            MarketPriceTickedV1.class,
            EventTypes.MARKET_PRICE_TICKED,
            1,
            codec,
            handler,
            deadLetterPublisher,
            new ExponentialBackoffRetryPolicy(
                3, Duration.ofMillis(100), Duration.ofSeconds(1), 2.0d),
            telemetry,
            sleeps::add);

    adapter.process(createRecord(true));

    assertEquals(3, calls.get());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    verify(telemetry, times(2)).onRetry(eq(TopicNames.MARKET_PRICES_V1), any(), anyInt());
    verify(deadLetterPublisher, never()).publish(any(), anyInt(), any());
  }

  @Test
  void shouldDeadLetterAfterRetriesAreExhausted() throws Exception {
    @SuppressWarnings("unchecked")
    EventHandler<MarketPriceTickedV1> handler = mock(EventHandler.class);
    doThrow(new IllegalStateException("boom")).when(handler).handle(any());
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        adapter(handler, ExponentialBackoffRetryPolicy.fixed(2, Duration.ofMillis(5)));
    ConsumerRecord<String, String> record = createRecord(true);

    adapter.process(record);

    verify(handler, times(2)).handle(any());
    verify(deadLetterPublisher).publish(eq(record), eq(2), any(IllegalStateException.class));
  }

  @Test
  void shouldNotRetryExceptionsOutsideThePredicate() throws Exception {
    @SuppressWarnings("unchecked")
    EventHandler<MarketPriceTickedV1> handler = mock(EventHandler.class);
    doThrow(new IllegalArgumentException("bad price")).when(handler).handle(any());
    EventConsumerAdapter<MarketPriceTickedV1> adapter =
        adapter(
            handler,
            ExponentialBackoffRetryPolicy.fixed(5, Duration.ofMillis(5))
                .retryingOnly(ex -> ex instanceof IllegalStateException));

    adapter.process(createRecord(true));

    verify(handler, times(1)).handle(any());
    verify(deadLetterPublisher).publish(any(), eq(1), any(IllegalArgumentException.class));
  }

  private EventConsumerAdapter<MarketPriceTickedV1> adapter(
      EventHandler<MarketPriceTickedV1> handler, ExponentialBackoffRetryPolicy policy) {
    return new EventConsumerAdapter<>(
        MarketPriceTickedV1.class,
        EventTypes.MARKET_PRICE_TICKED,
        1,
        codec,
        handler,
        deadLetterPublisher,
        policy,
        KafkaTelemetry.NOOP,
        sleeps::add);
  }

  private ConsumerRecord<String, String> createRecord(boolean includeVersionHeader) {
    EventEnvelope<MarketPriceTickedV1> envelope =
        EventEnvelope.of(
            EventTypes.MARKET_PRICE_TICKED,
            1,
            "price-feed",
            "tok-1",
            "tok-1",
            Instant.parse("2026-03-01T12:00:00Z"),
            new MarketPriceTickedV1(
                "tok-1", new BigDecimal("0.57"), Instant.parse("2026-03-01T12:00:00Z")));
    ConsumerRecord<String, String> record =
        new ConsumerRecord<>(TopicNames.MARKET_PRICES_V1, 0, 0L, "tok-1", codec.encode(envelope));
    return withHeaders(record, includeVersionHeader);
  }

  private static ConsumerRecord<String, String> withHeaders(
      ConsumerRecord<String, String> record, boolean includeVersionHeader) {
    record
        .headers()
        .add(
            EventHeaders.X_EVENT_TYPE,
            EventTypes.MARKET_PRICE_TICKED.getBytes(StandardCharsets.UTF_8));
    record.headers().add(EventHeaders.X_CORRELATION_ID, "tok-1".getBytes(StandardCharsets.UTF_8));
    if (includeVersionHeader) {
      record.headers().add(EventHeaders.X_EVENT_VERSION, "1".getBytes(StandardCharsets.UTF_8));
    }
    return record;
  }
}
