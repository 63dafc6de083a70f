package com.copytrading.infra.kafka.producer;

import com.copytrading.infra.kafka.contract.EventEnvelope;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public interface EventPublisher {
  /** Publishes the envelope keyed by {@link EventEnvelope#key()}. */
  <T> CompletableFuture<SendResult<String, String>> publish(String topic, EventEnvelope<T> envelope);
}
