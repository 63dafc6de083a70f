package com.copytrading.infra.kafka.consumer;

import com.copytrading.infra.kafka.contract.EventEnvelope;

@FunctionalInterface
public interface EventHandler<T> {
  void handle(EventEnvelope<T> envelope) throws Exception;
}
