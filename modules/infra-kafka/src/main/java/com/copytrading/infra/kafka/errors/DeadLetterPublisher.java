package com.copytrading.infra.kafka.errors;

import org.apache.kafka.clients.consumer.ConsumerRecord;

public interface DeadLetterPublisher {
  void publish(ConsumerRecord<String, String> failedRecord, int attempts, Exception exception);
}
