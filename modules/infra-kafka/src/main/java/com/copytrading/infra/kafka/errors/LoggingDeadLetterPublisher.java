package com.copytrading.infra.kafka.errors;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeadLetterPublisher implements DeadLetterPublisher {
  private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterPublisher.class);

  @Override
  public void publish(ConsumerRecord<String, String> failedRecord, int attempts, Exception exception) {
    log.warn(
        "Dropping unprocessable event topic={} partition={} offset={} key={} attempts={} error={}",
        failedRecord.topic(),
        failedRecord.partition(),
        failedRecord.offset(),
        failedRecord.key(),
        attempts,
        exception.getMessage());
  }
}
