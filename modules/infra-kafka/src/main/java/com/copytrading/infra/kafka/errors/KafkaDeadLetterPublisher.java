package com.copytrading.infra.kafka.errors;

import com.copytrading.infra.kafka.config.InfraKafkaProperties;
import com.copytrading.infra.kafka.topics.TopicNames;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

public class KafkaDeadLetterPublisher implements DeadLetterPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

  static final String HEADER_SOURCE_TOPIC = "x-dlq-source-topic";
  static final String HEADER_SOURCE_PARTITION = "x-dlq-source-partition";
  static final String HEADER_SOURCE_OFFSET = "x-dlq-source-offset";
  static final String HEADER_ATTEMPTS = "x-dlq-attempts";
  static final String HEADER_EXCEPTION_CLASS = "x-dlq-exception-class";
  static final String HEADER_EXCEPTION_MESSAGE = "x-dlq-exception-message";
  static final String HEADER_FAILED_AT = "x-dlq-failed-at";

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final InfraKafkaProperties.DeadLetter properties;
  private final Clock clock;

  public KafkaDeadLetterPublisher(
      KafkaTemplate<String, String> kafkaTemplate, InfraKafkaProperties.DeadLetter properties) {
    this(kafkaTemplate, properties, Clock.systemUTC());
  }

  KafkaDeadLetterPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      InfraKafkaProperties.DeadLetter properties,
      Clock clock) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public void publish(ConsumerRecord<String, String> failedRecord, int attempts, Exception exception) {
    String sourceTopic = failedRecord.topic();
    String targetTopic = TopicNames.deadLetterOf(sourceTopic);
    String payload = properties.isIncludePayload() ? failedRecord.value() : null;

    ProducerRecord<String, String> deadLetterRecord =
        new ProducerRecord<>(targetTopic, failedRecord.key(), payload);
    Headers headers = deadLetterRecord.headers();
    add(headers, HEADER_SOURCE_TOPIC, sourceTopic);
    add(headers, HEADER_SOURCE_PARTITION, Integer.toString(failedRecord.partition()));
    add(headers, HEADER_SOURCE_OFFSET, Long.toString(failedRecord.offset()));
    add(headers, HEADER_ATTEMPTS, Integer.toString(attempts));
    add(headers, HEADER_EXCEPTION_CLASS, exception.getClass().getName());
    add(headers, HEADER_EXCEPTION_MESSAGE, safeMessage(exception.getMessage()));
    add(headers, HEADER_FAILED_AT, clock.instant().toString());

    kafkaTemplate
        .send(deadLetterRecord)
        .whenComplete(
            (result, throwable) -> {
              if (throwable != null) {
                log.error(
                    "Failed to dead-letter record sourceTopic={} targetTopic={} offset={}",
                    sourceTopic,
                    targetTopic,
                    failedRecord.offset(),
                    throwable);
                return;
              }
              log.warn(
                  "Dead-lettered record sourceTopic={} targetTopic={} partition={} offset={} attempts={}",
                  sourceTopic,
                  targetTopic,
                  failedRecord.partition(),
                  failedRecord.offset(),
                  attempts);
            });
  }

  private static void add(Headers headers, String name, String value) {
    headers.add(name, value.getBytes(StandardCharsets.UTF_8));
  }

  private static String safeMessage(String message) {
    return message == null || message.isBlank() ? "no-message" : message;
  }
}
