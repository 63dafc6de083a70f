package com.copytrading.infra.kafka.topics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;

/**
 * Source topics share the configured partition count. Dead-letter topics are single-partition and
 * keep messages long enough for an operator to replay them.
 */
public final class KafkaTopicDefinitions {
  static final Duration DEAD_LETTER_RETENTION = Duration.ofDays(14);

  private KafkaTopicDefinitions() {}

  public static List<KafkaTopicDefinition> defaults(int partitions, short replicationFactor) {
    List<KafkaTopicDefinition> definitions = new ArrayList<>();
    for (String source : TopicNames.sources()) {
      definitions.add(new KafkaTopicDefinition(source, partitions, replicationFactor, Map.of()));
    }
    Map<String, String> deadLetterConfig =
        Map.of(
            TopicConfig.RETENTION_MS_CONFIG, Long.toString(DEAD_LETTER_RETENTION.toMillis()));
    for (String consumed : TopicNames.consumed()) {
      definitions.add(
          new KafkaTopicDefinition(
              TopicNames.deadLetterOf(consumed), 1, replicationFactor, deadLetterConfig));
    }
    return List.copyOf(definitions);
  }

  public record KafkaTopicDefinition(
      String name, int partitions, short replicationFactor, Map<String, String> configs) {
    public KafkaTopicDefinition {
      TopicNameValidator.assertValid(name);
      if (partitions < 1) {
        throw new IllegalArgumentException("partitions must be >= 1");
      }
      if (replicationFactor < 1) {
        throw new IllegalArgumentException("replicationFactor must be >= 1");
      }
      configs = configs == null ? Map.of() : Map.copyOf(configs);
    }

    public NewTopic toNewTopic() {
      return new NewTopic(name, partitions, replicationFactor).configs(configs);
    }
  }
}
