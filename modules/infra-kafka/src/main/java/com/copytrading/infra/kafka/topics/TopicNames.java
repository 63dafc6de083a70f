package com.copytrading.infra.kafka.topics;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

public final class TopicNames {
  public static final String WHALE_TRADES_V1 = "copytrading.whale.trades.v1";
  public static final String WHALE_SCORES_V1 = "copytrading.whale.scores.v1";
  public static final String MARKET_PRICES_V1 = "copytrading.market.prices.v1";
  public static final String EXCHANGE_FILLS_V1 = "copytrading.exchange.fills.v1";
  public static final String ORDERS_UPDATED_V1 = "copytrading.orders.updated.v1";
  public static final String POSITIONS_UPDATED_V1 = "copytrading.positions.updated.v1";

  private static final Pattern VERSION_SUFFIX = Pattern.compile("^(.+)\\.(v[1-9][0-9]*)$");
  private static final String DEAD_LETTER_QUALIFIER = "dlq";

  private TopicNames() {}

  public static List<String> sources() {
    return List.of(
        WHALE_TRADES_V1,
        WHALE_SCORES_V1,
        MARKET_PRICES_V1,
        EXCHANGE_FILLS_V1,
        ORDERS_UPDATED_V1,
        POSITIONS_UPDATED_V1);
  }

  /** Inbound topics get a dead-letter twin; outbound topics have no consumer in this service. */
  public static List<String> consumed() {
    return List.of(WHALE_TRADES_V1, WHALE_SCORES_V1, MARKET_PRICES_V1, EXCHANGE_FILLS_V1);
  }

  public static List<String> all() {
    List<String> deadLetters = consumed().stream().map(TopicNames::deadLetterOf).toList();
    return Stream.concat(sources().stream(), deadLetters.stream()).toList();
  }

  /** {@code copytrading.whale.trades.v1} becomes {@code copytrading.whale.trades.dlq.v1}. */
  public static String deadLetterOf(String sourceTopic) {
    TopicNameValidator.assertValid(sourceTopic);
    Matcher matcher = VERSION_SUFFIX.matcher(sourceTopic);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Topic has no version suffix: " + sourceTopic);
    }
    String base = matcher.group(1);
    if (base.endsWith("." + DEAD_LETTER_QUALIFIER)) {
      throw new IllegalArgumentException("Topic is already a dead-letter topic: " + sourceTopic);
    }
    return base + "." + DEAD_LETTER_QUALIFIER + "." + matcher.group(2);
  }
}
