package com.copytrading.integration.polymarket;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/** Reads a {@code Retry-After} value given either as delta seconds or as an HTTP date. */
public class RetryAfterParser {
  private final Clock clock;

  public RetryAfterParser(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public Optional<Duration> parse(String headerValue) {
    if (headerValue == null || headerValue.isBlank()) {
      return Optional.empty();
    }
    String value = headerValue.trim();
    if (value.chars().allMatch(Character::isDigit)) {
      return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
    }
    return parseHttpDate(value)
        .map(retryAt -> Duration.between(clock.instant(), retryAt.toInstant()))
        .map(wait -> wait.isNegative() ? Duration.ZERO : wait);
  }

  private static Optional<ZonedDateTime> parseHttpDate(String value) {
    try {
      return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }
}
