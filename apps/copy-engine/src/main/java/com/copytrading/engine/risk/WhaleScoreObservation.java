package com.copytrading.engine.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record WhaleScoreObservation(
    String whaleAddress, BigDecimal score, BigDecimal currentDrawdown, Instant observedAt) {
  public WhaleScoreObservation {
    Objects.requireNonNull(whaleAddress, "whaleAddress must not be null");
    Objects.requireNonNull(score, "score must not be null");
    Objects.requireNonNull(observedAt, "observedAt must not be null");
  }
}
