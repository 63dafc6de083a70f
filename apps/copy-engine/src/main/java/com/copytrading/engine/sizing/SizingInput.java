package com.copytrading.engine.sizing;

import java.math.BigDecimal;
import java.util.Objects;

public record SizingInput(
    BigDecimal price,
    BigDecimal impliedCost,
    BigDecimal winProbability,
    BigDecimal whaleScore,
    BigDecimal correlation,
    BigDecimal marketVolatility,
    BigDecimal portfolioDrawdown,
    BigDecimal nav,
    BigDecimal riskMultiplier) {
  public SizingInput {
    Objects.requireNonNull(price, "price must not be null");
    Objects.requireNonNull(impliedCost, "impliedCost must not be null");
    Objects.requireNonNull(winProbability, "winProbability must not be null");
    Objects.requireNonNull(whaleScore, "whaleScore must not be null");
    Objects.requireNonNull(nav, "nav must not be null");
    if (price.signum() <= 0) {
      throw new IllegalArgumentException("price must be > 0");
    }
    correlation = correlation == null ? BigDecimal.ZERO : correlation;
    marketVolatility = marketVolatility == null ? BigDecimal.ZERO : marketVolatility;
    portfolioDrawdown = portfolioDrawdown == null ? BigDecimal.ZERO : portfolioDrawdown;
    riskMultiplier = riskMultiplier == null ? BigDecimal.ONE : riskMultiplier;
  }
}
