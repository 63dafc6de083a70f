package com.copytrading.engine.sizing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Per-token EWMA of squared simple returns, fed by price ticks. */
@Component
public class VolatilityTracker {
  private final double lambda;
  private final Map<String, Estimate> estimates = new ConcurrentHashMap<>();

  public VolatilityTracker(SizingProperties properties) {
    this.lambda = properties.getVolatilityLambda();
  }

  public void onPrice(String tokenId, BigDecimal price) {
    if (price == null || price.signum() <= 0) {
      return;
    }
    double value = price.doubleValue();
    estimates.compute(
        tokenId,
        (key, current) -> current == null ? new Estimate(value, 0d, false) : current.next(value, lambda));
  }

  /** Square root of the EWMA variance, zero until a token has seen two prices. */
  public BigDecimal volatility(String tokenId) {
    Estimate estimate = estimates.get(tokenId);
    if (estimate == null || !estimate.seeded()) {
      return BigDecimal.ZERO;
    }
    return BigDecimal.valueOf(Math.sqrt(estimate.variance())).setScale(8, RoundingMode.HALF_UP);
  }

  private record Estimate(double lastPrice, double variance, boolean seeded) {
    Estimate next(double price, double lambda) {
      double ret = (price - lastPrice) / lastPrice;
      double squared = ret * ret;
      double updated = seeded ? lambda * variance + (1d - lambda) * squared : squared;
      return new Estimate(price, updated, true);
    }
  }
}
