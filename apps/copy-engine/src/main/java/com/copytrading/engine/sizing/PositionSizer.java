package com.copytrading.engine.sizing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Adaptive fractional Kelly.
 *
 * <pre>
 * f_kelly = (p*b - q) / b            b = (1 - c) / c, q = 1 - p, 0 when not positive
 * k_conf  = 0.4 + 0.6 * score / 100
 * k_vol   = clamp(1 / (1 + 5 * vol), 0.5, 1.2)
 * k_corr  = clamp(1 - corr^2, 0.3, 1.0)
 * k_dd    = clamp(1 - 3 * drawdown, 0.2, 1.0)
 * f       = clamp(multiplier * f_kelly * k_conf * k_vol * k_corr * k_dd, 0, maxFraction)
 * </pre>
 */
@Component
public class PositionSizer {
  private static final int SCALE = 8;
  private static final int SIZE_SCALE = 2;
  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final SizingProperties properties;

  public PositionSizer(SizingProperties properties) {
    this.properties = properties;
  }

  public SizingResult size(SizingInput input) {
    BigDecimal kelly = kellyFraction(input.winProbability(), input.impliedCost());
    BigDecimal confidence =
        clamp(
            new BigDecimal("0.4")
                .add(
                    new BigDecimal("0.6")
                        .multiply(input.whaleScore())
                        .divide(HUNDRED, SCALE, RoundingMode.HALF_UP)),
            new BigDecimal("0.4"),
            BigDecimal.ONE);
    BigDecimal volatility =
        clamp(
            BigDecimal.ONE.divide(
                BigDecimal.ONE.add(new BigDecimal("5").multiply(input.marketVolatility())),
                SCALE,
                RoundingMode.HALF_UP),
            new BigDecimal("0.5"),
            new BigDecimal("1.2"));
    BigDecimal correlation =
        clamp(
            BigDecimal.ONE.subtract(input.correlation().multiply(input.correlation())),
            new BigDecimal("0.3"),
            BigDecimal.ONE);
    BigDecimal drawdown =
        clamp(
            BigDecimal.ONE.subtract(new BigDecimal("3").multiply(input.portfolioDrawdown())),
            new BigDecimal("0.2"),
            BigDecimal.ONE);

    BigDecimal fraction =
        clamp(
            properties
                .getKellyMultiplier()
                .multiply(kelly)
                .multiply(confidence)
                .multiply(volatility)
                .multiply(correlation)
                .multiply(drawdown)
                .setScale(SCALE, RoundingMode.HALF_UP),
            BigDecimal.ZERO,
            properties.getMaxFraction());

    BigDecimal notional =
        fraction.multiply(input.nav()).multiply(input.riskMultiplier()).setScale(SCALE, RoundingMode.HALF_UP);
    BigDecimal size = notional.divide(input.price(), SIZE_SCALE, RoundingMode.DOWN);
    return new SizingResult(
        kelly, confidence, volatility, correlation, drawdown, fraction, notional, size);
  }

  static BigDecimal kellyFraction(BigDecimal winProbability, BigDecimal impliedCost) {
    if (impliedCost.signum() <= 0 || impliedCost.compareTo(BigDecimal.ONE) >= 0) {
      return BigDecimal.ZERO;
    }
    BigDecimal odds =
        BigDecimal.ONE.subtract(impliedCost).divide(impliedCost, SCALE, RoundingMode.HALF_UP);
    BigDecimal loss = BigDecimal.ONE.subtract(winProbability);
    BigDecimal kelly =
        winProbability.multiply(odds).subtract(loss).divide(odds, SCALE, RoundingMode.HALF_UP);
    if (kelly.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return kelly.min(BigDecimal.ONE);
  }

  private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
    return value.max(min).min(max);
  }
}
