package com.copytrading.engine.sizing;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.sizing")
public class SizingProperties {
  private BigDecimal kellyMultiplier = new BigDecimal("0.5");
  private BigDecimal maxFraction = new BigDecimal("0.08");
  private double volatilityLambda = 0.94d;

  public BigDecimal getKellyMultiplier() {
    return kellyMultiplier;
  }

  public void setKellyMultiplier(BigDecimal kellyMultiplier) {
    this.kellyMultiplier = kellyMultiplier;
  }

  public BigDecimal getMaxFraction() {
    return maxFraction;
  }

  public void setMaxFraction(BigDecimal maxFraction) {
    this.maxFraction = maxFraction;
  }

  public double getVolatilityLambda() {
    return volatilityLambda;
  }

  public void setVolatilityLambda(double volatilityLambda) {
    this.volatilityLambda = volatilityLambda;
  }
}
