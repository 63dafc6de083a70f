package com.copytrading.engine.sizing;

import com.copytrading.domain.orders.OrderSide;
import java.math.BigDecimal;

/**
 * Win probability of a copied trade, blended from the whale's historical win rate and the
 * probability the market implies through its price.
 */
public final class EdgeModel {
  private EdgeModel() {}

  /** Price paid for a YES exposure, or one minus the price for a NO exposure. */
  public static BigDecimal impliedCost(OrderSide side, BigDecimal price) {
    return side == OrderSide.BUY ? price : BigDecimal.ONE.subtract(price);
  }

  public static BigDecimal winProbability(
      BigDecimal whaleWinRate, BigDecimal impliedCost, BigDecimal winRateWeight) {
    return winRateWeight
        .multiply(whaleWinRate)
        .add(BigDecimal.ONE.subtract(winRateWeight).multiply(impliedCost));
  }

  public static BigDecimal edge(BigDecimal winProbability, BigDecimal impliedCost) {
    return winProbability.subtract(impliedCost);
  }
}
