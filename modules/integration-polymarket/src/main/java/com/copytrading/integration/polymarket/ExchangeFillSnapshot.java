package com.copytrading.integration.polymarket;

import java.math.BigDecimal;

/**
 * Cumulative execution of one exchange order as reported by REST polling. {@code tradeCount} is
 * the number of exchange trades matched so far and numbers fills the same way the fill feed's
 * {@code fillSequence} does.
 */
public record ExchangeFillSnapshot(
    String exchangeOrderId,
    String status,
    BigDecimal originalSize,
    BigDecimal sizeMatched,
    BigDecimal price,
    int tradeCount) {
  public boolean isLive() {
    return "LIVE".equalsIgnoreCase(status);
  }

  public boolean isCancelled() {
    return status != null && status.toUpperCase().startsWith("CANCEL");
  }
}
