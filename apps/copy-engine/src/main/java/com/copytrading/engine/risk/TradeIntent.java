package com.copytrading.engine.risk;

import java.util.Objects;

/**
 * A copy trade awaiting approval. {@code reservationKey} identifies the notional held against the
 * limits until the order that carries it finishes.
 */
public record TradeIntent(
    String reservationKey, String whaleAddress, String tokenId, String category) {
  public TradeIntent {
    Objects.requireNonNull(reservationKey, "reservationKey must not be null");
    Objects.requireNonNull(whaleAddress, "whaleAddress must not be null");
    Objects.requireNonNull(tokenId, "tokenId must not be null");
  }
}
