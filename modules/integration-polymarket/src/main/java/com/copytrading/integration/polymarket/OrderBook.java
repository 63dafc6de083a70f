package com.copytrading.integration.polymarket;

import com.copytrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Bids best-first (descending price), asks best-first (ascending price). */
public record OrderBook(String tokenId, List<OrderBookLevel> bids, List<OrderBookLevel> asks) {
  private static final int SCALE = 8;
  private static final BigDecimal TWO = BigDecimal.valueOf(2);

  public OrderBook {
    bids =
        bids == null
            ? List.of()
            : bids.stream().sorted(Comparator.comparing(OrderBookLevel::price).reversed()).toList();
    asks =
        asks == null
            ? List.of()
            : asks.stream().sorted(Comparator.comparing(OrderBookLevel::price)).toList();
  }

  public Optional<BigDecimal> bestBid() {
    return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0).price());
  }

  public Optional<BigDecimal> bestAsk() {
    return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0).price());
  }

  public Optional<BigDecimal> mid() {
    if (bids.isEmpty() || asks.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        bids.get(0).price().add(asks.get(0).price()).divide(TWO, SCALE, RoundingMode.HALF_UP));
  }

  /**
   * Volume-weighted price of taking {@code size} from the side a {@code side} order consumes:
   * asks for BUY, bids for SELL. Empty when the book is too thin to fill the size.
   */
  public Optional<BigDecimal> vwap(OrderSide side, BigDecimal size) {
    if (size == null || size.signum() <= 0) {
      return Optional.empty();
    }
    List<OrderBookLevel> levels = side == OrderSide.BUY ? asks : bids;
    BigDecimal remaining = size;
    BigDecimal cost = BigDecimal.ZERO;
    for (OrderBookLevel level : levels) {
      BigDecimal take = remaining.min(level.size());
      cost = cost.add(take.multiply(level.price()));
      remaining = remaining.subtract(take);
      if (remaining.signum() == 0) {
        return Optional.of(cost.divide(size, SCALE, RoundingMode.HALF_UP));
      }
    }
    return Optional.empty();
  }

  /** {@code |vwap - mid| / mid} for the given order; empty when either side cannot be priced. */
  public Optional<BigDecimal> slippage(OrderSide side, BigDecimal size) {
    Optional<BigDecimal> mid = mid();
    Optional<BigDecimal> vwap = vwap(side, size);
    if (mid.isEmpty() || vwap.isEmpty() || mid.get().signum() == 0) {
      return Optional.empty();
    }
    return Optional.of(
        vwap.get().subtract(mid.get()).abs().divide(mid.get(), SCALE, RoundingMode.HALF_UP));
  }
}
