package com.copytrading.integration.polymarket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.copytrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrderBookTest {
  private final OrderBook book =
      new OrderBook(
          "tok-1",
          List.of(level("0.53", "500"), level("0.54", "1000")),
          List.of(level("0.57", "4000"), level("0.56", "1000")));

  @Test
  void shouldOrderLevelsBestFirst() {
    assertEquals(new BigDecimal("0.54"), book.bestBid().orElseThrow());
    assertEquals(new BigDecimal("0.56"), book.bestAsk().orElseThrow());
    assertEquals(0, new BigDecimal("0.55").compareTo(book.mid().orElseThrow()));
  }

  @Test
  void shouldWalkAsksForBuyVwap() {
    BigDecimal vwap = book.vwap(OrderSide.BUY, new BigDecimal("2000")).orElseThrow();

    assertEquals(0, new BigDecimal("0.565").compareTo(vwap));
    BigDecimal slippage = book.slippage(OrderSide.BUY, new BigDecimal("2000")).orElseThrow();
    assertEquals(0, new BigDecimal("0.02727273").compareTo(slippage));
  }

  @Test
  void shouldWalkBidsForSellVwap() {
    BigDecimal vwap = book.vwap(OrderSide.SELL, new BigDecimal("1000")).orElseThrow();

    assertEquals(0, new BigDecimal("0.54").compareTo(vwap));
  }

  @Test
  void shouldReportNoPriceWhenDepthIsInsufficientOrBookIsOneSided() {
    assertTrue(book.vwap(OrderSide.SELL, new BigDecimal("1501")).isEmpty());
    OrderBook askOnly = new OrderBook("tok-1", List.of(), List.of(level("0.60", "10")));
    assertTrue(askOnly.slippage(OrderSide.BUY, BigDecimal.ONE).isEmpty());
  }

  private static OrderBookLevel level(String price, String size) {
    return new OrderBookLevel(new BigDecimal(price), new BigDecimal(size));
  }
}
