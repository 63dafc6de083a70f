package com.copytrading.integration.polymarket;

/**
 * Order entry and market data against the exchange. Every method raises {@link ExchangeException}
 * with a transient or terminal {@link ExchangeErrorCode}.
 */
public interface ExchangeClient {
  ExchangeOrderAck submitOrder(ExchangeOrderRequest request);

  ExchangeCancelResult cancelOrder(String exchangeOrderId);

  OrderBook fetchOrderBook(String tokenId);

  ExchangeFillSnapshot pollFill(String exchangeOrderId);
}
