package com.copytrading.infra.kafka.contract;

public final class EventTypes {
  public static final String WHALE_TRADE_DETECTED = "WhaleTradeDetected";
  public static final String WHALE_SCORE_UPDATED = "WhaleScoreUpdated";
  public static final String MARKET_PRICE_TICKED = "MarketPriceTicked";
  public static final String FILL_REPORTED = "FillReported";
  public static final String ORDER_UPDATED = "OrderUpdated";
  public static final String POSITION_UPDATED = "PositionUpdated";

  private EventTypes() {}
}
