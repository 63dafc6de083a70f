package com.copytrading.engine.api;

import com.copytrading.domain.positions.PositionUpdate;
import java.math.BigDecimal;
import java.time.Instant;

public record PositionUpdateResponse(
    String updateType,
    BigDecimal oldSize,
    BigDecimal newSize,
    BigDecimal oldPrice,
    BigDecimal newPrice,
    BigDecimal newUnrealizedPnl,
    String reason,
    Instant timestamp) {

  public static PositionUpdateResponse from(PositionUpdate update) {
    return new PositionUpdateResponse(
        update.updateType().name(),
        update.oldSize(),
        update.newSize(),
        update.oldPrice(),
        update.newPrice(),
        update.newUnrealizedPnl(),
        update.reason(),
        update.timestamp());
  }
}
