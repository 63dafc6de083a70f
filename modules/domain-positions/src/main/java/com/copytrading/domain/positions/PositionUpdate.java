package com.copytrading.domain.positions;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record PositionUpdate(
    UUID id,
    UUID positionId,
    PositionUpdateType updateType,
    BigDecimal oldSize,
    BigDecimal oldPrice,
    BigDecimal oldMarketValue,
    BigDecimal oldUnrealizedPnl,
    BigDecimal newSize,
    BigDecimal newPrice,
    BigDecimal newMarketValue,
    BigDecimal newUnrealizedPnl,
    Instant timestamp,
    String reason,
    Map<String, Object> metadata) {
  public PositionUpdate {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(positionId, "positionId must not be null");
    Objects.requireNonNull(updateType, "updateType must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static PositionUpdate between(
      Position before,
      Position after,
      PositionUpdateType updateType,
      String reason,
      Map<String, Object> metadata) {
    Objects.requireNonNull(after, "after must not be null");
    return new PositionUpdate(
        UUID.randomUUID(),
        after.positionId(),
        updateType,
        before == null ? null : before.currentSize(),
        before == null ? null : before.currentPrice(),
        before == null ? null : before.marketValue(),
        before == null ? null : before.unrealizedPnl(),
        after.currentSize(),
        after.currentPrice(),
        after.marketValue(),
        after.unrealizedPnl(),
        after.lastUpdatedAt(),
        reason,
        metadata);
  }
}
