package com.copytrading.engine.api;

import com.copytrading.domain.positions.Position;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record PositionResponse(
    UUID id,
    String whaleAddress,
    String tokenId,
    String category,
    String side,
    String status,
    BigDecimal entrySize,
    BigDecimal entryPrice,
    BigDecimal currentSize,
    BigDecimal currentPrice,
    BigDecimal marketValue,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    BigDecimal totalPnl,
    BigDecimal pnlPercentage,
    BigDecimal stopLossPrice,
    BigDecimal takeProfitPrice,
    Instant marketEndsAt,
    Instant openedAt,
    Instant lastUpdatedAt,
    Instant closedAt,
    String closeReason) {

  public static PositionResponse from(Position position) {
    return new PositionResponse(
        position.positionId(),
        position.whaleAddress(),
        position.tokenId(),
        position.category(),
        position.side().name(),
        position.status().name(),
        position.entrySize(),
        position.entryPrice(),
        position.currentSize(),
        position.currentPrice(),
        position.marketValue(),
        position.unrealizedPnl(),
        position.realizedPnl(),
        position.totalPnl(),
        position.pnlPercentage(),
        position.stopLossPrice(),
        position.takeProfitPrice(),
        position.marketEndsAt(),
        position.openedAt(),
        position.lastUpdatedAt(),
        position.closedAt(),
        position.closeReason() == null ? null : position.closeReason().name());
  }
}
