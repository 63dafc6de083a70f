package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionUpdatedV1(
    String positionId,
    String whaleAddress,
    String tokenId,
    String side,
    String status,
    String updateType,
    BigDecimal currentSize,
    BigDecimal currentPrice,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    String closeReason,
    Instant updatedAt) {}
