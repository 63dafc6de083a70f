package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderUpdatedV1(
    String orderId,
    String idempotencyKey,
    String tokenId,
    String side,
    String state,
    BigDecimal size,
    BigDecimal filledSize,
    BigDecimal avgFillPrice,
    String exchangeOrderId,
    String whaleAddress,
    Instant updatedAt) {}
