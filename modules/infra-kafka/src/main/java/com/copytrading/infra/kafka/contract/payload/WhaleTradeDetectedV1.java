package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A trade made by a tracked whale, enriched by the scoring service with the whale's current
 * metrics and the market's metadata. Metric fields are nullable; consumers treat a missing metric
 * as a failed check.
 */
public record WhaleTradeDetectedV1(
    String tradeId,
    String whaleAddress,
    String tokenId,
    String marketId,
    String category,
    String side,
    BigDecimal size,
    BigDecimal price,
    BigDecimal lastPrice,
    Instant marketEndsAt,
    BigDecimal whaleScore,
    BigDecimal sharpe30d,
    BigDecimal sharpe90d,
    BigDecimal currentDrawdown,
    BigDecimal winRate,
    Instant tradedAt) {}
