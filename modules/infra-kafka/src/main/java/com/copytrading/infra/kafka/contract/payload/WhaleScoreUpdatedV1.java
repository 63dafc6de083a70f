package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record WhaleScoreUpdatedV1(
    String whaleAddress,
    BigDecimal score,
    BigDecimal currentDrawdown,
    BigDecimal sharpe30d,
    BigDecimal sharpe90d,
    BigDecimal winRate,
    Instant observedAt) {}
