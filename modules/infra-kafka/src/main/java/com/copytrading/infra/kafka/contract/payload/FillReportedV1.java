package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record FillReportedV1(
    String exchangeOrderId,
    long fillSequence,
    BigDecimal size,
    BigDecimal price,
    Instant filledAt) {}
