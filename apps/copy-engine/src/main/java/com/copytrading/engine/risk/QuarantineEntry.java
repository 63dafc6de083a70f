package com.copytrading.engine.risk;

import java.math.BigDecimal;
import java.time.Instant;

public record QuarantineEntry(
    String whaleAddress, String reason, BigDecimal scoreAtEntry, Instant quarantinedAt) {}
