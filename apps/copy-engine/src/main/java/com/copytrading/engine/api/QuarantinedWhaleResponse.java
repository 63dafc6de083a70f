package com.copytrading.engine.api;

import com.copytrading.engine.risk.QuarantineEntry;
import java.math.BigDecimal;
import java.time.Instant;

public record QuarantinedWhaleResponse(
    String whaleAddress, String reason, BigDecimal scoreAtEntry, Instant quarantinedAt) {

  public static QuarantinedWhaleResponse from(QuarantineEntry entry) {
    return new QuarantinedWhaleResponse(
        entry.whaleAddress(), entry.reason(), entry.scoreAtEntry(), entry.quarantinedAt());
  }
}
