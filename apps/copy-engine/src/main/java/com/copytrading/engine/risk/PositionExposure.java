package com.copytrading.engine.risk;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/** Latest mark of one active position as seen by the risk manager. */
public record PositionExposure(
    UUID positionId,
    String whaleAddress,
    String tokenId,
    String category,
    BigDecimal exposure,
    BigDecimal unrealizedPnl) {
  public PositionExposure {
    Objects.requireNonNull(positionId, "positionId must not be null");
    Objects.requireNonNull(exposure, "exposure must not be null");
    Objects.requireNonNull(unrealizedPnl, "unrealizedPnl must not be null");
  }

  public ExposureEntry toEntry() {
    return new ExposureEntry(whaleAddress, tokenId, category, exposure);
  }
}
