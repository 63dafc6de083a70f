package com.copytrading.engine.risk;

import java.math.BigDecimal;

/** Capital held in one market on behalf of one whale, by an open position or a reservation. */
public record ExposureEntry(
    String whaleAddress, String tokenId, String category, BigDecimal exposure) {}
