package com.copytrading.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record MarketPriceTickedV1(String tokenId, BigDecimal price, Instant observedAt) {}
