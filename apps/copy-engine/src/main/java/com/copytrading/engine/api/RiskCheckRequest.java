package com.copytrading.engine.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record RiskCheckRequest(
    @NotBlank String whaleAddress,
    @NotBlank String tokenId,
    String category,
    @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal notional) {}
