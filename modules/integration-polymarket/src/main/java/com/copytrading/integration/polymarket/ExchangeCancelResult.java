package com.copytrading.integration.polymarket;

public record ExchangeCancelResult(String exchangeOrderId, boolean cancelled, String reason) {}
