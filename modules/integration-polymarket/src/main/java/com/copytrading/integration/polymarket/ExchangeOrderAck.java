package com.copytrading.integration.polymarket;

public record ExchangeOrderAck(String exchangeOrderId, String status, String rawResponse) {}
