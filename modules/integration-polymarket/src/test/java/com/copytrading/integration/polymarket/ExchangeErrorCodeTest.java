package com.copytrading.integration.polymarket;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ExchangeErrorCodeTest {
  @Test
  void shouldClassifyHttpStatuses() {
    assertEquals(ExchangeErrorCode.RATE_LIMITED, ExchangeErrorCode.fromHttpStatus(429, null));
    assertEquals(ExchangeErrorCode.SERVER_ERROR, ExchangeErrorCode.fromHttpStatus(503, "busy"));
    assertEquals(ExchangeErrorCode.UNAUTHORIZED, ExchangeErrorCode.fromHttpStatus(401, null));
    assertEquals(ExchangeErrorCode.ORDER_NOT_FOUND, ExchangeErrorCode.fromHttpStatus(404, null));
    assertEquals(
        ExchangeErrorCode.INVALID_MARKET,
        ExchangeErrorCode.fromHttpStatus(400, "market not found for token"));
    assertEquals(ExchangeErrorCode.REJECTED, ExchangeErrorCode.fromHttpStatus(400, ""));
  }
}
