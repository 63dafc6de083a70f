package com.copytrading.integration.polymarket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestPolymarketExchangeClientTest {
  private static final String BASE_URL = "https://clob.polymarket.test";
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

  private MockRestServiceServer server;
  private RestPolymarketExchangeClient client;

  @BeforeEach
  void setUp() {
    PolymarketConnectorProperties properties = new PolymarketConnectorProperties();
    properties.setBaseUrl(BASE_URL);
    properties.setAddress("0xfunder");
    properties.setApiKey("api-key");
    properties.setApiSecret("c2VjcmV0");
    properties.setPassphrase("pass");

    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    client =
        new RestPolymarketExchangeClient(
            builder.build(),
            new ObjectMapper(),
            properties,
            new PolymarketRequestSigner(properties.getApiSecret(), CLOCK),
            new RateLimitRetryExecutor(
                2,
                new RetryAfterParser(CLOCK),
                new JitteredExponentialBackoff(Duration.ofMillis(100L), Duration.ofSeconds(1), false),
                duration -> {},
                new SimpleMeterRegistry()));
  }

  @Test
  void shouldSubmitSignedLimitOrder() {
    server
        .expect(requestTo(BASE_URL + "/order"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("POLY_ADDRESS", "0xfunder"))
        .andExpect(header("POLY_API_KEY", "api-key"))
        .andExpect(header("POLY_PASSPHRASE", "pass"))
        .andExpect(header("POLY_TIMESTAMP", Long.toString(CLOCK.instant().getEpochSecond())))
        .andExpect(jsonPath("$.order.tokenID").value("tok-1"))
        .andExpect(jsonPath("$.order.side").value("BUY"))
        .andExpect(jsonPath("$.order.price").value("0.55"))
        .andExpect(jsonPath("$.orderType").value("GTC"))
        .andExpect(jsonPath("$.clientOrderId").value("whale-0xA-t1"))
        .andRespond(
            withSuccess(
                """
                {"success":true,"errorMsg":"","orderID":"0xabc","status":"live"}
                """,
                MediaType.APPLICATION_JSON));

    ExchangeOrderAck ack = client.submitOrder(limitBuy());

    assertEquals("0xabc", ack.exchangeOrderId());
    assertEquals("live", ack.status());
    server.verify();
  }

  @Test
  void shouldClassifyUnsuccessfulSubmitAsTerminal() {
    server
        .expect(requestTo(BASE_URL + "/order"))
        .andRespond(
            withSuccess(
                """
                {"success":false,"errorMsg":"not enough balance / allowance","orderID":""}
                """,
                MediaType.APPLICATION_JSON));

    ExchangeException thrown =
        assertThrows(ExchangeException.class, () -> client.submitOrder(limitBuy()));

    assertEquals(ExchangeErrorCode.INSUFFICIENT_BALANCE, thrown.errorCode());
    assertFalse(thrown.isTransient());
  }

  @Test
  void shouldPostRateLimitedSubmitOnlyOnce() {
    HttpHeaders retryAfter = new HttpHeaders();
    retryAfter.set(HttpHeaders.RETRY_AFTER, "1");
    server
        .expect(times(1), requestTo(BASE_URL + "/order"))
        .andExpect(method(HttpMethod.POST))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(retryAfter));

    ExchangeException thrown =
        assertThrows(ExchangeException.class, () -> client.submitOrder(limitBuy()));

    assertEquals(ExchangeErrorCode.RATE_LIMITED, thrown.errorCode());
    assertTrue(thrown.isTransient());
    server.verify();
  }

  @Test
  void shouldMapServerErrorsAndTimeoutsToTransientCodes() {
    server.expect(requestTo(BASE_URL + "/data/order/0xabc")).andRespond(withServerError());
    server
        .expect(requestTo(BASE_URL + "/data/order/0xabc"))
        .andRespond(withException(new SocketTimeoutException("read timed out")));

    ExchangeException serverError =
        assertThrows(ExchangeException.class, () -> client.pollFill("0xabc"));
    ExchangeException timeout =
        assertThrows(ExchangeException.class, () -> client.pollFill("0xabc"));

    assertEquals(ExchangeErrorCode.SERVER_ERROR, serverError.errorCode());
    assertEquals(ExchangeErrorCode.TIMEOUT, timeout.errorCode());
    assertTrue(serverError.isTransient());
    assertTrue(timeout.isTransient());
  }

  @Test
  void shouldClassifyBadRequestBodyError() {
    server
        .expect(requestTo(BASE_URL + "/order"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid price (0.995), min: 0.01 - max: 0.99\"}"));

    ExchangeException thrown =
        assertThrows(ExchangeException.class, () -> client.submitOrder(limitBuy()));

    assertEquals(ExchangeErrorCode.PRICE_OUT_OF_BOUNDS, thrown.errorCode());
    assertEquals(400, thrown.statusCode());
  }

  @Test
  void shouldReportCancelOutcome() {
    server
        .expect(requestTo(BASE_URL + "/order"))
        .andExpect(method(HttpMethod.DELETE))
        .andExpect(jsonPath("$.orderID").value("0xabc"))
        .andRespond(
            withSuccess(
                """
                {"canceled":[],"not_canceled":{"0xabc":"order already matched"}}
                """,
                MediaType.APPLICATION_JSON));

    ExchangeCancelResult result = client.cancelOrder("0xabc");

    assertFalse(result.cancelled());
    assertEquals("order already matched", result.reason());
  }

  @Test
  void shouldFetchPublicOrderBookWithoutAuthHeaders() {
    server
        .expect(requestTo(BASE_URL + "/book?token_id=tok-1"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(headerDoesNotExist("POLY_SIGNATURE"))
        .andRespond(
            withSuccess(
                """
                {
                  "market": "0xcond",
                  "asset_id": "tok-1",
                  "bids": [{"price":"0.50","size":"100"},{"price":"0.54","size":"1000"}],
                  "asks": [{"price":"0.60","size":"200"},{"price":"0.56","size":"1000"}]
                }
                """,
                MediaType.APPLICATION_JSON));

    OrderBook book = client.fetchOrderBook("tok-1");

    assertEquals(new BigDecimal("0.54"), book.bestBid().orElseThrow());
    assertEquals(new BigDecimal("0.56"), book.bestAsk().orElseThrow());
    assertEquals(2, book.asks().size());
  }

  @Test
  void shouldPollCumulativeFill() {
    server
        .expect(requestTo(BASE_URL + "/data/order/0xabc"))
        .andExpect(header("POLY_API_KEY", "api-key"))
        .andRespond(
            withSuccess(
                """
                {
                  "id": "0xabc",
                  "status": "LIVE",
                  "original_size": "100",
                  "size_matched": "40",
                  "price": "0.55",
                  "associate_trades": ["t-1", "t-2"]
                }
                """,
                MediaType.APPLICATION_JSON));

    ExchangeFillSnapshot snapshot = client.pollFill("0xabc");

    assertTrue(snapshot.isLive());
    assertEquals(new BigDecimal("40"), snapshot.sizeMatched());
    assertEquals(2, snapshot.tradeCount());
  }

  @Test
  void shouldGiveUpAfterRepeatedRateLimits() {
    server
        .expect(times(2), requestTo(BASE_URL + "/book?token_id=tok-1"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    ExchangeException thrown =
        assertThrows(ExchangeException.class, () -> client.fetchOrderBook("tok-1"));

    assertEquals(ExchangeErrorCode.RATE_LIMITED, thrown.errorCode());
    server.verify();
  }

  private static ExchangeOrderRequest limitBuy() {
    return new ExchangeOrderRequest(
        "whale-0xA-t1",
        "tok-1",
        OrderSide.BUY,
        OrderType.LIMIT,
        new BigDecimal("1196.36"),
        new BigDecimal("0.55"));
  }
}
