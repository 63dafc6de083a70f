package com.copytrading.integration.polymarket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

class RateLimitRetryExecutorTest {
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<Duration> sleeps = new ArrayList<>();
  private final RateLimitRetryExecutor executor =
      new RateLimitRetryExecutor(
          3,
          new RetryAfterParser(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC)),
          new JitteredExponentialBackoff(Duration.ofMillis(100L), Duration.ofSeconds(2), false),
          sleeps::add,
          meterRegistry);

  @Test
  void shouldRetryRateLimitUsingRetryAfterCappedByMaxBackoff() {
    AtomicInteger calls = new AtomicInteger();

    String result =
        executor.execute(
            "submit",
            () -> {
              int call = calls.incrementAndGet();
              if (call == 1) {
                throw rateLimited("10");
              }
              if (call == 2) {
                throw rateLimited(null);
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(List.of(Duration.ofSeconds(2), Duration.ofMillis(200L)), sleeps);
    assertEquals(
        2.0d,
        meterRegistry
            .get(RateLimitRetryExecutor.RETRY_COUNTER)
            .tag("operation", "submit")
            .counter()
            .count());
  }

  @Test
  void shouldGiveUpAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();

    ExchangeException thrown =
        assertThrows(
            ExchangeException.class,
            () ->
                executor.execute(
                    "poll",
                    () -> {
                      calls.incrementAndGet();
                      throw rateLimited(null);
                    }));

    assertEquals(ExchangeErrorCode.RATE_LIMITED, thrown.errorCode());
    assertEquals(3, calls.get());
    assertEquals(
        1.0d, meterRegistry.get(RateLimitRetryExecutor.EXHAUSTED_COUNTER).counter().count());
  }

  @Test
  void shouldNotRetryOtherErrors() {
    ExchangeException terminal =
        new ExchangeException(ExchangeErrorCode.INSUFFICIENT_BALANCE, "not enough balance");
    AtomicInteger calls = new AtomicInteger();

    ExchangeException thrown =
        assertThrows(
            ExchangeException.class,
            () ->
                executor.execute(
                    "submit",
                    () -> {
                      calls.incrementAndGet();
                      throw terminal;
                    }));

    assertSame(terminal, thrown);
    assertEquals(1, calls.get());
    assertEquals(List.of(), sleeps);
  }

  private static ExchangeException rateLimited(String retryAfter) {
    HttpHeaders headers = new HttpHeaders();
    if (retryAfter != null) {
      headers.set(HttpHeaders.RETRY_AFTER, retryAfter);
    }
    return new ExchangeException(ExchangeErrorCode.RATE_LIMITED, "slow down", 429, headers, "", null);
  }
}
