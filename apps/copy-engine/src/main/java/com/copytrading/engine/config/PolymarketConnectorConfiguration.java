package com.copytrading.engine.config;

import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.JitteredExponentialBackoff;
import com.copytrading.integration.polymarket.PolymarketConnectorProperties;
import com.copytrading.integration.polymarket.PolymarketRequestSigner;
import com.copytrading.integration.polymarket.RateLimitRetryExecutor;
import com.copytrading.integration.polymarket.RestPolymarketExchangeClient;
import com.copytrading.integration.polymarket.RetryAfterParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PolymarketConnectorProperties.class)
public class PolymarketConnectorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PolymarketRequestSigner polymarketRequestSigner(
      PolymarketConnectorProperties properties, Clock clock) {
    return new PolymarketRequestSigner(properties.getApiSecret(), clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryAfterParser retryAfterParser(Clock clock) {
    return new RetryAfterParser(clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public JitteredExponentialBackoff jitteredExponentialBackoff(
      PolymarketConnectorProperties properties) {
    PolymarketConnectorProperties.Retry retry = properties.getRetry();
    return new JitteredExponentialBackoff(
        Duration.ofMillis(retry.getBaseBackoffMs()),
        Duration.ofMillis(retry.getMaxBackoffMs()),
        retry.isJitterEnabled());
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitRetryExecutor rateLimitRetryExecutor(
      PolymarketConnectorProperties properties,
      RetryAfterParser retryAfterParser,
      JitteredExponentialBackoff jitteredExponentialBackoff,
      MeterRegistry meterRegistry) {
    return new RateLimitRetryExecutor(
        properties.getRetry().getMaxAttempts(),
        retryAfterParser,
        jitteredExponentialBackoff,
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(name = "polymarketRestClient")
  public RestClient polymarketRestClient(PolymarketConnectorProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(toTimeout(properties.getConnectTimeoutMs()));
    requestFactory.setReadTimeout(toTimeout(properties.getReadTimeoutMs()));
    return RestClient.builder()
        .baseUrl(properties.getBaseUrl())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ExchangeClient exchangeClient(
      RestClient polymarketRestClient,
      ObjectMapper objectMapper,
      PolymarketConnectorProperties properties,
      PolymarketRequestSigner polymarketRequestSigner,
      RateLimitRetryExecutor rateLimitRetryExecutor) {
    return new RestPolymarketExchangeClient(
        polymarketRestClient,
        objectMapper,
        properties,
        polymarketRequestSigner,
        rateLimitRetryExecutor);
  }

  private static int toTimeout(long millis) {
    return (int) Math.min(Integer.MAX_VALUE, Math.max(100L, millis));
  }
}
