package com.copytrading.engine.order;

import com.copytrading.domain.orders.OrderType;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.execution")
public class ExecutionProperties {
  private OrderType orderType = OrderType.GTC;
  private int maxRetries = 3;
  private long initialBackoffMs = 1000L;
  private double backoffMultiplier = 2.0d;
  private long pendingTimeoutMs = 5000L;
  private long openOrderTimeoutMs = 30000L;
  private BigDecimal partialFillAcceptRatio = new BigDecimal("0.80");
  private long timeoutSweepDelayMs = 1000L;
  private long fillPollDelayMs = 2000L;

  public OrderType getOrderType() {
    return orderType;
  }

  public void setOrderType(OrderType orderType) {
    this.orderType = orderType;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public void setInitialBackoffMs(long initialBackoffMs) {
    this.initialBackoffMs = initialBackoffMs;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public long getPendingTimeoutMs() {
    return pendingTimeoutMs;
  }

  public void setPendingTimeoutMs(long pendingTimeoutMs) {
    this.pendingTimeoutMs = pendingTimeoutMs;
  }

  public long getOpenOrderTimeoutMs() {
    return openOrderTimeoutMs;
  }

  public void setOpenOrderTimeoutMs(long openOrderTimeoutMs) {
    this.openOrderTimeoutMs = openOrderTimeoutMs;
  }

  public BigDecimal getPartialFillAcceptRatio() {
    return partialFillAcceptRatio;
  }

  public void setPartialFillAcceptRatio(BigDecimal partialFillAcceptRatio) {
    this.partialFillAcceptRatio = partialFillAcceptRatio;
  }

  public long getTimeoutSweepDelayMs() {
    return timeoutSweepDelayMs;
  }

  public void setTimeoutSweepDelayMs(long timeoutSweepDelayMs) {
    this.timeoutSweepDelayMs = timeoutSweepDelayMs;
  }

  public long getFillPollDelayMs() {
    return fillPollDelayMs;
  }

  public void setFillPollDelayMs(long fillPollDelayMs) {
    this.fillPollDelayMs = fillPollDelayMs;
  }
}
