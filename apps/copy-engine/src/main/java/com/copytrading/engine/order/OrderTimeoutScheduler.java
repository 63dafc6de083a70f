package com.copytrading.engine.order;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class OrderTimeoutScheduler {
  private static final Logger log = LoggerFactory.getLogger(OrderTimeoutScheduler.class);

  private final OrderExecutor orderExecutor;

  public OrderTimeoutScheduler(OrderExecutor orderExecutor) {
    this.orderExecutor = orderExecutor;
  }

  @Scheduled(fixedDelayString = "${copytrading.execution.timeout-sweep-delay-ms:1000}")
  public void sweep() {
    int pending = orderExecutor.expirePending();
    int open = orderExecutor.expireOpenOrders();
    if (pending > 0 || open > 0) {
      log.info("Order timeout sweep pendingExpired={} openExpired={}", pending, open);
    }
  }
}
