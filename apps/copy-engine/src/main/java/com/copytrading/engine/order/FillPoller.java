package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** REST fill path: asks the exchange about every order still open there. */
@Component
public class FillPoller {
  private static final Logger log = LoggerFactory.getLogger(FillPoller.class);

  private final OrderExecutor orderExecutor;
  private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

  public FillPoller(OrderExecutor orderExecutor) {
    this.orderExecutor = orderExecutor;
  }

  @Scheduled(fixedDelayString = "${copytrading.execution.fill-poll-delay-ms:2000}")
  public void poll() {
    if (!pollInProgress.compareAndSet(false, true)) {
      log.info("Skipping fill poll because another run is in progress");
      return;
    }
    try {
      for (Order order : orderExecutor.openOrders()) {
        try {
          orderExecutor.pollFills(order.orderId());
        } catch (RuntimeException ex) {
          log.error(
              "Fill poll failed orderId={} exchangeOrderId={}",
              order.orderId(),
              order.exchangeOrderId(),
              ex);
        }
      }
    } finally {
      pollInProgress.set(false);
    }
  }
}
