package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.infra.kafka.contract.payload.OrderUpdatedV1;
import com.copytrading.infra.kafka.producer.OrderEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** Best-effort change feed for downstream dashboards; a no-op when Kafka is disabled. */
@Component
public class OrderEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(OrderEventPublisher.class);

  private final ObjectProvider<OrderEventProducer> producer;

  public OrderEventPublisher(ObjectProvider<OrderEventProducer> producer) {
    this.producer = producer;
  }

  public void publish(Order order) {
    OrderEventProducer eventProducer = producer.getIfAvailable();
    if (eventProducer == null) {
      return;
    }
    OrderUpdatedV1 payload =
        new OrderUpdatedV1(
            order.orderId().toString(),
            order.idempotencyKey(),
            order.tokenId(),
            order.side().name(),
            order.state().name(),
            order.size(),
            order.filledSize(),
            order.avgFillPrice(),
            order.exchangeOrderId(),
            order.context().whaleAddress(),
            order.updatedAt());
    try {
      eventProducer
          .publishOrderUpdated(payload)
          .whenComplete(
              (result, ex) -> {
                if (ex != null) {
                  log.warn(
                      "Order update publish failed orderId={} state={} error={}",
                      order.orderId(),
                      order.state(),
                      ex.getMessage());
                }
              });
    } catch (RuntimeException ex) {
      log.warn(
          "Order update publish failed orderId={} state={} error={}",
          order.orderId(),
          order.state(),
          ex.getMessage());
    }
  }
}
