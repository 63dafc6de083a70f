package com.copytrading.engine.position;

import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionUpdateType;
import com.copytrading.infra.kafka.contract.payload.PositionUpdatedV1;
import com.copytrading.infra.kafka.producer.PositionEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class PositionEventPublisher {
  private static final Logger log = LoggerFactory.getLogger(PositionEventPublisher.class);

  private final ObjectProvider<PositionEventProducer> producer;

  public PositionEventPublisher(ObjectProvider<PositionEventProducer> producer) {
    this.producer = producer;
  }

  public void publish(Position position, PositionUpdateType updateType) {
    PositionEventProducer eventProducer = producer.getIfAvailable();
    if (eventProducer == null) {
      return;
    }
    PositionUpdatedV1 payload =
        new PositionUpdatedV1(
            position.positionId().toString(),
            position.whaleAddress(),
            position.tokenId(),
            position.side().name(),
            position.status().name(),
            updateType == null ? null : updateType.name(),
            position.currentSize(),
            position.currentPrice(),
            position.unrealizedPnl(),
            position.realizedPnl(),
            position.closeReason() == null ? null : position.closeReason().name(),
            position.lastUpdatedAt());
    try {
      eventProducer
          .publishPositionUpdated(payload)
          .whenComplete(
              (result, ex) -> {
                if (ex != null) {
                  log.warn(
                      "Position update publish failed positionId={} error={}",
                      position.positionId(),
                      ex.getMessage());
                }
              });
    } catch (RuntimeException ex) {
      log.warn(
          "Position update publish failed positionId={} error={}",
          position.positionId(),
          ex.getMessage());
    }
  }
}
