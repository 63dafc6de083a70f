package com.copytrading.engine.position;

import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Moves positions closed longer than the retention window to ARCHIVED. */
@Component
public class ArchivalScheduler {
  private final PositionLedger positionLedger;
  private final LedgerProperties properties;
  private final Clock clock;

  @Autowired
  public ArchivalScheduler(PositionLedger positionLedger, LedgerProperties properties) {
    this(positionLedger, properties, Clock.systemUTC());
  }

  ArchivalScheduler(PositionLedger positionLedger, LedgerProperties properties, Clock clock) {
    this.positionLedger = positionLedger;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(cron = "${copytrading.ledger.archival-cron:0 15 0 * * *}", zone = "UTC")
  public void archive() {
    positionLedger.archiveClosedBefore(
        clock.instant().minus(Duration.ofDays(properties.getArchiveAfterDays())));
  }
}
