package com.copytrading.engine.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Opens a new trading day at 00:00 UTC. Approvals also roll the day lazily if this run is late. */
@Component
public class TradingDayScheduler {
  private static final Logger log = LoggerFactory.getLogger(TradingDayScheduler.class);

  private final RiskManager riskManager;

  public TradingDayScheduler(RiskManager riskManager) {
    this.riskManager = riskManager;
  }

  @Scheduled(cron = "${copytrading.risk.day-roll-cron:0 0 0 * * *}", zone = "UTC")
  public void rollTradingDay() {
    if (!riskManager.rollTradingDay()) {
      log.debug("Trading day already current tradingDay={}", riskManager.snapshot().tradingDay());
    }
  }
}
