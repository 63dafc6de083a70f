package com.copytrading.engine.position;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.ledger")
public class LedgerProperties {
  private long archiveAfterDays = 30L;
  private String archivalCron = "0 15 0 * * *";

  public long getArchiveAfterDays() {
    return archiveAfterDays;
  }

  public void setArchiveAfterDays(long archiveAfterDays) {
    this.archiveAfterDays = archiveAfterDays;
  }

  public String getArchivalCron() {
    return archivalCron;
  }

  public void setArchivalCron(String archivalCron) {
    this.archivalCron = archivalCron;
  }
}
