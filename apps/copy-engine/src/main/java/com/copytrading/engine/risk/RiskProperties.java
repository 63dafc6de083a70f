package com.copytrading.engine.risk;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.risk")
public class RiskProperties {
  private BigDecimal startingNav = new BigDecimal("10000");
  private BigDecimal dailyLossLimitUsd = new BigDecimal("500");
  private BigDecimal dailyLossLimitRatio = new BigDecimal("0.05");
  private BigDecimal whaleDailyLossLimitUsd = new BigDecimal("200");
  private BigDecimal reduceDrawdownThreshold = new BigDecimal("0.10");
  private BigDecimal reduceMultiplier = new BigDecimal("0.5");
  private int maxConsecutiveLosses = 5;
  private long pauseMinutes = 60L;
  private BigDecimal maxPositionUsd = new BigDecimal("1000");
  private BigDecimal maxMarketExposureUsd = new BigDecimal("5000");
  private BigDecimal maxWhaleExposureUsd = new BigDecimal("10000");
  private BigDecimal maxTotalAllocationRatio = new BigDecimal("0.90");
  private int maxOpenPositions = 50;
  private String dayRollCron = "0 0 0 * * *";
  private Quarantine quarantine = new Quarantine();

  public BigDecimal getStartingNav() {
    return startingNav;
  }

  public void setStartingNav(BigDecimal startingNav) {
    this.startingNav = startingNav;
  }

  public BigDecimal getDailyLossLimitUsd() {
    return dailyLossLimitUsd;
  }

  public void setDailyLossLimitUsd(BigDecimal dailyLossLimitUsd) {
    this.dailyLossLimitUsd = dailyLossLimitUsd;
  }

  public BigDecimal getDailyLossLimitRatio() {
    return dailyLossLimitRatio;
  }

  public void setDailyLossLimitRatio(BigDecimal dailyLossLimitRatio) {
    this.dailyLossLimitRatio = dailyLossLimitRatio;
  }

  public BigDecimal getWhaleDailyLossLimitUsd() {
    return whaleDailyLossLimitUsd;
  }

  public void setWhaleDailyLossLimitUsd(BigDecimal whaleDailyLossLimitUsd) {
    this.whaleDailyLossLimitUsd = whaleDailyLossLimitUsd;
  }

  public BigDecimal getReduceDrawdownThreshold() {
    return reduceDrawdownThreshold;
  }

  public void setReduceDrawdownThreshold(BigDecimal reduceDrawdownThreshold) {
    this.reduceDrawdownThreshold = reduceDrawdownThreshold;
  }

  public BigDecimal getReduceMultiplier() {
    return reduceMultiplier;
  }

  public void setReduceMultiplier(BigDecimal reduceMultiplier) {
    this.reduceMultiplier = reduceMultiplier;
  }

  public int getMaxConsecutiveLosses() {
    return maxConsecutiveLosses;
  }

  public void setMaxConsecutiveLosses(int maxConsecutiveLosses) {
    this.maxConsecutiveLosses = maxConsecutiveLosses;
  }

  public long getPauseMinutes() {
    return pauseMinutes;
  }

  public void setPauseMinutes(long pauseMinutes) {
    this.pauseMinutes = pauseMinutes;
  }

  public BigDecimal getMaxPositionUsd() {
    return maxPositionUsd;
  }

  public void setMaxPositionUsd(BigDecimal maxPositionUsd) {
    this.maxPositionUsd = maxPositionUsd;
  }

  public BigDecimal getMaxMarketExposureUsd() {
    return maxMarketExposureUsd;
  }

  public void setMaxMarketExposureUsd(BigDecimal maxMarketExposureUsd) {
    this.maxMarketExposureUsd = maxMarketExposureUsd;
  }

  public BigDecimal getMaxWhaleExposureUsd() {
    return maxWhaleExposureUsd;
  }

  public void setMaxWhaleExposureUsd(BigDecimal maxWhaleExposureUsd) {
    this.maxWhaleExposureUsd = maxWhaleExposureUsd;
  }

  public BigDecimal getMaxTotalAllocationRatio() {
    return maxTotalAllocationRatio;
  }

  public void setMaxTotalAllocationRatio(BigDecimal maxTotalAllocationRatio) {
    this.maxTotalAllocationRatio = maxTotalAllocationRatio;
  }

  public int getMaxOpenPositions() {
    return maxOpenPositions;
  }

  public void setMaxOpenPositions(int maxOpenPositions) {
    this.maxOpenPositions = maxOpenPositions;
  }

  public String getDayRollCron() {
    return dayRollCron;
  }

  public void setDayRollCron(String dayRollCron) {
    this.dayRollCron = dayRollCron;
  }

  public Quarantine getQuarantine() {
    return quarantine;
  }

  public void setQuarantine(Quarantine quarantine) {
    this.quarantine = quarantine;
  }

  public static class Quarantine {
    private BigDecimal minScore = new BigDecimal("50");
    private BigDecimal maxDrawdown = new BigDecimal("0.10");
    private BigDecimal maxScoreDrop = new BigDecimal("25");
    private long scoreLookbackDays = 7L;
    private BigDecimal releaseScore = new BigDecimal("60");
    private long releaseQuietDays = 7L;
    private QuarantinePolicy policy = QuarantinePolicy.HOLD;

    public BigDecimal getMinScore() {
      return minScore;
    }

    public void setMinScore(BigDecimal minScore) {
      this.minScore = minScore;
    }

    public BigDecimal getMaxDrawdown() {
      return maxDrawdown;
    }

    public void setMaxDrawdown(BigDecimal maxDrawdown) {
      this.maxDrawdown = maxDrawdown;
    }

    public BigDecimal getMaxScoreDrop() {
      return maxScoreDrop;
    }

    public void setMaxScoreDrop(BigDecimal maxScoreDrop) {
      this.maxScoreDrop = maxScoreDrop;
    }

    public long getScoreLookbackDays() {
      return scoreLookbackDays;
    }

    public void setScoreLookbackDays(long scoreLookbackDays) {
      this.scoreLookbackDays = scoreLookbackDays;
    }

    public BigDecimal getReleaseScore() {
      return releaseScore;
    }

    public void setReleaseScore(BigDecimal releaseScore) {
      this.releaseScore = releaseScore;
    }

    public long getReleaseQuietDays() {
      return releaseQuietDays;
    }

    public void setReleaseQuietDays(long releaseQuietDays) {
      this.releaseQuietDays = releaseQuietDays;
    }

    public QuarantinePolicy getPolicy() {
      return policy;
    }

    public void setPolicy(QuarantinePolicy policy) {
      this.policy = policy;
    }
  }
}
