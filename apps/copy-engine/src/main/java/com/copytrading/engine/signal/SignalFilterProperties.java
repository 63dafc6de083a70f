package com.copytrading.engine.signal;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.filters")
public class SignalFilterProperties {
  private BigDecimal minWhaleScore = new BigDecimal("75");
  private BigDecimal maxWhaleDrawdown = new BigDecimal("0.25");
  private BigDecimal minTradeNotional = new BigDecimal("5000");
  private BigDecimal maxSlippage = new BigDecimal("0.01");
  private long maxDaysToResolution = 90L;
  private BigDecimal minEdge = new BigDecimal("0.03");
  private BigDecimal winRateWeight = new BigDecimal("0.7");
  private BigDecimal maxCorrelation = new BigDecimal("0.4");
  private BigDecimal maxTotalExposureRatio = new BigDecimal("0.95");
  private BigDecimal maxCategoryExposureRatio = new BigDecimal("0.30");
  private BigDecimal sameCategoryCorrelation = new BigDecimal("0.3");
  private BigDecimal defaultCorrelation = new BigDecimal("0.1");

  public BigDecimal getMinWhaleScore() {
    return minWhaleScore;
  }

  public void setMinWhaleScore(BigDecimal minWhaleScore) {
    this.minWhaleScore = minWhaleScore;
  }

  public BigDecimal getMaxWhaleDrawdown() {
    return maxWhaleDrawdown;
  }

  public void setMaxWhaleDrawdown(BigDecimal maxWhaleDrawdown) {
    this.maxWhaleDrawdown = maxWhaleDrawdown;
  }

  public BigDecimal getMinTradeNotional() {
    return minTradeNotional;
  }

  public void setMinTradeNotional(BigDecimal minTradeNotional) {
    this.minTradeNotional = minTradeNotional;
  }

  public BigDecimal getMaxSlippage() {
    return maxSlippage;
  }

  public void setMaxSlippage(BigDecimal maxSlippage) {
    this.maxSlippage = maxSlippage;
  }

  public long getMaxDaysToResolution() {
    return maxDaysToResolution;
  }

  public void setMaxDaysToResolution(long maxDaysToResolution) {
    this.maxDaysToResolution = maxDaysToResolution;
  }

  public BigDecimal getMinEdge() {
    return minEdge;
  }

  public void setMinEdge(BigDecimal minEdge) {
    this.minEdge = minEdge;
  }

  public BigDecimal getWinRateWeight() {
    return winRateWeight;
  }

  public void setWinRateWeight(BigDecimal winRateWeight) {
    this.winRateWeight = winRateWeight;
  }

  public BigDecimal getMaxCorrelation() {
    return maxCorrelation;
  }

  public void setMaxCorrelation(BigDecimal maxCorrelation) {
    this.maxCorrelation = maxCorrelation;
  }

  public BigDecimal getMaxTotalExposureRatio() {
    return maxTotalExposureRatio;
  }

  public void setMaxTotalExposureRatio(BigDecimal maxTotalExposureRatio) {
    this.maxTotalExposureRatio = maxTotalExposureRatio;
  }

  public BigDecimal getMaxCategoryExposureRatio() {
    return maxCategoryExposureRatio;
  }

  public void setMaxCategoryExposureRatio(BigDecimal maxCategoryExposureRatio) {
    this.maxCategoryExposureRatio = maxCategoryExposureRatio;
  }

  public BigDecimal getSameCategoryCorrelation() {
    return sameCategoryCorrelation;
  }

  public void setSameCategoryCorrelation(BigDecimal sameCategoryCorrelation) {
    this.sameCategoryCorrelation = sameCategoryCorrelation;
  }

  public BigDecimal getDefaultCorrelation() {
    return defaultCorrelation;
  }

  public void setDefaultCorrelation(BigDecimal defaultCorrelation) {
    this.defaultCorrelation = defaultCorrelation;
  }
}
