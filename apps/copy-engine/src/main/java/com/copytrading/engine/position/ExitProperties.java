package com.copytrading.engine.position;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "copytrading.exits")
public class ExitProperties {
  private List<ExitTrigger> priority =
      new ArrayList<>(
          List.of(
              ExitTrigger.STOP_LOSS,
              ExitTrigger.TAKE_PROFIT,
              ExitTrigger.PRE_RESOLUTION,
              ExitTrigger.WHALE_EXIT));
  private BigDecimal stopLossRatio = new BigDecimal("0.15");
  private BigDecimal takeProfitRatio = new BigDecimal("0.30");
  private long preResolutionWindowMinutes = 120L;

  public List<ExitTrigger> getPriority() {
    return priority;
  }

  public void setPriority(List<ExitTrigger> priority) {
    this.priority = priority;
  }

  public BigDecimal getStopLossRatio() {
    return stopLossRatio;
  }

  public void setStopLossRatio(BigDecimal stopLossRatio) {
    this.stopLossRatio = stopLossRatio;
  }

  public BigDecimal getTakeProfitRatio() {
    return takeProfitRatio;
  }

  public void setTakeProfitRatio(BigDecimal takeProfitRatio) {
    this.takeProfitRatio = takeProfitRatio;
  }

  public long getPreResolutionWindowMinutes() {
    return preResolutionWindowMinutes;
  }

  public void setPreResolutionWindowMinutes(long preResolutionWindowMinutes) {
    this.preResolutionWindowMinutes = preResolutionWindowMinutes;
  }
}
