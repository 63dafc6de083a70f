package com.copytrading.engine.signal;

import com.copytrading.engine.risk.RiskState;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Stage 1: is this whale worth copying right now. Missing metrics fail closed. */
@Component
public class WhaleGate {
  static final String WHALE_IN_TROUBLE = "Whale in trouble";

  private final SignalFilterProperties properties;

  public WhaleGate(SignalFilterProperties properties) {
    this.properties = properties;
  }

  public Optional<RejectionReason> evaluate(WhaleSignal signal, RiskState riskState) {
    if (riskState.isQuarantined(signal.whaleAddress())) {
      return Optional.of(
          RejectionReason.whale(
              RejectionCode.WHALE_QUARANTINED,
              "Whale " + signal.whaleAddress() + " is quarantined"));
    }
    WhaleMetrics metrics = signal.metrics();
    if (!metrics.isComplete()) {
      return Optional.of(
          RejectionReason.whale(RejectionCode.MISSING_WHALE_METRICS, "Whale metrics incomplete"));
    }
    if (metrics.score().compareTo(properties.getMinWhaleScore()) < 0) {
      return Optional.of(
          RejectionReason.whale(
              RejectionCode.LOW_WHALE_SCORE,
              "Whale score " + metrics.score() + " below " + properties.getMinWhaleScore()));
    }
    if (metrics.sharpe30d().compareTo(metrics.sharpe90d()) <= 0) {
      return Optional.of(
          RejectionReason.whale(
              RejectionCode.DECLINING_SHARPE,
              "30d Sharpe " + metrics.sharpe30d() + " not above 90d Sharpe " + metrics.sharpe90d()));
    }
    if (metrics.currentDrawdown().compareTo(properties.getMaxWhaleDrawdown()) >= 0) {
      return Optional.of(RejectionReason.whale(RejectionCode.WHALE_IN_TROUBLE, WHALE_IN_TROUBLE));
    }
    return Optional.empty();
  }
}
