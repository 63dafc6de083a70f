package com.copytrading.engine.signal;

import com.copytrading.engine.risk.RiskState;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Whale gate, trade gate, portfolio gate, in that order. The first failing check decides; a
 * rejection leaves nothing behind but a log line and a counter.
 */
@Component
public class SignalFilterPipeline {
  private static final Logger log = LoggerFactory.getLogger(SignalFilterPipeline.class);
  static final String SIGNALS_METRIC = "copytrading.signals.total";

  private final WhaleGate whaleGate;
  private final TradeGate tradeGate;
  private final PortfolioGate portfolioGate;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public SignalFilterPipeline(
      WhaleGate whaleGate,
      TradeGate tradeGate,
      PortfolioGate portfolioGate,
      MeterRegistry meterRegistry) {
    this(whaleGate, tradeGate, portfolioGate, meterRegistry, Clock.systemUTC());
  }

  SignalFilterPipeline(
      WhaleGate whaleGate,
      TradeGate tradeGate,
      PortfolioGate portfolioGate,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.whaleGate = whaleGate;
    this.tradeGate = tradeGate;
    this.portfolioGate = portfolioGate;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public FilterDecision evaluate(WhaleSignal signal, RiskState riskState) {
    Optional<RejectionReason> whale = whaleGate.evaluate(signal, riskState);
    if (whale.isPresent()) {
      return reject(signal, whale.get());
    }
    TradeAssessment trade = tradeGate.evaluate(signal, clock.instant());
    if (!trade.passed()) {
      return reject(signal, trade.rejection());
    }
    PortfolioAssessment portfolio = portfolioGate.evaluate(signal, riskState);
    if (!portfolio.passed()) {
      return reject(signal, portfolio.rejection());
    }
    meterRegistry.counter(SIGNALS_METRIC, "outcome", "accepted", "stage", "none").increment();
    log.info(
        "Signal accepted tradeId={} whale={} token={} edge={} slippage={} correlation={}",
        signal.tradeId(),
        signal.whaleAddress(),
        signal.tokenId(),
        trade.edge(),
        trade.slippage(),
        portfolio.correlation());
    return FilterDecision.accept(trade, portfolio);
  }

  private FilterDecision reject(WhaleSignal signal, RejectionReason reason) {
    meterRegistry
        .counter(SIGNALS_METRIC, "outcome", "rejected", "stage", reason.stage().name())
        .increment();
    log.info(
        "Signal rejected tradeId={} whale={} token={} stage={} code={} detail={}",
        signal.tradeId(),
        signal.whaleAddress(),
        signal.tokenId(),
        reason.stage(),
        reason.code(),
        reason.detail());
    return FilterDecision.reject(reason);
  }
}
