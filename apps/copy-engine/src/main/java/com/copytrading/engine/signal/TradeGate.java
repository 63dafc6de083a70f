package com.copytrading.engine.signal;

import com.copytrading.engine.sizing.EdgeModel;
import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.ExchangeException;
import com.copytrading.integration.polymarket.OrderBook;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Stage 2: is this particular trade worth copying. */
@Component
public class TradeGate {
  private static final Logger log = LoggerFactory.getLogger(TradeGate.class);

  private final SignalFilterProperties properties;
  private final ExchangeClient exchangeClient;

  public TradeGate(SignalFilterProperties properties, ExchangeClient exchangeClient) {
    this.properties = properties;
    this.exchangeClient = exchangeClient;
  }

  public TradeAssessment evaluate(WhaleSignal signal, Instant now) {
    BigDecimal notional = signal.notional();
    if (notional.compareTo(properties.getMinTradeNotional()) < 0) {
      return TradeAssessment.rejected(
          RejectionReason.trade(
              RejectionCode.TRADE_TOO_SMALL,
              "Trade notional " + notional + " below " + properties.getMinTradeNotional()));
    }

    OrderBook book;
    try {
      book = exchangeClient.fetchOrderBook(signal.tokenId());
    } catch (ExchangeException ex) {
      log.warn(
          "Order book unavailable tokenId={} errorCode={} error={}",
          signal.tokenId(),
          ex.errorCode(),
          ex.getMessage());
      return TradeAssessment.rejected(
          RejectionReason.trade(RejectionCode.ORDER_BOOK_UNAVAILABLE, ex.getMessage()));
    }
    Optional<BigDecimal> slippage = book.slippage(signal.side(), signal.size());
    if (slippage.isEmpty()) {
      return TradeAssessment.rejected(
          RejectionReason.trade(
              RejectionCode.INSUFFICIENT_DEPTH,
              "Book cannot absorb " + signal.size() + " on the " + signal.side() + " side"));
    }
    if (slippage.get().compareTo(properties.getMaxSlippage()) > 0) {
      return TradeAssessment.rejected(
          RejectionReason.trade(
              RejectionCode.SLIPPAGE_TOO_HIGH,
              "Estimated slippage " + slippage.get() + " above " + properties.getMaxSlippage()));
    }

    if (signal.marketEndsAt() == null) {
      return TradeAssessment.rejected(
          RejectionReason.trade(RejectionCode.UNKNOWN_RESOLUTION, "Market end date unknown"));
    }
    Duration untilResolution = Duration.between(now, signal.marketEndsAt());
    if (untilResolution.compareTo(Duration.ofDays(properties.getMaxDaysToResolution())) > 0) {
      return TradeAssessment.rejected(
          RejectionReason.trade(
              RejectionCode.RESOLUTION_TOO_FAR,
              "Market resolves in "
                  + untilResolution.toDays()
                  + " days, limit "
                  + properties.getMaxDaysToResolution()));
    }

    BigDecimal cost = EdgeModel.impliedCost(signal.side(), signal.price());
    BigDecimal probability =
        EdgeModel.winProbability(signal.metrics().winRate(), cost, properties.getWinRateWeight());
    BigDecimal edge = EdgeModel.edge(probability, cost);
    if (edge.compareTo(properties.getMinEdge()) < 0) {
      return TradeAssessment.rejected(
          RejectionReason.trade(
              RejectionCode.EDGE_TOO_LOW,
              "Estimated edge " + edge + " below " + properties.getMinEdge()));
    }
    return new TradeAssessment(null, slippage.get(), cost, probability, edge);
  }
}
