package com.copytrading.engine.signal;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.engine.audit.AuditTrail;
import com.copytrading.engine.order.ExecutionProperties;
import com.copytrading.engine.order.OrderExecutor;
import com.copytrading.engine.order.OrderStore;
import com.copytrading.engine.order.SubmitOrderCommand;
import com.copytrading.engine.position.ExitCoordinator;
import com.copytrading.engine.position.ExitEvaluator;
import com.copytrading.engine.position.PositionRepository;
import com.copytrading.engine.risk.RiskDecision;
import com.copytrading.engine.risk.RiskManager;
import com.copytrading.engine.risk.RiskState;
import com.copytrading.engine.risk.TradeIntent;
import com.copytrading.engine.sizing.PositionSizer;
import com.copytrading.engine.sizing.SizingInput;
import com.copytrading.engine.sizing.SizingResult;
import com.copytrading.engine.sizing.VolatilityTracker;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one whale trade through the whole copy path: exit detection, the three filter stages,
 * adaptive Kelly sizing, the risk check, and finally order submission.
 */
@Service
public class CopyTradeCoordinator {
  private static final Logger log = LoggerFactory.getLogger(CopyTradeCoordinator.class);
  private static final String ACTOR = "copy-engine";
  private static final String ACTION = "COPY_TRADE";

  private final SignalFilterPipeline pipeline;
  private final PositionSizer positionSizer;
  private final VolatilityTracker volatilityTracker;
  private final RiskManager riskManager;
  private final OrderExecutor orderExecutor;
  private final OrderStore orderStore;
  private final PositionRepository positionRepository;
  private final ExitCoordinator exitCoordinator;
  private final ExitEvaluator exitEvaluator;
  private final ExecutionProperties executionProperties;
  private final AuditTrail auditTrail;

  public CopyTradeCoordinator(
      SignalFilterPipeline pipeline,
      PositionSizer positionSizer,
      VolatilityTracker volatilityTracker,
      RiskManager riskManager,
      OrderExecutor orderExecutor,
      OrderStore orderStore,
      PositionRepository positionRepository,
      ExitCoordinator exitCoordinator,
      ExitEvaluator exitEvaluator,
      ExecutionProperties executionProperties,
      AuditTrail auditTrail) {
    this.pipeline = pipeline;
    this.positionSizer = positionSizer;
    this.volatilityTracker = volatilityTracker;
    this.riskManager = riskManager;
    this.orderExecutor = orderExecutor;
    this.orderStore = orderStore;
    this.positionRepository = positionRepository;
    this.exitCoordinator = exitCoordinator;
    this.exitEvaluator = exitEvaluator;
    this.executionProperties = executionProperties;
    this.auditTrail = auditTrail;
  }

  public CopyOutcome onWhaleTrade(WhaleSignal signal) {
    if (isExitOfCopiedPosition(signal)) {
      int closing = exitCoordinator.onWhaleExit(signal.whaleAddress(), signal.tokenId());
      log.info(
          "Whale exit mirrored tradeId={} whale={} token={} closingOrders={}",
          signal.tradeId(),
          signal.whaleAddress(),
          signal.tokenId(),
          closing);
      return CopyOutcome.of(CopyOutcome.Status.WHALE_EXIT, "closing orders: " + closing);
    }

    String idempotencyKey = "whale-" + signal.whaleAddress() + "-" + signal.tradeId();
    Optional<Order> existing = orderStore.findByIdempotencyKey(idempotencyKey);
    if (existing.isPresent()) {
      log.info(
          "Whale trade already copied tradeId={} orderId={}",
          signal.tradeId(),
          existing.get().orderId());
      return new CopyOutcome(CopyOutcome.Status.DUPLICATE, "already copied", existing.get());
    }

    RiskState riskState = riskManager.snapshot();
    FilterDecision decision = pipeline.evaluate(signal, riskState);
    if (!decision.accepted()) {
      RejectionReason reason = decision.rejection();
      auditRejection(signal, reason.code().name(), reason.detail(), reason.stage().name());
      return CopyOutcome.of(CopyOutcome.Status.REJECTED, reason.code() + ": " + reason.detail());
    }

    SizingResult sizing =
        positionSizer.size(
            new SizingInput(
                signal.price(),
                decision.impliedCost(),
                decision.winProbability(),
                signal.metrics().score(),
                decision.correlation(),
                volatilityTracker.volatility(signal.tokenId()),
                riskState.drawdown(),
                riskState.nav(),
                riskManager.riskMultiplier()));
    if (!sizing.isTradable()) {
      log.info(
          "Sized below minimum order tradeId={} fraction={} size={}",
          signal.tradeId(),
          sizing.finalFraction(),
          sizing.size());
      return CopyOutcome.of(CopyOutcome.Status.TOO_SMALL, "size " + sizing.size());
    }

    BigDecimal notional = sizing.size().multiply(signal.price());
    RiskDecision risk =
        riskManager.approve(
            new TradeIntent(
                idempotencyKey, signal.whaleAddress(), signal.tokenId(), signal.category()),
            notional);
    if (!risk.approved()) {
      auditRejection(signal, risk.code().name(), risk.reason(), "RISK");
      return CopyOutcome.of(CopyOutcome.Status.VETOED, risk.code() + ": " + risk.reason());
    }

    OrderContext context =
        OrderContext.opening(
            signal.whaleAddress(),
            signal.category(),
            sizing.finalFraction(),
            decision.edge(),
            signal.metrics().winRate(),
            exitEvaluator.stopLossFor(signal.side(), signal.price()),
            exitEvaluator.takeProfitFor(signal.side(), signal.price()),
            signal.marketEndsAt());
    Order order =
        orderExecutor.submit(
            new SubmitOrderCommand(
                idempotencyKey,
                signal.tokenId(),
                signal.side(),
                executionProperties.getOrderType(),
                sizing.size(),
                signal.price(),
                context));
    log.info(
        "Copy order submitted tradeId={} orderId={} state={} size={} price={} fraction={}",
        signal.tradeId(),
        order.orderId(),
        order.state(),
        order.size(),
        order.price(),
        sizing.finalFraction());
    return new CopyOutcome(CopyOutcome.Status.SUBMITTED, order.state().name(), order);
  }

  /** A whale selling a token we hold long from it, or buying one we hold short, is exiting. */
  private boolean isExitOfCopiedPosition(WhaleSignal signal) {
    PositionSide exitedSide = signal.side() == OrderSide.SELL ? PositionSide.YES : PositionSide.NO;
    List<Position> held =
        positionRepository.findActiveByWhaleAndToken(signal.whaleAddress(), signal.tokenId());
    return held.stream().anyMatch(position -> position.side() == exitedSide);
  }

  private void auditRejection(WhaleSignal signal, String code, String detail, String stage) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("tradeId", signal.tradeId());
    metadata.put("tokenId", signal.tokenId());
    metadata.put("stage", stage);
    auditTrail.recordRejection(
        ACTOR, ACTION, AuditTrail.ENTITY_WHALE, signal.whaleAddress(), code, detail, metadata);
  }
}
