package com.copytrading.engine.position;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.positions.CloseReason;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionDomainException;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.domain.positions.PositionStatus;
import com.copytrading.domain.positions.PositionUpdate;
import com.copytrading.domain.positions.PositionUpdateType;
import com.copytrading.engine.audit.AuditTrail;
import com.copytrading.engine.risk.PositionExposure;
import com.copytrading.engine.risk.RiskManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The position book. Every mutation locks the row, writes the position, appends a
 * {@link PositionUpdate} and pushes the new mark to the {@link RiskManager}.
 */
@Service
public class PositionLedger {
  private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);
  private static final String SYSTEM_ACTOR = "copy-engine";

  private final PositionRepository positionRepository;
  private final ExitEvaluator exitEvaluator;
  private final RiskManager riskManager;
  private final AuditTrail auditTrail;
  private final PositionEventPublisher eventPublisher;
  private final Clock clock;

  @Autowired
  public PositionLedger(
      PositionRepository positionRepository,
      ExitEvaluator exitEvaluator,
      RiskManager riskManager,
      AuditTrail auditTrail,
      PositionEventPublisher eventPublisher) {
    this(
        positionRepository,
        exitEvaluator,
        riskManager,
        auditTrail,
        eventPublisher,
        Clock.systemUTC());
  }

  PositionLedger(
      PositionRepository positionRepository,
      ExitEvaluator exitEvaluator,
      RiskManager riskManager,
      AuditTrail auditTrail,
      PositionEventPublisher eventPublisher,
      Clock clock) {
    this.positionRepository = positionRepository;
    this.exitEvaluator = exitEvaluator;
    this.riskManager = riskManager;
    this.auditTrail = auditTrail;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Applies the whole filled quantity of a settling order. An opening order without a position
   * opens one, a remainder child of an opening order adds to its position, and a closing order
   * reduces its position.
   *
   * @param remainderFollows a child order will continue a partially filled close, so the
   *     position stays CLOSING
   */
  @Transactional
  public Position applyOrderFill(Order order, boolean remainderFollows) {
    if (order.filledSize().signum() <= 0 || order.avgFillPrice() == null) {
      throw new IllegalArgumentException("Order " + order.orderId() + " has no fills to apply");
    }
    OrderContext context = order.context();
    if (context.isClosing()) {
      return applyClose(order, remainderFollows);
    }
    if (context.positionId() != null) {
      Optional<Position> existing = positionRepository.findByIdForUpdate(context.positionId());
      if (existing.isPresent() && existing.get().status().isActive()) {
        return applyIncrease(existing.get(), order);
      }
      log.warn(
          "Remainder fill for inactive position, opening a new one orderId={} positionId={}",
          order.orderId(),
          context.positionId());
    }
    return applyOpen(order);
  }

  /**
   * Marks every active position on the token and collects the exits the new price triggers.
   * Triggered positions are moved to CLOSING before this returns.
   */
  @Transactional
  public List<ExitDecision> onPriceTick(String tokenId, BigDecimal price) {
    if (price == null
        || price.compareTo(Position.MIN_PRICE) < 0
        || price.compareTo(Position.MAX_PRICE) > 0) {
      log.warn("Ignoring out-of-range price tick tokenId={} price={}", tokenId, price);
      return List.of();
    }
    Instant now = clock.instant();
    List<ExitDecision> exits = new ArrayList<>();
    for (Position candidate : positionRepository.findActiveByToken(tokenId)) {
      Optional<Position> locked = positionRepository.findByIdForUpdate(candidate.positionId());
      if (locked.isEmpty() || !locked.get().status().isActive()) {
        continue;
      }
      Position before = locked.get();
      Position marked = before.updatePrice(price, now);
      record(before, marked, PositionUpdateType.PRICE_UPDATE, "Price tick", Map.of());
      Optional<ExitTrigger> trigger = exitEvaluator.evaluate(marked, price, now, false);
      if (trigger.isPresent()) {
        Position closing = marked.markClosing(now);
        positionRepository.update(closing);
        auditClosing(closing, trigger.get().name(), SYSTEM_ACTOR);
        exits.add(new ExitDecision(closing, trigger.get(), price));
      }
    }
    return exits;
  }

  /** Moves an OPEN position to CLOSING; a position already closing or closed is left alone. */
  @Transactional
  public Optional<Position> markClosing(UUID positionId, String trigger, String actor) {
    Position before =
        positionRepository
            .findByIdForUpdate(positionId)
            .orElseThrow(() -> new PositionDomainException("Position not found: " + positionId));
    if (before.status() != PositionStatus.OPEN) {
      log.info(
          "Position not open, skipping close positionId={} status={} trigger={}",
          positionId,
          before.status(),
          trigger);
      return Optional.empty();
    }
    Position closing = before.markClosing(clock.instant());
    positionRepository.update(closing);
    auditClosing(closing, trigger, actor);
    eventPublisher.publish(closing, null);
    return Optional.of(closing);
  }

  /** A closing order ended without flattening the position; exits may fire again. */
  @Transactional
  public void reopenAfterFailedClose(UUID positionId, String reason) {
    Optional<Position> locked = positionRepository.findByIdForUpdate(positionId);
    if (locked.isEmpty() || locked.get().status() != PositionStatus.CLOSING) {
      return;
    }
    Position reopened = locked.get().reopen(clock.instant());
    positionRepository.update(reopened);
    auditTrail.recordEvent(
        SYSTEM_ACTOR,
        "POSITION_REOPENED",
        AuditTrail.ENTITY_POSITION,
        positionId.toString(),
        Map.of("status", PositionStatus.CLOSING.name()),
        Map.of("status", PositionStatus.OPEN.name()),
        Map.of("reason", reason == null ? "" : reason));
    eventPublisher.publish(reopened, null);
    log.warn("Position reopened after failed close positionId={} reason={}", positionId, reason);
  }

  @Transactional
  public int archiveClosedBefore(Instant cutoff) {
    int archived = positionRepository.archiveClosedBefore(cutoff, clock.instant());
    if (archived > 0) {
      log.info("Archived closed positions count={} cutoff={}", archived, cutoff);
    }
    return archived;
  }

  /**
   * Rebuilds the risk manager after a restart: the persisted breaker state plus the exposure of
   * every active position in the book.
   */
  @EventListener(ApplicationReadyEvent.class)
  @org.springframework.core.annotation.Order(1)
  @Transactional
  public void restoreRiskExposure() {
    List<Position> active = positionRepository.findActive();
    riskManager.restore(active.stream().map(PositionLedger::exposureOf).toList());
    log.info("Restored risk exposure from ledger positions={}", active.size());
  }

  private Position applyOpen(Order order) {
    OrderContext context = order.context();
    Instant now = clock.instant();
    Position opened =
        Position.open(
            UUID.randomUUID(),
            context.whaleAddress(),
            order.tokenId(),
            context.category(),
            order.side() == OrderSide.BUY ? PositionSide.YES : PositionSide.NO,
            order.filledSize(),
            order.avgFillPrice(),
            context.stopLossPrice(),
            context.takeProfitPrice(),
            context.kellyFraction(),
            context.edge(),
            context.winRate(),
            context.marketEndsAt(),
            now);
    positionRepository.insert(opened);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("orderId", order.orderId().toString());
    metadata.put("idempotencyKey", order.idempotencyKey());
    recordInserted(opened, metadata);
    log.info(
        "Position opened positionId={} whale={} tokenId={} side={} size={} price={}",
        opened.positionId(),
        opened.whaleAddress(),
        opened.tokenId(),
        opened.side(),
        opened.currentSize(),
        opened.entryPrice());
    return opened;
  }

  private Position applyIncrease(Position before, Order order) {
    Position increased = before.increase(order.filledSize(), order.avgFillPrice(), clock.instant());
    record(
        before,
        increased,
        PositionUpdateType.SIZE_INCREASE,
        "Remainder order filled",
        Map.of("orderId", order.orderId().toString()));
    return increased;
  }

  private Position applyClose(Order order, boolean remainderFollows) {
    UUID positionId = order.context().positionId();
    Position before =
        positionRepository
            .findByIdForUpdate(positionId)
            .orElseThrow(() -> new PositionDomainException("Position not found: " + positionId));
    if (!before.status().isActive()) {
      throw new PositionDomainException(
          "Closing order " + order.orderId() + " settled against " + before.status() + " position");
    }
    CloseReason reason = CloseReason.valueOf(order.context().closeReason());
    BigDecimal size = order.filledSize().min(before.currentSize());
    if (size.compareTo(order.filledSize()) < 0) {
      log.warn(
          "Closing fill exceeds position size orderId={} positionId={} filled={} held={}",
          order.orderId(),
          positionId,
          order.filledSize(),
          before.currentSize());
    }
    Instant now = clock.instant();
    Position reduced = before.reduce(size, order.avgFillPrice(), reason, now);
    BigDecimal realizedDelta = reduced.realizedPnl().subtract(before.realizedPnl());
    Map<String, Object> metadata = Map.of("orderId", order.orderId().toString());
    if (reduced.status() == PositionStatus.CLOSED) {
      record(before, reduced, reason.terminalUpdateType(), "Position closed: " + reason, metadata);
      riskManager.recordRealizedPnl(reduced.whaleAddress(), realizedDelta);
      riskManager.recordPositionClosed(
          reduced.positionId(), reduced.whaleAddress(), reduced.realizedPnl());
      log.info(
          "Position closed positionId={} reason={} realizedPnl={}",
          reduced.positionId(),
          reason,
          reduced.realizedPnl());
      return reduced;
    }
    Position partial =
        remainderFollows || reduced.status() != PositionStatus.CLOSING
            ? reduced
            : reduced.reopen(now);
    record(before, partial, PositionUpdateType.PARTIAL_CLOSE, "Partial close: " + reason, metadata);
    riskManager.recordRealizedPnl(partial.whaleAddress(), realizedDelta);
    return partial;
  }

  private void record(
      Position before,
      Position after,
      PositionUpdateType updateType,
      String reason,
      Map<String, Object> metadata) {
    positionRepository.update(after);
    auditTrail.recordPositionUpdate(
        PositionUpdate.between(before, after, updateType, reason, metadata));
    if (after.status().isActive()) {
      riskManager.syncPosition(exposureOf(after));
    }
    eventPublisher.publish(after, updateType);
  }

  private void recordInserted(Position opened, Map<String, Object> metadata) {
    auditTrail.recordPositionUpdate(
        PositionUpdate.between(
            null, opened, PositionUpdateType.SIZE_INCREASE, "Position opened", metadata));
    riskManager.syncPosition(exposureOf(opened));
    eventPublisher.publish(opened, PositionUpdateType.SIZE_INCREASE);
  }

  private void auditClosing(Position closing, String trigger, String actor) {
    auditTrail.recordEvent(
        actor,
        "POSITION_CLOSING",
        AuditTrail.ENTITY_POSITION,
        closing.positionId().toString(),
        Map.of("status", PositionStatus.OPEN.name()),
        Map.of("status", PositionStatus.CLOSING.name()),
        Map.of("trigger", trigger, "price", closing.currentPrice()));
  }

  static PositionExposure exposureOf(Position position) {
    return new PositionExposure(
        position.positionId(),
        position.whaleAddress(),
        position.tokenId(),
        position.category(),
        position.marketValue(),
        position.unrealizedPnl());
  }
}
