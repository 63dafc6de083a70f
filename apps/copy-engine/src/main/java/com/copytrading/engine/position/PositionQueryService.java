package com.copytrading.engine.position;

import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionStatus;
import com.copytrading.domain.positions.PositionUpdate;
import com.copytrading.engine.audit.AuditTrail;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class PositionQueryService {
  private static final int MAX_PAGE_SIZE = 500;

  private final PositionRepository positionRepository;
  private final AuditTrail auditTrail;
  private final ExitEvaluator exitEvaluator;
  private final Clock clock;

  @Autowired
  public PositionQueryService(
      PositionRepository positionRepository, AuditTrail auditTrail, ExitEvaluator exitEvaluator) {
    this(positionRepository, auditTrail, exitEvaluator, Clock.systemUTC());
  }

  PositionQueryService(
      PositionRepository positionRepository,
      AuditTrail auditTrail,
      ExitEvaluator exitEvaluator,
      Clock clock) {
    this.positionRepository = positionRepository;
    this.auditTrail = auditTrail;
    this.exitEvaluator = exitEvaluator;
    this.clock = clock;
  }

  public Optional<Position> find(UUID positionId) {
    return positionRepository.findById(positionId);
  }

  public List<Position> active() {
    return positionRepository.findActive();
  }

  public List<Position> byStatus(PositionStatus status, int offset, int limit) {
    return positionRepository.findByStatus(status, Math.max(0, offset), clampLimit(limit));
  }

  public List<Position> byWhale(String whaleAddress, int offset, int limit) {
    return positionRepository.findByWhale(whaleAddress, Math.max(0, offset), clampLimit(limit));
  }

  public List<PositionUpdate> history(UUID positionId) {
    return auditTrail.positionHistory(positionId);
  }

  public Map<PositionStatus, Long> countsByStatus() {
    return positionRepository.countByStatus();
  }

  public PerformanceSummary performance() {
    return positionRepository.performance();
  }

  public List<PerformanceSummary> performanceByWhale() {
    return positionRepository.performanceByWhale();
  }

  /** OPEN positions whose last mark already meets an exit trigger. */
  public List<ExitDecision> requiringAction() {
    Instant now = clock.instant();
    List<ExitDecision> pending = new ArrayList<>();
    for (Position position : positionRepository.findActive()) {
      exitEvaluator
          .evaluate(position, position.currentPrice(), now, false)
          .ifPresent(
              trigger ->
                  pending.add(new ExitDecision(position, trigger, position.currentPrice())));
    }
    return pending;
  }

  private static int clampLimit(int limit) {
    return Math.min(Math.max(1, limit), MAX_PAGE_SIZE);
  }
}
