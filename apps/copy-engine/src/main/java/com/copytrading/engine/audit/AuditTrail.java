package com.copytrading.engine.audit;

import com.copytrading.domain.orders.OrderTransition;
import com.copytrading.domain.positions.PositionUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only record of every order transition, position update and operator or risk event.
 * Writers join the caller's transaction so an order row and its transition commit together.
 */
@Service
public class AuditTrail {
  public static final String ENTITY_ORDER = "ORDER";
  public static final String ENTITY_POSITION = "POSITION";
  public static final String ENTITY_RISK = "RISK";
  public static final String ENTITY_WHALE = "WHALE";

  private static final int DEFAULT_EVENT_LIMIT = 100;

  private final OrderTransitionRepository orderTransitionRepository;
  private final PositionUpdateRepository positionUpdateRepository;
  private final AuditLogRepository auditLogRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Autowired
  public AuditTrail(
      OrderTransitionRepository orderTransitionRepository,
      PositionUpdateRepository positionUpdateRepository,
      AuditLogRepository auditLogRepository,
      ObjectMapper objectMapper) {
    this(
        orderTransitionRepository,
        positionUpdateRepository,
        auditLogRepository,
        objectMapper,
        Clock.systemUTC());
  }

  AuditTrail(
      OrderTransitionRepository orderTransitionRepository,
      PositionUpdateRepository positionUpdateRepository,
      AuditLogRepository auditLogRepository,
      ObjectMapper objectMapper,
      Clock clock) {
    this.orderTransitionRepository = orderTransitionRepository;
    this.positionUpdateRepository = positionUpdateRepository;
    this.auditLogRepository = auditLogRepository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Transactional
  public void recordOrderTransition(OrderTransition transition) {
    orderTransitionRepository.append(transition);
  }

  @Transactional
  public void recordPositionUpdate(PositionUpdate update) {
    positionUpdateRepository.append(update);
  }

  @Transactional
  public void recordEvent(
      String actor,
      String action,
      String entityType,
      String entityId,
      Object before,
      Object after,
      Map<String, Object> metadata) {
    auditLogRepository.append(
        new AuditLogEntry(
            actor,
            action,
            entityType,
            entityId,
            toJson(before),
            toJson(after),
            AuditResult.SUCCESS,
            null,
            null,
            toJson(metadata),
            clock.instant()));
  }

  @Transactional
  public void recordRejection(
      String actor,
      String action,
      String entityType,
      String entityId,
      String errorCode,
      String errorMessage,
      Map<String, Object> metadata) {
    auditLogRepository.append(
        new AuditLogEntry(
            actor,
            action,
            entityType,
            entityId,
            null,
            null,
            AuditResult.REJECTED,
            errorCode,
            errorMessage,
            toJson(metadata),
            clock.instant()));
  }

  @Transactional(readOnly = true)
  public List<OrderTransition> orderHistory(UUID orderId) {
    return orderTransitionRepository.findByOrderId(orderId);
  }

  @Transactional(readOnly = true)
  public List<PositionUpdate> positionHistory(UUID positionId) {
    return positionUpdateRepository.findByPositionId(positionId);
  }

  @Transactional(readOnly = true)
  public List<AuditLogEntry> events(String entityType, String entityId) {
    return auditLogRepository.findByEntity(entityType, entityId, DEFAULT_EVENT_LIMIT);
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize audit payload", ex);
    }
  }
}
