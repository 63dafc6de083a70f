package com.copytrading.engine.audit;

import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.orders.OrderTransition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOrderTransitionRepository implements OrderTransitionRepository {
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcOrderTransitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void append(OrderTransition transition) {
    String sql =
        """
        INSERT INTO order_transitions (
            id,
            order_id,
            from_state,
            to_state,
            reason,
            metadata_json,
            occurred_at
        ) VALUES (?, ?, ?, ?, ?, CAST(? AS JSONB), ?)
        """;
    jdbcTemplate.update(
        sql,
        transition.id(),
        transition.orderId(),
        transition.fromState() == null ? null : transition.fromState().name(),
        transition.toState().name(),
        transition.reason(),
        toJson(transition.metadata()),
        Timestamp.from(transition.occurredAt()));
  }

  @Override
  public List<OrderTransition> findByOrderId(UUID orderId) {
    String sql =
        """
        SELECT id, order_id, from_state, to_state, reason, metadata_json::text AS metadata_json, occurred_at
        FROM order_transitions
        WHERE order_id = ?
        ORDER BY seq ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow, orderId);
  }

  @Override
  public Optional<OrderTransition> findLatestByOrderId(UUID orderId) {
    String sql =
        """
        SELECT id, order_id, from_state, to_state, reason, metadata_json::text AS metadata_json, occurred_at
        FROM order_transitions
        WHERE order_id = ?
        ORDER BY seq DESC
        LIMIT 1
        """;
    List<OrderTransition> rows = jdbcTemplate.query(sql, this::mapRow, orderId);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  private OrderTransition mapRow(ResultSet rs, int rowNum) throws SQLException {
    String fromState = rs.getString("from_state");
    return new OrderTransition(
        rs.getObject("id", UUID.class),
        rs.getObject("order_id", UUID.class),
        fromState == null ? null : OrderState.valueOf(fromState),
        OrderState.valueOf(rs.getString("to_state")),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getString("reason"),
        fromJson(rs.getString("metadata_json")));
  }

  private String toJson(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize order transition metadata", ex);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to read order transition metadata", ex);
    }
  }
}
