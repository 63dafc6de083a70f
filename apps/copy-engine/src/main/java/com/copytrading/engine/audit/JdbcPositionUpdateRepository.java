package com.copytrading.engine.audit;

import com.copytrading.domain.positions.PositionUpdate;
import com.copytrading.domain.positions.PositionUpdateType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPositionUpdateRepository implements PositionUpdateRepository {
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcPositionUpdateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void append(PositionUpdate update) {
    String sql =
        """
        INSERT INTO position_updates (
            id,
            position_id,
            update_type,
            old_size,
            old_price,
            old_market_value,
            old_unrealized_pnl,
            new_size,
            new_price,
            new_market_value,
            new_unrealized_pnl,
            reason,
            metadata_json,
            created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?)
        """;
    jdbcTemplate.update(
        sql,
        update.id(),
        update.positionId(),
        update.updateType().name(),
        update.oldSize(),
        update.oldPrice(),
        update.oldMarketValue(),
        update.oldUnrealizedPnl(),
        update.newSize(),
        update.newPrice(),
        update.newMarketValue(),
        update.newUnrealizedPnl(),
        update.reason(),
        toJson(update.metadata()),
        Timestamp.from(update.timestamp()));
  }

  @Override
  public List<PositionUpdate> findByPositionId(UUID positionId) {
    String sql =
        """
        SELECT id,
               position_id,
               update_type,
               old_size,
               old_price,
               old_market_value,
               old_unrealized_pnl,
               new_size,
               new_price,
               new_market_value,
               new_unrealized_pnl,
               reason,
               metadata_json::text AS metadata_json,
               created_at
        FROM position_updates
        WHERE position_id = ?
        ORDER BY seq ASC
        """;
    return jdbcTemplate.query(sql, this::mapRow, positionId);
  }

  private PositionUpdate mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PositionUpdate(
        rs.getObject("id", UUID.class),
        rs.getObject("position_id", UUID.class),
        PositionUpdateType.valueOf(rs.getString("update_type")),
        rs.getBigDecimal("old_size"),
        rs.getBigDecimal("old_price"),
        rs.getBigDecimal("old_market_value"),
        rs.getBigDecimal("old_unrealized_pnl"),
        rs.getBigDecimal("new_size"),
        rs.getBigDecimal("new_price"),
        rs.getBigDecimal("new_market_value"),
        rs.getBigDecimal("new_unrealized_pnl"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getString("reason"),
        fromJson(rs.getString("metadata_json")));
  }

  private String toJson(Map<String, Object> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize position update metadata", ex);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to read position update metadata", ex);
    }
  }
}
