package com.copytrading.engine.audit;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcAuditLogRepository implements AuditLogRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcAuditLogRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void append(AuditLogEntry entry) {
    String sql =
        """
        INSERT INTO audit_log (
            id,
            actor,
            action,
            entity_type,
            entity_id,
            before_json,
            after_json,
            result,
            error_code,
            error_message,
            metadata_json,
            created_at
        ) VALUES (?, ?, ?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), ?, ?, ?, CAST(? AS JSONB), ?)
        """;
    jdbcTemplate.update(
        sql,
        UUID.randomUUID(),
        entry.actor(),
        entry.action(),
        entry.entityType(),
        entry.entityId(),
        entry.beforeJson(),
        entry.afterJson(),
        entry.result().name(),
        entry.errorCode(),
        entry.errorMessage(),
        entry.metadataJson() == null ? "{}" : entry.metadataJson(),
        Timestamp.from(entry.createdAt()));
  }

  @Override
  public List<AuditLogEntry> findByEntity(String entityType, String entityId, int limit) {
    String sql =
        """
        SELECT actor,
               action,
               entity_type,
               entity_id,
               before_json::text AS before_json,
               after_json::text AS after_json,
               result,
               error_code,
               error_message,
               metadata_json::text AS metadata_json,
               created_at
        FROM audit_log
        WHERE entity_type = ?
          AND entity_id = ?
        ORDER BY created_at DESC
        LIMIT ?
        """;
    return jdbcTemplate.query(sql, this::mapRow, entityType, entityId, limit);
  }

  private AuditLogEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditLogEntry(
        rs.getString("actor"),
        rs.getString("action"),
        rs.getString("entity_type"),
        rs.getString("entity_id"),
        rs.getString("before_json"),
        rs.getString("after_json"),
        AuditResult.valueOf(rs.getString("result")),
        rs.getString("error_code"),
        rs.getString("error_message"),
        rs.getString("metadata_json"),
        rs.getTimestamp("created_at").toInstant());
  }
}
