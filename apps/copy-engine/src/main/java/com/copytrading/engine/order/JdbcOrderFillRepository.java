package com.copytrading.engine.order;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOrderFillRepository implements OrderFillRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcOrderFillRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean insertIfAbsent(UUID orderId, FillEvent fill, Instant recordedAt) {
    String sql =
        """
        INSERT INTO order_fills (order_id, fill_sequence, size, price, source, filled_at, recorded_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (order_id, fill_sequence) DO NOTHING
        """;
    return jdbcTemplate.update(
            sql,
            orderId,
            fill.sequence(),
            fill.size(),
            fill.price(),
            fill.source().name(),
            Timestamp.from(fill.filledAt()),
            Timestamp.from(recordedAt))
        == 1;
  }
}
