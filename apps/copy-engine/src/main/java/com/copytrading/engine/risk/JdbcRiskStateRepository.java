package com.copytrading.engine.risk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Single-row {@code risk_state} plus one {@code whale_quarantine} row per quarantined whale. */
@Repository
public class JdbcRiskStateRepository implements RiskStateRepository {
  private static final int SINGLETON_ID = 1;
  private static final TypeReference<Map<String, BigDecimal>> AMOUNTS_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<Set<String>> WHALES_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, Instant>> INSTANTS_TYPE =
      new TypeReference<>() {};
  private static final TypeReference<Map<String, List<WhaleScoreObservation>>> HISTORY_TYPE =
      new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcRiskStateRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<PersistedRiskState> load() {
    Map<String, QuarantineEntry> quarantined = new LinkedHashMap<>();
    jdbcTemplate.query(
        """
        SELECT whale_address, reason, score_at_entry, quarantined_at
        FROM whale_quarantine
        ORDER BY quarantined_at
        """,
        rs -> {
          QuarantineEntry entry =
              new QuarantineEntry(
                  rs.getString("whale_address"),
                  rs.getString("reason"),
                  rs.getBigDecimal("score_at_entry"),
                  rs.getTimestamp("quarantined_at").toInstant());
          quarantined.put(entry.whaleAddress(), entry);
        });
    List<PersistedRiskState> rows =
        jdbcTemplate.query(
            """
            SELECT trading_day,
                   start_of_day_nav,
                   start_of_day_unrealized_pnl,
                   realized_pnl_today,
                   realized_pnl_total,
                   nav_peak,
                   halted,
                   halt_reason,
                   paused_until,
                   consecutive_losses,
                   whale_realized_today_json::text AS whale_realized_today_json,
                   blocked_whales_json::text AS blocked_whales_json,
                   whale_last_loss_json::text AS whale_last_loss_json,
                   score_history_json::text AS score_history_json
            FROM risk_state
            WHERE id = ?
            """,
            (rs, rowNum) -> mapState(rs, quarantined),
            SINGLETON_ID);
    return rows.stream().findFirst();
  }

  @Override
  @Transactional
  public void save(PersistedRiskState state, Instant savedAt) {
    jdbcTemplate.update(
        """
        INSERT INTO risk_state (
            id,
            trading_day,
            start_of_day_nav,
            start_of_day_unrealized_pnl,
            realized_pnl_today,
            realized_pnl_total,
            nav_peak,
            halted,
            halt_reason,
            paused_until,
            consecutive_losses,
            whale_realized_today_json,
            blocked_whales_json,
            whale_last_loss_json,
            score_history_json,
            updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,
                  CAST(? AS JSONB), CAST(? AS JSONB), CAST(? AS JSONB), CAST(? AS JSONB), ?)
        ON CONFLICT (id) DO UPDATE
        SET trading_day = EXCLUDED.trading_day,
            start_of_day_nav = EXCLUDED.start_of_day_nav,
            start_of_day_unrealized_pnl = EXCLUDED.start_of_day_unrealized_pnl,
            realized_pnl_today = EXCLUDED.realized_pnl_today,
            realized_pnl_total = EXCLUDED.realized_pnl_total,
            nav_peak = EXCLUDED.nav_peak,
            halted = EXCLUDED.halted,
            halt_reason = EXCLUDED.halt_reason,
            paused_until = EXCLUDED.paused_until,
            consecutive_losses = EXCLUDED.consecutive_losses,
            whale_realized_today_json = EXCLUDED.whale_realized_today_json,
            blocked_whales_json = EXCLUDED.blocked_whales_json,
            whale_last_loss_json = EXCLUDED.whale_last_loss_json,
            score_history_json = EXCLUDED.score_history_json,
            updated_at = EXCLUDED.updated_at
        """,
        SINGLETON_ID,
        Date.valueOf(state.tradingDay()),
        state.startOfDayNav(),
        state.startOfDayUnrealizedPnl(),
        state.realizedPnlToday(),
        state.realizedPnlTotal(),
        state.navPeak(),
        state.halted(),
        state.haltReason(),
        state.pausedUntil() == null ? null : Timestamp.from(state.pausedUntil()),
        state.consecutiveLosses(),
        toJson(state.whaleRealizedToday()),
        toJson(state.blockedWhales()),
        toJson(state.whaleLastLossAt()),
        toJson(state.scoreHistory()),
        Timestamp.from(savedAt));

    jdbcTemplate.update("DELETE FROM whale_quarantine");
    for (QuarantineEntry entry : state.quarantinedWhales().values()) {
      jdbcTemplate.update(
          """
          INSERT INTO whale_quarantine (whale_address, reason, score_at_entry, quarantined_at)
          VALUES (?, ?, ?, ?)
          """,
          entry.whaleAddress(),
          entry.reason(),
          entry.scoreAtEntry(),
          Timestamp.from(entry.quarantinedAt()));
    }
  }

  private PersistedRiskState mapState(ResultSet rs, Map<String, QuarantineEntry> quarantined)
      throws SQLException {
    Timestamp pausedUntil = rs.getTimestamp("paused_until");
    return new PersistedRiskState(
        rs.getDate("trading_day").toLocalDate(),
        rs.getBigDecimal("start_of_day_nav"),
        rs.getBigDecimal("start_of_day_unrealized_pnl"),
        rs.getBigDecimal("realized_pnl_today"),
        rs.getBigDecimal("realized_pnl_total"),
        rs.getBigDecimal("nav_peak"),
        rs.getBoolean("halted"),
        rs.getString("halt_reason"),
        pausedUntil == null ? null : pausedUntil.toInstant(),
        rs.getInt("consecutive_losses"),
        fromJson(rs.getString("whale_realized_today_json"), AMOUNTS_TYPE),
        fromJson(rs.getString("blocked_whales_json"), WHALES_TYPE),
        fromJson(rs.getString("whale_last_loss_json"), INSTANTS_TYPE),
        fromJson(rs.getString("score_history_json"), HISTORY_TYPE),
        quarantined);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize risk state", ex);
    }
  }

  private <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to read risk state", ex);
    }
  }
}
