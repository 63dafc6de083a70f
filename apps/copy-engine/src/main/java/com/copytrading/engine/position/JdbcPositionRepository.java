package com.copytrading.engine.position;

import com.copytrading.domain.positions.CloseReason;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.domain.positions.PositionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPositionRepository implements PositionRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id, whale_address, token_id, category, side, entry_size, entry_price,
             entry_amount, current_size, current_price, unrealized_pnl, realized_pnl,
             max_drawdown, max_profit, stop_loss_price, take_profit_price, kelly_fraction,
             edge, win_rate, market_ends_at, status, opened_at, last_updated_at,
             closed_at, close_reason
      FROM positions
      """;
  private static final String ACTIVE = " status IN ('OPEN', 'CLOSING')";
  private static final String PERFORMANCE_COLUMNS =
      """
      SELECT COUNT(*) AS total_positions,
             COUNT(*) FILTER (WHERE status IN ('OPEN', 'CLOSING')) AS active_positions,
             COUNT(*) FILTER (WHERE status IN ('CLOSED', 'ARCHIVED')) AS closed_positions,
             COUNT(*) FILTER (WHERE status IN ('CLOSED', 'ARCHIVED') AND realized_pnl > 0) AS winning_positions,
             COUNT(*) FILTER (WHERE status IN ('CLOSED', 'ARCHIVED') AND realized_pnl < 0) AS losing_positions,
             COALESCE(SUM(realized_pnl), 0) AS realized_pnl,
             COALESCE(SUM(unrealized_pnl), 0) AS unrealized_pnl,
             COALESCE(MAX(total_pnl), 0) AS best_pnl,
             COALESCE(MIN(total_pnl), 0) AS worst_pnl
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcPositionRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void insert(Position position) {
    String sql =
        """
        INSERT INTO positions (
            id, whale_address, token_id, category, side, entry_size, entry_price,
            entry_amount, current_size, current_price, unrealized_pnl, realized_pnl,
            max_drawdown, max_profit, stop_loss_price, take_profit_price, kelly_fraction,
            edge, win_rate, market_ends_at, status, opened_at, last_updated_at,
            closed_at, close_reason
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    jdbcTemplate.update(
        sql,
        position.positionId(),
        position.whaleAddress(),
        position.tokenId(),
        position.category(),
        position.side().name(),
        position.entrySize(),
        position.entryPrice(),
        position.entryAmount(),
        position.currentSize(),
        position.currentPrice(),
        position.unrealizedPnl(),
        position.realizedPnl(),
        position.maxDrawdown(),
        position.maxProfit(),
        position.stopLossPrice(),
        position.takeProfitPrice(),
        position.kellyFraction(),
        position.edge(),
        position.winRate(),
        timestamp(position.marketEndsAt()),
        position.status().name(),
        timestamp(position.openedAt()),
        timestamp(position.lastUpdatedAt()),
        timestamp(position.closedAt()),
        position.closeReason() == null ? null : position.closeReason().name());
  }

  @Override
  public void update(Position position) {
    String sql =
        """
        UPDATE positions
        SET entry_size = ?,
            entry_price = ?,
            entry_amount = ?,
            current_size = ?,
            current_price = ?,
            unrealized_pnl = ?,
            realized_pnl = ?,
            max_drawdown = ?,
            max_profit = ?,
            status = ?,
            last_updated_at = ?,
            closed_at = ?,
            close_reason = ?
        WHERE id = ?
        """;
    jdbcTemplate.update(
        sql,
        position.entrySize(),
        position.entryPrice(),
        position.entryAmount(),
        position.currentSize(),
        position.currentPrice(),
        position.unrealizedPnl(),
        position.realizedPnl(),
        position.maxDrawdown(),
        position.maxProfit(),
        position.status().name(),
        timestamp(position.lastUpdatedAt()),
        timestamp(position.closedAt()),
        position.closeReason() == null ? null : position.closeReason().name(),
        position.positionId());
  }

  @Override
  public Optional<Position> findById(UUID positionId) {
    return single(jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", this::mapRow, positionId));
  }

  @Override
  public Optional<Position> findByIdForUpdate(UUID positionId) {
    return single(
        jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ? FOR UPDATE", this::mapRow, positionId));
  }

  @Override
  public List<Position> findActiveByToken(String tokenId) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE token_id = ? AND" + ACTIVE + " ORDER BY opened_at",
        this::mapRow,
        tokenId);
  }

  @Override
  public List<Position> findActiveByWhaleAndToken(String whaleAddress, String tokenId) {
    return jdbcTemplate.query(
        SELECT_COLUMNS
            + " WHERE whale_address = ? AND token_id = ? AND"
            + ACTIVE
            + " ORDER BY opened_at",
        this::mapRow,
        whaleAddress,
        tokenId);
  }

  @Override
  public List<Position> findActiveByWhale(String whaleAddress) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE whale_address = ? AND" + ACTIVE + " ORDER BY opened_at",
        this::mapRow,
        whaleAddress);
  }

  @Override
  public List<Position> findActive() {
    return jdbcTemplate.query(SELECT_COLUMNS + " WHERE" + ACTIVE + " ORDER BY opened_at", this::mapRow);
  }

  @Override
  public List<Position> findByStatus(PositionStatus status, int offset, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE status = ? ORDER BY last_updated_at DESC LIMIT ? OFFSET ?",
        this::mapRow,
        status.name(),
        limit,
        offset);
  }

  @Override
  public List<Position> findByWhale(String whaleAddress, int offset, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE whale_address = ? ORDER BY opened_at DESC LIMIT ? OFFSET ?",
        this::mapRow,
        whaleAddress,
        limit,
        offset);
  }

  @Override
  public Map<PositionStatus, Long> countByStatus() {
    Map<PositionStatus, Long> counts = new EnumMap<>(PositionStatus.class);
    for (PositionStatus status : PositionStatus.values()) {
      counts.put(status, 0L);
    }
    jdbcTemplate.query(
        "SELECT status, COUNT(*) AS n FROM positions GROUP BY status",
        rs -> {
          counts.put(PositionStatus.valueOf(rs.getString("status")), rs.getLong("n"));
        });
    return counts;
  }

  @Override
  public PerformanceSummary performance() {
    return jdbcTemplate.queryForObject(
        PERFORMANCE_COLUMNS + ", NULL AS whale_address FROM positions", this::mapPerformance);
  }

  @Override
  public List<PerformanceSummary> performanceByWhale() {
    return jdbcTemplate.query(
        PERFORMANCE_COLUMNS
            + ", whale_address FROM positions GROUP BY whale_address ORDER BY whale_address",
        this::mapPerformance);
  }

  @Override
  public int archiveClosedBefore(Instant cutoff, Instant now) {
    return jdbcTemplate.update(
        """
        UPDATE positions
        SET status = 'ARCHIVED', last_updated_at = ?
        WHERE status = 'CLOSED' AND closed_at < ?
        """,
        timestamp(now),
        timestamp(cutoff));
  }

  private Position mapRow(ResultSet rs, int rowNum) throws SQLException {
    String closeReason = rs.getString("close_reason");
    return new Position(
        rs.getObject("id", UUID.class),
        rs.getString("whale_address"),
        rs.getString("token_id"),
        rs.getString("category"),
        PositionSide.valueOf(rs.getString("side")),
        rs.getBigDecimal("entry_size"),
        rs.getBigDecimal("entry_price"),
        rs.getBigDecimal("entry_amount"),
        rs.getBigDecimal("current_size"),
        rs.getBigDecimal("current_price"),
        rs.getBigDecimal("unrealized_pnl"),
        rs.getBigDecimal("realized_pnl"),
        rs.getBigDecimal("max_drawdown"),
        rs.getBigDecimal("max_profit"),
        rs.getBigDecimal("stop_loss_price"),
        rs.getBigDecimal("take_profit_price"),
        rs.getBigDecimal("kelly_fraction"),
        rs.getBigDecimal("edge"),
        rs.getBigDecimal("win_rate"),
        instant(rs.getTimestamp("market_ends_at")),
        PositionStatus.valueOf(rs.getString("status")),
        instant(rs.getTimestamp("opened_at")),
        instant(rs.getTimestamp("last_updated_at")),
        instant(rs.getTimestamp("closed_at")),
        closeReason == null ? null : CloseReason.valueOf(closeReason));
  }

  private PerformanceSummary mapPerformance(ResultSet rs, int rowNum) throws SQLException {
    return new PerformanceSummary(
        rs.getString("whale_address"),
        rs.getLong("total_positions"),
        rs.getLong("active_positions"),
        rs.getLong("closed_positions"),
        rs.getLong("winning_positions"),
        rs.getLong("losing_positions"),
        rs.getBigDecimal("realized_pnl"),
        rs.getBigDecimal("unrealized_pnl"),
        rs.getBigDecimal("best_pnl"),
        rs.getBigDecimal("worst_pnl"));
  }

  private static Optional<Position> single(List<Position> rows) {
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  private static Timestamp timestamp(Instant value) {
    return value == null ? null : Timestamp.from(value);
  }

  private static Instant instant(Timestamp value) {
    return value == null ? null : value.toInstant();
  }
}
