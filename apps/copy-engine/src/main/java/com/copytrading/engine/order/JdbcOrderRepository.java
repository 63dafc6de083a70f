package com.copytrading.engine.order;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderContext;
import com.copytrading.domain.orders.OrderPurpose;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.orders.OrderType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcOrderRepository implements OrderRepository {
  private static final String SELECT_COLUMNS =
      """
      SELECT id, idempotency_key, token_id, side, order_type, size, price, state,
             filled_size, avg_fill_price, exchange_order_id, retry_count, max_retries,
             error_message, parent_order_id, root_order_id, purpose, whale_address,
             position_id, close_reason, category, kelly_fraction, edge, win_rate,
             stop_loss_price, take_profit_price, market_ends_at, created_at,
             submitted_at, filled_at, confirmed_at, updated_at
      FROM orders
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcOrderRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean insertIfAbsent(Order order) {
    String sql =
        """
        INSERT INTO orders (
            id, idempotency_key, token_id, side, order_type, size, price, state,
            filled_size, avg_fill_price, exchange_order_id, retry_count, max_retries,
            error_message, parent_order_id, root_order_id, purpose, whale_address,
            position_id, close_reason, category, kelly_fraction, edge, win_rate,
            stop_loss_price, take_profit_price, market_ends_at, created_at,
            submitted_at, filled_at, confirmed_at, updated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (idempotency_key) DO NOTHING
        """;
    OrderContext context = order.context();
    int inserted =
        jdbcTemplate.update(
            sql,
            order.orderId(),
            order.idempotencyKey(),
            order.tokenId(),
            order.side().name(),
            order.orderType().name(),
            order.size(),
            order.price(),
            order.state().name(),
            order.filledSize(),
            order.avgFillPrice(),
            order.exchangeOrderId(),
            order.retryCount(),
            order.maxRetries(),
            order.errorMessage(),
            order.parentOrderId(),
            order.rootOrderId(),
            context.purpose().name(),
            context.whaleAddress(),
            context.positionId(),
            context.closeReason(),
            context.category(),
            context.kellyFraction(),
            context.edge(),
            context.winRate(),
            context.stopLossPrice(),
            context.takeProfitPrice(),
            timestamp(context.marketEndsAt()),
            timestamp(order.createdAt()),
            timestamp(order.submittedAt()),
            timestamp(order.filledAt()),
            timestamp(order.confirmedAt()),
            timestamp(order.updatedAt()));
    return inserted == 1;
  }

  @Override
  public Optional<Order> findById(UUID orderId) {
    return single(jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", this::mapRow, orderId));
  }

  @Override
  public Optional<Order> findByIdForUpdate(UUID orderId) {
    return single(
        jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ? FOR UPDATE", this::mapRow, orderId));
  }

  @Override
  public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
    return single(
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE idempotency_key = ?", this::mapRow, idempotencyKey));
  }

  @Override
  public Optional<Order> findByExchangeOrderId(String exchangeOrderId) {
    return single(
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE exchange_order_id = ? ORDER BY created_at DESC LIMIT 1",
            this::mapRow,
            exchangeOrderId));
  }

  @Override
  public void update(Order order) {
    String sql =
        """
        UPDATE orders
        SET state = ?,
            filled_size = ?,
            avg_fill_price = ?,
            exchange_order_id = ?,
            retry_count = ?,
            error_message = ?,
            submitted_at = ?,
            filled_at = ?,
            confirmed_at = ?,
            updated_at = ?
        WHERE id = ?
        """;
    jdbcTemplate.update(
        sql,
        order.state().name(),
        order.filledSize(),
        order.avgFillPrice(),
        order.exchangeOrderId(),
        order.retryCount(),
        order.errorMessage(),
        timestamp(order.submittedAt()),
        timestamp(order.filledAt()),
        timestamp(order.confirmedAt()),
        timestamp(order.updatedAt()),
        order.orderId());
  }

  @Override
  public List<Order> findByStateUpdatedBefore(OrderState state, Instant cutoff, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE state = ? AND updated_at < ? ORDER BY updated_at LIMIT ?",
        this::mapRow,
        state.name(),
        timestamp(cutoff),
        limit);
  }

  @Override
  public List<Order> findOpenSubmittedBefore(Instant cutoff, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS
            + " WHERE state IN ('SUBMITTED', 'PARTIALLY_FILLED') AND submitted_at < ?"
            + " ORDER BY submitted_at LIMIT ?",
        this::mapRow,
        timestamp(cutoff),
        limit);
  }

  @Override
  public List<Order> findByStates(Collection<OrderState> states, int limit) {
    if (states.isEmpty()) {
      return List.of();
    }
    List<Object> params = new ArrayList<>();
    StringBuilder placeholders = new StringBuilder();
    for (OrderState state : states) {
      if (!params.isEmpty()) {
        placeholders.append(", ");
      }
      placeholders.append('?');
      params.add(state.name());
    }
    params.add(limit);
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE state IN (" + placeholders + ") ORDER BY updated_at LIMIT ?",
        this::mapRow,
        params.toArray());
  }

  @Override
  public List<Order> findByState(OrderState state, int offset, int limit) {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " WHERE state = ? ORDER BY updated_at DESC LIMIT ? OFFSET ?",
        this::mapRow,
        state.name(),
        limit,
        offset);
  }

  @Override
  public long countByState(OrderState state) {
    Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM orders WHERE state = ?", Long.class, state.name());
    return count != null ? count : 0L;
  }

  @Override
  public int countChildren(UUID rootOrderId) {
    Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM orders WHERE root_order_id = ?", Integer.class, rootOrderId);
    return count != null ? count : 0;
  }

  @Override
  public void forceState(UUID orderId, OrderState state, Instant updatedAt) {
    jdbcTemplate.update(
        "UPDATE orders SET state = ?, updated_at = ? WHERE id = ?",
        state.name(),
        timestamp(updatedAt),
        orderId);
  }

  private Order mapRow(ResultSet rs, int rowNum) throws SQLException {
    OrderContext context =
        new OrderContext(
            OrderPurpose.valueOf(rs.getString("purpose")),
            rs.getString("whale_address"),
            rs.getObject("position_id", UUID.class),
            rs.getString("close_reason"),
            rs.getString("category"),
            rs.getBigDecimal("kelly_fraction"),
            rs.getBigDecimal("edge"),
            rs.getBigDecimal("win_rate"),
            rs.getBigDecimal("stop_loss_price"),
            rs.getBigDecimal("take_profit_price"),
            instant(rs.getTimestamp("market_ends_at")));
    return new Order(
        rs.getObject("id", UUID.class),
        rs.getString("idempotency_key"),
        rs.getString("token_id"),
        OrderSide.valueOf(rs.getString("side")),
        OrderType.valueOf(rs.getString("order_type")),
        rs.getBigDecimal("size"),
        rs.getBigDecimal("price"),
        OrderState.valueOf(rs.getString("state")),
        rs.getBigDecimal("filled_size"),
        rs.getBigDecimal("avg_fill_price"),
        rs.getString("exchange_order_id"),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        rs.getString("error_message"),
        rs.getObject("parent_order_id", UUID.class),
        rs.getObject("root_order_id", UUID.class),
        context,
        instant(rs.getTimestamp("created_at")),
        instant(rs.getTimestamp("submitted_at")),
        instant(rs.getTimestamp("filled_at")),
        instant(rs.getTimestamp("confirmed_at")),
        instant(rs.getTimestamp("updated_at")));
  }

  private static Optional<Order> single(List<Order> rows) {
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
