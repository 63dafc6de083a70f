package com.copytrading.engine.signal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderSide;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.domain.positions.CloseReason;
import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionSide;
import com.copytrading.domain.positions.PositionStatus;
import com.copytrading.engine.audit.AuditTrail;
import com.copytrading.engine.audit.JdbcAuditLogRepository;
import com.copytrading.engine.audit.JdbcOrderTransitionRepository;
import com.copytrading.engine.audit.JdbcPositionUpdateRepository;
import com.copytrading.engine.order.ExchangeRetryPolicy;
import com.copytrading.engine.order.ExecutionProperties;
import com.copytrading.engine.order.FillEvent;
import com.copytrading.engine.order.FillSource;
import com.copytrading.engine.order.JdbcOrderFillRepository;
import com.copytrading.engine.order.JdbcOrderRepository;
import com.copytrading.engine.order.OrderEventPublisher;
import com.copytrading.engine.order.OrderExecutor;
import com.copytrading.engine.order.OrderSettlement;
import com.copytrading.engine.order.OrderStore;
import com.copytrading.engine.position.ExitCoordinator;
import com.copytrading.engine.position.ExitDecision;
import com.copytrading.engine.position.ExitEvaluator;
import com.copytrading.engine.position.ExitProperties;
import com.copytrading.engine.position.ExitTrigger;
import com.copytrading.engine.position.JdbcPositionRepository;
import com.copytrading.engine.position.PositionEventPublisher;
import com.copytrading.engine.position.PositionLedger;
import com.copytrading.engine.risk.JdbcRiskStateRepository;
import com.copytrading.engine.risk.RiskManager;
import com.copytrading.engine.risk.RiskProperties;
import com.copytrading.engine.sizing.PositionSizer;
import com.copytrading.engine.sizing.SizingProperties;
import com.copytrading.engine.sizing.VolatilityTracker;
import com.copytrading.infra.kafka.producer.OrderEventProducer;
import com.copytrading.infra.kafka.producer.PositionEventProducer;
import com.copytrading.integration.polymarket.ExchangeClient;
import com.copytrading.integration.polymarket.ExchangeOrderAck;
import com.copytrading.integration.polymarket.OrderBook;
import com.copytrading.integration.polymarket.OrderBookLevel;
import com.copytrading.testsupport.containers.PostgresContainerBaseIT;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.jdbc.core.JdbcTemplate;

/** Whale trade in, copy order out, fills into the ledger, exits back out, against a real schema. */
class CopyTradeEndToEndIntegrationTest extends PostgresContainerBaseIT {
  private JdbcTemplate jdbcTemplate;
  private ExchangeClient exchangeClient;
  private RiskManager riskManager;
  private JdbcPositionRepository positionRepository;
  private JdbcOrderRepository orderRepository;
  private OrderExecutor orderExecutor;
  private ExitCoordinator exitCoordinator;
  private CopyTradeCoordinator coordinator;

  @BeforeEach
  void setUp() {
    jdbcTemplate = new JdbcTemplate(migratedDataSource());
    ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    StaticListableBeanFactory beans = new StaticListableBeanFactory();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    exchangeClient = mock(ExchangeClient.class);
    when(exchangeClient.fetchOrderBook("M1"))
        .thenReturn(
            new OrderBook(
                "M1",
                List.of(new OrderBookLevel(new BigDecimal("0.548"), new BigDecimal("20000"))),
                List.of(new OrderBookLevel(new BigDecimal("0.552"), new BigDecimal("20000")))));
    when(exchangeClient.submitOrder(any()))
        .thenReturn(
            new ExchangeOrderAck("ex-1", "LIVE", "{}"), new ExchangeOrderAck("ex-2", "LIVE", "{}"));

    AuditTrail auditTrail =
        new AuditTrail(
            new JdbcOrderTransitionRepository(jdbcTemplate, objectMapper),
            new JdbcPositionUpdateRepository(jdbcTemplate, objectMapper),
            new JdbcAuditLogRepository(jdbcTemplate),
            objectMapper);
    riskManager =
        new RiskManager(
            new RiskProperties(),
            new JdbcRiskStateRepository(jdbcTemplate, objectMapper),
            auditTrail,
            meterRegistry);
    positionRepository = new JdbcPositionRepository(jdbcTemplate);
    orderRepository = new JdbcOrderRepository(jdbcTemplate);
    ExitEvaluator exitEvaluator = new ExitEvaluator(new ExitProperties());
    ExecutionProperties executionProperties = new ExecutionProperties();
    OrderStore orderStore =
        new OrderStore(
            orderRepository,
            new JdbcOrderFillRepository(jdbcTemplate),
            auditTrail,
            new OrderEventPublisher(beans.getBeanProvider(OrderEventProducer.class)),
            meterRegistry);
    PositionLedger ledger =
        new PositionLedger(
            positionRepository,
            exitEvaluator,
            riskManager,
            auditTrail,
            new PositionEventPublisher(beans.getBeanProvider(PositionEventProducer.class)));
    orderExecutor =
        new OrderExecutor(
            orderStore,
            orderRepository,
            new OrderSettlement(orderStore, ledger),
            ledger,
            riskManager,
            exchangeClient,
            new ExchangeRetryPolicy(executionProperties),
            executionProperties,
            meterRegistry);
    exitCoordinator =
        new ExitCoordinator(
            ledger,
            positionRepository,
            orderExecutor,
            exchangeClient,
            executionProperties,
            meterRegistry);
    SignalFilterProperties filterProperties = new SignalFilterProperties();
    SizingProperties sizingProperties = new SizingProperties();
    coordinator =
        new CopyTradeCoordinator(
            new SignalFilterPipeline(
                new WhaleGate(filterProperties),
                new TradeGate(filterProperties, exchangeClient),
                new PortfolioGate(
                    filterProperties, sizingProperties, new CorrelationEstimator(filterProperties)),
                meterRegistry),
            new PositionSizer(sizingProperties),
            new VolatilityTracker(sizingProperties),
            riskManager,
            orderExecutor,
            orderStore,
            positionRepository,
            exitCoordinator,
            exitEvaluator,
            executionProperties,
            auditTrail);
  }

  @Test
  void shouldCopyWhaleTradeOpenPositionAndStopOut() {
    CopyOutcome outcome = coordinator.onWhaleTrade(whaleTrade("t-1", OrderSide.BUY, "0.05"));

    assertEquals(CopyOutcome.Status.SUBMITTED, outcome.status());
    Order copy = outcome.order();
    assertEquals(OrderState.SUBMITTED, copy.state());
    assertEquals(OrderSide.BUY, copy.side());
    assertEquals(0, copy.price().compareTo(new BigDecimal("0.55")));
    BigDecimal fraction = copy.context().kellyFraction();
    assertTrue(fraction.signum() > 0 && fraction.compareTo(new BigDecimal("0.08")) <= 0);

    orderExecutor.onFill(
        new FillEvent("ex-1", 1, copy.size(), new BigDecimal("0.55"), Instant.now(), FillSource.FEED));

    Position opened = positionRepository.findActiveByToken("M1").get(0);
    assertEquals(PositionStatus.OPEN, opened.status());
    assertEquals(PositionSide.YES, opened.side());
    assertEquals(0, opened.stopLossPrice().compareTo(new BigDecimal("0.4675")));
    assertEquals(0, opened.takeProfitPrice().compareTo(new BigDecimal("0.715")));
    assertEquals(0, opened.currentSize().compareTo(copy.size()));

    List<ExitDecision> exits = exitCoordinator.onPriceTick("M1", new BigDecimal("0.46"));

    assertEquals(1, exits.size());
    assertEquals(ExitTrigger.STOP_LOSS, exits.get(0).trigger());
    assertEquals(
        PositionStatus.CLOSING,
        positionRepository.findById(opened.positionId()).orElseThrow().status());
    Order close = orderRepository.findByExchangeOrderId("ex-2").orElseThrow();
    assertEquals(OrderSide.SELL, close.side());
    assertEquals(0, close.price().compareTo(new BigDecimal("0.548")));
    assertEquals("STOP_LOSS", close.context().closeReason());

    orderExecutor.onFill(
        new FillEvent("ex-2", 1, close.size(), new BigDecimal("0.46"), Instant.now(), FillSource.FEED));

    Position closed = positionRepository.findById(opened.positionId()).orElseThrow();
    assertEquals(PositionStatus.CLOSED, closed.status());
    assertEquals(CloseReason.STOP_LOSS, closed.closeReason());
    assertTrue(closed.realizedPnl().signum() < 0);
    assertEquals(0, riskManager.snapshot().openPositionCount());
    assertEquals(1, riskManager.snapshot().consecutiveLosses());
    assertEquals(0, riskManager.snapshot().realizedPnlTotal().compareTo(closed.realizedPnl()));
  }

  @Test
  void shouldRejectWhaleInDrawdownWithoutSideEffects() {
    CopyOutcome outcome = coordinator.onWhaleTrade(whaleTrade("t-2", OrderSide.BUY, "0.30"));

    assertEquals(CopyOutcome.Status.REJECTED, outcome.status());
    assertTrue(outcome.detail().contains("Whale in trouble"));
    verify(exchangeClient, never()).submitOrder(any());
    assertEquals(0, count("SELECT COUNT(*) FROM orders"));
    assertEquals(0, count("SELECT COUNT(*) FROM positions"));
    assertEquals(
        1,
        count(
            "SELECT COUNT(*) FROM audit_log WHERE result = 'REJECTED' AND error_code = 'WHALE_IN_TROUBLE'"));
  }

  @Test
  void shouldTreatRedeliveredTradeAsDuplicate() {
    coordinator.onWhaleTrade(whaleTrade("t-3", OrderSide.BUY, "0.05"));

    CopyOutcome again = coordinator.onWhaleTrade(whaleTrade("t-3", OrderSide.BUY, "0.05"));

    assertEquals(CopyOutcome.Status.DUPLICATE, again.status());
    assertEquals(1, count("SELECT COUNT(*) FROM orders"));
  }

  @Test
  void shouldFollowWhaleOutOfCopiedPosition() {
    Order copy = coordinator.onWhaleTrade(whaleTrade("t-4", OrderSide.BUY, "0.05")).order();
    orderExecutor.onFill(
        new FillEvent("ex-1", 1, copy.size(), new BigDecimal("0.55"), Instant.now(), FillSource.FEED));

    CopyOutcome exit = coordinator.onWhaleTrade(whaleTrade("t-5", OrderSide.SELL, "0.05"));

    assertEquals(CopyOutcome.Status.WHALE_EXIT, exit.status());
    Order close = orderRepository.findByExchangeOrderId("ex-2").orElseThrow();
    assertEquals("WHALE_EXIT", close.context().closeReason());
    assertEquals(PositionStatus.CLOSING, positionRepository.findActive().get(0).status());
  }

  private static WhaleSignal whaleTrade(String tradeId, OrderSide side, String whaleDrawdown) {
    Instant now = Instant.now();
    return new WhaleSignal(
        tradeId,
        "0xA",
        "M1",
        "mkt-1",
        "politics",
        side,
        new BigDecimal("10000"),
        new BigDecimal("0.55"),
        null,
        now.plus(Duration.ofDays(30)),
        now,
        new WhaleMetrics(
            new BigDecimal("90"),
            new BigDecimal("2.0"),
            new BigDecimal("1.5"),
            new BigDecimal(whaleDrawdown),
            new BigDecimal("0.62")));
  }

  private int count(String sql) {
    Integer count = jdbcTemplate.queryForObject(sql, Integer.class);
    return count == null ? 0 : count;
  }
}
