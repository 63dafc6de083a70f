package com.copytrading.engine.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.copytrading.domain.orders.OrderState;
import com.copytrading.engine.config.GlobalExceptionHandler;
import com.copytrading.engine.config.KeycloakRoleConverter;
import com.copytrading.engine.config.SecurityConfig;
import com.copytrading.engine.order.OrderQueryService;
import com.copytrading.engine.position.ExitCoordinator;
import com.copytrading.engine.position.PositionQueryService;
import com.copytrading.engine.risk.RiskCode;
import com.copytrading.engine.risk.RiskDecision;
import com.copytrading.engine.risk.RiskManager;
import com.copytrading.engine.risk.RiskState;
import com.copytrading.engine.risk.TradeIntent;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@WebMvcTest(
    controllers = {
      PositionController.class,
      OrderController.class,
      RiskController.class,
      AdminRiskController.class,
      AdminPositionController.class,
      VersionController.class
    })
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class ApiSecurityTest {
  private static final KeycloakRoleConverter ROLE_CONVERTER =
      new KeycloakRoleConverter("copy-engine");

  @Autowired private MockMvc mockMvc;

  @MockBean private PositionQueryService positionQueryService;
  @MockBean private OrderQueryService orderQueryService;
  @MockBean private RiskManager riskManager;
  @MockBean private ExitCoordinator exitCoordinator;
  @MockBean private JwtDecoder jwtDecoder;

  @Test
  void shouldRejectRequestsWithoutToken() throws Exception {
    mockMvc.perform(get("/v1/risk/state")).andExpect(status().isUnauthorized());
    mockMvc.perform(get("/v1/positions")).andExpect(status().isUnauthorized());
  }

  @Test
  void shouldServeVersionWithoutToken() throws Exception {
    mockMvc
        .perform(get("/v1/version"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value("unknown"));
  }

  @Test
  void shouldServeRiskStateToTrader() throws Exception {
    when(riskManager.snapshot())
        .thenReturn(RiskState.initial(new BigDecimal("10000"), LocalDate.of(2026, 3, 1)));

    mockMvc
        .perform(withRoles(get("/v1/risk/state"), "TRADER"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.nav").value(10000))
        .andExpect(jsonPath("$.halted").value(false));
  }

  @Test
  void shouldForbidTraderFromAdminEndpoints() throws Exception {
    mockMvc
        .perform(withRoles(post("/v1/admin/risk/circuit-breaker/reset"), "TRADER"))
        .andExpect(status().isForbidden());

    verify(riskManager, never()).resetCircuitBreaker(any());
  }

  @Test
  void shouldLetAdminResetCircuitBreaker() throws Exception {
    when(riskManager.resetCircuitBreaker(eq("ops-user")))
        .thenReturn(RiskState.initial(new BigDecimal("9500"), LocalDate.of(2026, 3, 1)));

    mockMvc
        .perform(
            post("/v1/admin/risk/circuit-breaker/reset")
                .with(
                    jwt()
                        .jwt(
                            jwt ->
                                jwt.subject("ops-user")
                                    .claim("realm_access", Map.of("roles", List.of("ADMIN"))))
                        .authorities(ROLE_CONVERTER)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.halted").value(false))
        .andExpect(jsonPath("$.nav").value(9500));
  }

  @Test
  void shouldForbidAdminOnlyTokenFromTraderEndpoints() throws Exception {
    mockMvc
        .perform(withRoles(get("/v1/positions"), "ADMIN"))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldAcceptClientRoleFromResourceAccess() throws Exception {
    when(riskManager.snapshot())
        .thenReturn(RiskState.initial(new BigDecimal("10000"), LocalDate.of(2026, 3, 1)));

    mockMvc
        .perform(
            get("/v1/risk/exposure")
                .with(
                    jwt()
                        .jwt(
                            jwt ->
                                jwt.claim(
                                    "resource_access",
                                    Map.of("copy-engine", Map.of("roles", List.of("trader")))))
                        .authorities(ROLE_CONVERTER)))
        .andExpect(status().isOk());
  }

  @Test
  void shouldReturnNotFoundForUnknownPosition() throws Exception {
    UUID positionId = UUID.randomUUID();
    when(positionQueryService.find(positionId)).thenReturn(Optional.empty());

    mockMvc
        .perform(withRoles(get("/v1/positions/" + positionId), "TRADER"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.title").value("Not Found"));
  }

  @Test
  void shouldValidateRiskCheckRequest() throws Exception {
    mockMvc
        .perform(
            withRoles(post("/v1/risk/check"), "TRADER")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"whaleAddress\":\"\",\"tokenId\":\"t-1\",\"notional\":-5}"))
        .andExpect(status().isBadRequest());

    verify(riskManager, never()).preview(any(), any());
  }

  @Test
  void shouldReturnVetoFromRiskCheckPreview() throws Exception {
    when(riskManager.preview(any(TradeIntent.class), eq(new BigDecimal("1500"))))
        .thenReturn(RiskDecision.veto(RiskCode.POSITION_LIMIT, "notional above position limit"));

    mockMvc
        .perform(
            withRoles(post("/v1/risk/check"), "TRADER")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"whaleAddress\":\"0xA\",\"tokenId\":\"t-1\",\"category\":\"politics\","
                        + "\"notional\":1500}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.approved").value(false))
        .andExpect(jsonPath("$.code").value("POSITION_LIMIT"));
  }

  @Test
  void shouldPageDeadLettersByState() throws Exception {
    when(orderQueryService.byState(OrderState.DEAD_LETTER, 20, 10)).thenReturn(List.of());
    when(orderQueryService.countByState(OrderState.DEAD_LETTER)).thenReturn(25L);

    mockMvc
        .perform(withRoles(get("/v1/orders/dead-letters?page=2&size=10"), "TRADER"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.page").value(2))
        .andExpect(jsonPath("$.totalElements").value(25))
        .andExpect(jsonPath("$.totalPages").value(3));

    verify(orderQueryService).byState(OrderState.DEAD_LETTER, 20, 10);
  }

  private static MockHttpServletRequestBuilder withRoles(
      MockHttpServletRequestBuilder request, String... roles) {
    return request.with(
        jwt()
            .jwt(jwt -> jwt.claim("realm_access", Map.of("roles", List.of(roles))))
            .authorities(ROLE_CONVERTER));
  }
}
