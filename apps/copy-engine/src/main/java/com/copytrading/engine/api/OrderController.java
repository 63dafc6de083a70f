package com.copytrading.engine.api;

import com.copytrading.domain.orders.Order;
import com.copytrading.domain.orders.OrderState;
import com.copytrading.engine.order.OrderQueryService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/v1/orders")
@PreAuthorize("hasRole('TRADER')")
public class OrderController {
  private final OrderQueryService orderQueryService;

  public OrderController(OrderQueryService orderQueryService) {
    this.orderQueryService = orderQueryService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<OrderDetailResponse> getOrder(@PathVariable("id") UUID id) {
    Order order =
        orderQueryService
            .find(id)
            .orElseThrow(
                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Order not found: " + id));
    List<OrderTransitionResponse> transitions =
        orderQueryService.history(id).stream().map(OrderTransitionResponse::from).toList();
    return ResponseEntity.ok(new OrderDetailResponse(OrderResponse.from(order), transitions));
  }

  @GetMapping
  public ResponseEntity<OrdersPageResponse> listOrders(
      @RequestParam("state") OrderState state,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "20") int size) {
    return ResponseEntity.ok(page(state, page, size));
  }

  @GetMapping("/dead-letters")
  public ResponseEntity<OrdersPageResponse> deadLetters(
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "20") int size) {
    return ResponseEntity.ok(page(OrderState.DEAD_LETTER, page, size));
  }

  @GetMapping("/stats")
  public ResponseEntity<OrderStatsResponse> stats() {
    return ResponseEntity.ok(OrderStatsResponse.from(orderQueryService.stats()));
  }

  private OrdersPageResponse page(OrderState state, int page, int size) {
    int clampedSize = Math.min(Math.max(size, 1), 100);
    List<OrderResponse> orders =
        orderQueryService.byState(state, page * clampedSize, clampedSize).stream()
            .map(OrderResponse::from)
            .toList();
    long totalElements = orderQueryService.countByState(state);
    int totalPages = (int) Math.ceil((double) totalElements / clampedSize);
    return new OrdersPageResponse(orders, page, clampedSize, totalElements, totalPages);
  }
}
