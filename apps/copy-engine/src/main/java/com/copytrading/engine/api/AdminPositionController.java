package com.copytrading.engine.api;

import com.copytrading.domain.orders.Order;
import com.copytrading.engine.position.ExitCoordinator;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/positions")
@PreAuthorize("hasRole('ADMIN')")
public class AdminPositionController {
  private final ExitCoordinator exitCoordinator;

  public AdminPositionController(ExitCoordinator exitCoordinator) {
    this.exitCoordinator = exitCoordinator;
  }

  @PostMapping("/{id}/close")
  public ResponseEntity<ManualCloseResponse> closePosition(
      @PathVariable("id") UUID id, Authentication authentication) {
    Order order = exitCoordinator.closeManually(id, authentication.getName());
    return ResponseEntity.accepted().body(ManualCloseResponse.from(id, order));
  }
}
