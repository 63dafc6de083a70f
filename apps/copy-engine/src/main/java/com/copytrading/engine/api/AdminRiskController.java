package com.copytrading.engine.api;

import com.copytrading.engine.risk.QuarantineEntry;
import com.copytrading.engine.risk.RiskManager;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminRiskController {
  private final RiskManager riskManager;

  public AdminRiskController(RiskManager riskManager) {
    this.riskManager = riskManager;
  }

  @PostMapping("/risk/circuit-breaker/reset")
  public ResponseEntity<RiskStateResponse> resetCircuitBreaker(Authentication authentication) {
    return ResponseEntity.ok(
        RiskStateResponse.from(riskManager.resetCircuitBreaker(authentication.getName())));
  }

  @GetMapping("/whales/quarantined")
  public ResponseEntity<List<QuarantinedWhaleResponse>> quarantinedWhales() {
    return ResponseEntity.ok(
        riskManager.snapshot().quarantinedWhales().values().stream()
            .sorted(Comparator.comparing(QuarantineEntry::quarantinedAt))
            .map(QuarantinedWhaleResponse::from)
            .toList());
  }
}
