package com.copytrading.engine.api;

import com.copytrading.engine.risk.RiskManager;
import com.copytrading.engine.risk.TradeIntent;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/risk")
@PreAuthorize("hasRole('TRADER')")
public class RiskController {
  private final RiskManager riskManager;

  public RiskController(RiskManager riskManager) {
    this.riskManager = riskManager;
  }

  @GetMapping("/state")
  public ResponseEntity<RiskStateResponse> state() {
    return ResponseEntity.ok(RiskStateResponse.from(riskManager.snapshot()));
  }

  @GetMapping("/exposure")
  public ResponseEntity<ExposureResponse> exposure() {
    return ResponseEntity.ok(ExposureResponse.from(riskManager.snapshot()));
  }

  /** Runs the pre-trade limits without reserving anything. */
  @PostMapping("/check")
  public ResponseEntity<RiskCheckResponse> check(@Valid @RequestBody RiskCheckRequest request) {
    TradeIntent intent =
        new TradeIntent(
            "preview", request.whaleAddress(), request.tokenId(), request.category());
    return ResponseEntity.ok(
        RiskCheckResponse.from(riskManager.preview(intent, request.notional())));
  }
}
