package com.copytrading.engine.risk;

import com.copytrading.engine.position.ExitCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies whale score updates to the quarantine set. Open positions of a newly quarantined whale
 * are held or liquidated according to the configured policy.
 */
@Service
public class WhaleQuarantineService {
  private static final Logger log = LoggerFactory.getLogger(WhaleQuarantineService.class);

  private final RiskManager riskManager;
  private final RiskProperties properties;
  private final ExitCoordinator exitCoordinator;

  public WhaleQuarantineService(
      RiskManager riskManager, RiskProperties properties, ExitCoordinator exitCoordinator) {
    this.riskManager = riskManager;
    this.properties = properties;
    this.exitCoordinator = exitCoordinator;
  }

  public QuarantineChange onScoreUpdate(WhaleScoreObservation observation) {
    QuarantineChange change = riskManager.observeWhaleScore(observation);
    if (change == QuarantineChange.ENTERED
        && properties.getQuarantine().getPolicy() == QuarantinePolicy.LIQUIDATE) {
      int submitted = exitCoordinator.liquidateWhale(observation.whaleAddress());
      log.warn(
          "Liquidating quarantined whale positions whale={} closingOrders={}",
          observation.whaleAddress(),
          submitted);
    }
    return change;
  }
}
