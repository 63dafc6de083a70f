package com.copytrading.engine.risk;

import java.time.Instant;
import java.util.Optional;

public interface RiskStateRepository {
  Optional<PersistedRiskState> load();

  void save(PersistedRiskState state, Instant savedAt);
}
