package com.copytrading.engine.audit;

import com.copytrading.domain.positions.PositionUpdate;
import java.util.List;
import java.util.UUID;

public interface PositionUpdateRepository {
  void append(PositionUpdate update);

  List<PositionUpdate> findByPositionId(UUID positionId);
}
