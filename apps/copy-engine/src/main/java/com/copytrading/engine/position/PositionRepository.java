package com.copytrading.engine.position;

import com.copytrading.domain.positions.Position;
import com.copytrading.domain.positions.PositionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface PositionRepository {
  void insert(Position position);

  void update(Position position);

  Optional<Position> findById(UUID positionId);

  Optional<Position> findByIdForUpdate(UUID positionId);

  /** OPEN and CLOSING positions on a token, oldest first. */
  List<Position> findActiveByToken(String tokenId);

  List<Position> findActiveByWhaleAndToken(String whaleAddress, String tokenId);

  List<Position> findActiveByWhale(String whaleAddress);

  List<Position> findActive();

  List<Position> findByStatus(PositionStatus status, int offset, int limit);

  List<Position> findByWhale(String whaleAddress, int offset, int limit);

  Map<PositionStatus, Long> countByStatus();

  PerformanceSummary performance();

  List<PerformanceSummary> performanceByWhale();

  int archiveClosedBefore(Instant cutoff, Instant now);
}
