package com.copytrading.engine.order;

import java.time.Instant;
import java.util.UUID;

public interface OrderFillRepository {
  /** Records a fill unless {@code (orderId, sequence)} was already seen. */
  boolean insertIfAbsent(UUID orderId, FillEvent fill, Instant recordedAt);
}
