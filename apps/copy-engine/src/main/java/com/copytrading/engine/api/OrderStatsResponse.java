package com.copytrading.engine.api;

import com.copytrading.engine.order.OrderStats;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public record OrderStatsResponse(Map<String, Long> countsByState, BigDecimal fillRate) {

  public static OrderStatsResponse from(OrderStats stats) {
    Map<String, Long> counts = new LinkedHashMap<>();
    stats.countsByState().entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(entry -> counts.put(entry.getKey().name(), entry.getValue()));
    return new OrderStatsResponse(counts, stats.fillRate());
  }
}
