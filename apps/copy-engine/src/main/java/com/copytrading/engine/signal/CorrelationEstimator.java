package com.copytrading.engine.signal;

import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/** Category-level proxy for the correlation between two markets. */
@Component
public class CorrelationEstimator {
  private final SignalFilterProperties properties;

  public CorrelationEstimator(SignalFilterProperties properties) {
    this.properties = properties;
  }

  public BigDecimal correlation(
      String tokenId, String category, String otherTokenId, String otherCategory) {
    if (tokenId.equals(otherTokenId)) {
      return BigDecimal.ONE;
    }
    if (category != null && category.equals(otherCategory)) {
      return properties.getSameCategoryCorrelation();
    }
    return properties.getDefaultCorrelation();
  }
}
