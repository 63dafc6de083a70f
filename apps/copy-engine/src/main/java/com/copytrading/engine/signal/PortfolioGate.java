package com.copytrading.engine.signal;

import com.copytrading.engine.risk.ExposureEntry;
import com.copytrading.engine.risk.RiskState;
import com.copytrading.engine.sizing.SizingProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Stage 3: does the trade fit the book. Exposure projections assume the largest copy the sizer
 * could produce.
 */
@Component
public class PortfolioGate {
  private final SignalFilterProperties properties;
  private final SizingProperties sizingProperties;
  private final CorrelationEstimator correlationEstimator;

  public PortfolioGate(
      SignalFilterProperties properties,
      SizingProperties sizingProperties,
      CorrelationEstimator correlationEstimator) {
    this.properties = properties;
    this.sizingProperties = sizingProperties;
    this.correlationEstimator = correlationEstimator;
  }

  public PortfolioAssessment evaluate(WhaleSignal signal, RiskState riskState) {
    BigDecimal correlation = weightedCorrelation(signal, riskState.exposures());
    if (correlation.compareTo(properties.getMaxCorrelation()) >= 0) {
      return new PortfolioAssessment(
          RejectionReason.portfolio(
              RejectionCode.HIGH_CORRELATION,
              "Portfolio correlation " + correlation + " not below " + properties.getMaxCorrelation()),
          correlation);
    }

    BigDecimal nav = riskState.nav();
    BigDecimal maxCopy = nav.multiply(sizingProperties.getMaxFraction());
    BigDecimal projectedTotal = riskState.openExposure().add(maxCopy);
    BigDecimal totalLimit = nav.multiply(properties.getMaxTotalExposureRatio());
    if (projectedTotal.compareTo(totalLimit) >= 0) {
      return new PortfolioAssessment(
          RejectionReason.portfolio(
              RejectionCode.TOTAL_EXPOSURE_LIMIT,
              "Projected exposure " + projectedTotal + " not below " + totalLimit),
          correlation);
    }

    if (signal.category() != null) {
      BigDecimal projectedCategory = riskState.categoryExposure(signal.category()).add(maxCopy);
      BigDecimal categoryLimit = nav.multiply(properties.getMaxCategoryExposureRatio());
      if (projectedCategory.compareTo(categoryLimit) >= 0) {
        return new PortfolioAssessment(
            RejectionReason.portfolio(
                RejectionCode.CATEGORY_EXPOSURE_LIMIT,
                "Projected "
                    + signal.category()
                    + " exposure "
                    + projectedCategory
                    + " not below "
                    + categoryLimit),
            correlation);
      }
    }
    return new PortfolioAssessment(null, correlation);
  }

  /** Exposure-weighted mean correlation with the open book; zero for an empty book. */
  BigDecimal weightedCorrelation(WhaleSignal signal, List<ExposureEntry> exposures) {
    BigDecimal weighted = BigDecimal.ZERO;
    BigDecimal total = BigDecimal.ZERO;
    for (ExposureEntry entry : exposures) {
      BigDecimal rho =
          correlationEstimator.correlation(
              signal.tokenId(), signal.category(), entry.tokenId(), entry.category());
      weighted = weighted.add(rho.multiply(entry.exposure()));
      total = total.add(entry.exposure());
    }
    if (total.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return weighted.divide(total, 8, RoundingMode.HALF_UP);
  }
}
