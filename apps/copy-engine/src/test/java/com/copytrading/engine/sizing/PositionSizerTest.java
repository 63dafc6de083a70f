package com.copytrading.engine.sizing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.copytrading.domain.orders.OrderSide;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PositionSizerTest {
  private static final BigDecimal NAV = new BigDecimal("10000");

  private PositionSizer sizer;

  @BeforeEach
  void setUp() {
    sizer = new PositionSizer(new SizingProperties());
  }

  @Test
  void kellyFractionIsZeroWithoutEdge() {
    assertEquals(
        0, PositionSizer.kellyFraction(new BigDecimal("0.55"), new BigDecimal("0.55")).signum());
    assertEquals(
        0, PositionSizer.kellyFraction(new BigDecimal("0.40"), new BigDecimal("0.55")).signum());
  }

  @Test
  void kellyFractionMatchesClosedForm() {
    // b = 0.45 / 0.55, f = (0.6 * b - 0.4) / b = 1/9
    BigDecimal kelly = PositionSizer.kellyFraction(new BigDecimal("0.60"), new BigDecimal("0.55"));

    assertEquals(new BigDecimal("0.1111"), kelly.setScale(4, java.math.RoundingMode.HALF_UP));
  }

  @Test
  void sizesTypicalCopyTradeWithinMaxFraction() {
    BigDecimal cost = EdgeModel.impliedCost(OrderSide.BUY, new BigDecimal("0.55"));
    BigDecimal probability = EdgeModel.winProbability(new BigDecimal("0.62"), cost, new BigDecimal("0.7"));

    SizingResult result =
        sizer.size(
            new SizingInput(
                new BigDecimal("0.55"),
                cost,
                probability,
                new BigDecimal("90"),
                new BigDecimal("0.1"),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                NAV,
                BigDecimal.ONE));

    assertTrue(result.finalFraction().signum() > 0);
    assertTrue(result.finalFraction().compareTo(new BigDecimal("0.08")) <= 0);
    assertTrue(result.notional().compareTo(new BigDecimal("400")) > 0);
    assertTrue(result.notional().compareTo(new BigDecimal("600")) < 0);
    assertEquals(0, result.confidenceFactor().compareTo(new BigDecimal("0.94")));
    assertEquals(0, result.correlationFactor().compareTo(new BigDecimal("0.99")));
    assertTrue(result.isTradable());
  }

  @Test
  void capsFractionAtMaximum() {
    SizingResult result =
        sizer.size(
            new SizingInput(
                new BigDecimal("0.30"),
                new BigDecimal("0.30"),
                new BigDecimal("0.90"),
                new BigDecimal("100"),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                NAV,
                BigDecimal.ONE));

    assertEquals(0, result.finalFraction().compareTo(new BigDecimal("0.08")));
    assertEquals(0, result.notional().compareTo(new BigDecimal("800")));
    assertEquals(new BigDecimal("2666.66"), result.size());
  }

  @Test
  void drawdownAndVolatilityShrinkTheFraction() {
    SizingInput calm =
        new SizingInput(
            new BigDecimal("0.50"),
            new BigDecimal("0.50"),
            new BigDecimal("0.58"),
            new BigDecimal("80"),
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            NAV,
            BigDecimal.ONE);
    SizingInput stressed =
        new SizingInput(
            new BigDecimal("0.50"),
            new BigDecimal("0.50"),
            new BigDecimal("0.58"),
            new BigDecimal("80"),
            BigDecimal.ZERO,
            new BigDecimal("0.2"),
            new BigDecimal("0.2"),
            NAV,
            BigDecimal.ONE);

    SizingResult calmResult = sizer.size(calm);
    SizingResult stressedResult = sizer.size(stressed);

    assertEquals(0, stressedResult.volatilityFactor().compareTo(new BigDecimal("0.5")));
    assertEquals(0, stressedResult.drawdownFactor().compareTo(new BigDecimal("0.4")));
    assertTrue(stressedResult.finalFraction().compareTo(calmResult.finalFraction()) < 0);
  }

  @Test
  void reduceMultiplierHalvesNotional() {
    SizingInput full =
        new SizingInput(
            new BigDecimal("0.50"),
            new BigDecimal("0.50"),
            new BigDecimal("0.58"),
            new BigDecimal("80"),
            null,
            null,
            null,
            NAV,
            null);
    SizingInput reduced =
        new SizingInput(
            new BigDecimal("0.50"),
            new BigDecimal("0.50"),
            new BigDecimal("0.58"),
            new BigDecimal("80"),
            null,
            null,
            null,
            NAV,
            new BigDecimal("0.5"));

    assertEquals(
        0,
        sizer
            .size(full)
            .notional()
            .compareTo(sizer.size(reduced).notional().multiply(BigDecimal.valueOf(2))));
  }

  @Test
  void tinyNotionalIsNotTradable() {
    SizingResult result =
        sizer.size(
            new SizingInput(
                new BigDecimal("0.50"),
                new BigDecimal("0.50"),
                new BigDecimal("0.50"),
                new BigDecimal("80"),
                null,
                null,
                null,
                NAV,
                null));

    assertEquals(0, result.finalFraction().signum());
    assertFalse(result.isTradable());
  }
}
