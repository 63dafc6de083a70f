package com.copytrading.domain.positions;

/** YES is long the token, NO is short it. Prices are always quoted in the token's own terms. */
public enum PositionSide {
  YES,
  NO;

  public int sign() {
    return this == YES ? 1 : -1;
  }
}
