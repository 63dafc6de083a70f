package com.copytrading.domain.positions;

public enum PositionStatus {
  OPEN,
  CLOSING,
  CLOSED,
  ARCHIVED;

  public boolean isActive() {
    return this == OPEN || this == CLOSING;
  }
}
