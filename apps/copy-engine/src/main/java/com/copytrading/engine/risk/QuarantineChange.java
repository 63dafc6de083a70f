package com.copytrading.engine.risk;

public enum QuarantineChange {
  ENTERED,
  RELEASED,
  UNCHANGED
}
