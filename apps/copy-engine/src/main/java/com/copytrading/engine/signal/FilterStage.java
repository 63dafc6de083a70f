package com.copytrading.engine.signal;

public enum FilterStage {
  WHALE,
  TRADE,
  PORTFOLIO
}
