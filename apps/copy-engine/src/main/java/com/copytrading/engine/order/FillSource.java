package com.copytrading.engine.order;

public enum FillSource {
  FEED,
  POLL
}
