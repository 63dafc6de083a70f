package com.copytrading.domain.orders;

public enum OrderPurpose {
  OPEN_POSITION,
  CLOSE_POSITION
}
