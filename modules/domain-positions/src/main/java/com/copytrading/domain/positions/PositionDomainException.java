package com.copytrading.domain.positions;

public class PositionDomainException extends RuntimeException {
  public PositionDomainException(String message) {
    super(message);
  }
}
