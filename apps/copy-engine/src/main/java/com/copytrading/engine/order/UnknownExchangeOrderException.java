package com.copytrading.engine.order;

/** A fill referenced an exchange order id this engine has not recorded (yet). */
public class UnknownExchangeOrderException extends RuntimeException {
  public UnknownExchangeOrderException(String exchangeOrderId) {
    super("No order recorded for exchange order id " + exchangeOrderId);
  }
}
