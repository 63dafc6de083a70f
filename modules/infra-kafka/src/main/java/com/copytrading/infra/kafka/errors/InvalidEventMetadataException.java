package com.copytrading.infra.kafka.errors;

/** Raised for records that can never be processed, whatever the number of attempts. */
public class InvalidEventMetadataException extends RuntimeException {
  public InvalidEventMetadataException(String message) {
    super(message);
  }

  public InvalidEventMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
