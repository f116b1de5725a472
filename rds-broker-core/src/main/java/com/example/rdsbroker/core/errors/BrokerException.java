package com.example.rdsbroker.core.errors;

/** Base type of every failure raised by the broker core. */
public class BrokerException extends RuntimeException {

  public BrokerException(final String message) {
    super(message);
  }

  public BrokerException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
