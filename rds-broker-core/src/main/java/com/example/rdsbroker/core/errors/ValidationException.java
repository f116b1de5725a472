package com.example.rdsbroker.core.errors;

/** Caller supplied privilege specs or bind parameters that can never be applied. */
public class ValidationException extends BrokerException {

  public ValidationException(final String message) {
    super(message);
  }

  public ValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
