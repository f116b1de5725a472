package com.example.rdsbroker.core.errors;

/** The provider reports that the requested instance, snapshot or resource does not exist. */
public class NotFoundException extends BrokerException {

  public NotFoundException(final String message) {
    super(message);
  }

  public NotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
