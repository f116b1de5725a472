package com.example.rdsbroker.core.errors;

/** An engine version lookup matched zero or several provider records, or no usable target. */
public class AmbiguousVersionException extends BrokerException {

  public AmbiguousVersionException(final String message) {
    super(message);
  }
}
