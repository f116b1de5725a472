package com.example.rdsbroker.core.errors;

/** A modification asked to move an instance to a different engine family. */
public class EngineMismatchException extends BrokerException {

  private final String currentEngine;
  private final String requestedEngine;

  public EngineMismatchException(final String currentEngine, final String requestedEngine) {
    super(
        String.format(
            "Migrating the RDS DB Instance engine from '%s' to '%s' is not supported",
            currentEngine, requestedEngine));
    this.currentEngine = currentEngine;
    this.requestedEngine = requestedEngine;
  }

  public String currentEngine() {
    return currentEngine;
  }

  public String requestedEngine() {
    return requestedEngine;
  }
}
