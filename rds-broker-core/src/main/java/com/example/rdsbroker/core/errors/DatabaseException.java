package com.example.rdsbroker.core.errors;

import java.sql.SQLException;

/** A statement failed inside a managed database for a reason other than a rejected login. */
public class DatabaseException extends BrokerException {

  private final String sqlState;
  private final int vendorCode;

  public DatabaseException(final String message, final SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.sqlState = cause.getSQLState();
    this.vendorCode = cause.getErrorCode();
  }

  public String sqlState() {
    return sqlState;
  }

  public int vendorCode() {
    return vendorCode;
  }
}
