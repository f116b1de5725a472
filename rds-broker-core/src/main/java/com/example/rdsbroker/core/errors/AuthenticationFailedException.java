package com.example.rdsbroker.core.errors;

/**
 * A SQL login was rejected.
 *
 * <p>Raised by every engine driver in the same shape so callers never match vendor error codes.
 */
public class AuthenticationFailedException extends BrokerException {

  public AuthenticationFailedException(final String username, final Throwable cause) {
    super("Login failed for user '" + username + "'", cause);
  }
}
