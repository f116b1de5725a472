package com.example.rdsbroker.core.engines;

import com.example.rdsbroker.core.credentials.Credential;
import java.util.List;

/**
 * Administrative session against one database server.
 *
 * <p>A driver is opened once, used by a single caller, then closed. Every failure surfaces as a
 * {@link com.example.rdsbroker.core.errors.BrokerException}; a rejected login always as {@link
 * com.example.rdsbroker.core.errors.AuthenticationFailedException}.
 */
public interface EngineDriver extends AutoCloseable {

  /**
   * Connects as an administrative user.
   *
   * @throws com.example.rdsbroker.core.errors.AuthenticationFailedException if the login is
   *     rejected
   */
  void open(ConnectionSpec spec);

  /** Releases the session; safe to call when not open. */
  @Override
  void close();

  /**
   * Creates (or re-creates) the login of a binding.
   *
   * @param bindingId stable binding identifier the user name is derived from
   * @param database database to grant access to
   * @param bindParameters engine-specific JSON parameters, may be null
   * @return the login
   */
  Credential createUser(String bindingId, String database, String bindParameters);

  /** Removes the login of a binding. Missing users are not an error. */
  void dropUser(String bindingId, String database);

  /** Drops every non-administrative login on the server. */
  void resetState();

  /** Connection URI handed to applications. */
  String uri(ConnectionSpec spec);

  /** JDBC URL handed to applications, credentials included. */
  String jdbcUri(ConnectionSpec spec);

  default void createExtensions(final List<String> extensions) {}

  default void dropExtensions(final List<String> extensions) {}
}
