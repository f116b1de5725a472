package com.example.rdsbroker.core.engines;

import com.example.rdsbroker.core.errors.AuthenticationFailedException;
import com.example.rdsbroker.core.errors.BrokerException;
import com.example.rdsbroker.core.errors.DatabaseException;
import java.sql.SQLException;
import java.util.Locale;

/** Classifies and translates JDBC failures. */
final class SqlErrors {

  static final int MYSQL_ACCESS_DENIED = 1045;
  static final int MSSQL_LOGIN_FAILED = 18456;

  private static final String[] AUTH_KEYWORDS =
      new String[] {
        "access denied",
        "authentication failed",
        "password authentication failed",
        "invalid password",
        "login failed"
      };

  private SqlErrors() {}

  /**
   * Finds the first SQLException in a throwable cause chain, following chained exceptions to the
   * last one.
   *
   * @return the exception found, or null
   */
  static SQLException findSqlException(final Throwable t) {
    Throwable cur = t;
    SQLException last = null;
    while (cur != null) {
      if (cur instanceof SQLException sql) {
        if (last == null) last = sql;
        SQLException next = sql.getNextException();
        while (next != null) {
          last = next;
          next = next.getNextException();
        }
      }
      cur = cur.getCause();
    }
    return last;
  }

  /**
   * Detects rejected logins: SQLState 28000 or 28P01, MySQL error 1045, SQL Server error 18456,
   * or a well-known message.
   */
  static boolean isAuthError(final SQLException e) {
    if (e == null) return false;

    final var state = e.getSQLState();
    if ("28000".equals(state) || "28P01".equals(state)) return true;
    if (e.getErrorCode() == MYSQL_ACCESS_DENIED || e.getErrorCode() == MSSQL_LOGIN_FAILED)
      return true;

    final var msg = e.getMessage();
    if (msg != null) {
      final var lower = msg.toLowerCase(Locale.ROOT);
      for (final var keyword : AUTH_KEYWORDS) if (lower.contains(keyword)) return true;
    }
    return false;
  }

  /** Translates a failure raised while opening a session. */
  static BrokerException onOpen(final String username, final Throwable t) {
    if (t instanceof BrokerException broker) return broker;
    final var sql = findSqlException(t);
    if (sql == null) return new BrokerException("failed to connect as " + username, t);
    if (isAuthError(sql)) return new AuthenticationFailedException(username, t);
    return new DatabaseException("failed to connect as " + username, sql);
  }

  static BrokerException translate(final String what, final SQLException e) {
    return new DatabaseException(what, e);
  }
}
