package com.example.rdsbroker.core.privileges;

/** PostgreSQL identifier and literal quoting. */
public final class PgQuoting {

  private PgQuoting() {}

  /** Double-quotes an identifier, doubling embedded quotes. Input is cut at the first NUL. */
  public static String quoteIdentifier(final String name) {
    final var nul = name.indexOf('\0');
    final var safe = nul >= 0 ? name.substring(0, nul) : name;
    return '"' + safe.replace("\"", "\"\"") + '"';
  }

  /**
   * Single-quotes a literal, doubling embedded quotes. Literals holding a backslash become
   * escape-string literals ({@code E'...'}) with the backslashes doubled.
   */
  public static String quoteLiteral(final String literal) {
    final var doubled = literal.replace("'", "''");
    if (doubled.indexOf('\\') >= 0) {
      return " E'" + doubled.replace("\\", "\\\\") + "'";
    }
    return "'" + doubled + "'";
  }
}
