package com.example.rdsbroker.core.privileges;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Kinds of object a {@link PrivilegeSpec} can address, with the verbs legal on each. */
public enum TargetType {
  TABLE(
      Set.of("SELECT", "INSERT", "UPDATE", "DELETE", "TRUNCATE", "REFERENCES", "TRIGGER", "ALL"),
      Set.of("SELECT", "INSERT", "UPDATE", "REFERENCES", "ALL")),
  SEQUENCE(Set.of("USAGE", "SELECT", "UPDATE", "ALL"), Set.of()),
  DATABASE(Set.of("TEMPORARY", "TEMP", "ALL"), Set.of()),
  SCHEMA(Set.of("USAGE", "ALL"), Set.of());

  private final Set<String> privileges;
  private final Set<String> columnPrivileges;

  TargetType(final Set<String> privileges, final Set<String> columnPrivileges) {
    this.privileges = privileges;
    this.columnPrivileges = columnPrivileges;
  }

  /** Case-insensitive lookup; empty for anything unrecognized. */
  public static Optional<TargetType> parse(final String value) {
    if (value == null) return Optional.empty();
    try {
      return Optional.of(valueOf(value.toUpperCase(Locale.ROOT)));
    } catch (final IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  boolean allows(final String privilege) {
    return privileges.contains(privilege);
  }

  boolean allowsOnColumns(final String privilege) {
    return columnPrivileges.contains(privilege);
  }

  String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
