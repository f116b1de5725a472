package com.example.rdsbroker.core.privileges;

import java.util.Locale;
import java.util.Optional;

/** What a non-owner binding can reach before its explicit privilege list is applied. */
public enum DefaultPrivilegePolicy {
  /** Everything is granted, the binding's list revokes. */
  GRANT,
  /** Nothing but CONNECT is granted, the binding's list grants. */
  REVOKE;

  static Optional<DefaultPrivilegePolicy> parse(final String value) {
    if (value == null) return Optional.empty();
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "grant" -> Optional.of(GRANT);
      case "revoke" -> Optional.of(REVOKE);
      default -> Optional.empty();
    };
  }
}
