package com.example.rdsbroker.core.privileges;

/** Direction of a compiled privilege statement. */
public enum PrivilegeAction {
  GRANT("TO"),
  REVOKE("FROM");

  private final String preposition;

  PrivilegeAction(final String preposition) {
    this.preposition = preposition;
  }

  public String preposition() {
    return preposition;
  }
}
