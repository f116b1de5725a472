package com.example.rdsbroker.core.credentials;

import java.util.Objects;

/**
 * Login minted for a binding.
 *
 * @param username deterministic user name, see {@link CredentialVault#username}
 * @param password generated password
 * @param database database the login was granted on
 */
public record Credential(String username, String password, String database) {

  public Credential {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(database, "database");
  }

  @Override
  public String toString() {
    return "Credential[username=" + username + ", password=REDACTED, database=" + database + "]";
  }
}
