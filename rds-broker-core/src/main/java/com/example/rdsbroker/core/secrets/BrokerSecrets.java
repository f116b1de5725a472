package com.example.rdsbroker.core.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Broker secrets as stored in AWS Secrets Manager.
 *
 * @param stateEncryptionKey key sealing engine-side password bookkeeping
 * @param masterPasswordSeed seed master passwords are derived from
 */
public record BrokerSecrets(
    @JsonProperty("state_encryption_key") String stateEncryptionKey,
    @JsonProperty("master_password_seed") String masterPasswordSeed) {

  public BrokerSecrets {
    Objects.requireNonNull(stateEncryptionKey, "state_encryption_key");
    Objects.requireNonNull(masterPasswordSeed, "master_password_seed");
  }

  @Override
  public String toString() {
    return "BrokerSecrets[REDACTED]";
  }
}
