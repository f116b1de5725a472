package com.example.rdsbroker.core.errors;

/** Stored state failed authenticated decryption: wrong key or tampered ciphertext. */
public class DecryptionFailedException extends BrokerException {

  public DecryptionFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
