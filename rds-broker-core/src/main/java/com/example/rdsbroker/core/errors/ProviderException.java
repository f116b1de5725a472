package com.example.rdsbroker.core.errors;

import java.util.Objects;

/** Any provider API failure that is not a missing resource. */
public class ProviderException extends BrokerException {

  private final String code;
  private final String providerMessage;

  public ProviderException(final String code, final String providerMessage, final Throwable cause) {
    super(code + ": " + providerMessage, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.providerMessage = providerMessage;
  }

  /** Provider error code, e.g. {@code InvalidDBInstanceState}. */
  public String code() {
    return code;
  }

  public String providerMessage() {
    return providerMessage;
  }
}
