package com.example.rdsbroker.core.instances;

import java.util.Objects;

/** Network address of an available instance. */
public record Endpoint(String address, int port) {

  public Endpoint {
    Objects.requireNonNull(address, "address");
  }
}
