package com.example.rdsbroker.core.tags;

import java.util.Objects;

/**
 * One provider-side resource tag.
 *
 * @param key tag key
 * @param value tag value, empty when the provider reports none
 */
public record Tag(String key, String value) {

  public Tag {
    Objects.requireNonNull(key, "key");
    value = value == null ? "" : value;
  }
}
