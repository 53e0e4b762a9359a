package com.example.vaultkv2.core.kv;

import java.util.Map;

/**
 * Payload of one secret version: string keys mapped to string values.
 *
 * @param data the key/value pairs; the map is copied and unmodifiable
 */
public record SecretData(Map<String, String> data) {

  public SecretData {
    data = Map.copyOf(data);
  }

  /**
   * Returns the value stored under the given key.
   *
   * @param key the key
   * @return the value, or null if absent
   */
  public String get(final String key) {
    return data.get(key);
  }

  @Override
  public String toString() {
    // values are secrets
    return "SecretData" + data.keySet();
  }
}
