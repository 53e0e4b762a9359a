package com.example.vaultkv2.core.kv;

import java.util.Objects;

/**
 * Entry of a secrets listing: either a secret name or a folder, which Vault marks with a trailing
 * slash.
 *
 * @param key the key as returned by the service
 */
public record VaultKey(String key) {

  public VaultKey {
    Objects.requireNonNull(key, "key");
  }

  public boolean isFolder() {
    return key.endsWith("/");
  }

  @Override
  public String toString() {
    return key;
  }
}
