package com.example.vaultkv2.core.kv;

import java.util.Objects;

/**
 * Location of a secret inside the mounted KV engine, e.g. {@code "app/db"}.
 *
 * @param path the path relative to the engine mount, without leading slash
 */
public record SecretPath(String path) {

  public SecretPath {
    Objects.requireNonNull(path, "path");
    while (path.startsWith("/")) path = path.substring(1);
  }

  @Override
  public String toString() {
    return path;
  }
}
