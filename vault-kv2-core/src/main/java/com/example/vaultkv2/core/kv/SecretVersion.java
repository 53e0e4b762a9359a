package com.example.vaultkv2.core.kv;

/**
 * One revision of a secret. Versions start at 1; the KV engine uses 0 in check-and-set options to
 * mean "no version exists yet".
 *
 * <p>Callers must not construct negative versions. Values decoded from a server response are
 * checked before a {@code SecretVersion} is built.
 *
 * @param version the revision number
 */
public record SecretVersion(int version) implements Comparable<SecretVersion> {

  @Override
  public int compareTo(final SecretVersion other) {
    return Integer.compare(version, other.version);
  }

  @Override
  public String toString() {
    return Integer.toString(version);
  }
}
