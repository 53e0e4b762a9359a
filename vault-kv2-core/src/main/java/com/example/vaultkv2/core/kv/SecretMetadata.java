package com.example.vaultkv2.core.kv;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Version history of a secret as reported by the metadata endpoint. Built fresh from every
 * metadata response.
 *
 * @param versions history entries ordered by version
 * @param currentVersion latest version of the secret
 * @param oldestVersion oldest version still tracked
 * @param maxVersions per-secret version limit, empty when not reported
 * @param casRequired whether writes to this secret must carry a check-and-set version
 * @param createdTime ISO-8601 creation time of the secret, empty when not reported
 * @param updatedTime ISO-8601 time of the last write, empty when not reported
 */
public record SecretMetadata(
    Map<SecretVersion, Metadata> versions,
    SecretVersion currentVersion,
    SecretVersion oldestVersion,
    OptionalInt maxVersions,
    boolean casRequired,
    String createdTime,
    String updatedTime) {

  public SecretMetadata {
    versions = Collections.unmodifiableSortedMap(new TreeMap<>(versions));
    createdTime = createdTime == null ? "" : createdTime;
    updatedTime = updatedTime == null ? "" : updatedTime;
  }

  /**
   * Looks up the history entry of one version.
   *
   * @param version the version
   * @return its metadata, empty if the version is unknown
   */
  public Optional<Metadata> version(final SecretVersion version) {
    return Optional.ofNullable(versions.get(version));
  }
}
