package com.example.vaultkv2.core.kv;

import java.util.Arrays;
import java.util.List;

/**
 * Versions targeted by a bulk delete, undelete or destroy request. Insertion order is preserved.
 *
 * @param versions the versions, in request order
 */
public record SecretVersions(List<SecretVersion> versions) {

  public SecretVersions {
    versions = List.copyOf(versions);
  }

  /**
   * Builds a version list from plain revision numbers.
   *
   * @param versions revision numbers
   * @return the wrapped versions
   */
  public static SecretVersions of(final int... versions) {
    return new SecretVersions(Arrays.stream(versions).mapToObj(SecretVersion::new).toList());
  }
}
