package com.example.vaultkv2.core.kv;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between the library's secret types and plain Java collections. */
public final class SecretConversions {

  private SecretConversions() {}

  /**
   * Builds secret data from key/value pairs. When a key repeats, the last pair wins.
   *
   * @param pairs key/value pairs
   * @return the secret data
   */
  public static SecretData toSecretData(final List<Map.Entry<String, String>> pairs) {
    final var data = new LinkedHashMap<String, String>();
    pairs.forEach(pair -> data.put(pair.getKey(), pair.getValue()));
    return new SecretData(data);
  }

  /**
   * Flattens secret data into key/value pairs, in no particular order.
   *
   * @param secretData the secret data
   * @return the pairs
   */
  public static List<Map.Entry<String, String>> fromSecretData(final SecretData secretData) {
    return secretData.data().entrySet().stream()
        .map(e -> Map.entry(e.getKey(), e.getValue()))
        .toList();
  }

  public static SecretVersions toSecretVersions(final List<Integer> versions) {
    return new SecretVersions(versions.stream().map(SecretVersion::new).toList());
  }

  public static List<Integer> fromSecretVersions(final SecretVersions versions) {
    return versions.versions().stream().map(SecretVersion::version).toList();
  }
}
