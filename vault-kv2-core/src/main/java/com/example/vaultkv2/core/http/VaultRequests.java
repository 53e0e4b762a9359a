package com.example.vaultkv2.core.http;

import com.example.vaultkv2.core.connection.VaultConnection;
import com.example.vaultkv2.core.kv.CheckAndSet;
import com.example.vaultkv2.core.kv.SecretData;
import com.example.vaultkv2.core.kv.SecretPath;
import com.example.vaultkv2.core.kv.SecretVersion;
import com.example.vaultkv2.core.kv.SecretVersions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the requests of the KV version 2 API.
 *
 * <p>URLs have the form {@code <address>v1/<engine>/<segment>/<path>}. Every request carries the
 * {@code X-Vault-Token} header; requests with a body also carry {@code Content-Type:
 * application/json}.
 *
 * <p>Construction never fails. Versions must not be negative.
 */
public final class VaultRequests {

  public static final String TOKEN_HEADER = "X-Vault-Token";
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String APPLICATION_JSON = "application/json";

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private VaultRequests() {}

  /**
   * {@code GET data/<path>[?version=n]}.
   *
   * @param connection the connection
   * @param path secret path
   * @param version version to read, null for the current one
   * @return the request
   */
  public static VaultRequest readSecret(
      final VaultConnection connection, final SecretPath path, final SecretVersion version) {
    final var query = version == null ? "" : "?version=" + version.version();
    return request(connection, "GET", OperationSegment.DATA, path, query, null);
  }

  /**
   * {@code POST data/<path>} with {@code {"options":{"cas":n?},"data":{...}}}.
   *
   * @param connection the connection
   * @param cas check-and-set mode
   * @param path secret path
   * @param data secret payload
   * @return the request
   */
  public static VaultRequest writeSecret(
      final VaultConnection connection,
      final CheckAndSet cas,
      final SecretPath path,
      final SecretData data) {
    final var body = NODES.objectNode();
    final var options = body.putObject("options");
    cas.cas().ifPresent(value -> options.put("cas", value));
    final var payload = body.putObject("data");
    data.data().forEach(payload::put);
    return request(connection, "POST", OperationSegment.DATA, path, "", body);
  }

  /** {@code DELETE data/<path>}: soft-deletes the current version. */
  public static VaultRequest deleteSecret(final VaultConnection connection, final SecretPath path) {
    return request(connection, "DELETE", OperationSegment.DATA, path, "", null);
  }

  /**
   * {@code POST delete|undelete|destroy/<path>} with {@code {"versions":[...]}}.
   *
   * @param connection the connection
   * @param segment one of {@link OperationSegment#DELETE}, {@link OperationSegment#UNDELETE},
   *     {@link OperationSegment#DESTROY}
   * @param path secret path
   * @param versions targeted versions
   * @return the request
   */
  public static VaultRequest secretVersions(
      final VaultConnection connection,
      final OperationSegment segment,
      final SecretPath path,
      final SecretVersions versions) {
    final var body = NODES.objectNode();
    final var array = body.putArray("versions");
    versions.versions().forEach(version -> array.add(version.version()));
    return request(connection, "POST", segment, path, "", body);
  }

  /** {@code DELETE metadata/<path>}: removes every version and the metadata. */
  public static VaultRequest destroySecret(
      final VaultConnection connection, final SecretPath path) {
    return request(connection, "DELETE", OperationSegment.METADATA, path, "", null);
  }

  public static VaultRequest readMetadata(
      final VaultConnection connection, final SecretPath path) {
    return request(connection, "GET", OperationSegment.METADATA, path, "", null);
  }

  public static VaultRequest listSecrets(final VaultConnection connection, final SecretPath path) {
    return request(connection, "GET", OperationSegment.METADATA, path, "?list=true", null);
  }

  /** {@code POST config} with the engine-wide defaults. */
  public static VaultRequest engineConfig(
      final VaultConnection connection, final int maxVersions, final boolean casRequired) {
    return request(
        connection, "POST", OperationSegment.CONFIG, null, "", config(maxVersions, casRequired));
  }

  /** {@code POST metadata/<path>} overriding the engine defaults for one secret. */
  public static VaultRequest secretConfig(
      final VaultConnection connection,
      final SecretPath path,
      final int maxVersions,
      final boolean casRequired) {
    return request(
        connection, "POST", OperationSegment.METADATA, path, "", config(maxVersions, casRequired));
  }

  private static ObjectNode config(final int maxVersions, final boolean casRequired) {
    return NODES.objectNode().put("max_versions", maxVersions).put("cas_required", casRequired);
  }

  static URI uri(
      final VaultConnection connection,
      final OperationSegment segment,
      final SecretPath path,
      final String query) {
    final var url = new StringBuilder(connection.address());
    url.append("v1/").append(connection.enginePath()).append('/').append(segment.segment());
    if (path != null) url.append('/').append(encodePath(path.path()));
    return URI.create(url.append(query).toString());
  }

  // encodes each segment, keeping the separators and a trailing folder slash
  static String encodePath(final String path) {
    return Arrays.stream(path.split("/", -1))
        .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
        .collect(Collectors.joining("/"));
  }

  private static VaultRequest request(
      final VaultConnection connection,
      final String method,
      final OperationSegment segment,
      final SecretPath path,
      final String query,
      final JsonNode body) {
    final var headers =
        body == null
            ? Map.of(TOKEN_HEADER, connection.tokenValue())
            : Map.of(TOKEN_HEADER, connection.tokenValue(), CONTENT_TYPE, APPLICATION_JSON);
    return new VaultRequest(method, uri(connection, segment, path, query), headers, body);
  }
}
