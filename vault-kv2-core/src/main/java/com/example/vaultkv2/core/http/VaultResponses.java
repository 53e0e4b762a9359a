package com.example.vaultkv2.core.http;

import com.example.vaultkv2.core.Result;
import com.example.vaultkv2.core.VaultError.DecodeError;
import com.example.vaultkv2.core.VaultError.ServiceError;
import com.example.vaultkv2.core.kv.Metadata;
import com.example.vaultkv2.core.kv.SecretData;
import com.example.vaultkv2.core.kv.SecretMetadata;
import com.example.vaultkv2.core.kv.SecretVersion;
import com.example.vaultkv2.core.kv.VaultKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Decodes KV version 2 responses.
 *
 * <p>{@link #envelope(VaultResponse)} turns a raw response into the parsed JSON document or a
 * {@link ServiceError}. The remaining methods extract typed payloads from a successful document
 * and report a {@link DecodeError} when the expected field is missing or has the wrong JSON type.
 */
public final class VaultResponses {

  private VaultResponses() {}

  /**
   * Parses the response envelope.
   *
   * <ul>
   *   <li>2xx with empty body: success with {@link NullNode}
   *   <li>2xx with JSON body: success with the parsed document
   *   <li>2xx with a body that is not JSON: {@link DecodeError}
   *   <li>any other status: {@link ServiceError}
   * </ul>
   *
   * @param response raw response
   * @return the document, or an error
   */
  public static Result<JsonNode> envelope(final VaultResponse response) {
    if (!response.isSuccess()) return Result.failure(serviceError(response));
    if (response.body().isBlank()) return Result.success(NullNode.getInstance());
    try {
      return Result.success(VaultJson.mapper().readTree(response.body()));
    } catch (final JsonProcessingException e) {
      return Result.failure(
          new DecodeError("Response body is not valid JSON: " + e.getOriginalMessage()));
    }
  }

  /**
   * Builds the error of a rejected request from its {@code {"errors":[...]}} body. When the body
   * cannot be parsed or carries no messages, the error keeps the status and the raw body.
   *
   * @param response raw response with a status outside 200–299
   * @return the service error
   */
  static ServiceError serviceError(final VaultResponse response) {
    final var errors = new ArrayList<String>();
    try {
      final var node = VaultJson.mapper().readTree(response.body());
      if (node != null)
        node.path("errors")
            .forEach(
                message -> {
                  if (message.isTextual()) errors.add(message.asText());
                });
    } catch (final JsonProcessingException e) {
      return new ServiceError(response.status(), List.of(), response.body());
    }
    return new ServiceError(response.status(), errors, response.body());
  }

  /** Extracts {@code data.data} of a secret read. */
  public static Result<SecretData> secretData(final JsonNode document) {
    final var node = document.path("data").path("data");
    if (!node.isObject()) return missing("data.data", "an object");
    final var data = new LinkedHashMap<String, String>();
    final var fields = node.fields();
    while (fields.hasNext()) {
      final var field = fields.next();
      if (!field.getValue().isTextual())
        return Result.failure(
            new DecodeError("Expected a string value for key " + field.getKey() + " in data.data"));
      data.put(field.getKey(), field.getValue().asText());
    }
    return Result.success(new SecretData(data));
  }

  /** Extracts {@code data.version} of a secret write. */
  public static Result<SecretVersion> writtenVersion(final JsonNode document) {
    return version(document.path("data").path("version"), "data.version");
  }

  /** Extracts {@code data.current_version} of a metadata read. */
  public static Result<SecretVersion> currentVersion(final JsonNode document) {
    return version(document.path("data").path("current_version"), "data.current_version");
  }

  /** Extracts {@code data.keys} of a listing. */
  public static Result<List<VaultKey>> keys(final JsonNode document) {
    final var node = document.path("data").path("keys");
    if (!node.isArray()) return missing("data.keys", "an array");
    final var keys = new ArrayList<VaultKey>();
    for (final var key : node) {
      if (!key.isTextual()) return missing("data.keys", "an array of strings");
      keys.add(new VaultKey(key.asText()));
    }
    return Result.success(List.copyOf(keys));
  }

  /**
   * Extracts the version history of a metadata read. {@code data.current_version} and {@code
   * data.versions} are required; when {@code data.oldest_version} is absent the smallest listed
   * version is used.
   *
   * @param document successful metadata document
   * @return the metadata, or a decode error
   */
  public static Result<SecretMetadata> metadata(final JsonNode document) {
    final var data = document.path("data");
    final var versionsNode = data.path("versions");
    if (!versionsNode.isObject()) return missing("data.versions", "an object");

    final var versions = new TreeMap<SecretVersion, Metadata>();
    final var fields = versionsNode.fields();
    while (fields.hasNext()) {
      final var field = fields.next();
      final var version = parseVersionKey(field.getKey());
      if (version.isFailure()) return Result.failure(version.error().orElseThrow());
      if (!field.getValue().isObject())
        return missing("data.versions." + field.getKey(), "an object");
      try {
        versions.put(
            version.orElseThrow(),
            VaultJson.mapper().treeToValue(field.getValue(), Metadata.class));
      } catch (final JsonProcessingException e) {
        return Result.failure(
            new DecodeError(
                "Invalid metadata of version " + field.getKey() + ": " + e.getOriginalMessage()));
      }
    }

    final var oldestNode = data.path("oldest_version");
    final var oldest =
        oldestNode.isMissingNode()
            ? Result.success(versions.isEmpty() ? new SecretVersion(0) : versions.firstKey())
            : version(oldestNode, "data.oldest_version");
    final var maxVersionsNode = data.path("max_versions");
    final var maxVersions =
        maxVersionsNode.isMissingNode() || maxVersionsNode.isNull()
            ? Result.success(OptionalInt.empty())
            : version(maxVersionsNode, "data.max_versions").map(v -> OptionalInt.of(v.version()));

    return currentVersion(document)
        .flatMap(
            current ->
                oldest.flatMap(
                    oldestVersion ->
                        maxVersions.map(
                            max ->
                                new SecretMetadata(
                                    versions,
                                    current,
                                    oldestVersion,
                                    max,
                                    data.path("cas_required").asBoolean(false),
                                    data.path("created_time").asText(""),
                                    data.path("updated_time").asText("")))));
  }

  private static Result<SecretVersion> parseVersionKey(final String key) {
    try {
      final var version = Integer.parseInt(key);
      if (version >= 0) return Result.success(new SecretVersion(version));
    } catch (final NumberFormatException e) {
      return Result.failure(new DecodeError("Invalid version key in data.versions: " + key));
    }
    return Result.failure(new DecodeError("Negative version key in data.versions: " + key));
  }

  private static Result<SecretVersion> version(final JsonNode node, final String field) {
    if (node.isMissingNode() || node.isNull()) return missing(field, "a non-negative integer");
    if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 0)
      return Result.failure(
          new DecodeError("Expected a non-negative integer at " + field + ", got " + node));
    return Result.success(new SecretVersion(node.intValue()));
  }

  private static <T> Result<T> missing(final String field, final String expected) {
    return Result.failure(new DecodeError("Expected " + expected + " at " + field));
  }
}
