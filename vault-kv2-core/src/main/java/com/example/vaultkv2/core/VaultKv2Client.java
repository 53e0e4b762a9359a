package com.example.vaultkv2.core;

import com.example.vaultkv2.core.connection.VaultConnection;
import com.example.vaultkv2.core.http.OperationSegment;
import com.example.vaultkv2.core.http.VaultRequest;
import com.example.vaultkv2.core.http.VaultRequests;
import com.example.vaultkv2.core.http.VaultResponses;
import com.example.vaultkv2.core.http.VaultTransport;
import com.example.vaultkv2.core.kv.CheckAndSet;
import com.example.vaultkv2.core.kv.SecretData;
import com.example.vaultkv2.core.kv.SecretMetadata;
import com.example.vaultkv2.core.kv.SecretPath;
import com.example.vaultkv2.core.kv.SecretVersion;
import com.example.vaultkv2.core.kv.SecretVersions;
import com.example.vaultkv2.core.kv.VaultKey;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Client for the KV version 2 secrets engine mounted on one {@link VaultConnection}.
 *
 * <p>Each operation performs one HTTP round trip and never throws for expected failures: value
 * returning operations answer a {@link Result}, effect-only operations an {@code
 * Optional<VaultError>} that is empty on success.
 *
 * <pre>{@code
 * var client = new VaultKv2Client(connection);
 * client.putSecret(CheckAndSet.CREATE_ONLY, new SecretPath("app/db"),
 *     new SecretData(Map.of("password", "s3cr3t")));
 * SecretData data = client.getSecret(new SecretPath("app/db")).orElseThrow();
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads.
 *
 * @param connection the connection all requests go through
 */
public record VaultKv2Client(VaultConnection connection) {

  public VaultKv2Client {
    Objects.requireNonNull(connection, "connection");
  }

  /**
   * Sets the engine-wide defaults.
   *
   * @param maxVersions number of versions kept per secret
   * @param casRequired whether every write must carry a check-and-set version
   * @return the raw response document
   */
  public Result<JsonNode> kvEngineConfig(final int maxVersions, final boolean casRequired) {
    return exchange(VaultRequests.engineConfig(connection, maxVersions, casRequired));
  }

  /**
   * Overrides the engine defaults for one secret.
   *
   * @param path the secret
   * @param maxVersions number of versions kept for this secret
   * @param casRequired whether writes to this secret must carry a check-and-set version
   * @return the raw response document
   */
  public Result<JsonNode> secretConfig(
      final SecretPath path, final int maxVersions, final boolean casRequired) {
    return exchange(VaultRequests.secretConfig(connection, path, maxVersions, casRequired));
  }

  /**
   * Reads the current version of a secret.
   *
   * @param path the secret
   * @return the secret payload
   */
  public Result<SecretData> getSecret(final SecretPath path) {
    return exchange(VaultRequests.readSecret(connection, path, null))
        .flatMap(VaultResponses::secretData);
  }

  /**
   * Reads one version of a secret.
   *
   * @param path the secret
   * @param version the version to read
   * @return the secret payload
   */
  public Result<SecretData> getSecret(final SecretPath path, final SecretVersion version) {
    return exchange(VaultRequests.readSecret(connection, path, version))
        .flatMap(VaultResponses::secretData);
  }

  /**
   * Writes a new version of a secret.
   *
   * @param cas check-and-set mode
   * @param path the secret
   * @param data the payload
   * @return the version created by the write
   */
  public Result<SecretVersion> putSecret(
      final CheckAndSet cas, final SecretPath path, final SecretData data) {
    return exchange(VaultRequests.writeSecret(connection, cas, path, data))
        .flatMap(VaultResponses::writtenVersion);
  }

  /** Soft-deletes the current version of a secret. */
  public Optional<VaultError> deleteSecret(final SecretPath path) {
    return exchange(VaultRequests.deleteSecret(connection, path)).error();
  }

  /** Soft-deletes the given versions of a secret. */
  public Optional<VaultError> deleteSecretVersions(
      final SecretPath path, final SecretVersions versions) {
    return exchange(
            VaultRequests.secretVersions(connection, OperationSegment.DELETE, path, versions))
        .error();
  }

  /** Restores soft-deleted versions of a secret. */
  public Optional<VaultError> unDeleteSecretVersions(
      final SecretPath path, final SecretVersions versions) {
    return exchange(
            VaultRequests.secretVersions(connection, OperationSegment.UNDELETE, path, versions))
        .error();
  }

  /** Permanently deletes a secret: every version and its metadata. */
  public Optional<VaultError> destroySecret(final SecretPath path) {
    return exchange(VaultRequests.destroySecret(connection, path)).error();
  }

  /**
   * Permanently deletes the data of the given versions. The service confirms without any
   * structured payload, so the decoded document is returned as is.
   *
   * @param path the secret
   * @param versions versions to destroy
   * @return the raw response document
   */
  public Result<JsonNode> destroySecretVersions(
      final SecretPath path, final SecretVersions versions) {
    return exchange(
        VaultRequests.secretVersions(connection, OperationSegment.DESTROY, path, versions));
  }

  /**
   * Lists the secrets and folders under a path. Folders end with a slash.
   *
   * @param path the folder to list
   * @return the keys in service order
   */
  public Result<List<VaultKey>> secretsList(final SecretPath path) {
    return exchange(VaultRequests.listSecrets(connection, path)).flatMap(VaultResponses::keys);
  }

  /**
   * Reads the version history of a secret.
   *
   * @param path the secret
   * @return the metadata
   */
  public Result<SecretMetadata> readSecretMetadata(final SecretPath path) {
    return exchange(VaultRequests.readMetadata(connection, path))
        .flatMap(VaultResponses::metadata);
  }

  /**
   * Reads the current version number of a secret.
   *
   * @param path the secret
   * @return the current version
   */
  public Result<SecretVersion> currentSecretVersion(final SecretPath path) {
    return exchange(VaultRequests.readMetadata(connection, path))
        .flatMap(VaultResponses::currentVersion);
  }

  private Result<JsonNode> exchange(final VaultRequest request) {
    return VaultTransport.send(connection, request).flatMap(VaultResponses::envelope);
  }
}
