package com.example;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultkv2.core.Result;
import com.example.vaultkv2.core.VaultKv2Client;
import com.example.vaultkv2.core.connection.VaultConnection;
import com.example.vaultkv2.core.kv.CheckAndSet;
import com.example.vaultkv2.core.kv.SecretData;
import com.example.vaultkv2.core.kv.SecretMetadata;
import com.example.vaultkv2.core.kv.SecretPath;
import com.example.vaultkv2.core.kv.SecretVersion;
import com.example.vaultkv2.core.kv.VaultKey;
import java.util.List;
import java.util.Map;

/** Demo application storing a secret in a KV version 2 engine and reading it back. */
public class App {

  private static final System.Logger logger = System.getLogger(App.class.getName());

  private final VaultKv2Client client;

  /**
   * Constructs the application on an already resolved connection.
   *
   * @param connection the connection to the Vault server
   */
  public App(final VaultConnection connection) {
    this.client = new VaultKv2Client(connection);
  }

  /**
   * Entry point. Resolves the server address from {@code vault.addr} or {@code VAULT_ADDR} and the
   * token from {@code ~/.vault-token}, then writes, reads, lists and inspects {@code demo/app}.
   *
   * @param args optional engine mount path, {@code secret} by default
   */
  public static void main(final String[] args) {
    final var enginePath = args.length > 0 ? args[0] : "secret";
    final var connection = VaultConnection.builder().enginePath(enginePath).connect();
    final var app = new App(connection.orElseThrow());
    final var path = new SecretPath("demo/app");

    app.store(path, new SecretData(Map.of("password", "s3cr3t")))
        .flatMap(version -> app.read(path))
        .onSuccess(data -> logger.log(DEBUG, "Read keys %s".formatted(data.data().keySet())));
    app.list(new SecretPath("demo"))
        .onSuccess(keys -> logger.log(DEBUG, "Listed %s".formatted(keys)));
    app.history(path)
        .map(SecretMetadata::currentVersion)
        .onSuccess(current -> logger.log(DEBUG, "Current version %s".formatted(current)));
  }

  /**
   * Writes a new version of the secret, whatever its current version.
   *
   * @param path the secret
   * @param data the payload
   * @return the written version number
   */
  public Result<Integer> store(final SecretPath path, final SecretData data) {
    return client
        .putSecret(CheckAndSet.WRITE_ALLOWED, path, data)
        .map(SecretVersion::version)
        .onFailure(
            error ->
                logger.log(WARNING, "Write of %s failed: %s".formatted(path, error.message())));
  }

  public Result<SecretData> read(final SecretPath path) {
    return client
        .getSecret(path)
        .onFailure(
            error -> logger.log(WARNING, "Read of %s failed: %s".formatted(path, error.message())));
  }

  public Result<List<VaultKey>> list(final SecretPath folder) {
    return client.secretsList(folder);
  }

  public Result<SecretMetadata> history(final SecretPath path) {
    return client.readSecretMetadata(path);
  }
}
