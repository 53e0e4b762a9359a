package com.example.vaultkv2.core.connection;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.vaultkv2.core.Result;
import com.example.vaultkv2.core.VaultError.ConfigurationError;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Resolves address, token and engine path into a {@link VaultConnection}.
 *
 * <p>The address comes from the explicit argument, else from {@link ConnectionDefaults#address()}.
 * The token comes from the explicit argument, else from the {@code .vault-token} file in {@link
 * ConnectionDefaults#homeDirectory()}. Every failure is returned as a {@link ConfigurationError}.
 */
public final class ConnectionResolver {

  static final String TOKEN_FILE = ".vault-token";

  private static final System.Logger LOGGER = System.getLogger(ConnectionResolver.class.getName());

  private ConnectionResolver() {}

  /**
   * Resolves a connection with default client settings.
   *
   * @param address explicit address, or null to use the defaults
   * @param enginePath KV engine mount path
   * @param token explicit token, or null to read the token file
   * @param disableCertValidation skip certificate and host name validation
   * @param defaults source of default address and home directory
   * @return the connection, or a configuration error
   */
  public static Result<VaultConnection> resolve(
      final String address,
      final String enginePath,
      final String token,
      final boolean disableCertValidation,
      final ConnectionDefaults defaults) {
    return resolve(
        address, enginePath, token, disableCertValidation, Duration.ofSeconds(10), defaults);
  }

  static Result<VaultConnection> resolve(
      final String address,
      final String enginePath,
      final String token,
      final boolean disableCertValidation,
      final Duration connectTimeout,
      final ConnectionDefaults defaults) {
    if (enginePath == null || VaultConnection.trimSlashes(enginePath).isEmpty())
      return Result.failure(new ConfigurationError("KV engine path must not be blank"));

    final var resolvedAddress =
        Optional.ofNullable(address).filter(value -> !value.isBlank()).or(defaults::address);
    if (resolvedAddress.isEmpty())
      return Result.failure(
          new ConfigurationError(
              "Environment variable " + ConnectionDefaults.ADDRESS_VARIABLE + " not set"));

    return validateAddress(resolvedAddress.get())
        .flatMap(
            validAddress ->
                resolveToken(token, defaults)
                    .flatMap(
                        tokenBytes ->
                            TlsSettings.httpClient(disableCertValidation, connectTimeout)
                                .map(
                                    client ->
                                        new VaultConnection(
                                            validAddress, tokenBytes, enginePath, client))))
        .onSuccess(connection -> LOGGER.log(DEBUG, "Resolved {0}", connection));
  }

  private static Result<String> validateAddress(final String address) {
    try {
      final var uri = new URI(address.strip());
      final var scheme = uri.getScheme();
      if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme)))
        return Result.failure(
            new ConfigurationError("Vault address must be an absolute http(s) URL: " + address));
      return Result.success(uri.toString());
    } catch (final URISyntaxException e) {
      return Result.failure(
          new ConfigurationError("Invalid Vault address " + address + ": " + e.getReason()));
    }
  }

  private static Result<byte[]> resolveToken(
      final String token, final ConnectionDefaults defaults) {
    if (token != null) return Result.success(token.getBytes(StandardCharsets.UTF_8));

    final var home = defaults.homeDirectory();
    if (home.isEmpty())
      return Result.failure(
          new ConfigurationError(
              "Environment variable " + ConnectionDefaults.HOME_VARIABLE + " not set"));

    final var tokenFile = Path.of(home.get(), TOKEN_FILE);
    if (!Files.isRegularFile(tokenFile))
      return Result.failure(new ConfigurationError("No Vault token file found at " + tokenFile));

    try {
      return Result.success(stripLineBreaks(Files.readAllBytes(tokenFile)));
    } catch (final IOException e) {
      LOGGER.log(WARNING, "Failed to read Vault token file " + tokenFile, e);
      return Result.failure(
          new ConfigurationError("Cannot read Vault token file " + tokenFile + ": " + e));
    }
  }

  // header values cannot carry line breaks, and token files usually end with one
  static byte[] stripLineBreaks(final byte[] content) {
    var end = content.length;
    while (end > 0 && (content[end - 1] == '\n' || content[end - 1] == '\r')) end--;
    return Arrays.copyOf(content, end);
  }
}
