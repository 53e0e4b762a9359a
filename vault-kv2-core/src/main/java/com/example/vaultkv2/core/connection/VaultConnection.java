package com.example.vaultkv2.core.connection;

import com.example.vaultkv2.core.Result;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable handle on one Vault server and KV engine mount.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Result<VaultConnection> connection = VaultConnection.builder()
 *     .address("https://vault.local.lan:8200/")
 *     .enginePath("secret")
 *     .connect();
 * }</pre>
 *
 * <p>Omitted address and token fall back to {@link ConnectionDefaults#environment()}: the {@code
 * VAULT_ADDR} variable and the {@code $HOME/.vault-token} file.
 *
 * @param address service base address, always ending with a slash
 * @param token bearer credential sent as {@code X-Vault-Token}
 * @param enginePath mount path of the KV engine, without leading or trailing slashes
 * @param httpClient client shared by every request made through this connection
 */
public record VaultConnection(
    String address, byte[] token, String enginePath, HttpClient httpClient) {

  public VaultConnection {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(enginePath, "enginePath");
    Objects.requireNonNull(httpClient, "httpClient");
    address = address.endsWith("/") ? address : address + "/";
    token = token.clone();
    enginePath = trimSlashes(enginePath);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public byte[] token() {
    return token.clone();
  }

  /**
   * Credential as header value.
   *
   * @return the token decoded as UTF-8
   */
  public String tokenValue() {
    return new String(token, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof VaultConnection that)) return false;
    return address.equals(that.address)
        && Arrays.equals(token, that.token)
        && enginePath.equals(that.enginePath)
        && httpClient.equals(that.httpClient);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(address, enginePath, httpClient);
    result = 31 * result + Arrays.hashCode(token);
    return result;
  }

  @Override
  public String toString() {
    return "VaultConnection[address=" + address + ", token=******, enginePath=" + enginePath + ']';
  }

  static String trimSlashes(final String path) {
    var trimmed = path.strip();
    while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }

  /**
   * Builder for {@link VaultConnection}. Only the engine path is required.
   *
   * <pre>{@code
   * var connection = VaultConnection.builder()
   *     .address("https://127.0.0.1:8200")
   *     .enginePath("secret")
   *     .token("s.xxxxx")
   *     .disableCertValidation(true)
   *     .connectTimeout(Duration.ofSeconds(3))
   *     .connect()
   *     .orElseThrow();
   * }</pre>
   */
  public static class Builder {
    private String address;
    private String enginePath;
    private String token;
    private boolean disableCertValidation;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private ConnectionDefaults defaults = ConnectionDefaults.environment();

    private Builder() {}

    /**
     * Sets the service address. When absent, {@link ConnectionDefaults#address()} is used.
     *
     * @param address base address such as {@code https://vault:8200}
     * @return this builder
     */
    public Builder address(final String address) {
      this.address = address;
      return this;
    }

    /**
     * Sets the KV engine mount path (required).
     *
     * @param enginePath mount path, e.g. {@code secret}
     * @return this builder
     */
    public Builder enginePath(final String enginePath) {
      this.enginePath = enginePath;
      return this;
    }

    /**
     * Sets the token. When absent, it is read from {@code <home>/.vault-token}.
     *
     * @param token the Vault token
     * @return this builder
     */
    public Builder token(final String token) {
      this.token = token;
      return this;
    }

    public Builder disableCertValidation(final boolean disableCertValidation) {
      this.disableCertValidation = disableCertValidation;
      return this;
    }

    /**
     * Sets the connect timeout of the HTTP client (default 10 seconds).
     *
     * @param connectTimeout timeout, must be positive
     * @return this builder
     */
    public Builder connectTimeout(final Duration connectTimeout) {
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero())
        throw new IllegalArgumentException("connectTimeout must be positive");
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Replaces the source of default address and home directory.
     *
     * @param defaults the defaults provider
     * @return this builder
     */
    public Builder defaults(final ConnectionDefaults defaults) {
      this.defaults = Objects.requireNonNull(defaults, "defaults");
      return this;
    }

    /**
     * Resolves the connection parameters and creates the HTTP client. No request is sent.
     *
     * @return the connection, or a configuration error
     */
    public Result<VaultConnection> connect() {
      return ConnectionResolver.resolve(
          address, enginePath, token, disableCertValidation, connectTimeout, defaults);
    }
  }
}
