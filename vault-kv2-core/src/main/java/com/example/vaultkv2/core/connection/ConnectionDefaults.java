package com.example.vaultkv2.core.connection;

import java.util.Optional;

/**
 * Source of the default connection parameters used when the caller does not pass them
 * explicitly.
 *
 * <p>{@link #environment()} reads:
 *
 * <ul>
 *   <li>vault.addr / VAULT_ADDR – service base address
 *   <li>HOME – home directory holding the {@code .vault-token} file
 * </ul>
 */
public interface ConnectionDefaults {

  String ADDRESS_PROPERTY = "vault.addr";
  String ADDRESS_VARIABLE = "VAULT_ADDR";
  String HOME_VARIABLE = "HOME";

  /**
   * Default service address.
   *
   * @return the address, empty when not configured
   */
  Optional<String> address();

  /**
   * Home directory of the current user.
   *
   * @return the directory, empty when not configured
   */
  Optional<String> homeDirectory();

  /**
   * Defaults taken from system properties and the process environment.
   *
   * @return environment-backed defaults
   */
  static ConnectionDefaults environment() {
    return new ConnectionDefaults() {
      @Override
      public Optional<String> address() {
        return Optional.ofNullable(System.getProperty(ADDRESS_PROPERTY))
            .or(() -> Optional.ofNullable(System.getenv(ADDRESS_VARIABLE)))
            .filter(value -> !value.isBlank());
      }

      @Override
      public Optional<String> homeDirectory() {
        return Optional.ofNullable(System.getenv(HOME_VARIABLE)).filter(value -> !value.isBlank());
      }
    };
  }

  /**
   * Fixed defaults, mostly useful in tests.
   *
   * @param address default address, may be null
   * @param homeDirectory home directory, may be null
   * @return the defaults
   */
  static ConnectionDefaults of(final String address, final String homeDirectory) {
    return new ConnectionDefaults() {
      @Override
      public Optional<String> address() {
        return Optional.ofNullable(address);
      }

      @Override
      public Optional<String> homeDirectory() {
        return Optional.ofNullable(homeDirectory);
      }
    };
  }
}
