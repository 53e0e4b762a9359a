package com.example.vaultkv2.core;

import java.util.List;
import java.util.Objects;

/**
 * Failure outcome of a Vault operation.
 *
 * <p>Every public operation reports failures as a value of this type instead of throwing:
 *
 * <ul>
 *   <li>{@link ConfigurationError} – missing address, credential, environment variable or token
 *       file; the operation was never attempted.
 *   <li>{@link TransportError} – network or TLS failure while performing the HTTP call.
 *   <li>{@link ServiceError} – the service answered with a status outside 200–299.
 *   <li>{@link DecodeError} – the service answered successfully but the body does not have the
 *       shape the operation expects.
 * </ul>
 */
public sealed interface VaultError {

  /**
   * Human readable description of the failure.
   *
   * @return the message
   */
  String message();

  /**
   * Connection parameters could not be resolved.
   *
   * @param message what is missing or invalid
   */
  record ConfigurationError(String message) implements VaultError {
    public ConfigurationError {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * The HTTP call itself failed.
   *
   * @param message description of the failure
   * @param cause underlying exception, may be null
   */
  record TransportError(String message, Throwable cause) implements VaultError {
    public TransportError {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * The service rejected the request.
   *
   * @param status HTTP status code
   * @param errors messages decoded from the {@code errors} array, empty when absent
   * @param body raw response body text
   */
  record ServiceError(int status, List<String> errors, String body) implements VaultError {
    public ServiceError {
      errors = List.copyOf(errors);
      body = body == null ? "" : body;
    }

    @Override
    public String message() {
      if (!errors.isEmpty()) return String.join(", ", errors);
      return "HTTP " + status + (body.isBlank() ? "" : ": " + body);
    }
  }

  /**
   * The response did not match the expected shape.
   *
   * @param message what was expected and not found
   */
  record DecodeError(String message) implements VaultError {
    public DecodeError {
      Objects.requireNonNull(message, "message");
    }
  }
}
