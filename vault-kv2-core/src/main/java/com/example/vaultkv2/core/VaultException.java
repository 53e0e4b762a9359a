package com.example.vaultkv2.core;

/** Unchecked wrapper for a {@link VaultError}, thrown only by {@link Result#orElseThrow()}. */
public class VaultException extends RuntimeException {

  private final transient VaultError error;

  public VaultException(final VaultError error) {
    super(error.message(), error instanceof VaultError.TransportError t ? t.cause() : null);
    this.error = error;
  }

  public VaultError error() {
    return error;
  }
}
