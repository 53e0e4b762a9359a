package com.example.vaultkv2.core.kv;

import java.util.OptionalInt;

/**
 * Check-and-set mode of a write. Exactly one mode applies per write:
 *
 * <ul>
 *   <li>{@link WriteAllowed} – no check, the write always creates a new version.
 *   <li>{@link CreateOnly} – the write fails if the secret already has a version.
 *   <li>{@link CurrentVersion} – the write fails unless the latest version equals the given one.
 * </ul>
 */
public sealed interface CheckAndSet {

  CheckAndSet WRITE_ALLOWED = new WriteAllowed();
  CheckAndSet CREATE_ONLY = new CreateOnly();

  static CheckAndSet currentVersion(final int version) {
    return new CurrentVersion(new SecretVersion(version));
  }

  /**
   * Value of the {@code cas} write option.
   *
   * @return the option value, empty when the option must be omitted
   */
  OptionalInt cas();

  record WriteAllowed() implements CheckAndSet {
    @Override
    public OptionalInt cas() {
      return OptionalInt.empty();
    }
  }

  record CreateOnly() implements CheckAndSet {
    @Override
    public OptionalInt cas() {
      return OptionalInt.of(0);
    }
  }

  record CurrentVersion(SecretVersion version) implements CheckAndSet {
    @Override
    public OptionalInt cas() {
      return OptionalInt.of(version.version());
    }
  }
}
