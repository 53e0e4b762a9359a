package com.example.vaultkv2.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a Vault operation: either a value or a {@link VaultError}.
 *
 * <pre>{@code
 * client.getSecret(new SecretPath("app/db"))
 *     .onSuccess(data -> use(data.data()))
 *     .onFailure(error -> logger.log(WARNING, error.message()));
 * }</pre>
 *
 * @param <T> success value type
 */
public sealed interface Result<T> {

  static <T> Result<T> success(final T value) {
    return new Success<>(value);
  }

  static <T> Result<T> failure(final VaultError error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  default boolean isFailure() {
    return !isSuccess();
  }

  /**
   * Returns the success value, if any.
   *
   * @return the value, empty on failure
   */
  Optional<T> value();

  /**
   * Returns the failure, if any.
   *
   * @return the error, empty on success
   */
  Optional<VaultError> error();

  <U> Result<U> map(Function<? super T, ? extends U> mapper);

  <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

  /**
   * Collapses both branches into one value.
   *
   * @param onFailure applied to the error
   * @param onSuccess applied to the value
   * @param <U> result type
   * @return the folded value
   */
  <U> U fold(
      Function<? super VaultError, ? extends U> onFailure,
      Function<? super T, ? extends U> onSuccess);

  default Result<T> onSuccess(final Consumer<? super T> action) {
    value().ifPresent(action);
    return this;
  }

  default Result<T> onFailure(final Consumer<? super VaultError> action) {
    error().ifPresent(action);
    return this;
  }

  /**
   * Returns the value or throws the error wrapped in a {@link VaultException}.
   *
   * @return the success value
   * @throws VaultException on failure
   */
  default T orElseThrow() {
    return fold(
        error -> {
          throw new VaultException(error);
        },
        Function.identity());
  }

  record Success<T>(T result) implements Result<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Optional<T> value() {
      return Optional.ofNullable(result);
    }

    @Override
    public Optional<VaultError> error() {
      return Optional.empty();
    }

    @Override
    public <U> Result<U> map(final Function<? super T, ? extends U> mapper) {
      return new Success<>(mapper.apply(result));
    }

    @Override
    public <U> Result<U> flatMap(final Function<? super T, Result<U>> mapper) {
      return mapper.apply(result);
    }

    @Override
    public <U> U fold(
        final Function<? super VaultError, ? extends U> onFailure,
        final Function<? super T, ? extends U> onSuccess) {
      return onSuccess.apply(result);
    }
  }

  record Failure<T>(VaultError cause) implements Result<T> {
    public Failure {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Optional<T> value() {
      return Optional.empty();
    }

    @Override
    public Optional<VaultError> error() {
      return Optional.of(cause);
    }

    @Override
    public <U> Result<U> map(final Function<? super T, ? extends U> mapper) {
      return new Failure<>(cause);
    }

    @Override
    public <U> Result<U> flatMap(final Function<? super T, Result<U>> mapper) {
      return new Failure<>(cause);
    }

    @Override
    public <U> U fold(
        final Function<? super VaultError, ? extends U> onFailure,
        final Function<? super T, ? extends U> onSuccess) {
      return onFailure.apply(cause);
    }
  }
}
