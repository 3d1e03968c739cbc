package com.acme.sourcing.core;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail in an expected, typed way. Infrastructure faults are still
 * raised as exceptions; only outcomes a caller is meant to branch on travel through here.
 *
 * @param <T> success value type
 * @param <E> error type
 */
public sealed interface Result<T, E> {

  static <T, E> Result<T, E> success(T value) {
    return new Success<>(value);
  }

  static <T, E> Result<T, E> failure(E error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  default boolean isFailure() {
    return !isSuccess();
  }

  /** Value on success, {@code null} on failure. */
  T getOrNull();

  /** Error on failure, {@code null} on success. */
  E errorOrNull();

  <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure);

  default <R> Result<R, E> map(Function<? super T, ? extends R> mapper) {
    return fold(v -> Result.success(mapper.apply(v)), Result::failure);
  }

  default <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
    return fold(Result::success, e -> Result.failure(mapper.apply(e)));
  }

  default <R> Result<R, E> flatMap(Function<? super T, Result<R, E>> mapper) {
    return fold(mapper, Result::failure);
  }

  default Result<T, E> onSuccess(Consumer<? super T> action) {
    if (isSuccess()) {
      action.accept(getOrNull());
    }
    return this;
  }

  default Result<T, E> onFailure(Consumer<? super E> action) {
    if (isFailure()) {
      action.accept(errorOrNull());
    }
    return this;
  }

  record Success<T, E>(T value) implements Result<T, E> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public T getOrNull() {
      return value;
    }

    @Override
    public E errorOrNull() {
      return null;
    }

    @Override
    public <R> R fold(
        Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
      return onSuccess.apply(value);
    }
  }

  record Failure<T, E>(E error) implements Result<T, E> {
    public Failure {
      if (error == null) {
        throw new IllegalArgumentException("Failure error cannot be null");
      }
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T getOrNull() {
      return null;
    }

    @Override
    public E errorOrNull() {
      return error;
    }

    @Override
    public <R> R fold(
        Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
      return onFailure.apply(error);
    }
  }
}
