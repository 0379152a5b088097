package com.jokes.common.status;

import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * The result of an operation that yields a value on success: exactly one of a non-null value
 * (with an OK status) or a failed {@link Status}.
 *
 * @param <T> The type of the value
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    this.status = status;
    this.value = value;
  }

  /**
   * Wraps a successful value.
   *
   * @throws NullPointerException if value is null
   */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Objects.requireNonNull(value));
  }

  /**
   * Wraps a failure.
   *
   * @throws IllegalArgumentException if status is OK, since an OK result needs a value
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("ofStatus needs a failed status, got OK");
    }
    return new StatusOr<>(status, null);
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if this result is a failure
   */
  @Nonnull
  public T getValue() {
    if (status.isError()) {
      throw new IllegalStateException("No value in failed result: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return status.isError();
  }

  /** Transforms the value of a successful result; a failure passes through unchanged. */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    if (status.isError()) {
      return StatusOr.ofStatus(status);
    }
    return StatusOr.ofValue(mapper.apply(value));
  }

  /** Chains another fallible step onto a successful result; a failure passes through. */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    if (status.isError()) {
      return StatusOr.ofStatus(status);
    }
    return mapper.apply(value);
  }

  @Override
  public String toString() {
    return status.isOk() ? "StatusOr{value=" + value + "}" : "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StatusOr<?> other)) {
      return false;
    }
    return status.equals(other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}
