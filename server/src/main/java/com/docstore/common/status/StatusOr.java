package com.docstore.common.status;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Either a value or the error status explaining why there is none.
 *
 * @param <T> The type of the value in case of success.
 */
public final class StatusOr<T> {
  private final Status status;
  private final T value;

  private StatusOr(Status status, T value) {
    if (status.isOk() && value == null) {
      throw new IllegalArgumentException("Value cannot be null when status is OK");
    }
    if (!status.isOk() && value != null) {
      throw new IllegalArgumentException("Value must be null when status is not OK");
    }
    this.status = Objects.requireNonNull(status);
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
   * Wraps an error.
   *
   * @throws IllegalArgumentException if status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("Status must not be OK when using ofStatus");
    }
    return new StatusOr<>(status, null);
  }

  /**
   * Converts an empty Optional into a NOT_FOUND status carrying {@code errorMessage}.
   */
  public static <T> StatusOr<T> fromOptional(Optional<T> optional, String errorMessage) {
    return optional
        .map(StatusOr::ofValue)
        .orElseGet(() -> StatusOr.ofStatus(Status.notFound(errorMessage)));
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if the status is not OK
   */
  @Nonnull
  public T getValue() {
    if (!status.isOk()) {
      throw new IllegalStateException("Cannot get value from failed StatusOr: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return status.isOk();
  }

  public boolean isNotOk() {
    return !status.isOk();
  }

  /** Maps the value if present, otherwise propagates the error. */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    if (status.isOk()) {
      return StatusOr.ofValue(mapper.apply(value));
    }
    return StatusOr.ofStatus(status);
  }

  /** Chains another fallible step onto the value, or propagates the error. */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    if (status.isOk()) {
      return mapper.apply(value);
    }
    return StatusOr.ofStatus(status);
  }

  @Override
  public String toString() {
    if (status.isOk()) {
      return "StatusOr{value=" + value + "}";
    }
    return "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    StatusOr<?> other = (StatusOr<?>) obj;
    return Objects.equals(status, other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}
