package io.rerun;

import java.util.Objects;

/**
 * Wraps a {@link RerunException} with an unchecked exception, for code paths such as iterators
 * and streams that cannot throw checked exceptions.
 */
public final class UncheckedRerunException extends RuntimeException {
  /**
   * Creates an unchecked wrapper.
   *
   * @param cause the checked exception
   */
  public UncheckedRerunException(RerunException cause) {
    super(Objects.requireNonNull(cause, "cause").getMessage(), cause);
  }

  /**
   * Returns the wrapped exception.
   *
   * @return the checked cause
   */
  @Override
  public RerunException getCause() {
    return (RerunException) super.getCause();
  }
}
