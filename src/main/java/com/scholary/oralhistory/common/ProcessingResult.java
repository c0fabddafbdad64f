package com.scholary.oralhistory.common;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of processing one unit of work (a segment or a story).
 *
 * <p>A failure here means the unit's input is internally inconsistent and no correct output can be
 * produced for it. Callers skip the unit and continue with the next one.
 */
public record ProcessingResult<T>(T value, String error) {

  public ProcessingResult {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("Exactly one of value or error must be set");
    }
  }

  public static <T> ProcessingResult<T> success(T value) {
    return new ProcessingResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> ProcessingResult<T> failure(String error) {
    return new ProcessingResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** Apply {@code mapper} to a successful value; failures pass through unchanged. */
  public <R> ProcessingResult<R> map(Function<T, R> mapper) {
    return isSuccess() ? success(mapper.apply(value)) : failure(error);
  }

  /** Returns the value or throws if this result is a failure. */
  public T orElseThrow(Function<String, ? extends RuntimeException> exceptionFactory) {
    if (!isSuccess()) {
      throw exceptionFactory.apply(error);
    }
    return value;
  }
}
