package com.gentoro.graphdsl.exception;

import java.util.Objects;

/**
 * Execution specific {@link GraphDslException}.
 *
 * <p>Thrown whenever evaluating an expression or executing a statement fails, including:
 *
 * <ul>
 *   <li>Type coercion failures ({@code EXPECTED_*}), carrying a description of the value seen.
 *   <li>Variable errors: undefined, redefined or immutable variables.
 *   <li>Graph errors: references to missing graph nodes or edges, duplicate attributes.
 *   <li>Function errors: unknown functions and failures raised by a function implementation.
 * </ul>
 *
 * <p>The exception is always reported with {@link GraphDslErrorCode#EXECUTION_ERROR}; the precise
 * failure is exposed through {@link #getError()}.
 */
public class ExecutionException extends GraphDslException {
  private final ExecutionError error;

  public ExecutionException(ExecutionError error, String message) {
    super(GraphDslErrorCode.EXECUTION_ERROR, message);
    this.error = Objects.requireNonNull(error, "error");
  }

  public ExecutionException(ExecutionError error, String message, Throwable cause) {
    super(GraphDslErrorCode.EXECUTION_ERROR, message, cause);
    this.error = Objects.requireNonNull(error, "error");
  }

  public ExecutionError getError() {
    return error;
  }

  @Override
  public String getMessage() {
    return error + ": " + super.getMessage();
  }
}
