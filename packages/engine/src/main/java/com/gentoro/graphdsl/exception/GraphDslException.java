package com.gentoro.graphdsl.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the graph DSL engine with a stable {@link GraphDslErrorCode} and
 * optional context.
 *
 * <p>The context map is copied on construction and exposed read-only. Subclasses may add entries
 * while an error propagates outward (for example the stanza executor attaches the stanza and
 * statement location) through {@link #withContext(String, Object)}.
 */
public class GraphDslException extends RuntimeException {
  private final GraphDslErrorCode code;
  private final Map<String, Object> context;

  public GraphDslException(GraphDslErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = new LinkedHashMap<>();
  }

  public GraphDslException(GraphDslErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = new LinkedHashMap<>();
  }

  public GraphDslException(GraphDslErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public GraphDslException(
      GraphDslErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public GraphDslErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /**
   * Attach a context entry unless one with the same key is already present. The innermost
   * location wins, so outer layers never overwrite more precise details.
   */
  public GraphDslException withContext(String key, Object value) {
    if (key != null && value != null) {
      context.putIfAbsent(key, value);
    }
    return this;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (input != null) {
      input.forEach(m::put);
    }
    return m;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
