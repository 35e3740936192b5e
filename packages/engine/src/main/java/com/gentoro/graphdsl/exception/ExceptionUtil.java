package com.gentoro.graphdsl.exception;

import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, human-friendly representation of a throwable's stack trace. It captures only
   * the top stack frames up to the provided limit and joins them in call-order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   * @return a single-line compact stack trace string
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a reasonable default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Render a one-line, user-facing description of an error: the message of the outermost {@link
   * GraphDslException} followed by its context entries, then the chain of causes.
   *
   * @param t the throwable to describe
   * @return the description, or "Unknown error" when {@code t} is null
   */
  public static String describe(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    StringBuilder sb = new StringBuilder();
    String message = t.getMessage();
    sb.append(message == null || message.isBlank() ? t.getClass().getSimpleName() : message);
    if (t instanceof GraphDslException ex && !ex.getContext().isEmpty()) {
      sb.append(" [");
      boolean first = true;
      for (Map.Entry<String, Object> entry : ex.getContext().entrySet()) {
        if (!first) sb.append(", ");
        sb.append(entry.getKey()).append('=').append(entry.getValue());
        first = false;
      }
      sb.append(']');
    }
    Throwable cause = t.getCause();
    while (cause != null && cause != t) {
      String causeMessage = cause.getMessage();
      sb.append(" caused by ")
          .append(cause.getClass().getSimpleName())
          .append(causeMessage == null ? "" : ": " + causeMessage);
      t = cause;
      cause = cause.getCause();
    }
    return sb.toString();
  }

  public static GraphDslException rethrowIfUnchecked(
      Throwable t, java.util.function.Function<Throwable, GraphDslException> supplier) {
    if (t instanceof GraphDslException) {
      return (GraphDslException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
