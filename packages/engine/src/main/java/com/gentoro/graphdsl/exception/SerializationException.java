package com.gentoro.graphdsl.exception;

/** Failures reading or writing JSON/YAML documents. */
public class SerializationException extends GraphDslException {
  public SerializationException(String message) {
    super(GraphDslErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GraphDslErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
