package com.gentoro.graphdsl.exception;

/** Configuration loading or validation failures. */
public class ConfigException extends GraphDslException {
  public ConfigException(String message) {
    super(GraphDslErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GraphDslErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
