package com.gentoro.graphdsl.exception;

/**
 * Canonical error codes for the graph DSL engine. Codes are stable and suitable for logs and for
 * tools that drive the engine. Prefer the most specific code that reflects the failure origin.
 */
public enum GraphDslErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PARSE_ERROR,
  QUERY_ERROR,
  EXECUTION_ERROR,
}
