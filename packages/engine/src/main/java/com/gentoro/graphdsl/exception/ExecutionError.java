package com.gentoro.graphdsl.exception;

/** The specific kind of failure behind an {@link ExecutionException}. */
public enum ExecutionError {
  EXPECTED_BOOLEAN,
  EXPECTED_INTEGER,
  EXPECTED_STRING,
  EXPECTED_LIST,
  EXPECTED_SET,
  EXPECTED_GRAPH_NODE,
  EXPECTED_SYNTAX_NODE,
  UNDEFINED_VARIABLE,
  DUPLICATE_VARIABLE,
  IMMUTABLE_VARIABLE,
  UNDEFINED_CAPTURE,
  UNDEFINED_GRAPH_NODE,
  UNDEFINED_EDGE,
  DUPLICATE_ATTRIBUTE,
  UNKNOWN_FUNCTION,
  FUNCTION_ERROR,
  QUERY_ERROR,
}
