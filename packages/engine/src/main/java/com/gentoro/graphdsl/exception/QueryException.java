package com.gentoro.graphdsl.exception;

/** Errors raised while compiling or running a tree query pattern. */
public class QueryException extends GraphDslException {
  public QueryException(String message) {
    super(GraphDslErrorCode.QUERY_ERROR, message);
  }

  public QueryException(String message, Throwable cause) {
    super(GraphDslErrorCode.QUERY_ERROR, message, cause);
  }
}
