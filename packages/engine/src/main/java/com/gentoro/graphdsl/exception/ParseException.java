package com.gentoro.graphdsl.exception;

import java.util.Map;

/** Syntax error in DSL source text, reported with a 1-based line and column. */
public class ParseException extends GraphDslException {
  private final int line;
  private final int column;

  public ParseException(String message, int line, int column) {
    super(
        GraphDslErrorCode.PARSE_ERROR,
        message + " at line " + line + ", column " + column,
        Map.of("line", line, "column", column));
    this.line = line;
    this.column = column;
  }

  public ParseException(String message, int line, int column, Throwable cause) {
    super(
        GraphDslErrorCode.PARSE_ERROR,
        message + " at line " + line + ", column " + column,
        Map.of("line", line, "column", column),
        cause);
    this.line = line;
    this.column = column;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
