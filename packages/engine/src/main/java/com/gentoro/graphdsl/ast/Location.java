package com.gentoro.graphdsl.ast;

/** 1-based line and column of a construct in DSL source. */
public record Location(int line, int column) {

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
