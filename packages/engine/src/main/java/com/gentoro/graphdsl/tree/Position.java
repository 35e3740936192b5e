package com.gentoro.graphdsl.tree;

/**
 * Zero-based row/column position inside the parsed source.
 *
 * @param row zero-based line number
 * @param column zero-based column, counted in characters
 */
public record Position(int row, int column) implements Comparable<Position> {

  @Override
  public int compareTo(Position other) {
    int byRow = Integer.compare(row, other.row);
    return byRow != 0 ? byRow : Integer.compare(column, other.column);
  }

  @Override
  public String toString() {
    return "(" + (row + 1) + ", " + (column + 1) + ")";
  }
}
