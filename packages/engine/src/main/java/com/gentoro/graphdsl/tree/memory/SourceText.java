package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.tree.Position;
import java.util.ArrayList;
import java.util.List;

/** Source text with a row index, for slicing by row/column positions. */
final class SourceText {
  private final String source;
  private final List<Integer> lineStarts = new ArrayList<>();

  SourceText(String source) {
    this.source = source == null ? "" : source;
    lineStarts.add(0);
    for (int i = 0; i < this.source.length(); i++) {
      if (this.source.charAt(i) == '\n') {
        lineStarts.add(i + 1);
      }
    }
  }

  String source() {
    return source;
  }

  /**
   * Text between two positions; empty when the source does not cover them, including a column past
   * the end of its line.
   */
  String slice(Position start, Position end) {
    int from = offset(start);
    int to = offset(end);
    if (from < 0 || to < 0 || to < from) {
      return "";
    }
    return source.substring(from, to);
  }

  private int offset(Position position) {
    if (position.row() >= lineStarts.size()) {
      return -1;
    }
    int row = position.row();
    int lineEnd = row + 1 < lineStarts.size() ? lineStarts.get(row + 1) - 1 : source.length();
    int offset = lineStarts.get(row) + position.column();
    return offset > lineEnd ? -1 : offset;
  }
}
