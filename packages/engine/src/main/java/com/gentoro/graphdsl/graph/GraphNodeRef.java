package com.gentoro.graphdsl.graph;

/** A reference to a graph node: its index in the owning {@link Graph}'s node arena. */
public record GraphNodeRef(int index) implements Comparable<GraphNodeRef> {

  public GraphNodeRef {
    if (index < 0) {
      throw new IllegalArgumentException("Graph node index must not be negative: " + index);
    }
  }

  @Override
  public int compareTo(GraphNodeRef other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "[graph node " + index + "]";
  }
}
