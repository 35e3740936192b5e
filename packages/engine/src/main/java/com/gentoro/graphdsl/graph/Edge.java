package com.gentoro.graphdsl.graph;

/** A directed edge owned by its source {@link GraphNode}. */
public class Edge {
  private final GraphNodeRef sink;
  private final Attributes attributes = new Attributes();

  Edge(GraphNodeRef sink) {
    this.sink = sink;
  }

  public GraphNodeRef sink() {
    return sink;
  }

  public Attributes attributes() {
    return attributes;
  }
}
