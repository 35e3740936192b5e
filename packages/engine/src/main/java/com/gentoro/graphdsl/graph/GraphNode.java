package com.gentoro.graphdsl.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the output graph: an attribute set plus its outgoing edges. Edges are kept sorted by
 * sink index and there is at most one edge per sink.
 */
public class GraphNode {
  private final List<Edge> outgoingEdges = new ArrayList<>();
  // sink index of each entry of outgoingEdges, same order
  private final List<Integer> sinks = new ArrayList<>();
  private final Attributes attributes = new Attributes();

  GraphNode() {}

  public Attributes attributes() {
    return attributes;
  }

  /**
   * Add an edge to {@code sink}, or return the edge that already connects this node to it.
   *
   * @return the (new or existing) edge
   */
  public Edge addEdge(GraphNodeRef sink) {
    int index = Collections.binarySearch(sinks, sink.index());
    if (index >= 0) {
      return outgoingEdges.get(index);
    }
    Edge edge = new Edge(sink);
    outgoingEdges.add(-index - 1, edge);
    sinks.add(-index - 1, sink.index());
    return edge;
  }

  /** The edge to {@code sink}, or {@code null} when there is none. */
  public Edge getEdge(GraphNodeRef sink) {
    int index = Collections.binarySearch(sinks, sink.index());
    return index >= 0 ? outgoingEdges.get(index) : null;
  }

  public boolean hasEdge(GraphNodeRef sink) {
    return Collections.binarySearch(sinks, sink.index()) >= 0;
  }

  /** Outgoing edges in ascending sink order. */
  public List<Edge> edges() {
    return Collections.unmodifiableList(outgoingEdges);
  }

  public int edgeCount() {
    return outgoingEdges.size();
  }
}
