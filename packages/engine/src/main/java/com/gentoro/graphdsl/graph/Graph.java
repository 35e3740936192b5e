package com.gentoro.graphdsl.graph;

import com.gentoro.graphdsl.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A graph produced by executing a graph DSL file.
 *
 * <p>The graph holds the syntax nodes that were referenced during execution (keyed by their id;
 * the tree itself is only borrowed) and an arena of graph nodes addressed by {@link
 * GraphNodeRef}. Arena slots are never removed, so every ref handed out stays valid for the
 * lifetime of the graph.
 */
public class Graph {
  private final Map<Long, SyntaxNode> syntaxNodes = new HashMap<>();
  private final List<GraphNode> graphNodes = new ArrayList<>();

  /**
   * Add a syntax node to the graph and return a reference to it. Adding the same node again (same
   * id) returns an equal reference and keeps the first handle.
   */
  public SyntaxNodeRef addSyntaxNode(SyntaxNode node) {
    syntaxNodes.putIfAbsent(node.id(), node);
    return new SyntaxNodeRef(node.id(), node.kind(), node.startPosition());
  }

  /** Append a new graph node. Never deduplicates. */
  public GraphNodeRef addGraphNode() {
    graphNodes.add(new GraphNode());
    return new GraphNodeRef(graphNodes.size() - 1);
  }

  /**
   * Add an edge between two graph nodes, or return the existing one.
   *
   * @throws IndexOutOfBoundsException if either ref does not belong to this graph
   */
  public Edge addEdge(GraphNodeRef source, GraphNodeRef sink) {
    node(sink);
    return node(source).addEdge(sink);
  }

  /**
   * The graph node behind a ref.
   *
   * @throws IndexOutOfBoundsException if the ref does not belong to this graph
   */
  public GraphNode node(GraphNodeRef ref) {
    if (!contains(ref)) {
      throw new IndexOutOfBoundsException("No graph node with index " + ref.index());
    }
    return graphNodes.get(ref.index());
  }

  /**
   * The syntax node behind a ref.
   *
   * @throws IllegalArgumentException if the ref was not minted by this graph
   */
  public SyntaxNode syntaxNode(SyntaxNodeRef ref) {
    SyntaxNode node = syntaxNodes.get(ref.id());
    if (node == null) {
      throw new IllegalArgumentException("Syntax node " + ref + " was not added to this graph");
    }
    return node;
  }

  public boolean contains(GraphNodeRef ref) {
    return ref.index() < graphNodes.size();
  }

  public boolean containsSyntaxNode(long id) {
    return syntaxNodes.containsKey(id);
  }

  /** All graph node refs in arena order. */
  public List<GraphNodeRef> nodeRefs() {
    return IntStream.range(0, graphNodes.size())
        .mapToObj(GraphNodeRef::new)
        .collect(Collectors.toList());
  }

  public int nodeCount() {
    return graphNodes.size();
  }

  public int syntaxNodeCount() {
    return syntaxNodes.size();
  }

  public int edgeCount() {
    int count = 0;
    for (GraphNode node : graphNodes) {
      count += node.edgeCount();
    }
    return count;
  }
}
