package com.gentoro.graphdsl.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.memory.TestTrees;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphTest {

  @Test
  @DisplayName("adding the same syntax node twice yields equal refs and stores it once")
  void syntaxNodesAreDeduplicatedById() {
    Graph graph = new Graph();
    SyntaxNode root = TestTrees.functions().root();

    SyntaxNodeRef first = graph.addSyntaxNode(root);
    SyntaxNodeRef second = graph.addSyntaxNode(root);

    assertEquals(first, second);
    assertEquals(1, graph.syntaxNodeCount());
    assertSame(root, graph.syntaxNode(first));
    assertEquals("[syntax node program (1, 1)]", first.toString());
  }

  @Test
  @DisplayName("graph nodes are appended in arena order and never deduplicated")
  void graphNodesAppend() {
    Graph graph = new Graph();
    GraphNodeRef a = graph.addGraphNode();
    GraphNodeRef b = graph.addGraphNode();

    assertEquals(0, a.index());
    assertEquals(1, b.index());
    assertEquals(List.of(a, b), graph.nodeRefs());
    assertTrue(graph.contains(b));
    assertFalse(graph.contains(new GraphNodeRef(2)));
    assertThrows(IndexOutOfBoundsException.class, () -> graph.node(new GraphNodeRef(2)));
  }

  @Test
  @DisplayName("adding an existing edge returns it without creating another")
  void edgesAreIdempotent() {
    Graph graph = new Graph();
    GraphNodeRef a = graph.addGraphNode();
    GraphNodeRef b = graph.addGraphNode();

    Edge first = graph.addEdge(a, b);
    first.attributes().add("p", Value.of(10));
    Edge second = graph.addEdge(a, b);

    assertSame(first, second);
    assertEquals(1, graph.node(a).edgeCount());
    assertEquals(Value.of(10), second.attributes().get("p"));
  }

  @Test
  @DisplayName("edges are kept in ascending sink order regardless of insertion order")
  void edgesSortedBySink() {
    Graph graph = new Graph();
    GraphNodeRef source = graph.addGraphNode();
    GraphNodeRef n1 = graph.addGraphNode();
    GraphNodeRef n2 = graph.addGraphNode();
    GraphNodeRef n3 = graph.addGraphNode();

    graph.addEdge(source, n3);
    graph.addEdge(source, n1);
    graph.addEdge(source, n2);

    List<Edge> edges = graph.node(source).edges();
    assertEquals(List.of(n1, n2, n3), edges.stream().map(Edge::sink).toList());
    assertTrue(graph.node(source).hasEdge(n2));
    assertNull(graph.node(n1).getEdge(source));
    assertSame(graph.node(source).getEdge(n2), graph.addEdge(source, n2));
    assertSame(graph.node(source).getEdge(n3), graph.addEdge(source, n3));
    assertEquals(3, graph.edgeCount());
  }

  @Test
  @DisplayName("edges to nodes outside the graph are rejected")
  void edgeToUnknownNode() {
    Graph graph = new Graph();
    GraphNodeRef a = graph.addGraphNode();
    assertThrows(IndexOutOfBoundsException.class, () -> graph.addEdge(a, new GraphNodeRef(5)));
    assertEquals(0, graph.node(a).edgeCount());
  }

  @Test
  @DisplayName("a second write of an attribute is refused and the first value kept")
  void duplicateAttributeKeepsOriginal() {
    Attributes attributes = new Attributes();
    assertTrue(attributes.add("name", Value.of("x")));
    assertFalse(attributes.add("name", Value.of("y")));
    assertEquals(Value.of("x"), attributes.get("name"));
    assertEquals(1, attributes.size());
  }

  @Test
  @DisplayName("attribute names are ordered by code point, like string values")
  void attributeNamesInCodePointOrder() {
    Attributes attributes = new Attributes();
    String emoji = new String(Character.toChars(0x1F600));
    String ligature = "\uFB01";
    attributes.add(emoji, Value.TRUE);
    attributes.add(ligature, Value.TRUE);
    attributes.add("b", Value.TRUE);

    assertEquals(List.of("b", ligature, emoji), attributes.names());
    assertTrue(Value.of(ligature).compareTo(Value.of(emoji)) < 0);
  }

  @Test
  @DisplayName("syntax node refs from another graph are rejected")
  void foreignSyntaxNodeRef() {
    Graph graph = new Graph();
    SyntaxNodeRef ref = new Graph().addSyntaxNode(TestTrees.functions().root());
    assertThrows(IllegalArgumentException.class, () -> graph.syntaxNode(ref));
  }
}
