package com.gentoro.graphdsl.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphdsl.utility.JacksonUtility;

/**
 * Deterministic renderings of a {@link Graph}.
 *
 * <p>Nodes are written in arena order, edges in ascending sink order and attributes in
 * lexicographic name order, regardless of the unordered attribute storage.
 *
 * <p>JSON layout:
 *
 * <pre>
 * [ { "id": 0, "edges": [ { "sink": 1, "attrs": { ... } } ], "attrs": { ... } }, ... ]
 * </pre>
 *
 * Scalars are written as bare JSON values; lists and sets as {@code {"type": "list"|"set",
 * "values": [...]}}; references as {@code {"type": "syntaxNode"|"graphNode", "value": id}}.
 */
public final class GraphSerializer {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private GraphSerializer() {}

  public static ArrayNode toJson(Graph graph) {
    ArrayNode out = NODES.arrayNode();
    for (GraphNodeRef ref : graph.nodeRefs()) {
      GraphNode node = graph.node(ref);
      ObjectNode record = NODES.objectNode();
      record.put("id", ref.index());
      ArrayNode edges = record.putArray("edges");
      for (Edge edge : node.edges()) {
        ObjectNode edgeRecord = edges.addObject();
        edgeRecord.put("sink", edge.sink().index());
        edgeRecord.set("attrs", toJson(edge.attributes()));
      }
      record.set("attrs", toJson(node.attributes()));
      out.add(record);
    }
    return out;
  }

  public static ObjectNode toJson(Attributes attributes) {
    ObjectNode out = NODES.objectNode();
    for (String name : attributes.names()) {
      out.set(name, toJson(attributes.get(name)));
    }
    return out;
  }

  public static JsonNode toJson(Value value) {
    if (value instanceof Value.NullValue) {
      return NODES.nullNode();
    }
    if (value instanceof Value.BooleanValue b) {
      return NODES.booleanNode(b.value());
    }
    if (value instanceof Value.IntegerValue i) {
      return number(i.value());
    }
    if (value instanceof Value.StringValue s) {
      return NODES.textNode(s.value());
    }
    ObjectNode out = NODES.objectNode();
    if (value instanceof Value.ListValue l) {
      out.put("type", "list");
      ArrayNode values = out.putArray("values");
      l.values().forEach(v -> values.add(toJson(v)));
    } else if (value instanceof Value.SetValue s) {
      out.put("type", "set");
      ArrayNode values = out.putArray("values");
      s.values().forEach(v -> values.add(toJson(v)));
    } else if (value instanceof Value.SyntaxNodeValue n) {
      out.put("type", "syntaxNode");
      out.set("value", number(n.ref().id()));
    } else if (value instanceof Value.GraphNodeValue n) {
      out.put("type", "graphNode");
      out.put("value", n.ref().index());
    }
    return out;
  }

  /** Pretty-printed JSON document. */
  public static String toJsonString(Graph graph) {
    return JacksonUtility.toJson(toJson(graph));
  }

  /**
   * Plain text dump: {@code node <index>} followed by the node's attributes, then {@code edge
   * <index> -> <sink>} for each outgoing edge followed by the edge's attributes.
   */
  public static String toText(Graph graph) {
    StringBuilder sb = new StringBuilder();
    for (GraphNodeRef ref : graph.nodeRefs()) {
      GraphNode node = graph.node(ref);
      sb.append("node ").append(ref.index()).append('\n').append(node.attributes().display());
      for (Edge edge : node.edges()) {
        sb.append("edge ")
            .append(ref.index())
            .append(" -> ")
            .append(edge.sink().index())
            .append('\n')
            .append(edge.attributes().display());
      }
    }
    return sb.toString();
  }

  // int when it fits, so the node equals what a JSON parser reads back
  private static JsonNode number(long value) {
    return value <= Integer.MAX_VALUE ? NODES.numberNode((int) value) : NODES.numberNode(value);
  }
}
