package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.GraphNodeRef;
import java.util.HashMap;
import java.util.Map;

/**
 * Memo table that gives graph nodes their content identity: one graph node per (syntax node id,
 * tag path). The first lookup of a key creates the node in the graph, every later lookup returns
 * the same ref.
 */
public final class GraphNodeTable {

  /** The identity of a graph node created through the table. */
  public record Key(long syntaxNodeId, String tagPath) {
    public Key extend(String tags) {
      return new Key(syntaxNodeId, tagPath + "." + tags);
    }
  }

  private final Map<Key, GraphNodeRef> nodes = new HashMap<>();
  private final Map<GraphNodeRef, Key> keys = new HashMap<>();

  public GraphNodeRef resolve(Graph graph, Key key) {
    GraphNodeRef ref = nodes.get(key);
    if (ref == null) {
      ref = graph.addGraphNode();
      nodes.put(key, ref);
      keys.put(ref, key);
    }
    return ref;
  }

  /** The key a graph node was created for, or {@code null} if it was not created here. */
  public Key keyOf(GraphNodeRef ref) {
    return keys.get(ref);
  }

  public int size() {
    return nodes.size();
  }
}
