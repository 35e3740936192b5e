package com.gentoro.graphdsl.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One match of a query: capture name to the syntax nodes bound to it, in capture declaration
 * order. A capture usually binds exactly one node.
 */
public record QueryMatch(Map<String, List<SyntaxNode>> captures) {

  public QueryMatch {
    captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
  }

  public List<SyntaxNode> nodes(String captureName) {
    return captures.getOrDefault(captureName, List.of());
  }
}
