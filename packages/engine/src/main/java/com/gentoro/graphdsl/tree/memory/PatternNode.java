package com.gentoro.graphdsl.tree.memory;

import java.util.List;

/** Compiled form of a query pattern. Every variant carries the captures written after it. */
sealed interface PatternNode
    permits PatternNode.NodePattern,
        PatternNode.AnonymousPattern,
        PatternNode.AnyPattern,
        PatternNode.Alternation {

  List<String> captures();

  /**
   * {@code (kind child...)}; {@code kind} is {@code null} for {@code (_)}, which matches any named
   * node.
   */
  record NodePattern(String kind, List<Child> children, List<String> captures)
      implements PatternNode {
    public NodePattern {
      children = List.copyOf(children);
      captures = List.copyOf(captures);
    }
  }

  /** {@code "text"}: an anonymous node of that kind. */
  record AnonymousPattern(String kind, List<String> captures) implements PatternNode {
    public AnonymousPattern {
      captures = List.copyOf(captures);
    }
  }

  /** {@code _}: any node, named or anonymous. */
  record AnyPattern(List<String> captures) implements PatternNode {
    public AnyPattern {
      captures = List.copyOf(captures);
    }
  }

  /** {@code [a b ...]}: any one of the alternatives. */
  record Alternation(List<PatternNode> alternatives, List<String> captures)
      implements PatternNode {
    public Alternation {
      alternatives = List.copyOf(alternatives);
      captures = List.copyOf(captures);
    }
  }

  /** A child pattern, optionally restricted to a field. */
  record Child(String field, PatternNode pattern) {}

  /** {@code (#name? arg ...)}; arguments are capture names or string literals. */
  record Predicate(String name, List<Argument> arguments) {
    public Predicate {
      arguments = List.copyOf(arguments);
    }
  }

  record Argument(String value, boolean capture) {}

  /** One top-level pattern with the predicates written inside or directly after it. */
  record TopLevel(PatternNode pattern, List<Predicate> predicates) {
    public TopLevel {
      predicates = List.copyOf(predicates);
    }
  }
}
