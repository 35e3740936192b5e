package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.exception.QueryException;
import com.gentoro.graphdsl.tree.Query;
import com.gentoro.graphdsl.tree.QueryMatch;
import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.SyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled {@link PatternQueryEngine} query.
 *
 * <p>Nodes are visited in pre-order and every top-level pattern is tried at each node, in the order
 * the patterns were written. Child patterns match a subsequence of the node's children in order;
 * every distinct way of binding the captures is reported as its own match.
 */
final class PatternQuery implements Query {
  private final String pattern;
  private final List<PatternNode.TopLevel> patterns;
  private final List<String> captureNames;
  private final Map<String, Pattern> regexes = new LinkedHashMap<>();

  PatternQuery(String pattern, List<PatternNode.TopLevel> patterns, List<String> captureNames) {
    this.pattern = pattern;
    this.patterns = List.copyOf(patterns);
    this.captureNames = List.copyOf(captureNames);
    for (PatternNode.TopLevel topLevel : patterns) {
      for (PatternNode.Predicate predicate : topLevel.predicates()) {
        if (predicate.name().endsWith("match?")) {
          String regex = predicate.arguments().get(1).value();
          try {
            regexes.put(regex, Pattern.compile(regex));
          } catch (PatternSyntaxException e) {
            throw new QueryException(
                "Invalid regular expression in #" + predicate.name() + ": " + e.getDescription(),
                e);
          }
        }
      }
    }
  }

  @Override
  public String pattern() {
    return pattern;
  }

  @Override
  public List<String> captureNames() {
    return captureNames;
  }

  @Override
  public List<QueryMatch> matches(SyntaxTree tree) {
    List<QueryMatch> matches = new ArrayList<>();
    Deque<SyntaxNode> pending = new ArrayDeque<>();
    pending.push(tree.root());
    while (!pending.isEmpty()) {
      SyntaxNode node = pending.pop();
      for (PatternNode.TopLevel topLevel : patterns) {
        Set<Map<String, List<SyntaxNode>>> distinct = new LinkedHashSet<>();
        for (Bindings bindings : match(topLevel.pattern(), node, Bindings.EMPTY)) {
          if (satisfies(topLevel.predicates(), bindings)) {
            distinct.add(bindings.ordered(captureNames));
          }
        }
        distinct.forEach(captures -> matches.add(new QueryMatch(captures)));
      }
      List<SyntaxNode> children = node.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    return matches;
  }

  private List<Bindings> match(PatternNode pattern, SyntaxNode node, Bindings bindings) {
    List<Bindings> results = new ArrayList<>();
    if (pattern instanceof PatternNode.AnyPattern) {
      results.add(bindings);
    } else if (pattern instanceof PatternNode.AnonymousPattern anonymous) {
      if (!node.isNamed() && node.kind().equals(anonymous.kind())) {
        results.add(bindings);
      }
    } else if (pattern instanceof PatternNode.Alternation alternation) {
      for (PatternNode alternative : alternation.alternatives()) {
        results.addAll(match(alternative, node, bindings));
      }
    } else if (pattern instanceof PatternNode.NodePattern nodePattern) {
      if (node.isNamed()
          && (nodePattern.kind() == null || nodePattern.kind().equals(node.kind()))) {
        matchChildren(nodePattern.children(), 0, node.children(), 0, bindings, results);
      }
    }
    if (pattern.captures().isEmpty()) {
      return results;
    }
    List<Bindings> captured = new ArrayList<>(results.size());
    for (Bindings result : results) {
      captured.add(result.bind(pattern.captures(), node));
    }
    return captured;
  }

  private void matchChildren(
      List<PatternNode.Child> patterns,
      int patternIndex,
      List<SyntaxNode> children,
      int childIndex,
      Bindings bindings,
      List<Bindings> results) {
    if (patternIndex == patterns.size()) {
      results.add(bindings);
      return;
    }
    PatternNode.Child child = patterns.get(patternIndex);
    for (int i = childIndex; i < children.size(); i++) {
      SyntaxNode candidate = children.get(i);
      if (child.field() != null && !child.field().equals(candidate.fieldName())) {
        continue;
      }
      for (Bindings next : match(child.pattern(), candidate, bindings)) {
        matchChildren(patterns, patternIndex + 1, children, i + 1, next, results);
      }
    }
  }

  // A predicate whose capture is unbound in this match is not checked.
  private boolean satisfies(List<PatternNode.Predicate> predicates, Bindings bindings) {
    for (PatternNode.Predicate predicate : predicates) {
      List<SyntaxNode> subjects = bindings.nodes(predicate.arguments().get(0).value());
      PatternNode.Argument other = predicate.arguments().get(1);
      for (SyntaxNode subject : subjects) {
        if (!test(predicate.name(), subject.text(), other, bindings)) {
          return false;
        }
      }
    }
    return true;
  }

  private boolean test(
      String predicate, String text, PatternNode.Argument other, Bindings bindings) {
    switch (predicate) {
      case "eq?":
        return equalsArgument(text, other, bindings);
      case "not-eq?":
        return !equalsArgument(text, other, bindings);
      case "match?":
        return regexes.get(other.value()).matcher(text).find();
      case "not-match?":
        return !regexes.get(other.value()).matcher(text).find();
      default:
        throw new QueryException("Unsupported predicate #" + predicate);
    }
  }

  private static boolean equalsArgument(
      String text, PatternNode.Argument other, Bindings bindings) {
    if (!other.capture()) {
      return text.equals(other.value());
    }
    for (SyntaxNode node : bindings.nodes(other.value())) {
      if (!Objects.equals(text, node.text())) {
        return false;
      }
    }
    return true;
  }

  /** Persistent capture bindings; {@link #bind} returns a copy. */
  private static final class Bindings {
    static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, List<SyntaxNode>> captures;

    private Bindings(Map<String, List<SyntaxNode>> captures) {
      this.captures = captures;
    }

    Bindings bind(List<String> names, SyntaxNode node) {
      Map<String, List<SyntaxNode>> copy = new LinkedHashMap<>(captures);
      for (String name : names) {
        List<SyntaxNode> nodes = new ArrayList<>(copy.getOrDefault(name, List.of()));
        nodes.add(node);
        copy.put(name, List.copyOf(nodes));
      }
      return new Bindings(copy);
    }

    List<SyntaxNode> nodes(String name) {
      return captures.getOrDefault(name, List.of());
    }

    // captures in declaration order; names this match did not bind are left out
    Map<String, List<SyntaxNode>> ordered(List<String> declared) {
      Map<String, List<SyntaxNode>> ordered = new LinkedHashMap<>();
      for (String name : declared) {
        List<SyntaxNode> nodes = captures.get(name);
        if (nodes != null) {
          ordered.put(name, nodes);
        }
      }
      return ordered;
    }
  }
}
