package com.gentoro.graphdsl.tree;

import java.util.List;

/**
 * A node of an externally supplied, already parsed concrete syntax tree.
 *
 * <p>The engine only borrows syntax nodes: it never mutates them and keys all of its own state by
 * {@link #id()}, so implementations are free to hand out fresh wrapper objects for the same
 * underlying node as long as the id is stable for the lifetime of the tree.
 */
public interface SyntaxNode {

  /** Identifier that is unique and stable within one tree. */
  long id();

  /** Grammar kind of the node, e.g. {@code identifier}. */
  String kind();

  /** Whether the node is a named node (as opposed to an anonymous token such as {@code "("}). */
  boolean isNamed();

  Position startPosition();

  Position endPosition();

  /** Source text covered by the node; empty when the tree carries no source. */
  String text();

  /** Name of the field under which the node appears in its parent, or {@code null}. */
  String fieldName();

  /** Parent node, or {@code null} for the root. */
  SyntaxNode parent();

  /** All children (named and anonymous) in source order. */
  List<SyntaxNode> children();

  default List<SyntaxNode> namedChildren() {
    return children().stream().filter(SyntaxNode::isNamed).toList();
  }
}
