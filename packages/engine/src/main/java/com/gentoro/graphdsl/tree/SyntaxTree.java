package com.gentoro.graphdsl.tree;

/** A parsed syntax tree. */
public interface SyntaxTree {

  SyntaxNode root();

  /** The full source text the tree was parsed from; may be empty. */
  String source();
}
