package com.gentoro.graphdsl.tree;

import java.util.List;

/** A compiled query pattern. */
public interface Query {

  /** The pattern text this query was compiled from. */
  String pattern();

  /** Capture names declared by the pattern, in declaration order, without the {@code @} sigil. */
  List<String> captureNames();

  /** All matches of this query against the tree, in document order. */
  List<QueryMatch> matches(SyntaxTree tree);
}
