package com.gentoro.graphdsl.graph;

import com.gentoro.graphdsl.tree.Position;
import java.util.Comparator;

/**
 * A reference to a syntax node that has been added to a {@link Graph}.
 *
 * <p>Refs are minted by {@link Graph#addSyntaxNode} only. They carry the node kind and start
 * position so values can be displayed without going back to the tree.
 */
public record SyntaxNodeRef(long id, String kind, Position position)
    implements Comparable<SyntaxNodeRef> {

  private static final Comparator<SyntaxNodeRef> ORDER =
      Comparator.comparingLong(SyntaxNodeRef::id)
          .thenComparing(SyntaxNodeRef::kind)
          .thenComparing(SyntaxNodeRef::position);

  @Override
  public int compareTo(SyntaxNodeRef other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "[syntax node " + kind + " " + position + "]";
  }
}
