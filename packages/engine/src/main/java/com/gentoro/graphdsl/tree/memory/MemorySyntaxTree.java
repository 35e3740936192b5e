package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.SyntaxTree;

/**
 * A syntax tree held entirely in memory. Node ids are assigned in pre-order starting at 0, so the
 * root always has id 0.
 */
public final class MemorySyntaxTree implements SyntaxTree {
  private final String source;
  private final MemorySyntaxNode root;

  private MemorySyntaxTree(String source, MemorySyntaxNode root) {
    this.source = source;
    this.root = root;
  }

  public static MemorySyntaxTree of(String source, MemorySyntaxNode.Builder root) {
    SourceText text = new SourceText(source);
    return new MemorySyntaxTree(text.source(), root.build(new long[] {0}, null, text));
  }

  public static MemorySyntaxTree of(MemorySyntaxNode.Builder root) {
    return of("", root);
  }

  @Override
  public SyntaxNode root() {
    return root;
  }

  @Override
  public String source() {
    return source;
  }
}
