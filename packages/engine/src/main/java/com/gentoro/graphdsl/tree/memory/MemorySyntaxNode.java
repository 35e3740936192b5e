package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.tree.Position;
import com.gentoro.graphdsl.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A node of a {@link MemorySyntaxTree}. Created through {@link Builder}; immutable once built. */
public final class MemorySyntaxNode implements SyntaxNode {
  private final long id;
  private final String kind;
  private final boolean named;
  private final String fieldName;
  private final Position start;
  private final Position end;
  private final String text;
  private final MemorySyntaxNode parent;
  private final List<SyntaxNode> children = new ArrayList<>();

  private MemorySyntaxNode(
      long id,
      String kind,
      boolean named,
      String fieldName,
      Position start,
      Position end,
      String text,
      MemorySyntaxNode parent) {
    this.id = id;
    this.kind = kind;
    this.named = named;
    this.fieldName = fieldName;
    this.start = start;
    this.end = end;
    this.text = text;
    this.parent = parent;
  }

  public static Builder builder(String kind) {
    return new Builder(kind);
  }

  @Override
  public long id() {
    return id;
  }

  @Override
  public String kind() {
    return kind;
  }

  @Override
  public boolean isNamed() {
    return named;
  }

  @Override
  public Position startPosition() {
    return start;
  }

  @Override
  public Position endPosition() {
    return end;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public String fieldName() {
    return fieldName;
  }

  @Override
  public SyntaxNode parent() {
    return parent;
  }

  @Override
  public List<SyntaxNode> children() {
    return Collections.unmodifiableList(children);
  }

  @Override
  public String toString() {
    return kind + start;
  }

  /** Mutable description of a node and its subtree. */
  public static final class Builder {
    private final String kind;
    private boolean named = true;
    private String fieldName;
    private Position start = new Position(0, 0);
    private Position end;
    private String text;
    private final List<Builder> children = new ArrayList<>();

    private Builder(String kind) {
      this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Builder named(boolean named) {
      this.named = named;
      return this;
    }

    public Builder field(String fieldName) {
      this.fieldName = fieldName;
      return this;
    }

    public Builder start(int row, int column) {
      this.start = new Position(row, column);
      return this;
    }

    public Builder end(int row, int column) {
      this.end = new Position(row, column);
      return this;
    }

    /** Source text of the node; when absent it is sliced from the tree source, if any. */
    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder child(Builder child) {
      children.add(child);
      return this;
    }

    // ids are handed out in pre-order, starting at the value held by nextId
    MemorySyntaxNode build(long[] nextId, MemorySyntaxNode parent, SourceText source) {
      Position endPosition = end == null ? start : end;
      String nodeText = text != null ? text : source.slice(start, endPosition);
      MemorySyntaxNode node =
          new MemorySyntaxNode(
              nextId[0]++, kind, named, fieldName, start, endPosition, nodeText, parent);
      for (Builder child : children) {
        node.children.add(child.build(nextId, node, source));
      }
      return node;
    }
  }
}
