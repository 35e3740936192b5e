package com.gentoro.graphdsl.tree.memory;

/**
 * Syntax tree fixtures shared by the tests.
 *
 * <pre>
 * def foo(a, b):
 * def bar():
 * </pre>
 *
 * Pre-order ids: program 0, function_definition 1, "def" 2, foo 3, parameters 4, "(" 5, a 6,
 * "," 7, b 8, ")" 9, function_definition 10, "def" 11, bar 12, parameters 13, "(" 14, ")" 15.
 */
public final class TestTrees {
  public static final String SOURCE = "def foo(a, b):\ndef bar():";

  private TestTrees() {}

  public static MemorySyntaxTree functions() {
    return MemorySyntaxTree.of(
        SOURCE,
        MemorySyntaxNode.builder("program")
            .start(0, 0)
            .end(1, 10)
            .child(
                MemorySyntaxNode.builder("function_definition")
                    .start(0, 0)
                    .end(0, 14)
                    .child(token("def", 0, 0))
                    .child(identifier(0, 4, 7).field("name"))
                    .child(
                        MemorySyntaxNode.builder("parameters")
                            .field("parameters")
                            .start(0, 7)
                            .end(0, 13)
                            .child(token("(", 0, 7))
                            .child(identifier(0, 8, 9))
                            .child(token(",", 0, 9))
                            .child(identifier(0, 11, 12))
                            .child(token(")", 0, 12))))
            .child(
                MemorySyntaxNode.builder("function_definition")
                    .start(1, 0)
                    .end(1, 10)
                    .child(token("def", 1, 0))
                    .child(identifier(1, 4, 7).field("name"))
                    .child(
                        MemorySyntaxNode.builder("parameters")
                            .field("parameters")
                            .start(1, 7)
                            .end(1, 9)
                            .child(token("(", 1, 7))
                            .child(token(")", 1, 8)))));
  }

  private static MemorySyntaxNode.Builder identifier(int row, int start, int end) {
    return MemorySyntaxNode.builder("identifier").start(row, start).end(row, end);
  }

  private static MemorySyntaxNode.Builder token(String kind, int row, int column) {
    return MemorySyntaxNode.builder(kind)
        .named(false)
        .start(row, column)
        .end(row, column + kind.length());
  }
}
