package com.gentoro.graphdsl.tree.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdsl.exception.SerializationException;
import com.gentoro.graphdsl.tree.Position;
import com.gentoro.graphdsl.tree.SyntaxNode;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyntaxTreeReaderTest {

  private static final String DOCUMENT =
      """
      {
        "source": "x = 1\\ny = 22",
        "root": {
          "kind": "module", "start": [0, 0], "end": [1, 6],
          "children": [
            {"kind": "assignment", "start": [0, 0], "end": [0, 5], "children": [
              {"kind": "identifier", "field": "left", "start": [0, 0], "end": [0, 1]},
              {"kind": "=", "named": false, "start": [0, 2], "end": [0, 3]},
              {"kind": "integer", "field": "right", "start": [0, 4], "end": [0, 5]}
            ]},
            {"kind": "assignment", "start": [1, 0], "end": [1, 6], "text": "y=22"}
          ]
        }
      }
      """;

  @Test
  @DisplayName("nodes get pre-order ids, fields and text sliced from the source")
  void readsDocument() {
    MemorySyntaxTree tree = SyntaxTreeReader.read(DOCUMENT);
    assertEquals("x = 1\ny = 22", tree.source());

    SyntaxNode root = tree.root();
    assertEquals(0, root.id());
    assertEquals("module", root.kind());
    assertEquals("x = 1\ny = 22", root.text());
    assertNull(root.parent());

    SyntaxNode first = root.children().get(0);
    assertEquals(1, first.id());
    assertSame(root, first.parent());
    SyntaxNode left = first.children().get(0);
    SyntaxNode equals = first.children().get(1);
    SyntaxNode right = first.children().get(2);
    assertEquals(2, left.id());
    assertEquals("left", left.fieldName());
    assertEquals("x", left.text());
    assertFalse(equals.isNamed());
    assertEquals("=", equals.text());
    assertEquals(4, right.id());
    assertEquals(new Position(0, 4), right.startPosition());
    assertEquals("1", right.text());

    SyntaxNode second = root.children().get(1);
    assertEquals(5, second.id());
    assertEquals("y=22", second.text());
    assertEquals(new Position(1, 6), second.endPosition());
  }

  @Test
  @DisplayName("a bare root node without source is accepted")
  void bareRoot(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("tree.json");
    Files.writeString(
        file, "{\"kind\": \"program\", \"children\": [{\"kind\": \"x\", \"text\": \"abc\"}]}");

    MemorySyntaxTree tree = SyntaxTreeReader.read(file);
    assertEquals("", tree.source());
    assertEquals("", tree.root().text());
    assertTrue(tree.root().isNamed());
    assertEquals("abc", tree.root().children().get(0).text());
  }

  @Test
  @DisplayName("malformed documents are rejected")
  void malformed(@TempDir Path dir) {
    assertThrows(SerializationException.class, () -> SyntaxTreeReader.read("[1, 2]"));
    assertThrows(SerializationException.class, () -> SyntaxTreeReader.read("{\"kind\": "));
    assertThrows(SerializationException.class, () -> SyntaxTreeReader.read("{\"named\": true}"));
    assertThrows(
        SerializationException.class,
        () -> SyntaxTreeReader.read("{\"kind\": \"a\", \"start\": [0]}"));
    assertThrows(
        SerializationException.class,
        () -> SyntaxTreeReader.read("{\"kind\": \"a\", \"start\": [0, -1]}"));
    assertThrows(
        SerializationException.class,
        () -> SyntaxTreeReader.read("{\"kind\": \"a\", \"children\": {}}"));
    assertThrows(
        SerializationException.class,
        () -> SyntaxTreeReader.read("{\"kind\": \"a\", \"children\": [\"b\"]}"));
    assertThrows(
        SerializationException.class, () -> SyntaxTreeReader.read(dir.resolve("missing.json")));
  }
}
