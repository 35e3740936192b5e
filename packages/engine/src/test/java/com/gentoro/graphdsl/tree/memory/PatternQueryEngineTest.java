package com.gentoro.graphdsl.tree.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdsl.exception.QueryException;
import com.gentoro.graphdsl.tree.Query;
import com.gentoro.graphdsl.tree.QueryMatch;
import com.gentoro.graphdsl.tree.SyntaxNode;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PatternQueryEngineTest {

  private final PatternQueryEngine engine = new PatternQueryEngine();
  private final MemorySyntaxTree tree = TestTrees.functions();

  private List<String> texts(String pattern, String capture) {
    return engine.compile(pattern).matches(tree).stream()
        .map(m -> m.nodes(capture).stream().map(SyntaxNode::text).collect(Collectors.joining("|")))
        .toList();
  }

  @Test
  @DisplayName("capture names are listed in order of first appearance")
  void captureNames() {
    Query query =
        engine.compile("(function_definition name: (identifier) @name (parameters) @params) @fn");
    assertEquals(List.of("name", "params", "fn"), query.captureNames());
  }

  @Test
  @DisplayName("matches are reported in pre-order of the matched node")
  void preOrder() {
    assertEquals(List.of("foo", "a", "b", "bar"), texts("(identifier) @id", "id"));
  }

  @Test
  @DisplayName("fields restrict which child a pattern may match")
  void fields() {
    assertEquals(List.of("foo", "bar"), texts("(_ name: (identifier) @n)", "n"));
  }

  @Test
  @DisplayName("every distinct assignment of child patterns is its own match")
  void distinctAssignments() {
    List<QueryMatch> matches =
        engine.compile("(parameters (identifier) @x (identifier) @y)").matches(tree);
    assertEquals(1, matches.size());
    assertEquals("a", matches.get(0).nodes("x").get(0).text());
    assertEquals("b", matches.get(0).nodes("y").get(0).text());

    assertEquals(List.of("a", "b"), texts("(parameters (identifier) @p)", "p"));
  }

  @Test
  @DisplayName("anonymous nodes match by their text, wildcards by namedness")
  void anonymousAndWildcards() {
    assertEquals(List.of("(", "("), texts("(parameters \"(\" @open)", "open"));
    assertEquals(2, texts("(parameters (_) @named)", "named").size());
    assertEquals(
        List.of("(", "a", ",", "b", ")", "(", ")"), texts("(parameters _ @any)", "any"));
  }

  @Test
  @DisplayName("alternations and multiple top-level patterns")
  void alternationsAndPatterns() {
    assertEquals(
        List.of("def foo(a, b):", "(a, b)", "def bar():", "()"),
        texts("[(function_definition) (parameters)] @x", "x"));

    Query query = engine.compile("(program) @p (identifier) @id");
    List<QueryMatch> matches = query.matches(tree);
    assertEquals(5, matches.size());
    assertTrue(matches.get(0).captures().containsKey("p"));
    assertFalse(matches.get(0).captures().containsKey("id"));
  }

  @Test
  @DisplayName("predicates filter matches on node text")
  void predicates() {
    assertEquals(List.of("foo"), texts("((identifier) @id (#eq? @id \"foo\"))", "id"));
    assertEquals(
        List.of("a", "b"), texts("((identifier) @id (#not-match? @id \"^(foo|bar)$\"))", "id"));
    assertEquals(List.of("bar"), texts("(identifier) @id (#match? @id \"^b.r\")", "id"));
    assertEquals(
        List.of("a", "b", "bar"), texts("(identifier) @id (#not-eq? @id \"foo\")", "id"));
  }

  @Test
  @DisplayName("malformed patterns are rejected with a query error")
  void malformed() {
    assertThrows(QueryException.class, () -> engine.compile(""));
    assertThrows(QueryException.class, () -> engine.compile("(identifier"));
    assertThrows(QueryException.class, () -> engine.compile("identifier"));
    assertThrows(QueryException.class, () -> engine.compile("(identifier) @"));
    assertThrows(QueryException.class, () -> engine.compile("(a) @x (#frob? @x \"y\")"));
    assertThrows(QueryException.class, () -> engine.compile("(a) @x (#eq? @nope \"y\")"));
    assertThrows(QueryException.class, () -> engine.compile("(a) @x (#match? @x \"(\")"));
    assertThrows(QueryException.class, () -> engine.compile("((a) (b))"));
  }
}
