package com.gentoro.graphdsl.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdsl.ast.DslFile;
import com.gentoro.graphdsl.ast.Expression;
import com.gentoro.graphdsl.ast.Stanza;
import com.gentoro.graphdsl.ast.Statement;
import com.gentoro.graphdsl.exception.ParseException;
import com.gentoro.graphdsl.graph.Value;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DslParserTest {

  private static List<Statement> statements(String dsl) {
    DslFile file = DslParser.parse(dsl);
    assertEquals(1, file.stanzas().size());
    return file.stanzas().get(0).statements();
  }

  @Test
  @DisplayName("stanza query text is kept verbatim up to the block")
  void queryText() {
    DslFile file =
        DslParser.parse(
            """
            ; leading comment
            (call_expression
              function: (identifier) @fn
              (#match? @fn "^[a-z]+\\\\d{")) @call
            {
              node @call.def
            }
            (identifier) @id { }
            """);
    assertEquals(2, file.stanzas().size());
    Stanza first = file.stanzas().get(0);
    assertTrue(first.query().startsWith("(call_expression"));
    assertTrue(first.query().endsWith("@call"));
    assertEquals(2, first.location().line());
    assertEquals("(identifier) @id", file.stanzas().get(1).query());
    assertTrue(file.stanzas().get(1).statements().isEmpty());
  }

  @Test
  @DisplayName("node, edge and attr statements")
  void graphStatements() {
    List<Statement> statements =
        statements(
            """
            (a) @a {
              node @a.def
              edge @a.def -> @a.ref
              attr (@a.def) name = "x", flag
              attr (@a.def -> @a.ref) weight = 2
              attr @a.ref kind = #null
            }
            """);
    assertEquals(5, statements.size());

    Statement.NodeStatement node = (Statement.NodeStatement) statements.get(0);
    assertEquals(
        new Expression.TagPath(new Expression.Capture("a"), List.of("def")), node.node());
    assertEquals(2, node.location().line());
    assertEquals(3, node.location().column());

    assertInstanceOf(Statement.EdgeStatement.class, statements.get(1));

    Statement.AttrStatement attr = (Statement.AttrStatement) statements.get(2);
    assertFalse(attr.targetsEdge());
    assertEquals(2, attr.attributes().size());
    assertEquals(new Expression.Literal(Value.TRUE), attr.attributes().get(1).value());

    assertTrue(((Statement.AttrStatement) statements.get(3)).targetsEdge());
    Statement.AttrStatement bare = (Statement.AttrStatement) statements.get(4);
    assertEquals(new Expression.Literal(Value.NULL), bare.attributes().get(0).value());
  }

  @Test
  @DisplayName("variables, scoped variables and calls")
  void variablesAndCalls() {
    List<Statement> statements =
        statements(
            """
            (a) @a {
              let x = (+ 1 2)
              var @a::count = 0
              set @a::count = (length [1, 2, 3,])
              print x, (eq x 3), {1, 1}
            }
            """);
    Statement.LetStatement let = (Statement.LetStatement) statements.get(0);
    assertEquals(new Expression.UnscopedVariable("x"), let.variable());
    assertEquals(
        new Expression.Call(
            "+",
            List.of(
                new Expression.Literal(Value.of(1)), new Expression.Literal(Value.of(2)))),
        let.value());

    Statement.VarStatement var = (Statement.VarStatement) statements.get(1);
    assertEquals(
        new Expression.ScopedVariable(new Expression.Capture("a"), "count"), var.variable());

    Statement.SetStatement set = (Statement.SetStatement) statements.get(2);
    Expression.Call length = (Expression.Call) set.value();
    assertEquals(3, ((Expression.ListLiteral) length.arguments().get(0)).elements().size());

    Statement.PrintStatement print = (Statement.PrintStatement) statements.get(3);
    assertEquals(3, print.values().size());
    assertInstanceOf(Expression.SetLiteral.class, print.values().get(2));
  }

  @Test
  @DisplayName("a parenthesized expression that cannot start a call is grouping")
  void grouping() {
    Statement.NodeStatement node =
        (Statement.NodeStatement) statements("(a) @a { node (@a).def }").get(0);
    assertEquals(
        new Expression.TagPath(new Expression.Capture("a"), List.of("def")), node.node());

    Statement.LetStatement let =
        (Statement.LetStatement) statements("(a) @a { let y = (x.tag) }").get(0);
    assertInstanceOf(Expression.TagPath.class, let.value());
  }

  @Test
  @DisplayName("string escapes are decoded")
  void stringEscapes() {
    Statement.PrintStatement print =
        (Statement.PrintStatement) statements("(a) @a { print \"q\\\"b\\\\n\\n\\t\\0\" }").get(0);
    assertEquals(
        new Expression.Literal(Value.of("q\"b\\n\n\t\0")), print.values().get(0));
  }

  @Test
  @DisplayName("scan arms compile their regular expressions and bind group variables")
  void scan() {
    Statement.ScanStatement scan =
        (Statement.ScanStatement)
            statements(
                    """
                    (a) @a {
                      scan "x" {
                        "([a-z]+)" { print $1 }
                        "\\\\d" { }
                      }
                    }
                    """)
                .get(0);
    assertEquals(2, scan.arms().size());
    assertEquals("([a-z]+)", scan.arms().get(0).regex().pattern());
    assertEquals("\\d", scan.arms().get(1).regex().pattern());
    Statement.PrintStatement print =
        (Statement.PrintStatement) scan.arms().get(0).statements().get(0);
    assertEquals(new Expression.UnscopedVariable("$1"), print.values().get(0));
  }

  @Test
  @DisplayName("syntax errors report line and column")
  void syntaxErrors() {
    ParseException e =
        assertThrows(ParseException.class, () -> DslParser.parse("(a) @a {\n  node\n}"));
    assertEquals(3, e.getLine());
    assertEquals(1, e.getColumn());

    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { frobnicate @a }"));
    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { print \"\\q\" }"));
    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { print 4294967296 }"));
    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { scan \"\" { \"(\" { } } }"));
    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { let 1 = 2 }"));
    assertThrows(ParseException.class, () -> DslParser.parse("(a) @a { node @a.def"));
  }

  @Test
  @DisplayName("the largest unsigned 32-bit integer is accepted")
  void maxInteger() {
    Statement.PrintStatement print =
        (Statement.PrintStatement) statements("(a) @a { print 4294967295 }").get(0);
    assertEquals(new Expression.Literal(Value.of(Value.MAX_INTEGER)), print.values().get(0));
  }
}
