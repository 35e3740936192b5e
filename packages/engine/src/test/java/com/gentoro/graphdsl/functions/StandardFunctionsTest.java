package com.gentoro.graphdsl.functions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.memory.MemorySyntaxTree;
import com.gentoro.graphdsl.tree.memory.TestTrees;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StandardFunctionsTest {

  private FunctionRegistry registry;
  private FunctionContext context;
  private Graph graph;
  private MemorySyntaxTree tree;

  @BeforeEach
  void setUp() {
    registry = new FunctionRegistry();
    new StandardFunctions().registerAll(registry);
    graph = new Graph();
    tree = TestTrees.functions();
    context = mock(FunctionContext.class);
    when(context.graph()).thenReturn(graph);
    when(context.tree()).thenReturn(tree);
    when(context.syntaxNode(any())).thenCallRealMethod();
  }

  private Value call(String name, Value... args) {
    return registry.invoke(name, context, List.of(args));
  }

  private ExecutionError failure(String name, Value... args) {
    return assertThrows(ExecutionException.class, () -> call(name, args)).getError();
  }

  @Test
  @DisplayName("logic functions")
  void logic() {
    assertEquals(Value.TRUE, call("eq", Value.of("a"), Value.of("a")));
    assertEquals(Value.FALSE, call("eq", Value.of(1), Value.of("1")));
    assertEquals(Value.FALSE, call("not", Value.TRUE));
    assertEquals(Value.TRUE, call("and"));
    assertEquals(Value.FALSE, call("and", Value.TRUE, Value.FALSE));
    assertEquals(Value.FALSE, call("or"));
    assertEquals(Value.TRUE, call("or", Value.FALSE, Value.TRUE));
    assertEquals(Value.TRUE, call("is-null", Value.NULL));
    assertEquals(Value.FALSE, call("is-null", Value.of(0)));

    assertEquals(ExecutionError.FUNCTION_ERROR, failure("eq", Value.TRUE));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("not", Value.of(1)));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("and", Value.FALSE, Value.of(7)));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("or", Value.TRUE, Value.of("x")));
    ExecutionException e =
        assertThrows(ExecutionException.class, () -> call("and", Value.FALSE, Value.of(7)));
    assertEquals(
        ExecutionError.EXPECTED_BOOLEAN, ((ExecutionException) e.getCause()).getError());
  }

  @Test
  @DisplayName("arithmetic stays within unsigned 32-bit integers")
  void arithmetic() {
    assertEquals(Value.of(0), call("+"));
    assertEquals(Value.of(6), call("+", Value.of(1), Value.of(2), Value.of(3)));
    assertEquals(Value.of(3), call("-", Value.of(5), Value.of(2)));
    assertEquals(
        ExecutionError.FUNCTION_ERROR, failure("+", Value.of(Value.MAX_INTEGER), Value.of(1)));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("-", Value.of(1), Value.of(2)));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("-", Value.of(1)));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("+", Value.of("1")));
  }

  @Test
  @DisplayName("list and string functions")
  void listsAndStrings() {
    Value ab = Value.list(List.of(Value.of("a"), Value.of("b")));
    assertEquals(
        Value.list(List.of(Value.of("a"), Value.of("b"), Value.of(1))),
        call("concat", ab, Value.list(List.of(Value.of(1)))));
    assertEquals(Value.of("ab"), call("join", ab));
    assertEquals(Value.of("a, b"), call("join", ab, Value.of(", ")));
    assertEquals(
        Value.of("x-1-#null"),
        call("join", Value.list(List.of(Value.of("x"), Value.of(1), Value.NULL)), Value.of("-")));
    assertEquals(Value.of(2), call("length", ab));
    assertEquals(Value.of(2), call("length", Value.of("h😀")));
    assertEquals(Value.of(1), call("length", Value.set(List.of(Value.of(1), Value.of(1)))));
    assertEquals(
        Value.of("a_b_c"), call("replace", Value.of("a.b-c"), Value.of("[.-]"), Value.of("_")));

    assertEquals(ExecutionError.FUNCTION_ERROR, failure("join"));
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("length", Value.of(3)));
    assertEquals(
        ExecutionError.FUNCTION_ERROR,
        failure("replace", Value.of("x"), Value.of("("), Value.of("")));
  }

  @Test
  @DisplayName("syntax node functions read the node behind a ref")
  void syntaxNodes() {
    SyntaxNode function = tree.root().children().get(0);
    SyntaxNode name = function.children().get(1);
    Value functionRef = Value.of(graph.addSyntaxNode(function));
    Value nameRef = Value.of(graph.addSyntaxNode(name));

    assertEquals(Value.of("function_definition"), call("node-type", functionRef));
    assertEquals(Value.of("foo"), call("source-text", nameRef));
    assertEquals(Value.of(0), call("start-row", nameRef));
    assertEquals(Value.of(4), call("start-column", nameRef));
    assertEquals(Value.of(0), call("end-row", nameRef));
    assertEquals(Value.of(7), call("end-column", nameRef));
    assertEquals(Value.of(2), call("named-child-count", functionRef));

    assertEquals(ExecutionError.FUNCTION_ERROR, failure("node-type", Value.of("foo")));
    SyntaxNodeRef foreign = new SyntaxNodeRef(99, "identifier", name.startPosition());
    assertEquals(ExecutionError.FUNCTION_ERROR, failure("node-type", Value.of(foreign)));
  }
}
