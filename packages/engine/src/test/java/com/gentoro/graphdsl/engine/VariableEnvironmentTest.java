package com.gentoro.graphdsl.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.exception.SerializationException;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.tree.Position;
import com.gentoro.graphdsl.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VariableEnvironmentTest {

  private final SyntaxNodeRef nodeA = new SyntaxNodeRef(1, "identifier", new Position(0, 0));
  private final SyntaxNodeRef nodeB = new SyntaxNodeRef(2, "identifier", new Position(0, 4));

  @Test
  @DisplayName("bare names resolve local, then scoped on the default node, then global")
  void lookupOrder() {
    ScopedVariables scoped = new ScopedVariables();
    Globals globals = Globals.of(Map.of("v", Value.of("global"), "g", Value.of("only-global")));
    VariableEnvironment env = new VariableEnvironment(globals, scoped, LocalScope.root(), nodeA);

    assertEquals(Value.of("global"), env.lookup("v"));
    env.defineScoped(nodeA, "v", Value.of("scoped"), false);
    assertEquals(Value.of("scoped"), env.lookup("v"));
    env.defineLocal("v", Value.of("local"), false);
    assertEquals(Value.of("local"), env.lookup("v"));
    assertEquals(Value.of("only-global"), env.lookup("g"));
  }

  @Test
  @DisplayName("scoped variables of other nodes are only reachable qualified")
  void otherNodesNeedQualifiedLookup() {
    ScopedVariables scoped = new ScopedVariables();
    scoped.define(nodeB, "kind", Value.of("b"), false);
    VariableEnvironment env =
        new VariableEnvironment(Globals.empty(), scoped, LocalScope.root(), nodeA);

    ExecutionException e = assertThrows(ExecutionException.class, () -> env.lookup("kind"));
    assertEquals(ExecutionError.UNDEFINED_VARIABLE, e.getError());
    assertEquals(Value.of("b"), env.lookupScoped(nodeB, "kind"));
  }

  @Test
  @DisplayName("scoped var bindings follow the same let/var/set rules as locals")
  void scopedMutability() {
    ScopedVariables scoped = new ScopedVariables();
    scoped.define(nodeA, "count", Value.of(0), true);
    scoped.assign(nodeA, "count", Value.of(3));
    assertEquals(Value.of(3), scoped.lookup(nodeA, "count"));

    scoped.define(nodeA, "name", Value.of("x"), false);
    assertEquals(
        ExecutionError.IMMUTABLE_VARIABLE,
        assertThrows(ExecutionException.class, () -> scoped.assign(nodeA, "name", Value.NULL))
            .getError());
    assertEquals(
        ExecutionError.DUPLICATE_VARIABLE,
        assertThrows(
                ExecutionException.class, () -> scoped.define(nodeA, "count", Value.NULL, true))
            .getError());
    assertEquals(
        ExecutionError.UNDEFINED_VARIABLE,
        assertThrows(ExecutionException.class, () -> scoped.assign(nodeB, "count", Value.NULL))
            .getError());
  }

  @Test
  @DisplayName("globals are read from a JSON object")
  void globalsFromJson() {
    Globals globals =
        Globals.fromJson(
            JacksonUtility.readTree(
                "{\"file\": \"a.py\", \"depth\": 3, \"strict\": true, \"tags\": [\"x\"]}"));
    assertEquals(Value.of("a.py"), globals.get("file"));
    assertEquals(Value.of(3), globals.get("depth"));
    assertEquals(Value.TRUE, globals.get("strict"));
    assertEquals(Value.list(List.of(Value.of("x"))), globals.get("tags"));
    assertThrows(
        SerializationException.class,
        () -> Globals.fromJson(JacksonUtility.readTree("{\"n\": -1}")));
  }
}
