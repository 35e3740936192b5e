package com.gentoro.graphdsl.functions;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.graphdsl.exception.ConfigException;
import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.Value;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FunctionRegistryTest {

  private final FunctionContext context = mock(FunctionContext.class);

  @Test
  @DisplayName("invoke passes the context and arguments through")
  void invokesRegisteredFunction() {
    GraphFunction function = mock(GraphFunction.class);
    List<Value> args = List.of(Value.of(1), Value.of("x"));
    when(function.call(same(context), anyList())).thenReturn(Value.of("ok"));

    FunctionRegistry registry = new FunctionRegistry().register("probe", function);

    assertEquals(Value.of("ok"), registry.invoke("probe", context, args));
    verify(function).call(context, args);
  }

  @Test
  @DisplayName("a null result becomes #null")
  void nullResult() {
    GraphFunction function = mock(GraphFunction.class);
    FunctionRegistry registry = new FunctionRegistry().register("nothing", function);
    assertEquals(Value.NULL, registry.invoke("nothing", context, List.of()));
  }

  @Test
  @DisplayName("unknown names and failing functions raise execution errors")
  void failures() {
    GraphFunction failing = mock(GraphFunction.class);
    when(failing.call(any(), anyList())).thenThrow(new IllegalStateException("boom"));
    FunctionRegistry registry = new FunctionRegistry().register("fail", failing);

    ExecutionException unknown =
        assertThrows(ExecutionException.class, () -> registry.invoke("nope", context, List.of()));
    assertEquals(ExecutionError.UNKNOWN_FUNCTION, unknown.getError());

    ExecutionException failed =
        assertThrows(ExecutionException.class, () -> registry.invoke("fail", context, List.of()));
    assertEquals(ExecutionError.FUNCTION_ERROR, failed.getError());
    assertTrue(failed.getMessage().contains("boom"));
    assertInstanceOf(IllegalStateException.class, failed.getCause());
  }

  @Test
  @DisplayName("later registrations replace earlier ones")
  void replaces() {
    FunctionRegistry registry =
        new FunctionRegistry()
            .register("f", (ctx, args) -> Value.of(1))
            .register("f", (ctx, args) -> Value.of(2));
    assertEquals(Value.of(2), registry.invoke("f", context, List.of()));
    assertEquals(List.of("f"), List.copyOf(registry.names()));
  }

  @Test
  @DisplayName("libraries are discovered through ServiceLoader")
  void discoversLibraries() {
    FunctionRegistry all = FunctionRegistry.withLibraries(null);
    assertTrue(all.contains("eq"));
    assertTrue(all.contains("named-child-count"));

    FunctionRegistry standard = FunctionRegistry.withLibraries(List.of(StandardFunctions.ID));
    assertEquals(all.names(), standard.names());

    assertThrows(ConfigException.class, () -> FunctionRegistry.withLibraries(List.of("missing")));
  }
}
