package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.graph.Value;
import java.util.HashMap;
import java.util.Map;

/**
 * Variables that belong to a syntax node ({@code @node::name}). Keyed by the numeric syntax node
 * id, never by a tree handle, and kept for the whole run.
 */
public final class ScopedVariables {
  private record Key(long syntaxNodeId, String name) {}

  private final Map<Key, VariableBinding> bindings = new HashMap<>();

  public void define(SyntaxNodeRef node, String name, Value value, boolean mutable) {
    Key key = new Key(node.id(), name);
    if (bindings.containsKey(key)) {
      throw new ExecutionException(
          ExecutionError.DUPLICATE_VARIABLE,
          "Scoped variable '" + name + "' is already defined on " + node);
    }
    bindings.put(key, new VariableBinding(value, mutable));
  }

  public void assign(SyntaxNodeRef node, String name, Value value) {
    VariableBinding binding = bindings.get(new Key(node.id(), name));
    if (binding == null) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_VARIABLE,
          "Cannot set undefined scoped variable '" + name + "' on " + node);
    }
    if (!binding.isMutable()) {
      throw new ExecutionException(
          ExecutionError.IMMUTABLE_VARIABLE,
          "Cannot set immutable scoped variable '" + name + "' on " + node);
    }
    binding.update(value);
  }

  /** The value bound to (node, name), or {@code null}. */
  public Value lookup(SyntaxNodeRef node, String name) {
    VariableBinding binding = bindings.get(new Key(node.id(), name));
    return binding == null ? null : binding.value();
  }

  public int size() {
    return bindings.size();
  }
}
