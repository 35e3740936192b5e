package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.Value;
import java.util.HashMap;
import java.util.Map;

/**
 * Local variables of one statement-block execution. A fresh root scope is created for each query
 * match; scan arms run in a child scope that can read and {@code set} the outer bindings.
 */
public final class LocalScope {
  private final LocalScope parent;
  private final Map<String, VariableBinding> bindings = new HashMap<>();

  private LocalScope(LocalScope parent) {
    this.parent = parent;
  }

  public static LocalScope root() {
    return new LocalScope(null);
  }

  public LocalScope child() {
    return new LocalScope(this);
  }

  /**
   * Bind a new variable in this scope.
   *
   * @throws ExecutionException with {@code DUPLICATE_VARIABLE} if this scope already binds it
   */
  public void define(String name, Value value, boolean mutable) {
    if (bindings.containsKey(name)) {
      throw new ExecutionException(
          ExecutionError.DUPLICATE_VARIABLE, "Variable '" + name + "' is already defined");
    }
    bindings.put(name, new VariableBinding(value, mutable));
  }

  /**
   * Update the nearest binding of a variable.
   *
   * @throws ExecutionException with {@code UNDEFINED_VARIABLE} if no scope binds it, or {@code
   *     IMMUTABLE_VARIABLE} if it was bound with {@code let}
   */
  public void assign(String name, Value value) {
    VariableBinding binding = find(name);
    if (binding == null) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_VARIABLE, "Cannot set undefined variable '" + name + "'");
    }
    if (!binding.isMutable()) {
      throw new ExecutionException(
          ExecutionError.IMMUTABLE_VARIABLE, "Cannot set immutable variable '" + name + "'");
    }
    binding.update(value);
  }

  /** The value of the nearest binding, or {@code null}. */
  public Value lookup(String name) {
    VariableBinding binding = find(name);
    return binding == null ? null : binding.value();
  }

  private VariableBinding find(String name) {
    for (LocalScope scope = this; scope != null; scope = scope.parent) {
      VariableBinding binding = scope.bindings.get(name);
      if (binding != null) {
        return binding;
      }
    }
    return null;
  }
}
