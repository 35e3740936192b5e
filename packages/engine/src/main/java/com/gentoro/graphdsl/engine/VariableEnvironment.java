package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.graph.Value;

/**
 * The variables visible to one statement block.
 *
 * <p>A bare name resolves local first, then the scoped variable of the same name on the default
 * syntax node (if the match has one), then globals. Scoped variables of other nodes are only
 * reachable through the qualified {@code node::name} form.
 */
public final class VariableEnvironment {
  private final Globals globals;
  private final ScopedVariables scoped;
  private final LocalScope locals;
  private final SyntaxNodeRef defaultNode;

  public VariableEnvironment(
      Globals globals, ScopedVariables scoped, LocalScope locals, SyntaxNodeRef defaultNode) {
    this.globals = globals;
    this.scoped = scoped;
    this.locals = locals;
    this.defaultNode = defaultNode;
  }

  /** Same globals, scoped table and default node; a child scope for locals. */
  public VariableEnvironment child() {
    return new VariableEnvironment(globals, scoped, locals.child(), defaultNode);
  }

  /**
   * Resolve a bare variable name.
   *
   * @throws ExecutionException with {@code UNDEFINED_VARIABLE} if nothing binds it
   */
  public Value lookup(String name) {
    Value value = locals.lookup(name);
    if (value == null && defaultNode != null) {
      value = scoped.lookup(defaultNode, name);
    }
    if (value == null) {
      value = globals.get(name);
    }
    if (value == null) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'");
    }
    return value;
  }

  public Value lookupScoped(SyntaxNodeRef node, String name) {
    Value value = scoped.lookup(node, name);
    if (value == null) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_VARIABLE,
          "Undefined scoped variable '" + name + "' on " + node);
    }
    return value;
  }

  public void defineLocal(String name, Value value, boolean mutable) {
    locals.define(name, value, mutable);
  }

  public void assignLocal(String name, Value value) {
    locals.assign(name, value);
  }

  public void defineScoped(SyntaxNodeRef node, String name, Value value, boolean mutable) {
    scoped.define(node, name, value, mutable);
  }

  public void assignScoped(SyntaxNodeRef node, String name, Value value) {
    scoped.assign(node, name, value);
  }

  /** The syntax node bare names fall back to for scoped lookups, or {@code null}. */
  public SyntaxNodeRef defaultNode() {
    return defaultNode;
  }
}
