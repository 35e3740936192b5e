package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.functions.FunctionContext;
import com.gentoro.graphdsl.functions.FunctionRegistry;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.tree.SyntaxTree;

/**
 * All mutable state of one run: the graph under construction, scoped variables and the tag-path
 * memo table, together with the read-only collaborators the run needs. A context is never shared
 * between runs.
 */
public final class ExecutionContext implements FunctionContext {
  private final SyntaxTree tree;
  private final Globals globals;
  private final FunctionRegistry functions;
  private final ExecutionConfig config;
  private final Graph graph = new Graph();
  private final ScopedVariables scopedVariables = new ScopedVariables();
  private final GraphNodeTable graphNodes = new GraphNodeTable();

  public ExecutionContext(
      SyntaxTree tree, Globals globals, FunctionRegistry functions, ExecutionConfig config) {
    this.tree = tree;
    this.globals = globals == null ? Globals.empty() : globals;
    this.functions = functions;
    this.config = config == null ? ExecutionConfig.defaults() : config;
  }

  @Override
  public Graph graph() {
    return graph;
  }

  @Override
  public SyntaxTree tree() {
    return tree;
  }

  public Globals globals() {
    return globals;
  }

  public FunctionRegistry functions() {
    return functions;
  }

  public ExecutionConfig config() {
    return config;
  }

  public ScopedVariables scopedVariables() {
    return scopedVariables;
  }

  public GraphNodeTable graphNodes() {
    return graphNodes;
  }
}
