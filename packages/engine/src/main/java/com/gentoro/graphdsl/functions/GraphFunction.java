package com.gentoro.graphdsl.functions;

import com.gentoro.graphdsl.graph.Value;
import java.util.List;

/** A function callable from graph DSL expressions as {@code (name arg ...)}. */
@FunctionalInterface
public interface GraphFunction {

  /**
   * Invoke the function.
   *
   * @param context read access to the graph and the syntax tree of the current run
   * @param arguments evaluated arguments, in source order
   * @return the result; {@code null} is treated as {@code #null}
   */
  Value call(FunctionContext context, List<Value> arguments);
}
