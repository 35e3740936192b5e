package com.gentoro.graphdsl.functions;

/**
 * Service Provider Interface for bundles of graph DSL functions.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.graphdsl.functions.FunctionLibrary
 */
public interface FunctionLibrary {

  /** Unique library id used in configuration, e.g. "standard". */
  String id();

  /** Register every function of this library. */
  void registerAll(FunctionRegistry registry);
}
