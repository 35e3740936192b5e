package com.gentoro.graphdsl.tree;

import com.gentoro.graphdsl.exception.QueryException;

/**
 * Compiles stanza query patterns. The pattern language is owned by the implementation; the engine
 * treats pattern text as opaque.
 */
public interface QueryEngine {

  /**
   * Compile a query pattern.
   *
   * @throws QueryException if the pattern is malformed
   */
  Query compile(String pattern);
}
