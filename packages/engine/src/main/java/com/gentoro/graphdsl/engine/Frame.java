package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.tree.QueryMatch;
import java.util.List;

/**
 * What a statement block sees while it runs: the query match that triggered it, the capture names
 * its query declares, and its variables.
 */
public record Frame(QueryMatch match, List<String> captureNames, VariableEnvironment variables) {

  public Frame {
    captureNames = List.copyOf(captureNames);
  }

  /** Same match, nested local scope. */
  public Frame child() {
    return new Frame(match, captureNames, variables.child());
  }
}
