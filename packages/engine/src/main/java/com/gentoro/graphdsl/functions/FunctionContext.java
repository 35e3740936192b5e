package com.gentoro.graphdsl.functions;

import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.SyntaxTree;

/** What a {@link GraphFunction} may look at while it runs. */
public interface FunctionContext {

  Graph graph();

  SyntaxTree tree();

  /** The syntax node behind a ref handed to the function as an argument. */
  default SyntaxNode syntaxNode(SyntaxNodeRef ref) {
    return graph().syntaxNode(ref);
  }
}
