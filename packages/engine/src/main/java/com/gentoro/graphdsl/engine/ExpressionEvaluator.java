package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.ast.Expression;
import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.GraphNodeRef;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.List;

/** Evaluates expressions to {@link Value}s against the state of one run. */
public final class ExpressionEvaluator {
  private final ExecutionContext context;

  public ExpressionEvaluator(ExecutionContext context) {
    this.context = context;
  }

  public Value evaluate(Expression expression, Frame frame) {
    if (expression instanceof Expression.Literal literal) {
      return literal.value();
    }
    if (expression instanceof Expression.ListLiteral list) {
      return Value.list(evaluateAll(list.elements(), frame));
    }
    if (expression instanceof Expression.SetLiteral set) {
      return Value.set(evaluateAll(set.elements(), frame));
    }
    if (expression instanceof Expression.Capture capture) {
      return evaluateCapture(capture.name(), frame);
    }
    if (expression instanceof Expression.UnscopedVariable variable) {
      return frame.variables().lookup(variable.name());
    }
    if (expression instanceof Expression.ScopedVariable variable) {
      Value scope = evaluate(variable.scope(), frame);
      return frame.variables().lookupScoped(scope.asSyntaxNode(), variable.name());
    }
    if (expression instanceof Expression.TagPath path) {
      return Value.of(resolveTagPath(path, frame));
    }
    if (expression instanceof Expression.Call call) {
      List<Value> arguments = evaluateAll(call.arguments(), frame);
      return context.functions().invoke(call.function(), context, arguments);
    }
    throw new IllegalStateException("Unhandled expression " + expression);
  }

  private List<Value> evaluateAll(List<Expression> expressions, Frame frame) {
    List<Value> values = new ArrayList<>(expressions.size());
    for (Expression expression : expressions) {
      values.add(evaluate(expression, frame));
    }
    return values;
  }

  private Value evaluateCapture(String name, Frame frame) {
    if (!frame.captureNames().contains(name)) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_CAPTURE, "Query does not declare capture @" + name);
    }
    List<SyntaxNode> nodes = frame.match().nodes(name);
    Graph graph = context.graph();
    if (nodes.isEmpty()) {
      return Value.NULL;
    }
    if (nodes.size() == 1) {
      return Value.of(graph.addSyntaxNode(nodes.get(0)));
    }
    List<Value> values = new ArrayList<>(nodes.size());
    for (SyntaxNode node : nodes) {
      values.add(Value.of(graph.addSyntaxNode(node)));
    }
    return Value.list(values);
  }

  private GraphNodeRef resolveTagPath(Expression.TagPath path, Frame frame) {
    Value base = evaluate(path.base(), frame);
    String tags = String.join(".", path.tags());
    GraphNodeTable table = context.graphNodes();
    if (base instanceof Value.SyntaxNodeValue syntaxNode) {
      return table.resolve(context.graph(), new GraphNodeTable.Key(syntaxNode.ref().id(), tags));
    }
    if (base instanceof Value.GraphNodeValue graphNode) {
      GraphNodeTable.Key key = table.keyOf(graphNode.ref());
      if (key == null) {
        throw new ExecutionException(
            ExecutionError.UNDEFINED_GRAPH_NODE,
            graphNode.ref() + " was not created from a tag path and cannot be extended");
      }
      return table.resolve(context.graph(), key.extend(tags));
    }
    throw new ExecutionException(
        ExecutionError.EXPECTED_SYNTAX_NODE, "Tag path base: got " + base.display());
  }
}
