package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.ast.Expression;
import com.gentoro.graphdsl.ast.Statement;
import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.exception.GraphDslException;
import com.gentoro.graphdsl.graph.Attributes;
import com.gentoro.graphdsl.graph.Edge;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.GraphNodeRef;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Executes statement blocks. Each statement applies its effect to the graph or the variables of
 * the current {@link Frame}; the first failure propagates with the statement's location attached.
 */
public final class StatementInterpreter {
  private static final Logger log = LoggingService.getLogger(StatementInterpreter.class);

  private final ExecutionContext context;
  private final ExpressionEvaluator evaluator;

  public StatementInterpreter(ExecutionContext context, ExpressionEvaluator evaluator) {
    this.context = context;
    this.evaluator = evaluator;
  }

  public void execute(List<Statement> statements, Frame frame) {
    for (Statement statement : statements) {
      if (log.isTraceEnabled()) {
        log.trace("Executing {}", statement);
      }
      try {
        execute(statement, frame);
      } catch (GraphDslException e) {
        throw e.withContext("line", statement.location().line())
            .withContext("column", statement.location().column());
      }
    }
  }

  private void execute(Statement statement, Frame frame) {
    if (statement instanceof Statement.NodeStatement node) {
      requireNode(evaluator.evaluate(node.node(), frame));
    } else if (statement instanceof Statement.EdgeStatement edge) {
      GraphNodeRef source = requireNode(evaluator.evaluate(edge.source(), frame));
      GraphNodeRef sink = requireNode(evaluator.evaluate(edge.sink(), frame));
      context.graph().addEdge(source, sink);
    } else if (statement instanceof Statement.AttrStatement attr) {
      executeAttr(attr, frame);
    } else if (statement instanceof Statement.LetStatement let) {
      bind(let.variable(), let.value(), frame, false);
    } else if (statement instanceof Statement.VarStatement var) {
      bind(var.variable(), var.value(), frame, true);
    } else if (statement instanceof Statement.SetStatement set) {
      executeSet(set, frame);
    } else if (statement instanceof Statement.ScanStatement scan) {
      executeScan(scan, frame);
    } else if (statement instanceof Statement.PrintStatement print) {
      executePrint(print, frame);
    } else {
      throw new IllegalStateException("Unhandled statement " + statement);
    }
  }

  private void executeAttr(Statement.AttrStatement attr, Frame frame) {
    Graph graph = context.graph();
    GraphNodeRef node = requireNode(evaluator.evaluate(attr.node(), frame));
    Attributes target;
    if (attr.targetsEdge()) {
      GraphNodeRef sink = requireNode(evaluator.evaluate(attr.sink(), frame));
      Edge edge = graph.node(node).getEdge(sink);
      if (edge == null) {
        throw new ExecutionException(
            ExecutionError.UNDEFINED_EDGE, "No edge " + node + " -> " + sink);
      }
      target = edge.attributes();
    } else {
      target = graph.node(node).attributes();
    }
    for (Statement.AttributeAssignment assignment : attr.attributes()) {
      Value value = evaluator.evaluate(assignment.value(), frame);
      if (!target.add(assignment.name(), value)) {
        throw new ExecutionException(
            ExecutionError.DUPLICATE_ATTRIBUTE,
            "Attribute '"
                + assignment.name()
                + "' is already set to "
                + target.get(assignment.name()).display()
                + (attr.targetsEdge() ? " on edge from " : " on ")
                + node);
      }
    }
  }

  private void bind(Expression.Variable variable, Expression valueExpr, Frame frame, boolean mut) {
    VariableEnvironment variables = frame.variables();
    if (variable instanceof Expression.ScopedVariable scoped) {
      SyntaxNodeRef node = evaluator.evaluate(scoped.scope(), frame).asSyntaxNode();
      variables.defineScoped(node, scoped.name(), evaluator.evaluate(valueExpr, frame), mut);
    } else {
      variables.defineLocal(variable.name(), evaluator.evaluate(valueExpr, frame), mut);
    }
  }

  private void executeSet(Statement.SetStatement set, Frame frame) {
    VariableEnvironment variables = frame.variables();
    if (set.variable() instanceof Expression.ScopedVariable scoped) {
      SyntaxNodeRef node = evaluator.evaluate(scoped.scope(), frame).asSyntaxNode();
      variables.assignScoped(node, scoped.name(), evaluator.evaluate(set.value(), frame));
    } else {
      variables.assignLocal(set.variable().name(), evaluator.evaluate(set.value(), frame));
    }
  }

  private void executeScan(Statement.ScanStatement scan, Frame frame) {
    String subject = evaluator.evaluate(scan.subject(), frame).asString();
    List<Pattern> patterns = new ArrayList<>(scan.arms().size());
    for (Statement.ScanArm arm : scan.arms()) {
      patterns.add(arm.regex());
    }
    RegexScanner.scan(
        subject,
        patterns,
        (armIndex, groups) -> {
          Frame armFrame = frame.child();
          for (int g = 0; g < groups.size(); g++) {
            armFrame.variables().defineLocal("$" + g, Value.of(groups.get(g)), false);
          }
          execute(scan.arms().get(armIndex).statements(), armFrame);
        });
  }

  private void executePrint(Statement.PrintStatement print, Frame frame) {
    StringBuilder line = new StringBuilder();
    for (Expression expression : print.values()) {
      Value value = evaluator.evaluate(expression, frame);
      if (value instanceof Value.StringValue string) {
        line.append(string.value());
      } else {
        line.append(value.display());
      }
    }
    context.config().printSink().accept(line.toString());
  }

  private GraphNodeRef requireNode(Value value) {
    GraphNodeRef ref = value.asGraphNode();
    if (!context.graph().contains(ref)) {
      throw new ExecutionException(
          ExecutionError.UNDEFINED_GRAPH_NODE, ref + " does not exist in the graph");
    }
    return ref;
  }
}
