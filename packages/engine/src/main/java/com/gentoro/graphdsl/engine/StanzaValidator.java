package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.ast.DslFile;
import com.gentoro.graphdsl.ast.Expression;
import com.gentoro.graphdsl.ast.Stanza;
import com.gentoro.graphdsl.ast.Statement;
import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import com.gentoro.graphdsl.exception.QueryException;
import com.gentoro.graphdsl.tree.Query;
import com.gentoro.graphdsl.tree.QueryEngine;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a parsed DSL file before any statement runs.
 *
 * <p>Every stanza query must compile, and every {@code @capture} a stanza's statements mention
 * must be declared by that stanza's query. Failures carry the stanza index and location in their
 * context.
 */
public final class StanzaValidator {

  private StanzaValidator() {}

  /**
   * Compile and check every stanza.
   *
   * @throws ExecutionException with {@code QUERY_ERROR} when a query does not compile, or {@code
   *     UNDEFINED_CAPTURE} when a statement references an undeclared capture
   */
  public static List<CompiledStanza> validate(DslFile file, QueryEngine queryEngine) {
    List<CompiledStanza> compiled = new ArrayList<>(file.stanzas().size());
    for (int index = 0; index < file.stanzas().size(); index++) {
      Stanza stanza = file.stanzas().get(index);
      try {
        Query query = compile(stanza, queryEngine);
        for (Statement statement : stanza.statements()) {
          checkStatement(statement, query.captureNames());
        }
        compiled.add(new CompiledStanza(index, stanza, query));
      } catch (ExecutionException e) {
        e.withContext("stanza", index)
            .withContext("stanzaLine", stanza.location().line())
            .withContext("stanzaColumn", stanza.location().column());
        throw e;
      }
    }
    return compiled;
  }

  private static Query compile(Stanza stanza, QueryEngine queryEngine) {
    try {
      return queryEngine.compile(stanza.query());
    } catch (QueryException e) {
      throw new ExecutionException(
          ExecutionError.QUERY_ERROR, "Invalid query: " + e.getMessage(), e);
    }
  }

  private static void checkStatement(Statement statement, List<String> captures) {
    try {
      if (statement instanceof Statement.NodeStatement node) {
        checkExpression(node.node(), captures);
      } else if (statement instanceof Statement.EdgeStatement edge) {
        checkExpression(edge.source(), captures);
        checkExpression(edge.sink(), captures);
      } else if (statement instanceof Statement.AttrStatement attr) {
        checkExpression(attr.node(), captures);
        if (attr.targetsEdge()) {
          checkExpression(attr.sink(), captures);
        }
        for (Statement.AttributeAssignment assignment : attr.attributes()) {
          checkExpression(assignment.value(), captures);
        }
      } else if (statement instanceof Statement.LetStatement let) {
        checkVariable(let.variable(), captures);
        checkExpression(let.value(), captures);
      } else if (statement instanceof Statement.VarStatement var) {
        checkVariable(var.variable(), captures);
        checkExpression(var.value(), captures);
      } else if (statement instanceof Statement.SetStatement set) {
        checkVariable(set.variable(), captures);
        checkExpression(set.value(), captures);
      } else if (statement instanceof Statement.ScanStatement scan) {
        checkExpression(scan.subject(), captures);
        for (Statement.ScanArm arm : scan.arms()) {
          for (Statement nested : arm.statements()) {
            checkStatement(nested, captures);
          }
        }
      } else if (statement instanceof Statement.PrintStatement print) {
        for (Expression value : print.values()) {
          checkExpression(value, captures);
        }
      }
    } catch (ExecutionException e) {
      e.withContext("line", statement.location().line())
          .withContext("column", statement.location().column());
      throw e;
    }
  }

  private static void checkVariable(Expression.Variable variable, List<String> captures) {
    if (variable instanceof Expression.ScopedVariable scoped) {
      checkExpression(scoped.scope(), captures);
    }
  }

  private static void checkExpression(Expression expression, List<String> captures) {
    if (expression instanceof Expression.Capture capture) {
      if (!captures.contains(capture.name())) {
        throw new ExecutionException(
            ExecutionError.UNDEFINED_CAPTURE,
            "Capture @" + capture.name() + " is not declared by the stanza query");
      }
    } else if (expression instanceof Expression.ListLiteral list) {
      list.elements().forEach(e -> checkExpression(e, captures));
    } else if (expression instanceof Expression.SetLiteral set) {
      set.elements().forEach(e -> checkExpression(e, captures));
    } else if (expression instanceof Expression.ScopedVariable scoped) {
      checkExpression(scoped.scope(), captures);
    } else if (expression instanceof Expression.TagPath path) {
      checkExpression(path.base(), captures);
    } else if (expression instanceof Expression.Call call) {
      call.arguments().forEach(e -> checkExpression(e, captures));
    }
  }
}
