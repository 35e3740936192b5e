package com.gentoro.graphdsl.ast;

import java.util.List;
import java.util.regex.Pattern;

/** Statement nodes of the graph DSL. Every statement remembers where it was written. */
public sealed interface Statement
    permits Statement.NodeStatement,
        Statement.EdgeStatement,
        Statement.AttrStatement,
        Statement.LetStatement,
        Statement.VarStatement,
        Statement.SetStatement,
        Statement.ScanStatement,
        Statement.PrintStatement {

  Location location();

  /** {@code node expr}. */
  record NodeStatement(Expression node, Location location) implements Statement {}

  /** {@code edge source -> sink}. */
  record EdgeStatement(Expression source, Expression sink, Location location)
      implements Statement {}

  /**
   * {@code attr (node) name = value, ...} or {@code attr (source -> sink) name = value, ...}.
   *
   * @param node the node, or the edge source when {@code sink} is present
   * @param sink edge sink, {@code null} for node attributes
   */
  record AttrStatement(
      Expression node, Expression sink, List<AttributeAssignment> attributes, Location location)
      implements Statement {
    public AttrStatement {
      attributes = List.copyOf(attributes);
    }

    public boolean targetsEdge() {
      return sink != null;
    }
  }

  record AttributeAssignment(String name, Expression value) {}

  /** {@code let variable = value}: immutable binding. */
  record LetStatement(Expression.Variable variable, Expression value, Location location)
      implements Statement {}

  /** {@code var variable = value}: mutable binding. */
  record VarStatement(Expression.Variable variable, Expression value, Location location)
      implements Statement {}

  /** {@code set variable = value}: update of an existing mutable binding. */
  record SetStatement(Expression.Variable variable, Expression value, Location location)
      implements Statement {}

  /** {@code scan subject { "regex" { ... } ... }}. */
  record ScanStatement(Expression subject, List<ScanArm> arms, Location location)
      implements Statement {
    public ScanStatement {
      arms = List.copyOf(arms);
    }
  }

  record ScanArm(Pattern regex, List<Statement> statements, Location location) {
    public ScanArm {
      statements = List.copyOf(statements);
    }
  }

  /** {@code print value, ...}. */
  record PrintStatement(List<Expression> values, Location location) implements Statement {
    public PrintStatement {
      values = List.copyOf(values);
    }
  }
}
