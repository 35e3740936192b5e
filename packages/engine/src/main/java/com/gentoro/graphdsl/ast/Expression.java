package com.gentoro.graphdsl.ast;

import com.gentoro.graphdsl.graph.Value;
import java.util.List;

/** Expression nodes of the graph DSL. */
public sealed interface Expression
    permits Expression.Literal,
        Expression.ListLiteral,
        Expression.SetLiteral,
        Expression.Capture,
        Expression.UnscopedVariable,
        Expression.ScopedVariable,
        Expression.TagPath,
        Expression.Call {

  /** A variable reference that may also appear on the left-hand side of let/var/set. */
  sealed interface Variable permits UnscopedVariable, ScopedVariable {
    String name();
  }

  /** {@code #true}, {@code #false}, {@code #null}, strings and integers. */
  record Literal(Value value) implements Expression {}

  record ListLiteral(List<Expression> elements) implements Expression {
    public ListLiteral {
      elements = List.copyOf(elements);
    }
  }

  record SetLiteral(List<Expression> elements) implements Expression {
    public SetLiteral {
      elements = List.copyOf(elements);
    }
  }

  /** {@code @name}; the name is stored without the sigil. */
  record Capture(String name) implements Expression {}

  /** A bare name, including regex group variables {@code $0}, {@code $1}, ... */
  record UnscopedVariable(String name) implements Expression, Variable {}

  /** {@code scope::name} where {@code scope} evaluates to a syntax node. */
  record ScopedVariable(Expression scope, String name) implements Expression, Variable {}

  /** {@code base.tag.path}; {@code tags} holds the identifiers after the base. */
  record TagPath(Expression base, List<String> tags) implements Expression {
    public TagPath {
      tags = List.copyOf(tags);
    }
  }

  /** {@code (function arg ...)}. */
  record Call(String function, List<Expression> arguments) implements Expression {
    public Call {
      arguments = List.copyOf(arguments);
    }
  }
}
