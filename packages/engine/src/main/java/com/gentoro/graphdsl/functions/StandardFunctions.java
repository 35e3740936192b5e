package com.gentoro.graphdsl.functions;

import com.gentoro.graphdsl.graph.Value;
import com.gentoro.graphdsl.tree.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

/**
 * The {@code standard} function library.
 *
 * <ul>
 *   <li>Logic: {@code eq}, {@code not}, {@code and}, {@code or}, {@code is-null}
 *   <li>Arithmetic: {@code +}, {@code -}
 *   <li>Lists and strings: {@code concat}, {@code join}, {@code length}, {@code replace}
 *   <li>Syntax nodes: {@code node-type}, {@code source-text}, {@code start-row}, {@code
 *       start-column}, {@code end-row}, {@code end-column}, {@code named-child-count}
 * </ul>
 *
 * Argument errors are reported with {@link IllegalArgumentException}, which the registry turns
 * into {@code FUNCTION_ERROR}.
 */
public class StandardFunctions implements FunctionLibrary {

  public static final String ID = "standard";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public void registerAll(FunctionRegistry registry) {
    registry
        .register(
            "eq", (ctx, args) -> Value.of(exactly("eq", args, 2).get(0).equals(args.get(1))))
        .register("not", (ctx, args) -> Value.of(!exactly("not", args, 1).get(0).asBoolean()))
        .register("and", (ctx, args) -> Value.of(!booleans(args).contains(false)))
        .register("or", (ctx, args) -> Value.of(booleans(args).contains(true)))
        .register("is-null", (ctx, args) -> Value.of(exactly("is-null", args, 1).get(0).isNull()))
        .register("+", StandardFunctions::plus)
        .register("-", StandardFunctions::minus)
        .register("concat", StandardFunctions::concat)
        .register("join", StandardFunctions::join)
        .register("length", StandardFunctions::length)
        .register("replace", StandardFunctions::replace)
        .register(
            "node-type",
            (ctx, args) -> Value.of(node(ctx, exactly("node-type", args, 1).get(0)).kind()))
        .register(
            "source-text",
            (ctx, args) -> Value.of(node(ctx, exactly("source-text", args, 1).get(0)).text()))
        .register("start-row", position("start-row", n -> n.startPosition().row()))
        .register("start-column", position("start-column", n -> n.startPosition().column()))
        .register("end-row", position("end-row", n -> n.endPosition().row()))
        .register("end-column", position("end-column", n -> n.endPosition().column()))
        .register(
            "named-child-count",
            (ctx, args) ->
                Value.of(
                    node(ctx, exactly("named-child-count", args, 1).get(0))
                        .namedChildren()
                        .size()));
  }

  // no short-circuit: every argument must be a boolean
  private static List<Boolean> booleans(List<Value> args) {
    List<Boolean> booleans = new ArrayList<>(args.size());
    for (Value arg : args) {
      booleans.add(arg.asBoolean());
    }
    return booleans;
  }

  private static Value plus(FunctionContext ctx, List<Value> args) {
    long sum = 0;
    for (Value arg : args) {
      sum += arg.asInteger();
      if (sum > Value.MAX_INTEGER) {
        throw new IllegalArgumentException("Integer overflow in +");
      }
    }
    return Value.of(sum);
  }

  private static Value minus(FunctionContext ctx, List<Value> args) {
    exactly("-", args, 2);
    long difference = args.get(0).asInteger() - args.get(1).asInteger();
    if (difference < 0) {
      throw new IllegalArgumentException("Integer underflow in -: " + difference);
    }
    return Value.of(difference);
  }

  private static Value concat(FunctionContext ctx, List<Value> args) {
    List<Value> all = new ArrayList<>();
    for (Value arg : args) {
      all.addAll(arg.asList());
    }
    return Value.list(all);
  }

  // (join list) or (join list separator); strings are joined raw, other values by display form
  private static Value join(FunctionContext ctx, List<Value> args) {
    if (args.isEmpty() || args.size() > 2) {
      throw new IllegalArgumentException("join expects 1 or 2 arguments, got " + args.size());
    }
    String separator = args.size() == 2 ? args.get(1).asString() : "";
    List<String> parts = new ArrayList<>();
    for (Value element : args.get(0).asList()) {
      parts.add(element instanceof Value.StringValue s ? s.value() : element.display());
    }
    return Value.of(StringUtils.join(parts, separator));
  }

  private static Value length(FunctionContext ctx, List<Value> args) {
    Value value = exactly("length", args, 1).get(0);
    if (value instanceof Value.StringValue s) {
      return Value.of(s.value().codePointCount(0, s.value().length()));
    }
    if (value instanceof Value.SetValue s) {
      return Value.of(s.values().size());
    }
    return Value.of(value.asList().size());
  }

  private static Value replace(FunctionContext ctx, List<Value> args) {
    exactly("replace", args, 3);
    String text = args.get(0).asString();
    Pattern pattern = Pattern.compile(args.get(1).asString());
    return Value.of(pattern.matcher(text).replaceAll(args.get(2).asString()));
  }

  private static GraphFunction position(String name, ToIntFunction<SyntaxNode> coordinate) {
    return (ctx, args) ->
        Value.of(coordinate.applyAsInt(node(ctx, exactly(name, args, 1).get(0))));
  }

  private static SyntaxNode node(FunctionContext ctx, Value value) {
    return ctx.syntaxNode(value.asSyntaxNode());
  }

  private static List<Value> exactly(String name, List<Value> args, int count) {
    if (args.size() != count) {
      throw new IllegalArgumentException(
          name
              + " expects "
              + count
              + " argument"
              + (count == 1 ? "" : "s")
              + ", got "
              + args.size());
    }
    return args;
  }
}
