package com.gentoro.graphdsl.graph;

import com.gentoro.graphdsl.exception.ExecutionError;
import com.gentoro.graphdsl.exception.ExecutionException;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The value of an expression or attribute.
 *
 * <p>Values are immutable, structurally equal and totally ordered across all variants: first by
 * variant (null, boolean, integer, string, list, set, syntax node, graph node), then by content.
 * The order is what keeps {@link SetValue} deduplicated and serialization deterministic.
 */
public sealed interface Value extends Comparable<Value>
    permits Value.NullValue,
        Value.BooleanValue,
        Value.IntegerValue,
        Value.StringValue,
        Value.ListValue,
        Value.SetValue,
        Value.SyntaxNodeValue,
        Value.GraphNodeValue {

  long MAX_INTEGER = 0xFFFF_FFFFL;

  /** Orders strings by Unicode code point, the order used for string values. */
  Comparator<String> CODE_POINT_ORDER = Value::compareCodePoints;

  NullValue NULL = new NullValue();
  BooleanValue TRUE = new BooleanValue(true);
  BooleanValue FALSE = new BooleanValue(false);

  static Value of(boolean value) {
    return value ? TRUE : FALSE;
  }

  static Value of(long value) {
    return new IntegerValue(value);
  }

  static Value of(String value) {
    return new StringValue(value);
  }

  static Value of(SyntaxNodeRef ref) {
    return new SyntaxNodeValue(ref);
  }

  static Value of(GraphNodeRef ref) {
    return new GraphNodeValue(ref);
  }

  static Value list(List<? extends Value> values) {
    return new ListValue(List.copyOf(values));
  }

  static Value set(Collection<? extends Value> values) {
    return new SetValue(new TreeSet<>(values));
  }

  /** Position of the variant in the cross-variant order. */
  int rank();

  /** Display form, as written by {@code print} and the text dump. */
  String display();

  default boolean isNull() {
    return this instanceof NullValue;
  }

  default boolean asBoolean() {
    if (this instanceof BooleanValue b) return b.value();
    throw mismatch(ExecutionError.EXPECTED_BOOLEAN);
  }

  default long asInteger() {
    if (this instanceof IntegerValue i) return i.value();
    throw mismatch(ExecutionError.EXPECTED_INTEGER);
  }

  default String asString() {
    if (this instanceof StringValue s) return s.value();
    throw mismatch(ExecutionError.EXPECTED_STRING);
  }

  default List<Value> asList() {
    if (this instanceof ListValue l) return l.values();
    throw mismatch(ExecutionError.EXPECTED_LIST);
  }

  default SortedSet<Value> asSet() {
    if (this instanceof SetValue s) return s.values();
    throw mismatch(ExecutionError.EXPECTED_SET);
  }

  default SyntaxNodeRef asSyntaxNode() {
    if (this instanceof SyntaxNodeValue n) return n.ref();
    throw mismatch(ExecutionError.EXPECTED_SYNTAX_NODE);
  }

  default GraphNodeRef asGraphNode() {
    if (this instanceof GraphNodeValue n) return n.ref();
    throw mismatch(ExecutionError.EXPECTED_GRAPH_NODE);
  }

  private ExecutionException mismatch(ExecutionError error) {
    return new ExecutionException(error, "got " + display());
  }

  @Override
  default int compareTo(Value other) {
    int byRank = Integer.compare(rank(), other.rank());
    if (byRank != 0) {
      return byRank;
    }
    if (this instanceof BooleanValue a) {
      return Boolean.compare(a.value(), ((BooleanValue) other).value());
    }
    if (this instanceof IntegerValue a) {
      return Long.compare(a.value(), ((IntegerValue) other).value());
    }
    if (this instanceof StringValue a) {
      return compareCodePoints(a.value(), ((StringValue) other).value());
    }
    if (this instanceof ListValue a) {
      return compareSequences(a.values(), ((ListValue) other).values());
    }
    if (this instanceof SetValue a) {
      return compareSequences(a.values(), ((SetValue) other).values());
    }
    if (this instanceof SyntaxNodeValue a) {
      return a.ref().compareTo(((SyntaxNodeValue) other).ref());
    }
    if (this instanceof GraphNodeValue a) {
      return a.ref().compareTo(((GraphNodeValue) other).ref());
    }
    return 0;
  }

  private static int compareCodePoints(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Boolean.compare(i < a.length(), j < b.length());
  }

  private static int compareSequences(Iterable<Value> a, Iterable<Value> b) {
    Iterator<Value> left = a.iterator();
    Iterator<Value> right = b.iterator();
    while (left.hasNext() && right.hasNext()) {
      int cmp = left.next().compareTo(right.next());
      if (cmp != 0) {
        return cmp;
      }
    }
    return Boolean.compare(left.hasNext(), right.hasNext());
  }

  private static String joinDisplay(Iterable<Value> values) {
    StringBuilder sb = new StringBuilder();
    for (Value value : values) {
      if (sb.length() > 0) sb.append(", ");
      sb.append(value.display());
    }
    return sb.toString();
  }

  /** Quote a string with the escapes understood by the DSL lexer. */
  static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\0' -> sb.append("\\0");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> sb.append(c);
      }
    }
    return sb.append('"').toString();
  }

  record NullValue() implements Value {
    @Override
    public int rank() {
      return 0;
    }

    @Override
    public String display() {
      return "#null";
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record BooleanValue(boolean value) implements Value {
    @Override
    public int rank() {
      return 1;
    }

    @Override
    public String display() {
      return value ? "#true" : "#false";
    }

    @Override
    public String toString() {
      return display();
    }
  }

  /** Unsigned 32-bit integer. */
  record IntegerValue(long value) implements Value {
    public IntegerValue {
      if (value < 0 || value > MAX_INTEGER) {
        throw new IllegalArgumentException("Integer out of unsigned 32-bit range: " + value);
      }
    }

    @Override
    public int rank() {
      return 2;
    }

    @Override
    public String display() {
      return Long.toString(value);
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record StringValue(String value) implements Value {
    public StringValue {
      if (value == null) {
        throw new IllegalArgumentException("String value must not be null");
      }
    }

    @Override
    public int rank() {
      return 3;
    }

    @Override
    public String display() {
      return quote(value);
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record ListValue(List<Value> values) implements Value {
    public ListValue {
      values = List.copyOf(values);
    }

    @Override
    public int rank() {
      return 4;
    }

    @Override
    public String display() {
      return "[" + joinDisplay(values) + "]";
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record SetValue(SortedSet<Value> values) implements Value {
    public SetValue {
      values = Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    @Override
    public int rank() {
      return 5;
    }

    @Override
    public String display() {
      return "{" + joinDisplay(values) + "}";
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record SyntaxNodeValue(SyntaxNodeRef ref) implements Value {
    @Override
    public int rank() {
      return 6;
    }

    @Override
    public String display() {
      return ref.toString();
    }

    @Override
    public String toString() {
      return display();
    }
  }

  record GraphNodeValue(GraphNodeRef ref) implements Value {
    @Override
    public int rank() {
      return 7;
    }

    @Override
    public String display() {
      return ref.toString();
    }

    @Override
    public String toString() {
      return display();
    }
  }
}
