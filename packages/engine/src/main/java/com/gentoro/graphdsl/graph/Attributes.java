package com.gentoro.graphdsl.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The attributes of a graph node or edge. Each name may be written once; a second write is
 * rejected and the first value is kept.
 */
public class Attributes {

  private final Map<String, Value> values = new HashMap<>();

  /**
   * Add an attribute.
   *
   * @return {@code true} if the attribute was stored, {@code false} if an attribute with the same
   *     name already exists (the existing value is left untouched)
   */
  public boolean add(String name, Value value) {
    return values.putIfAbsent(name, value) == null;
  }

  /** The value of an attribute, or {@code null} when it is not set. */
  public Value get(String name) {
    return values.get(name);
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Attribute names in code point order. */
  public List<String> names() {
    List<String> names = new ArrayList<>(values.keySet());
    names.sort(Value.CODE_POINT_ORDER);
    return names;
  }

  /** One {@code "  name: value"} line per attribute, in name order. */
  public String display() {
    StringBuilder sb = new StringBuilder();
    for (String name : names()) {
      sb.append("  ").append(name).append(": ").append(values.get(name).display()).append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return display();
  }
}
