package com.gentoro.graphdsl.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphdsl.exception.SerializationException;
import com.gentoro.graphdsl.graph.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable global variables, supplied once by the host before a run starts. */
public final class Globals {
  private static final Globals EMPTY = new Globals(Map.of());

  private final Map<String, Value> values;

  private Globals(Map<String, Value> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static Globals empty() {
    return EMPTY;
  }

  public static Globals of(Map<String, Value> values) {
    return values == null || values.isEmpty() ? EMPTY : new Globals(values);
  }

  /**
   * Build globals from a JSON object. Strings, booleans, null, non-negative integers and arrays
   * (as lists) are accepted.
   *
   * @throws SerializationException if the document is not an object or holds an unsupported value
   */
  public static Globals fromJson(JsonNode json) {
    if (json == null || json.isNull() || json.isMissingNode()) {
      return EMPTY;
    }
    if (!json.isObject()) {
      throw new SerializationException("Globals must be a JSON object");
    }
    Map<String, Value> values = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = json.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      values.put(e.getKey(), toValue(e.getKey(), e.getValue()));
    }
    return of(values);
  }

  private static Value toValue(String name, JsonNode node) {
    if (node.isNull()) return Value.NULL;
    if (node.isBoolean()) return Value.of(node.booleanValue());
    if (node.isTextual()) return Value.of(node.textValue());
    if (node.isIntegralNumber()
        && node.canConvertToLong()
        && node.longValue() >= 0
        && node.longValue() <= Value.MAX_INTEGER) {
      return Value.of(node.longValue());
    }
    if (node.isArray()) {
      List<Value> elements = new ArrayList<>();
      node.forEach(element -> elements.add(toValue(name, element)));
      return Value.list(elements);
    }
    throw new SerializationException(
        "Unsupported value for global '" + name + "': " + node.getNodeType());
  }

  /** The value of a global, or {@code null} when it is not defined. */
  public Value get(String name) {
    return values.get(name);
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  public Map<String, Value> asMap() {
    return values;
  }
}
