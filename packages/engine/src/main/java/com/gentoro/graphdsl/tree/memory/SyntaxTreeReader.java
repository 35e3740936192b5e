package com.gentoro.graphdsl.tree.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.graphdsl.exception.SerializationException;
import com.gentoro.graphdsl.utility.JacksonUtility;
import java.nio.file.Path;

/**
 * Reads a {@link MemorySyntaxTree} from JSON.
 *
 * <p>A node is an object:
 *
 * <pre>{@code
 * {"kind": "identifier", "named": true, "field": "name",
 *  "start": [0, 4], "end": [0, 7], "text": "foo", "children": [ ... ]}
 * }</pre>
 *
 * Only {@code kind} is required; {@code named} defaults to {@code true}. The document is either a
 * root node or an object {@code {"source": "...", "root": { ... }}}, in which case node text
 * missing from the JSON is sliced from the source.
 */
public final class SyntaxTreeReader {

  private SyntaxTreeReader() {}

  public static MemorySyntaxTree read(Path path) {
    return read(JacksonUtility.readTree(path));
  }

  public static MemorySyntaxTree read(String json) {
    return read(JacksonUtility.readTree(json));
  }

  /**
   * @throws SerializationException if the document does not describe a tree
   */
  public static MemorySyntaxTree read(JsonNode json) {
    if (json == null || !json.isObject()) {
      throw new SerializationException("Syntax tree document must be a JSON object");
    }
    if (json.has("root")) {
      String source = json.path("source").asText("");
      return MemorySyntaxTree.of(source, node(json.get("root"), "root"));
    }
    return MemorySyntaxTree.of(node(json, "root"));
  }

  private static MemorySyntaxNode.Builder node(JsonNode json, String path) {
    if (json == null || !json.isObject()) {
      throw new SerializationException("Expected a node object at " + path);
    }
    JsonNode kind = json.get("kind");
    if (kind == null || !kind.isTextual()) {
      throw new SerializationException("Missing string 'kind' at " + path);
    }
    MemorySyntaxNode.Builder builder =
        MemorySyntaxNode.builder(kind.textValue()).named(json.path("named").asBoolean(true));
    if (json.hasNonNull("field")) {
      builder.field(json.get("field").asText());
    }
    if (json.has("start")) {
      int[] start = position(json.get("start"), path + ".start");
      builder.start(start[0], start[1]);
    }
    if (json.has("end")) {
      int[] end = position(json.get("end"), path + ".end");
      builder.end(end[0], end[1]);
    }
    if (json.hasNonNull("text")) {
      builder.text(json.get("text").asText());
    }
    JsonNode children = json.get("children");
    if (children != null && !children.isNull()) {
      if (!children.isArray()) {
        throw new SerializationException("'children' must be an array at " + path);
      }
      for (int i = 0; i < children.size(); i++) {
        builder.child(node(children.get(i), path + ".children[" + i + "]"));
      }
    }
    return builder;
  }

  private static int[] position(JsonNode json, String path) {
    if (json == null
        || !json.isArray()
        || json.size() != 2
        || !json.get(0).canConvertToInt()
        || !json.get(1).canConvertToInt()
        || json.get(0).intValue() < 0
        || json.get(1).intValue() < 0) {
      throw new SerializationException("Expected [row, column] at " + path);
    }
    return new int[] {json.get(0).intValue(), json.get(1).intValue()};
  }
}
