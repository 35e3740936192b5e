package com.gentoro.graphdsl.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.graphdsl.exception.SerializationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return JSON_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Invalid JSON document: " + e.getOriginalMessage(), e);
    }
  }

  public static JsonNode readTree(Path file) {
    try {
      return JSON_MAPPER.readTree(Files.readString(file));
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Invalid JSON document " + file + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new SerializationException("Failed to read " + file, e);
    }
  }
}
