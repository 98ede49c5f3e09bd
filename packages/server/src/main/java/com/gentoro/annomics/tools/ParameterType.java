package com.gentoro.annomics.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Primitive shapes a tool parameter can take, with their JSON Schema rendering. */
public enum ParameterType {
  STRING,
  BOOLEAN,
  INTEGER,
  STRING_ARRAY,
  /** A single string, or an array of strings. */
  STRING_OR_ARRAY;

  void describe(ObjectNode schema) {
    switch (this) {
      case STRING -> schema.put("type", "string");
      case BOOLEAN -> schema.put("type", "boolean");
      case INTEGER -> schema.put("type", "integer");
      case STRING_ARRAY -> {
        schema.put("type", "array");
        schema.putObject("items").put("type", "string");
      }
      case STRING_OR_ARRAY -> {
        schema.putArray("type").add("string").add("array");
        schema.putObject("items").put("type", "string");
      }
    }
  }
}
