package com.gentoro.annomics.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.annomics.utility.JacksonUtility;
import java.util.List;

/**
 * Response of a tool call: text content blocks and an error flag. Tool-level failures are
 * reported through {@link #isError()}, never as protocol errors.
 */
public final class ToolResult {
  private final List<String> texts;
  private final boolean error;

  private ToolResult(List<String> texts, boolean error) {
    this.texts = List.copyOf(texts);
    this.error = error;
  }

  public static ToolResult text(String text) {
    return new ToolResult(List.of(text), false);
  }

  public static ToolResult error(String text) {
    return new ToolResult(List.of(text), true);
  }

  /** All text blocks joined with newlines. */
  public String text() {
    return String.join("\n", texts);
  }

  public boolean isError() {
    return error;
  }

  /** {@code {"content":[{"type":"text","text":...}], "isError": true}}; the flag only when set. */
  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode content = node.putArray("content");
    for (String text : texts) {
      content.addObject().put("type", "text").put("text", text);
    }
    if (error) {
      node.put("isError", true);
    }
    return node;
  }

  @Override
  public String toString() {
    return "ToolResult{error=" + error + ", text=" + text() + "}";
  }
}
