package com.gentoro.annomics.tools;

import java.util.Map;

/** Implementation behind a registered tool. */
@FunctionalInterface
public interface ToolHandler {

  /**
   * Execute the tool. Arguments have already been coerced against the tool's descriptor. Any
   * exception is converted into an error result by the {@link ToolRegistry}.
   */
  ToolResult handle(Map<String, Object> arguments) throws Exception;
}
