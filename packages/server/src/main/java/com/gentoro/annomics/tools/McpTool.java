package com.gentoro.annomics.tools;

/** A tool that carries its own descriptor. */
public interface McpTool extends ToolHandler {

  ToolDescriptor descriptor();

  default String name() {
    return descriptor().name();
  }
}
