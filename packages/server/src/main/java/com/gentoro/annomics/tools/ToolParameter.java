package com.gentoro.annomics.tools;

import java.util.List;
import java.util.Objects;

/**
 * One named parameter of a tool.
 *
 * @param name argument key
 * @param type expected shape
 * @param description text shown to clients
 * @param required whether the argument must be present
 * @param defaultValue value applied when the argument is absent, or {@code null}
 * @param allowedValues enumerated values advertised in the schema; empty when unrestricted
 */
public record ToolParameter(
    String name,
    ParameterType type,
    String description,
    boolean required,
    Object defaultValue,
    List<String> allowedValues) {

  public ToolParameter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
  }

  public static ToolParameter required(String name, ParameterType type, String description) {
    return new ToolParameter(name, type, description, true, null, List.of());
  }

  public static ToolParameter optional(
      String name, ParameterType type, String description, Object defaultValue) {
    return new ToolParameter(name, type, description, false, defaultValue, List.of());
  }

  public ToolParameter withAllowedValues(List<String> values) {
    return new ToolParameter(name, type, description, required, defaultValue, values);
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }
}
