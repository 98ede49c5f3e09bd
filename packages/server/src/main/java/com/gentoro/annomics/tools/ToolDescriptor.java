package com.gentoro.annomics.tools;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.annomics.utility.JacksonUtility;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Static description of a tool: its name, what it does, and the parameters it accepts. */
public record ToolDescriptor(String name, String description, List<ToolParameter> parameters) {

  public ToolDescriptor {
    Objects.requireNonNull(name, "name");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public Optional<ToolParameter> parameter(String parameterName) {
    return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
  }

  /** JSON Schema object advertised as {@code inputSchema} in {@code tools/list}. */
  public ObjectNode inputSchema() {
    ObjectNode schema = JacksonUtility.getJsonMapper().createObjectNode();
    schema.put("type", "object");
    ObjectNode properties = schema.putObject("properties");
    ArrayNode required = JacksonUtility.getJsonMapper().createArrayNode();

    for (ToolParameter p : parameters) {
      ObjectNode property = properties.putObject(p.name());
      p.type().describe(property);
      if (p.description() != null) {
        property.put("description", p.description());
      }
      if (!p.allowedValues().isEmpty()) {
        ObjectNode target =
            p.type() == ParameterType.STRING_ARRAY ? (ObjectNode) property.get("items") : property;
        ArrayNode values = target.putArray("enum");
        p.allowedValues().forEach(values::add);
      }
      if (p.hasDefault()) {
        property.set("default", JacksonUtility.getJsonMapper().valueToTree(p.defaultValue()));
      }
      if (p.required()) {
        required.add(p.name());
      }
    }

    if (parameters.isEmpty()) {
      schema.put("additionalProperties", false);
    }
    if (!required.isEmpty()) {
      schema.set("required", required);
    }
    return schema;
  }

  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.put("name", name);
    node.put("description", description);
    node.set("inputSchema", inputSchema());
    return node;
  }
}
