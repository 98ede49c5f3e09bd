package com.gentoro.annomics.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.annomics.exception.EnvironmentException;
import com.gentoro.annomics.exception.ExceptionUtil;
import com.gentoro.annomics.tools.ToolDescriptor;
import com.gentoro.annomics.tools.ToolRegistry;
import com.gentoro.annomics.tools.ToolResult;
import com.gentoro.annomics.utility.JacksonUtility;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Maps one decoded request object to its response object.
 *
 * <p>Supported methods are {@code initialize}, {@code ping}, {@code tools/list} and {@code
 * tools/call}. Anything under {@code notifications/} is accepted silently. Tool failures are
 * reported inside the tool result; only protocol problems become {@code error} objects.
 */
public class McpProtocolHandler {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(McpProtocolHandler.class);

  public static final String SERVER_NAME = "annomics-mcp";
  public static final String SERVER_VERSION = "1.0.0";
  public static final String PROTOCOL_VERSION = "2024-11-05";

  public static final int PARSE_ERROR = -32700;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;

  private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

  private final ToolRegistry registry;
  private final EnvironmentException environmentFailure;

  public McpProtocolHandler(ToolRegistry registry) {
    this(registry, null);
  }

  /**
   * @param environmentFailure when non-null the session is degraded: every tool call is answered
   *     with an error naming this cause
   */
  public McpProtocolHandler(ToolRegistry registry, EnvironmentException environmentFailure) {
    this.registry = registry;
    this.environmentFailure = environmentFailure;
  }

  public boolean isDegraded() {
    return environmentFailure != null;
  }

  /**
   * Handle a request that has already been checked to be an object with a textual {@code method}.
   *
   * @return the response, or empty for notifications
   */
  public Optional<ObjectNode> handle(JsonNode request) {
    String method = request.path("method").asText();
    JsonNode params = request.path("params");
    if (method.startsWith("notifications/")) {
      log.debug("Notification {}", method);
      return Optional.empty();
    }

    ObjectNode response;
    try {
      response =
          switch (method) {
            case "initialize" -> initialize();
            case "ping" -> JacksonUtility.getJsonMapper().createObjectNode();
            case "tools/list" -> listTools();
            case "tools/call" -> callTool(params);
            default -> error(METHOD_NOT_FOUND, "Unknown method: " + method);
          };
    } catch (RuntimeException e) {
      log.error("Unexpected failure handling {}", method, e);
      response =
          error(INTERNAL_ERROR, "Internal error: " + ExceptionUtil.toErrorDetails(e).message());
    }
    return Optional.of(withId(response, request.get("id")));
  }

  private ObjectNode initialize() {
    ObjectNode result = JacksonUtility.getJsonMapper().createObjectNode();
    result.put("protocolVersion", PROTOCOL_VERSION);
    result.putObject("capabilities").putObject("tools");
    result.putObject("serverInfo").put("name", SERVER_NAME).put("version", SERVER_VERSION);
    return result;
  }

  private ObjectNode listTools() {
    ObjectNode result = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode tools = result.putArray("tools");
    for (ToolDescriptor descriptor : registry.list()) {
      tools.add(descriptor.toJson());
    }
    return result;
  }

  private ObjectNode callTool(JsonNode params) {
    JsonNode name = params.path("name");
    if (!name.isTextual() || name.asText().isBlank()) {
      return error(INVALID_PARAMS, "Missing tool name in params.name");
    }
    JsonNode rawArguments = params.path("arguments");
    if (!rawArguments.isMissingNode() && !rawArguments.isNull() && !rawArguments.isObject()) {
      return error(INVALID_PARAMS, "params.arguments must be an object");
    }

    if (environmentFailure != null) {
      return ToolResult.error(
              "Error executing " + name.asText() + ": " + environmentFailure.getMessage())
          .toJson();
    }

    Map<String, Object> arguments =
        rawArguments.isObject()
            ? JacksonUtility.getJsonMapper().convertValue(rawArguments, ARGUMENTS_TYPE)
            : Map.of();
    return registry.dispatch(name.asText(), arguments).toJson();
  }

  /** {@code {"error":{"code":..., "message":...}}} */
  public static ObjectNode error(int code, String message) {
    ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
    node.putObject("error").put("code", code).put("message", message);
    return node;
  }

  /** Echo the request id, when there is one, together with the protocol marker. */
  static ObjectNode withId(ObjectNode response, JsonNode id) {
    if (id == null || id.isNull()) {
      return response;
    }
    ObjectNode framed = JacksonUtility.getJsonMapper().createObjectNode();
    framed.put("jsonrpc", "2.0");
    framed.set("id", id);
    framed.setAll(response);
    return framed;
  }
}
