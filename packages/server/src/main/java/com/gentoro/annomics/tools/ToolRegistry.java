package com.gentoro.annomics.tools;

import com.gentoro.annomics.exception.ErrorDetails;
import com.gentoro.annomics.exception.ExceptionUtil;
import com.gentoro.annomics.exception.StateException;
import com.gentoro.annomics.exception.UnknownToolException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Registry of named tools and the single dispatch boundary for tool calls.
 *
 * <p>The typical lifecycle is:
 *
 * <ol>
 *   <li>Create a registry.
 *   <li>Register the tools of the session.
 *   <li>{@link #freeze()} it; from then on it is read-only and safe to share between threads.
 * </ol>
 *
 * <p>{@link #dispatch} never throws: unknown tools, argument validation failures and handler
 * exceptions are all turned into error {@link ToolResult}s.
 */
public class ToolRegistry {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(ToolRegistry.class);

  private final Map<String, Registration> tools = new LinkedHashMap<>();
  private volatile boolean frozen;

  private record Registration(ToolDescriptor descriptor, ToolHandler handler) {}

  public ToolRegistry register(ToolDescriptor descriptor, ToolHandler handler) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(handler, "handler");
    if (frozen) {
      throw new StateException("Tool registry is frozen; cannot register " + descriptor.name());
    }
    if (tools.containsKey(descriptor.name())) {
      throw new StateException("Tool already registered: " + descriptor.name());
    }
    tools.put(descriptor.name(), new Registration(descriptor, handler));
    return this;
  }

  public ToolRegistry register(McpTool tool) {
    return register(tool.descriptor(), tool);
  }

  /** Make the registry read-only. */
  public ToolRegistry freeze() {
    frozen = true;
    return this;
  }

  /** Descriptors in registration order. */
  public List<ToolDescriptor> list() {
    List<ToolDescriptor> descriptors = new ArrayList<>(tools.size());
    tools.values().forEach(r -> descriptors.add(r.descriptor()));
    return descriptors;
  }

  public Optional<ToolDescriptor> descriptor(String name) {
    return Optional.ofNullable(tools.get(name)).map(Registration::descriptor);
  }

  /**
   * Route a call to the named tool.
   *
   * @param name tool name as sent by the client
   * @param rawArgs loosely-typed arguments; may be {@code null}
   * @return the tool's result, or an error result describing why the call failed
   */
  public ToolResult dispatch(String name, Map<String, Object> rawArgs) {
    Registration registration = name == null ? null : tools.get(name);
    if (registration == null) {
      UnknownToolException unknown = new UnknownToolException(name);
      log.warn(unknown.getMessage());
      return ToolResult.error(unknown.getMessage());
    }

    long started = System.currentTimeMillis();
    try {
      Map<String, Object> arguments = ArgumentCoercer.coerce(registration.descriptor(), rawArgs);
      ToolResult result = registration.handler().handle(arguments);
      if (result == null) {
        result = ToolResult.text("");
      }
      log.debug(
          "Tool {} completed in {} ms (error={})",
          name,
          System.currentTimeMillis() - started,
          result.isError());
      return result;
    } catch (Exception e) {
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      if (details.context() == null || details.context().isEmpty()) {
        log.error("Error handling tool {}: [{}] {}", name, details.code(), details.message());
      } else {
        log.error(
            "Error handling tool {}: [{}] {} {}",
            name,
            details.code(),
            details.message(),
            details.context());
      }
      log.debug("Stack: {}", ExceptionUtil.formatCompactStackTrace(ExceptionUtil.unwrap(e)));
      return ToolResult.error("Error executing " + name + ": " + details.message());
    }
  }
}
