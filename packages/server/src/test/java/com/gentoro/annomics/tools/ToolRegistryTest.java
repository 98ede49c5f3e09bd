package com.gentoro.annomics.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.annomics.exception.StateException;
import com.gentoro.annomics.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

  private static final ToolDescriptor ECHO =
      new ToolDescriptor(
          "echo",
          "Echo a message",
          List.of(
              ToolParameter.required("message", ParameterType.STRING, "Text to echo"),
              ToolParameter.optional("times", ParameterType.INTEGER, "Repetitions", 1)));

  private static final ToolDescriptor NO_ARGS = new ToolDescriptor("noop", "Nothing", List.of());

  @Test
  @DisplayName("Listing returns descriptors in registration order")
  void listsInRegistrationOrder() {
    ToolRegistry registry =
        new ToolRegistry()
            .register(ECHO, args -> ToolResult.text("x"))
            .register(NO_ARGS, args -> ToolResult.text(""));

    List<ToolDescriptor> tools = registry.list();
    assertEquals(2, tools.size());
    assertEquals("echo", tools.get(0).name());
    assertEquals("noop", tools.get(1).name());
    assertTrue(registry.descriptor("echo").isPresent());
    assertTrue(registry.descriptor("missing").isEmpty());
  }

  @Test
  @DisplayName("Calling an unknown tool yields an error result, not an exception")
  void unknownToolIsAnErrorResult() {
    ToolResult result = new ToolRegistry().freeze().dispatch("frobnicate", Map.of());

    assertTrue(result.isError());
    assertEquals("Unknown tool: frobnicate", result.text());
  }

  @Test
  void handlerExceptionsBecomeErrorResults() {
    ToolRegistry registry =
        new ToolRegistry()
            .register(
                ECHO,
                args -> {
                  throw new ValidationException("bad input");
                });

    ToolResult result = registry.dispatch("echo", Map.of("message", "hi"));

    assertTrue(result.isError());
    assertEquals("Error executing echo: bad input", result.text());
  }

  @Test
  void checkedExceptionsAreReportedToo() {
    ToolRegistry registry =
        new ToolRegistry()
            .register(
                NO_ARGS,
                args -> {
                  throw new java.io.IOException("disk gone");
                });

    ToolResult result = registry.dispatch("noop", null);
    assertTrue(result.isError());
    assertTrue(result.text().contains("disk gone"));
  }

  @Test
  void argumentsAreCoercedBeforeTheHandlerRuns() {
    AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
    ToolRegistry registry =
        new ToolRegistry()
            .register(
                ECHO,
                args -> {
                  seen.set(args);
                  return ToolResult.text("ok");
                });

    Map<String, Object> raw = new HashMap<>();
    raw.put("message", "hi");
    raw.put("unexpected", true);
    ToolResult result = registry.dispatch("echo", raw);

    assertFalse(result.isError());
    assertEquals(Map.of("message", "hi", "times", 1), seen.get());
  }

  @Test
  void missingRequiredArgumentNeverReachesHandler() {
    ToolRegistry registry =
        new ToolRegistry().register(ECHO, args -> fail("handler must not run"));

    ToolResult result = registry.dispatch("echo", Map.of());
    assertTrue(result.isError());
    assertTrue(result.text().contains("'message'"));
  }

  @Test
  void rejectsDuplicatesAndRegistrationAfterFreeze() {
    ToolRegistry registry = new ToolRegistry().register(ECHO, args -> null);
    assertThrows(StateException.class, () -> registry.register(ECHO, args -> null));

    registry.freeze();
    assertThrows(StateException.class, () -> registry.register(NO_ARGS, args -> null));
  }

  @Test
  void nullResultBecomesEmptyText() {
    ToolResult result =
        new ToolRegistry().register(NO_ARGS, args -> null).dispatch("noop", Map.of());
    assertFalse(result.isError());
    assertEquals("", result.text());
  }

  @Test
  void resultJsonCarriesErrorFlagOnlyWhenSet() {
    assertFalse(ToolResult.text("fine").toJson().has("isError"));
    assertTrue(ToolResult.error("boom").toJson().get("isError").asBoolean());
    assertEquals(
        "boom", ToolResult.error("boom").toJson().get("content").get(0).get("text").asText());
  }
}
