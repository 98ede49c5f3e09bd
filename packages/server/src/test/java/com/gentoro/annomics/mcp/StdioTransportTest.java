package com.gentoro.annomics.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.annomics.exception.ProtocolException;
import com.gentoro.annomics.tools.ListSupportedGenomesTool;
import com.gentoro.annomics.tools.ToolRegistry;
import com.gentoro.annomics.utility.JacksonUtility;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StdioTransportTest {

  private final McpProtocolHandler handler =
      new McpProtocolHandler(new ToolRegistry().register(new ListSupportedGenomesTool()).freeze());

  private List<JsonNode> exchange(String input) throws Exception {
    StringWriter out = new StringWriter();
    StdioTransport transport = new StdioTransport(new StringReader(input), out, handler);
    transport.run();
    assertEquals(TransportState.CLOSED, transport.state());

    List<JsonNode> responses = new ArrayList<>();
    for (String line : out.toString().split("\n")) {
      if (!line.isEmpty()) {
        responses.add(JacksonUtility.getJsonMapper().readTree(line));
      }
    }
    return responses;
  }

  @Test
  @DisplayName("A malformed line gets a parse error and the next request is still served")
  void recoversFromMalformedLine() throws Exception {
    List<JsonNode> responses = exchange("{not json\n{\"method\":\"tools/list\"}\n");

    assertEquals(2, responses.size());
    assertEquals(-32700, responses.get(0).get("error").get("code").asInt());
    assertEquals(
        "list_supported_genomes", responses.get(1).get("tools").get(0).get("name").asText());
  }

  @Test
  @DisplayName("End of input closes the transport without output")
  void closesOnEof() throws Exception {
    assertTrue(exchange("").isEmpty());
  }

  @Test
  void skipsBlankLinesAndAnswersEachRequestOnItsOwnLine() throws Exception {
    List<JsonNode> responses =
        exchange("\n   \n{\"method\":\"ping\"}\n\n{\"method\":\"tools/list\"}\n");
    assertEquals(2, responses.size());
  }

  @Test
  void rejectsNonObjectsAndRequestsWithoutMethod() throws Exception {
    List<JsonNode> responses = exchange("[1,2]\n{\"params\":{}}\n{\"method\":7}\n");

    assertEquals(3, responses.size());
    for (JsonNode response : responses) {
      assertEquals(-32700, response.get("error").get("code").asInt());
    }
  }

  @Test
  void unknownMethodIsReported() throws Exception {
    JsonNode response = exchange("{\"method\":\"resources/list\"}\n").get(0);

    assertEquals(-32601, response.get("error").get("code").asInt());
    assertEquals("Unknown method: resources/list", response.get("error").get("message").asText());
    assertFalse(response.has("id"));
  }

  @Test
  void echoesRequestId() throws Exception {
    JsonNode response = exchange("{\"jsonrpc\":\"2.0\",\"id\":42,\"method\":\"ping\"}\n").get(0);

    assertEquals(42, response.get("id").asInt());
    assertEquals("2.0", response.get("jsonrpc").asText());
  }

  @Test
  void notificationsAreNotAnswered() throws Exception {
    List<JsonNode> responses =
        exchange(
            "{\"method\":\"notifications/initialized\"}\n"
                + "{\"id\":\"a\",\"method\":\"ping\"}\n");

    assertEquals(1, responses.size());
    assertEquals("a", responses.get(0).get("id").asText());
  }

  @Test
  void toolCallsReturnToolResults() throws Exception {
    JsonNode response =
        exchange(
                "{\"id\":1,\"method\":\"tools/call\","
                    + "\"params\":{\"name\":\"list_supported_genomes\",\"arguments\":{}}}\n")
            .get(0);

    assertEquals("text", response.get("content").get(0).get("type").asText());
    assertTrue(response.get("content").get(0).get("text").asText().contains("hg38"));
    assertFalse(response.has("isError"));
  }

  @Test
  void parseRejectsScalars() {
    assertThrows(ProtocolException.class, () -> StdioTransport.parse("42"));
    assertEquals("ping", StdioTransport.parse("{\"method\":\"ping\"}").get("method").asText());
  }
}
