package com.gentoro.annomics.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.annomics.exception.ExecutionException;
import com.gentoro.annomics.exception.ProtocolException;
import com.gentoro.annomics.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Newline-delimited JSON request/response loop.
 *
 * <p>One request per input line, one response per output line. A line that cannot be decoded is
 * answered with a parse error and the loop keeps reading. End of input closes the transport.
 */
public class StdioTransport {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(StdioTransport.class);

  private final BufferedReader in;
  private final Writer out;
  private final McpProtocolHandler handler;
  private volatile TransportState state = TransportState.AWAITING_REQUEST;

  public StdioTransport(Reader in, Writer out, McpProtocolHandler handler) {
    this.in = in instanceof BufferedReader br ? br : new BufferedReader(in);
    this.out = out;
    this.handler = handler;
  }

  public TransportState state() {
    return state;
  }

  /** Serve requests until end of input. */
  public void run() {
    log.info("Awaiting requests on stdin");
    try {
      String line;
      while ((line = in.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        state = TransportState.PROCESSING;
        Optional<ObjectNode> response = respond(line);
        if (response.isPresent()) {
          write(response.get());
        }
        state = TransportState.AWAITING_REQUEST;
      }
    } catch (IOException e) {
      throw new ExecutionException("Transport I/O failure", e);
    } finally {
      state = TransportState.CLOSED;
      log.info("Input closed, transport stopped");
    }
  }

  private Optional<ObjectNode> respond(String line) {
    JsonNode request;
    try {
      request = parse(line);
    } catch (ProtocolException e) {
      log.warn("Rejected request line: {}", e.getMessage());
      return Optional.of(McpProtocolHandler.error(McpProtocolHandler.PARSE_ERROR, e.getMessage()));
    }
    log.debug("Handling {}", request.path("method").asText());
    return handler.handle(request);
  }

  /**
   * Decode one line into a request object.
   *
   * @throws ProtocolException when the line is not JSON, not an object, or has no textual {@code
   *     method}
   */
  static JsonNode parse(String line) {
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(line);
    } catch (JsonProcessingException e) {
      throw new ProtocolException("Parse error: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new ProtocolException("Parse error: request must be a JSON object");
    }
    if (!node.path("method").isTextual()) {
      throw new ProtocolException("Parse error: request has no method");
    }
    return node;
  }

  private void write(ObjectNode response) throws IOException {
    out.write(JacksonUtility.toJson(response));
    out.write('\n');
    out.flush();
  }
}
