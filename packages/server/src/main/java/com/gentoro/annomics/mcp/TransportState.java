package com.gentoro.annomics.mcp;

/** Lifecycle of a {@link StdioTransport}. */
public enum TransportState {
  AWAITING_REQUEST,
  PROCESSING,
  CLOSED
}
