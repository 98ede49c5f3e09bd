package com.gentoro.annomics.exception;

/** Closed set of error kinds reported by the server. */
public enum AnnomicsErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  VALIDATION_ERROR,
  ENVIRONMENT_ERROR,
  PROCESS_ERROR,
  TIMEOUT_ERROR,
  EXECUTION_ERROR,
  UNKNOWN_TOOL,
  PROTOCOL_ERROR
}
