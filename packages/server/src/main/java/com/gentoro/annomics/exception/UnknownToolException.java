package com.gentoro.annomics.exception;

/** No tool is registered under the requested name. */
public class UnknownToolException extends AnnomicsException {
  public UnknownToolException(String toolName) {
    super(AnnomicsErrorCode.UNKNOWN_TOOL, "Unknown tool: " + toolName);
  }
}
