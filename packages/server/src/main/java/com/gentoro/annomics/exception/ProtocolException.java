package com.gentoro.annomics.exception;

/** A request line could not be parsed into the expected structure. */
public class ProtocolException extends AnnomicsException {
  public ProtocolException(String message) {
    super(AnnomicsErrorCode.PROTOCOL_ERROR, message);
  }

  public ProtocolException(String message, Throwable cause) {
    super(AnnomicsErrorCode.PROTOCOL_ERROR, message, cause);
  }
}
