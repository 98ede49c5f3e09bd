package com.gentoro.annomics.exception;

/** A component was used before it was initialized, or after it was frozen. */
public class StateException extends AnnomicsException {
  public StateException(String message) {
    super(AnnomicsErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(AnnomicsErrorCode.STATE_ERROR, message, cause);
  }
}
