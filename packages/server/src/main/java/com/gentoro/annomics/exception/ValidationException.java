package com.gentoro.annomics.exception;

/** Bad or missing tool argument; raised before any process is launched. */
public class ValidationException extends AnnomicsException {
  public ValidationException(String message) {
    super(AnnomicsErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AnnomicsErrorCode.VALIDATION_ERROR, message, cause);
  }
}
