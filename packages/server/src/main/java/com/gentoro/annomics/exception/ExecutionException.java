package com.gentoro.annomics.exception;

/** Unexpected failure while supervising a job. */
public class ExecutionException extends AnnomicsException {
  public ExecutionException(String message) {
    super(AnnomicsErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(AnnomicsErrorCode.EXECUTION_ERROR, message, cause);
  }
}
