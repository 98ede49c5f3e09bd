package com.gentoro.annomics.exception;

/** The external annotation runtime is unavailable or misconfigured. */
public class EnvironmentException extends AnnomicsException {
  public EnvironmentException(String message) {
    super(AnnomicsErrorCode.ENVIRONMENT_ERROR, message);
  }

  public EnvironmentException(String message, Throwable cause) {
    super(AnnomicsErrorCode.ENVIRONMENT_ERROR, message, cause);
  }
}
