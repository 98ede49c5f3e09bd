package com.gentoro.annomics.exception;

/** The external process did not finish before its deadline and was terminated. */
public class TimeoutFailureException extends AnnomicsException {
  public TimeoutFailureException(int timeoutSeconds) {
    super(
        AnnomicsErrorCode.TIMEOUT_ERROR,
        "R script execution timed out after " + timeoutSeconds + " seconds");
    withContext("timeoutSeconds", timeoutSeconds);
  }
}
