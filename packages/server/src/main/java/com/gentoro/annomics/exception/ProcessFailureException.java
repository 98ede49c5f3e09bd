package com.gentoro.annomics.exception;

/** The external process ran and exited with a non-zero status. */
public class ProcessFailureException extends AnnomicsException {
  public ProcessFailureException(int exitCode, String stderr) {
    super(
        AnnomicsErrorCode.PROCESS_ERROR,
        "R script failed with return code " + exitCode + ":\n" + (stderr == null ? "" : stderr));
    withContext("exitCode", exitCode);
  }
}
