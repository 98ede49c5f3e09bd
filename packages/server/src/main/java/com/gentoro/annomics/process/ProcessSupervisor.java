package com.gentoro.annomics.process;

import com.gentoro.annomics.job.JobSpec;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the external annotation tool for a {@link JobSpec}. Each call launches exactly one
 * process; there are no retries.
 */
public interface ProcessSupervisor extends AutoCloseable {

  /**
   * Launch the job asynchronously. The future always completes with an outcome for launch
   * failures, non-zero exits and timeouts; it completes exceptionally only for unexpected
   * supervision faults.
   */
  CompletableFuture<ProcessOutcome> run(JobSpec spec);

  @Override
  void close();
}
