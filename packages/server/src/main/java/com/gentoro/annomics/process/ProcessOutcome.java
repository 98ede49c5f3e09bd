package com.gentoro.annomics.process;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Result of supervising one external process. Built exactly once per job.
 *
 * @param status how the process ended
 * @param exitCode exit status, or {@code -1} when the process never exited on its own
 * @param stdout captured standard output
 * @param stderr captured standard error; for {@link ProcessStatus#LAUNCH_FAILED} the launch error
 * @param outputDirectory absolute output directory of the job
 * @param elapsed wall-clock time from launch to outcome
 */
public record ProcessOutcome(
    ProcessStatus status,
    int exitCode,
    String stdout,
    String stderr,
    Path outputDirectory,
    Duration elapsed) {

  public static ProcessOutcome exited(
      int exitCode, String stdout, String stderr, Path outputDirectory, Duration elapsed) {
    return new ProcessOutcome(
        exitCode == 0 ? ProcessStatus.SUCCESS : ProcessStatus.NON_ZERO_EXIT,
        exitCode,
        stdout,
        stderr,
        outputDirectory,
        elapsed);
  }

  public static ProcessOutcome timedOut(
      String stdout, String stderr, Path outputDirectory, Duration elapsed) {
    return new ProcessOutcome(
        ProcessStatus.TIMED_OUT, -1, stdout, stderr, outputDirectory, elapsed);
  }

  public static ProcessOutcome launchFailed(String reason, Path outputDirectory) {
    return new ProcessOutcome(
        ProcessStatus.LAUNCH_FAILED, -1, "", reason, outputDirectory, Duration.ZERO);
  }

  public boolean isSuccess() {
    return status == ProcessStatus.SUCCESS;
  }
}
