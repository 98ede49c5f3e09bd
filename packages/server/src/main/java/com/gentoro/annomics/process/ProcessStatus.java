package com.gentoro.annomics.process;

/** How a supervised process ended. */
public enum ProcessStatus {
  /** Exit status 0. */
  SUCCESS,
  /** Process ran and exited with a non-zero status. */
  NON_ZERO_EXIT,
  /** Deadline elapsed; the process was forcibly terminated. */
  TIMED_OUT,
  /** The process could not be started at all. */
  LAUNCH_FAILED
}
