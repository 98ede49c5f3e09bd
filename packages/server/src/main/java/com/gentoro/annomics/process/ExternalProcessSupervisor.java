package com.gentoro.annomics.process;

import com.gentoro.annomics.exception.ExecutionException;
import com.gentoro.annomics.exception.StateException;
import com.gentoro.annomics.job.JobSpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * {@link ProcessSupervisor} that runs the annotation script as a child process.
 *
 * <p>Jobs execute on a bounded pool of daemon worker threads, so several jobs can run side by
 * side; each job owns its process, its stream drainers and its deadline. Standard output and
 * standard error are drained concurrently while the worker waits for the process, which keeps a
 * chatty script from blocking on a full pipe.
 */
public class ExternalProcessSupervisor implements ProcessSupervisor {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(ExternalProcessSupervisor.class);

  /** How long to wait for the drainers once the process is gone. */
  private static final long STREAM_DRAIN_GRACE_MILLIS = 2_000;

  private final RuntimeSettings settings;
  private final ProcessLauncher launcher;
  private final ExecutorService jobExecutor;
  private final ExecutorService streamExecutor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public ExternalProcessSupervisor(RuntimeSettings settings) {
    this(settings, ProcessLauncher.system());
  }

  public ExternalProcessSupervisor(RuntimeSettings settings, ProcessLauncher launcher) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.jobExecutor =
        Executors.newFixedThreadPool(settings.maxConcurrentJobs(), daemonThreads("annomics-job"));
    this.streamExecutor = Executors.newCachedThreadPool(daemonThreads("annomics-stream"));
  }

  @Override
  public CompletableFuture<ProcessOutcome> run(JobSpec spec) {
    Objects.requireNonNull(spec, "spec");
    if (closed.get()) {
      return CompletableFuture.failedFuture(new StateException("Process supervisor is closed"));
    }
    try {
      return CompletableFuture.supplyAsync(() -> supervise(spec), jobExecutor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new StateException("Process supervisor rejected the job", e));
    }
  }

  ProcessOutcome supervise(JobSpec spec) {
    List<String> command = AnnotationCommand.build(settings, spec);
    Path outputDirectory = resolveOutputDirectory(spec.outputDirectory());
    log.info("Executing R script with args: {}", String.join(" ", command));

    long started = System.nanoTime();
    Process process;
    try {
      process = launcher.launch(command, settings.workingDirectory());
    } catch (IOException | RuntimeException e) {
      log.error("Failed to launch {}: {}", settings.executable(), e.getMessage());
      return ProcessOutcome.launchFailed(
          "Failed to launch " + settings.executable() + ": " + e.getMessage(), outputDirectory);
    }

    InputStream stdoutStream = process.getInputStream();
    InputStream stderrStream = process.getErrorStream();
    CompletableFuture<String> stdout = drain(stdoutStream);
    CompletableFuture<String> stderr = drain(stderrStream);
    try {
      boolean finished = process.waitFor(spec.timeoutSeconds(), TimeUnit.SECONDS);
      if (!finished) {
        log.warn(
            "R script exceeded its {}s deadline, terminating process {}",
            spec.timeoutSeconds(),
            safePid(process));
        terminate(process);
        long deadline = graceDeadline();
        return ProcessOutcome.timedOut(
            collect(stdout, stdoutStream, deadline),
            collect(stderr, stderrStream, deadline),
            outputDirectory,
            since(started));
      }

      int exitCode = process.exitValue();
      long deadline = graceDeadline();
      ProcessOutcome outcome =
          ProcessOutcome.exited(
              exitCode,
              collect(stdout, stdoutStream, deadline),
              collect(stderr, stderrStream, deadline),
              outputDirectory,
              since(started));
      if (outcome.isSuccess()) {
        log.info("R script finished in {} ms", outcome.elapsed().toMillis());
      } else {
        log.warn(
            "R script exited with status {} after {} ms", exitCode, outcome.elapsed().toMillis());
      }
      return outcome;
    } catch (InterruptedException ie) {
      terminate(process);
      Thread.currentThread().interrupt();
      throw new ExecutionException("Interrupted while waiting for the R script", ie);
    }
  }

  /** Relative output directories are interpreted against the pinned working directory. */
  Path resolveOutputDirectory(String outputDirectory) {
    Path path = Path.of(outputDirectory);
    return (path.isAbsolute() ? path : settings.workingDirectory().resolve(path)).normalize();
  }

  private CompletableFuture<String> drain(InputStream stream) {
    return CompletableFuture.supplyAsync(
        () -> {
          try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        },
        streamExecutor);
  }

  /**
   * Kill the script and everything it started. Descendants are collected first: once the parent
   * is gone they are re-parented and no longer reachable from it.
   */
  static void terminate(Process process) {
    try {
      process.descendants().forEach(ProcessHandle::destroyForcibly);
    } catch (UnsupportedOperationException e) {
      log.debug("Process tree not available, terminating the script only");
    }
    process.destroyForcibly();
  }

  private static long graceDeadline() {
    return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(STREAM_DRAIN_GRACE_MILLIS);
  }

  /**
   * Wait for a drainer until the shared deadline. A stream still held open by a leftover process
   * is closed so the drainer thread is released.
   */
  private static String collect(
      CompletableFuture<String> drained, InputStream stream, long deadlineNanos) {
    try {
      return drained.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      log.debug("Stream still open after process exit, returning without it");
      try {
        stream.close();
      } catch (IOException closeFailure) {
        log.debug("Failed to close process stream: {}", closeFailure.getMessage());
      }
      drained.cancel(true);
      return "";
    } catch (java.util.concurrent.ExecutionException e) {
      log.debug("Failed to read process stream: {}", e.getCause().getMessage());
      return "";
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return "";
    }
  }

  private static Duration since(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }

  private static String safePid(Process process) {
    try {
      return String.valueOf(process.pid());
    } catch (UnsupportedOperationException e) {
      return "?";
    }
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      jobExecutor.shutdownNow();
      streamExecutor.shutdownNow();
    }
  }
}
