package com.gentoro.annomics.process;

import com.gentoro.annomics.exception.EnvironmentException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/** Startup check that the R interpreter can be executed. */
public final class RuntimeEnvironment {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(RuntimeEnvironment.class);

  private RuntimeEnvironment() {}

  /**
   * Run {@code <executable> --version} and return the reported version line.
   *
   * @throws EnvironmentException if the interpreter is missing, hangs or exits non-zero
   */
  public static String verify(RuntimeSettings settings, ProcessLauncher launcher) {
    List<String> command = List.of(settings.executable(), "--version");
    Process process;
    try {
      process = launcher.launch(command, settings.workingDirectory());
    } catch (IOException e) {
      throw new EnvironmentException(
          "R environment validation failed: cannot execute " + settings.executable(), e);
    }

    try {
      if (!process.waitFor(settings.versionCheckTimeoutSeconds(), TimeUnit.SECONDS)) {
        ExternalProcessSupervisor.terminate(process);
        throw new EnvironmentException(
            "R environment validation failed: "
                + settings.executable()
                + " --version did not answer within "
                + settings.versionCheckTimeoutSeconds()
                + " seconds");
      }
      if (process.exitValue() != 0) {
        throw new EnvironmentException("Rscript not found or not working");
      }
      // Rscript prints its version on stderr
      String version = read(process.getErrorStream()).strip();
      if (version.isEmpty()) {
        version = read(process.getInputStream()).strip();
      }
      log.info("R version check passed: {}", version);
      return version;
    } catch (InterruptedException e) {
      ExternalProcessSupervisor.terminate(process);
      Thread.currentThread().interrupt();
      throw new EnvironmentException("Interrupted during R environment validation", e);
    }
  }

  private static String read(InputStream stream) {
    try (InputStream in = stream) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.debug("Could not read version output: {}", e.getMessage());
      return "";
    }
  }
}
