package com.gentoro.annomics.process;

import com.gentoro.annomics.exception.ConfigException;
import com.gentoro.annomics.exception.EnvironmentException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Where and how the annotation script is executed.
 *
 * @param executable interpreter, e.g. {@code Rscript}
 * @param script absolute path of the annotation script
 * @param workingDirectory directory every job runs in, so relative output paths are stable
 * @param versionCheckTimeoutSeconds deadline of the startup {@code --version} check
 * @param maxConcurrentJobs size of the job worker pool
 */
public record RuntimeSettings(
    String executable,
    Path script,
    Path workingDirectory,
    int versionCheckTimeoutSeconds,
    int maxConcurrentJobs) {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(RuntimeSettings.class);

  public static final String SCRIPT_NAME = "annotate_genomic_segments.R";

  public RuntimeSettings {
    Objects.requireNonNull(executable, "executable");
    Objects.requireNonNull(script, "script");
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    if (versionCheckTimeoutSeconds <= 0) {
      throw new ConfigException("annomics.runtime.version-check-timeout must be positive");
    }
    if (maxConcurrentJobs <= 0) {
      throw new ConfigException("annomics.job.max-concurrent must be positive");
    }
  }

  /**
   * Resolve settings from {@code annomics.runtime.*} and {@code annomics.job.*}.
   *
   * @throws EnvironmentException when no annotation script can be found
   */
  public static RuntimeSettings fromConfiguration(Configuration config) {
    String executable =
        StringUtils.defaultIfBlank(config.getString("annomics.runtime.executable"), "Rscript");

    Path script = locateScript(config.getString("annomics.runtime.script"));
    log.info("Using annotation script {}", script);

    String configuredRoot = config.getString("annomics.runtime.working-directory");
    Path workingDirectory =
        StringUtils.isBlank(configuredRoot)
            ? defaultWorkingDirectory(script)
            : Path.of(configuredRoot.trim()).toAbsolutePath().normalize();

    int versionTimeout;
    int maxConcurrent;
    try {
      versionTimeout = config.getInt("annomics.runtime.version-check-timeout", 10);
      maxConcurrent = config.getInt("annomics.job.max-concurrent", 4);
    } catch (Exception e) {
      throw new ConfigException("Failed to resolve runtime limits", e);
    }
    return new RuntimeSettings(executable, script, workingDirectory, versionTimeout, maxConcurrent);
  }

  /** Candidate script locations, checked in order. */
  static List<Path> scriptCandidates(String configured) {
    List<Path> candidates = new ArrayList<>();
    if (StringUtils.isNotBlank(configured)) {
      candidates.add(Path.of(configured.trim()));
    }
    candidates.add(Path.of("/app/scripts", SCRIPT_NAME));
    candidates.add(Path.of("scripts", SCRIPT_NAME));
    return candidates;
  }

  static Path locateScript(String configured) {
    List<Path> candidates = scriptCandidates(configured);
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        return candidate.toAbsolutePath().normalize();
      }
    }
    throw new EnvironmentException("R script not found in any of these locations: " + candidates);
  }

  /**
   * The project root for a {@code <root>/scripts/x.R} layout; the script directory itself when it
   * has no parent.
   */
  static Path defaultWorkingDirectory(Path script) {
    Path dir = script.toAbsolutePath().getParent();
    return dir.getParent() != null ? dir.getParent() : dir;
  }
}
