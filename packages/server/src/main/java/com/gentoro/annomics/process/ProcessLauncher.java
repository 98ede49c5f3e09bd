package com.gentoro.annomics.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Starts an OS process. Replaced in tests by launchers returning scripted processes. */
@FunctionalInterface
public interface ProcessLauncher {

  Process launch(List<String> command, Path workingDirectory) throws IOException;

  /** Launcher backed by {@link ProcessBuilder}; the child's stdin is closed right away. */
  static ProcessLauncher system() {
    return (command, workingDirectory) -> {
      ProcessBuilder pb = new ProcessBuilder(command);
      if (workingDirectory != null) {
        pb.directory(workingDirectory.toFile());
      }
      Process process = pb.start();
      process.getOutputStream().close();
      return process;
    };
  }
}
