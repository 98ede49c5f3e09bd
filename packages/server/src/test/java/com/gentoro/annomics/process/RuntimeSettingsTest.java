package com.gentoro.annomics.process;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.annomics.exception.ConfigException;
import com.gentoro.annomics.exception.EnvironmentException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RuntimeSettingsTest {

  @TempDir Path root;

  @Test
  void configuredScriptIsCheckedFirst() {
    List<Path> candidates = RuntimeSettings.scriptCandidates("/opt/annotate.R");
    assertEquals(
        List.of(
            Path.of("/opt/annotate.R"),
            Path.of("/app/scripts", RuntimeSettings.SCRIPT_NAME),
            Path.of("scripts", RuntimeSettings.SCRIPT_NAME)),
        candidates);
    assertEquals(2, RuntimeSettings.scriptCandidates("  ").size());
  }

  @Test
  void resolvesFromConfiguration() throws Exception {
    Path script = Files.createDirectories(root.resolve("scripts")).resolve("annotate.R");
    Files.writeString(script, "# r");

    Configuration config = new BaseConfiguration();
    config.setProperty("annomics.runtime.script", script.toString());
    config.setProperty("annomics.runtime.working-directory", "");
    config.setProperty("annomics.job.max-concurrent", 3);

    RuntimeSettings settings = RuntimeSettings.fromConfiguration(config);

    assertEquals("Rscript", settings.executable());
    assertEquals(script.toAbsolutePath().normalize(), settings.script());
    assertEquals(root.toAbsolutePath().normalize(), settings.workingDirectory());
    assertEquals(10, settings.versionCheckTimeoutSeconds());
    assertEquals(3, settings.maxConcurrentJobs());
  }

  @Test
  void explicitWorkingDirectoryWins() throws Exception {
    Path script = Files.writeString(root.resolve("annotate.R"), "# r");
    Configuration config = new BaseConfiguration();
    config.setProperty("annomics.runtime.script", script.toString());
    config.setProperty("annomics.runtime.working-directory", root.resolve("work").toString());

    RuntimeSettings settings = RuntimeSettings.fromConfiguration(config);
    assertEquals(root.resolve("work").toAbsolutePath().normalize(), settings.workingDirectory());
  }

  @Test
  void missingScriptIsAnEnvironmentError() {
    Path missing = root.resolve("nope.R");
    EnvironmentException ex =
        assertThrows(
            EnvironmentException.class, () -> RuntimeSettings.locateScript(missing.toString()));
    assertTrue(ex.getMessage().contains("nope.R"));
  }

  @Test
  void rejectsNonPositiveLimits() {
    Path script = root.resolve("a.R");
    assertThrows(ConfigException.class, () -> new RuntimeSettings("Rscript", script, root, 0, 1));
    assertThrows(ConfigException.class, () -> new RuntimeSettings("Rscript", script, root, 1, 0));
  }
}
