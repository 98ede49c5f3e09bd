package com.gentoro.annomics;

import com.gentoro.annomics.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the bundled {@code application.yaml}, overlays an optional external YAML file and then
 * the individual startup overrides.
 */
public class ConfigurationProvider {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "/application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile, Map<String, String> overrides) {
    this.config = loadResource(DEFAULT_RESOURCE);

    if (configFile != null) {
      Path path = Path.of(configFile);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
      }
      YAMLConfiguration external = new YAMLConfiguration();
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        external.read(reader);
      } catch (Exception e) {
        throw new ConfigException("Failed to read configuration file " + path, e);
      }
      external
          .getKeys()
          .forEachRemaining(key -> config.setProperty(key, external.getProperty(key)));
      log.debug("Overlaid configuration from {}", path.toAbsolutePath());
    }

    if (overrides != null) {
      overrides.forEach(config::setProperty);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = ConfigurationProvider.class.getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Bundled configuration {} not found, using built-in defaults", resource);
        return yaml;
      }
      yaml.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled configuration " + resource, e);
    }
    return yaml;
  }

  public Configuration config() {
    return config;
  }
}
