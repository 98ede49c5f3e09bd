package com.gentoro.annomics;

import com.gentoro.annomics.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line parameters in {@code --name=value} or {@code --name value} form. A bare {@code
 * --flag} is recorded as {@code "true"}.
 *
 * <p>{@code --config} names an optional YAML file overlaid on the bundled {@code
 * application.yaml}; every other parameter overrides the configuration key of the same name.
 */
public class StartupParameters {
  public static final String CONFIG_FILE = "config";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unrecognized startup argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public String configFile() {
    return StringUtils.trimToNull(parameters.get(CONFIG_FILE));
  }

  /** Every parameter except {@code --config}, in command line order. */
  public Map<String, String> overrides() {
    Map<String, String> copy = new LinkedHashMap<>(parameters);
    copy.remove(CONFIG_FILE);
    return Collections.unmodifiableMap(copy);
  }
}
