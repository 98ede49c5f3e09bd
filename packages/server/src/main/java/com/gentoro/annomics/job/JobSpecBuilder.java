package com.gentoro.annomics.job;

import com.gentoro.annomics.exception.ValidationException;
import com.gentoro.annomics.genome.SupportedGenomes;
import com.gentoro.annomics.utility.NumberUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns the loosely-typed argument bag of an annotation call into a {@link JobSpec}.
 *
 * <p>The builder never touches the filesystem: whether the input files exist is only discovered
 * once the external process runs.
 */
public class JobSpecBuilder {
  public static final String INPUT_FILES = "input_files";
  public static final String GENOME_BUILD = "genome_build";
  public static final String OUTPUT_DIRECTORY = "output_directory";
  public static final String SAMPLE_NAME = "sample_name";
  public static final String INCLUDE_CPG = "include_cpg";
  public static final String INCLUDE_GENIC = "include_genic";
  public static final String PLOT_FORMATS = "plot_formats";
  public static final String COMBINE_ANALYSIS = "combine_analysis";
  public static final String PATTERN = "pattern";
  public static final String TIMEOUT = "timeout";

  private final int defaultTimeoutSeconds;

  public JobSpecBuilder() {
    this(JobSpec.DEFAULT_TIMEOUT_SECONDS);
  }

  public JobSpecBuilder(int defaultTimeoutSeconds) {
    if (defaultTimeoutSeconds <= 0) {
      throw new IllegalArgumentException("Default timeout must be positive");
    }
    this.defaultTimeoutSeconds = defaultTimeoutSeconds;
  }

  public int defaultTimeoutSeconds() {
    return defaultTimeoutSeconds;
  }

  /**
   * Validate and normalize {@code args}.
   *
   * @throws ValidationException when a required argument is missing, the genome build is not
   *     supported, no input file remains after normalization, or an optional argument has an
   *     invalid value
   */
  public JobSpec build(Map<String, Object> args) {
    if (args == null) {
      throw new ValidationException("Missing arguments for annotation request");
    }

    List<String> inputFiles = normalizeInputFiles(required(args, INPUT_FILES));
    if (inputFiles.isEmpty()) {
      throw new ValidationException("No input files given in '" + INPUT_FILES + "'");
    }

    String genomeBuild = requiredString(args, GENOME_BUILD);
    if (!SupportedGenomes.isSupported(genomeBuild)) {
      throw new ValidationException(
          "Unsupported genome build '"
              + genomeBuild
              + "'. Available: "
              + String.join(", ", SupportedGenomes.names()));
    }

    String outputDirectory = requiredString(args, OUTPUT_DIRECTORY);

    return new JobSpec(
        inputFiles,
        genomeBuild,
        outputDirectory,
        StringUtils.trimToNull(asString(args.get(SAMPLE_NAME), SAMPLE_NAME)),
        asBoolean(args.get(INCLUDE_CPG), INCLUDE_CPG, true),
        asBoolean(args.get(INCLUDE_GENIC), INCLUDE_GENIC, true),
        plotFormats(args.get(PLOT_FORMATS)),
        asBoolean(args.get(COMBINE_ANALYSIS), COMBINE_ANALYSIS, false),
        StringUtils.defaultIfBlank(
            asString(args.get(PATTERN), PATTERN), JobSpec.DEFAULT_FILE_PATTERN),
        timeout(args.get(TIMEOUT)));
  }

  /**
   * Accepts a single path, a comma-joined string of paths, or a list of either. Entries are
   * trimmed and blanks dropped; order is preserved.
   */
  static List<String> normalizeInputFiles(Object value) {
    List<String> files = new ArrayList<>();
    if (value instanceof Collection<?> items) {
      for (Object item : items) {
        if (item != null) {
          splitInto(item.toString(), files);
        }
      }
    } else if (value != null) {
      splitInto(value.toString(), files);
    }
    return files;
  }

  private static void splitInto(String joined, List<String> target) {
    for (String part : joined.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        target.add(trimmed);
      }
    }
  }

  private static Object required(Map<String, Object> args, String name) {
    Object value = args.get(name);
    if (value == null) {
      throw new ValidationException("Missing required argument '" + name + "'");
    }
    return value;
  }

  private static String requiredString(Map<String, Object> args, String name) {
    String value = StringUtils.trimToNull(asString(required(args, name), name));
    if (value == null) {
      throw new ValidationException("Missing required argument '" + name + "'");
    }
    return value;
  }

  private static String asString(Object value, String name) {
    if (value == null) return null;
    if (value instanceof String s) return s;
    if (value instanceof Number || value instanceof Boolean) return value.toString();
    throw new ValidationException("Argument '" + name + "' must be a string");
  }

  private static boolean asBoolean(Object value, String name, boolean defaultValue) {
    if (value == null) return defaultValue;
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) {
      if ("true".equalsIgnoreCase(s.trim())) return true;
      if ("false".equalsIgnoreCase(s.trim())) return false;
    }
    throw new ValidationException("Argument '" + name + "' must be a boolean");
  }

  private static Set<PlotFormat> plotFormats(Object value) {
    if (value == null) {
      return JobSpec.DEFAULT_PLOT_FORMATS;
    }
    List<String> names = new ArrayList<>();
    if (value instanceof Collection<?> items) {
      for (Object item : items) {
        if (item != null) splitInto(item.toString(), names);
      }
    } else {
      splitInto(value.toString(), names);
    }
    if (names.isEmpty()) {
      throw new ValidationException("At least one plot format is required");
    }
    Set<PlotFormat> formats = EnumSet.noneOf(PlotFormat.class);
    for (String name : names) {
      formats.add(PlotFormat.parse(name));
    }
    return formats;
  }

  private int timeout(Object value) {
    if (value == null) {
      return defaultTimeoutSeconds;
    }
    OptionalInt parsed = NumberUtility.toIntExact(value);
    if (parsed.isEmpty()) {
      throw new ValidationException(
          "Argument '" + TIMEOUT + "' must be an integer no larger than " + Integer.MAX_VALUE);
    }
    int seconds = parsed.getAsInt();
    if (seconds <= 0) {
      throw new ValidationException(
          "Argument '" + TIMEOUT + "' must be a positive number of seconds");
    }
    return seconds;
  }
}
