package com.gentoro.annomics.job;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one annotation job. Instances are produced by {@link JobSpecBuilder}
 * and consumed by the process supervisor; a new instance is built for every call.
 *
 * @param inputFiles BED files to annotate, in caller order; existence is not checked here
 * @param genomeBuild identifier known to {@link com.gentoro.annomics.genome.SupportedGenomes}
 * @param outputDirectory output root exactly as supplied by the caller
 * @param sampleName optional sample label, {@code null} when unset
 * @param includeCpg whether CpG annotations are requested
 * @param includeGenic whether genic annotations are requested
 * @param plotFormats non-empty set of plot formats, iterated in declaration order
 * @param combineAnalysis whether a combined table over all inputs is requested
 * @param filePattern glob used by the script when an input is a directory
 * @param timeoutSeconds wall-clock deadline of the external process
 */
public record JobSpec(
    List<String> inputFiles,
    String genomeBuild,
    String outputDirectory,
    String sampleName,
    boolean includeCpg,
    boolean includeGenic,
    Set<PlotFormat> plotFormats,
    boolean combineAnalysis,
    String filePattern,
    int timeoutSeconds) {

  public static final int DEFAULT_TIMEOUT_SECONDS = 300;
  public static final String DEFAULT_FILE_PATTERN = "*.bed";
  public static final Set<PlotFormat> DEFAULT_PLOT_FORMATS =
      Collections.unmodifiableSet(EnumSet.of(PlotFormat.PNG, PlotFormat.PDF));

  public JobSpec {
    Objects.requireNonNull(genomeBuild, "genomeBuild");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    if (inputFiles == null || inputFiles.isEmpty()) {
      throw new IllegalArgumentException("inputFiles must not be empty");
    }
    if (plotFormats == null || plotFormats.isEmpty()) {
      throw new IllegalArgumentException("plotFormats must not be empty");
    }
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("timeoutSeconds must be positive");
    }
    inputFiles = List.copyOf(inputFiles);
    plotFormats = Collections.unmodifiableSet(EnumSet.copyOf(plotFormats));
    filePattern = filePattern == null ? DEFAULT_FILE_PATTERN : filePattern;
  }

  public boolean hasSampleName() {
    return sampleName != null;
  }

  public boolean hasCustomFilePattern() {
    return !DEFAULT_FILE_PATTERN.equals(filePattern);
  }
}
