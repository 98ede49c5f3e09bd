package com.gentoro.annomics.tools;

import static com.gentoro.annomics.job.JobSpecBuilder.*;

import com.gentoro.annomics.classify.FileManifest;
import com.gentoro.annomics.classify.ResultClassifier;
import com.gentoro.annomics.exception.EnvironmentException;
import com.gentoro.annomics.exception.ProcessFailureException;
import com.gentoro.annomics.exception.TimeoutFailureException;
import com.gentoro.annomics.genome.SupportedGenomes;
import com.gentoro.annomics.job.JobSpec;
import com.gentoro.annomics.job.JobSpecBuilder;
import com.gentoro.annomics.job.PlotFormat;
import com.gentoro.annomics.process.ProcessOutcome;
import com.gentoro.annomics.process.ProcessSupervisor;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the annotation script on one or more BED files and reports the files it produced.
 *
 * <p>Timeouts, non-zero exits and launch failures are raised as their own exception types so the
 * caller can tell "never finished" from "ran and failed".
 */
public class AnnotateGenomicRegionsTool implements McpTool {
  public static final String NAME = "annotate_genomic_regions";

  private static final int LISTED_ANNOTATION_FILES = 5;
  private static final int LISTED_PLOT_FILES = 3;

  private final JobSpecBuilder jobSpecBuilder;
  private final ProcessSupervisor supervisor;
  private final ResultClassifier classifier;
  private final ToolDescriptor descriptor;

  public AnnotateGenomicRegionsTool(
      JobSpecBuilder jobSpecBuilder, ProcessSupervisor supervisor, ResultClassifier classifier) {
    this.jobSpecBuilder = jobSpecBuilder;
    this.supervisor = supervisor;
    this.classifier = classifier;
    this.descriptor = describe(jobSpecBuilder.defaultTimeoutSeconds());
  }

  private static ToolDescriptor describe(int defaultTimeout) {
    List<String> formats =
        Arrays.stream(PlotFormat.values()).map(PlotFormat::extension).collect(Collectors.toList());
    return new ToolDescriptor(
        NAME,
        "Annotate genomic regions from BED files with CpG and genic features",
        List.of(
            ToolParameter.required(
                INPUT_FILES,
                ParameterType.STRING_OR_ARRAY,
                "Single BED file path, comma-separated list, or array of file paths"),
            ToolParameter.required(
                    GENOME_BUILD,
                    ParameterType.STRING,
                    "Target genome build (" + String.join(", ", SupportedGenomes.names()) + ")")
                .withAllowedValues(SupportedGenomes.names()),
            ToolParameter.required(OUTPUT_DIRECTORY, ParameterType.STRING, "Output directory path"),
            ToolParameter.optional(
                SAMPLE_NAME, ParameterType.STRING, "Optional sample name for output files", null),
            ToolParameter.optional(
                INCLUDE_CPG, ParameterType.BOOLEAN, "Include CpG island annotations", true),
            ToolParameter.optional(
                INCLUDE_GENIC, ParameterType.BOOLEAN, "Include genic feature annotations", true),
            ToolParameter.optional(
                    PLOT_FORMATS,
                    ParameterType.STRING_ARRAY,
                    "Output plot formats",
                    List.of("png", "pdf"))
                .withAllowedValues(formats),
            ToolParameter.optional(
                COMBINE_ANALYSIS,
                ParameterType.BOOLEAN,
                "Create combined analysis for multiple files",
                false),
            ToolParameter.optional(
                PATTERN,
                ParameterType.STRING,
                "File pattern used when an input is a directory",
                JobSpec.DEFAULT_FILE_PATTERN),
            ToolParameter.optional(
                TIMEOUT, ParameterType.INTEGER, "Execution timeout in seconds", defaultTimeout)));
  }

  @Override
  public ToolDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public ToolResult handle(Map<String, Object> arguments) {
    JobSpec spec = jobSpecBuilder.build(arguments);
    ProcessOutcome outcome = supervisor.run(spec).join();

    switch (outcome.status()) {
      case TIMED_OUT:
        throw new TimeoutFailureException(spec.timeoutSeconds())
            .withContext("outputDirectory", outcome.outputDirectory());
      case NON_ZERO_EXIT:
        throw new ProcessFailureException(outcome.exitCode(), outcome.stderr())
            .withContext("genomeBuild", spec.genomeBuild())
            .withContext("elapsedMillis", outcome.elapsed().toMillis());
      case LAUNCH_FAILED:
        throw new EnvironmentException(outcome.stderr());
      case SUCCESS:
      default:
        break;
    }

    FileManifest manifest = classifier.scan(outcome.outputDirectory());
    return ToolResult.text(format(spec, outcome, manifest));
  }

  static String format(JobSpec spec, ProcessOutcome outcome, FileManifest manifest) {
    StringBuilder sb = new StringBuilder();
    sb.append("Genomic annotation completed successfully!\n\n");
    sb.append("**Input**: ").append(String.join(", ", spec.inputFiles())).append('\n');
    sb.append("**Genome Build**: ").append(spec.genomeBuild()).append('\n');
    sb.append("**Output Directory**: ").append(outcome.outputDirectory()).append("\n\n");

    sb.append("**Generated Files**:\n");
    sb.append("- Annotation files: ").append(manifest.annotationFiles().size()).append('\n');
    sb.append("- Summary files: ").append(manifest.summaryFiles().size()).append('\n');
    sb.append("- Plot files: ").append(manifest.plotFiles().size()).append('\n');
    sb.append("- Combined files: ").append(manifest.combinedFiles().size()).append("\n\n");

    sb.append("**Key Output Files**:\n");
    manifest.annotationFiles().stream()
        .limit(LISTED_ANNOTATION_FILES)
        .forEach(f -> sb.append("- ").append(f).append('\n'));

    sb.append("\nYou can find all results in: ").append(outcome.outputDirectory()).append('\n');

    if (!manifest.plotFiles().isEmpty()) {
      sb.append("\n**Visualizations created**: ")
          .append(
              manifest.plotFiles().stream()
                  .limit(LISTED_PLOT_FILES)
                  .collect(Collectors.joining(", ")));
    }
    return sb.toString();
  }
}
