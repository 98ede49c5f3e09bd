package com.gentoro.annomics.tools;

import com.gentoro.annomics.classify.FileManifest;
import com.gentoro.annomics.classify.ResultClassifier;
import com.gentoro.annomics.exception.ValidationException;
import com.gentoro.annomics.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/** Summarizes an existing results directory without re-running anything. */
public class GetAnnotationSummaryTool implements McpTool {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(GetAnnotationSummaryTool.class);

  public static final String NAME = "get_annotation_summary";
  static final String RESULTS_DIRECTORY = "results_directory";
  static final String SAMPLE_NAME = "sample_name";

  private static final int LISTED_FILES = 5;
  private static final int PREVIEW_ROWS = 6;

  private static final ToolDescriptor DESCRIPTOR =
      new ToolDescriptor(
          NAME,
          "Get summary of annotation results from output directory",
          List.of(
              ToolParameter.required(
                  RESULTS_DIRECTORY, ParameterType.STRING, "Path to annotation results directory"),
              ToolParameter.optional(
                  SAMPLE_NAME,
                  ParameterType.STRING,
                  "Specific sample name (optional, defaults to all samples)",
                  null)));

  private final ResultClassifier classifier;

  public GetAnnotationSummaryTool(ResultClassifier classifier) {
    this.classifier = classifier;
  }

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public ToolResult handle(Map<String, Object> arguments) {
    String directory = (String) arguments.get(RESULTS_DIRECTORY);
    Path root = Path.of(directory);
    if (!Files.isDirectory(root)) {
      throw new ValidationException("Results directory not found: " + directory);
    }

    String sample = (String) arguments.get(SAMPLE_NAME);
    FileManifest manifest = classifier.scan(root);
    List<String> summaries = matching(manifest.summaryFiles(), sample);
    List<String> annotations = matching(manifest.annotationFiles(), sample);
    List<String> combined = matching(manifest.combinedFiles(), sample);
    List<String> plots = matching(manifest.plotFiles(), sample);

    StringBuilder sb = new StringBuilder("**Annotation Results Summary**\n\n");
    sb.append("**Directory**: ").append(directory).append('\n');
    if (sample != null && !sample.isBlank()) {
      sb.append("**Sample**: ").append(sample).append('\n');
    }
    sb.append("\n**Files Found**:\n");
    sb.append("- Summary files: ").append(summaries.size()).append('\n');
    sb.append("- Annotation files: ").append(annotations.size()).append('\n');
    sb.append("- Combined files: ").append(combined.size()).append('\n');
    sb.append("- Plot files: ").append(plots.size()).append('\n');

    section(sb, "Summary Files", summaries, Integer.MAX_VALUE);
    section(sb, "Annotation Files", annotations, LISTED_FILES);
    section(sb, "Visualizations", plots, LISTED_FILES);

    if (!summaries.isEmpty()) {
      String first = summaries.get(0);
      try {
        List<String> rows = FileUtility.head(root.resolve(first), PREVIEW_ROWS);
        sb.append("\n**Sample Summary** (from ")
            .append(first)
            .append("):\n```\n")
            .append(String.join("\n", rows))
            .append("\n```\n");
      } catch (IOException e) {
        log.debug("Could not read summary file {}: {}", first, e.getMessage());
        sb.append("\n(Could not read summary file details)\n");
      }
    }
    return ToolResult.text(sb.toString());
  }

  private static List<String> matching(List<String> files, String sample) {
    if (sample == null || sample.isBlank()) {
      return files;
    }
    return files.stream()
        .filter(f -> Path.of(f).getFileName().toString().contains(sample))
        .collect(Collectors.toList());
  }

  private static void section(StringBuilder sb, String title, List<String> files, int limit) {
    sb.append("\n**").append(title).append("**:\n");
    files.stream().limit(limit).forEach(f -> sb.append("- ").append(f).append('\n'));
  }
}
