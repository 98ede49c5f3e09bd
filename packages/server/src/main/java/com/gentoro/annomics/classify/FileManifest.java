package com.gentoro.annomics.classify;

import java.util.List;
import java.util.Map;

/**
 * Categorized listing of the files found under a job's output directory. Paths are relative to
 * that directory and use {@code /} as separator. The four lists are disjoint.
 */
public record FileManifest(
    List<String> annotationFiles,
    List<String> summaryFiles,
    List<String> combinedFiles,
    List<String> plotFiles) {

  public FileManifest {
    annotationFiles = List.copyOf(annotationFiles);
    summaryFiles = List.copyOf(summaryFiles);
    combinedFiles = List.copyOf(combinedFiles);
    plotFiles = List.copyOf(plotFiles);
  }

  public static FileManifest empty() {
    return new FileManifest(List.of(), List.of(), List.of(), List.of());
  }

  public List<String> files(FileCategory category) {
    switch (category) {
      case ANNOTATION:
        return annotationFiles;
      case SUMMARY:
        return summaryFiles;
      case COMBINED:
        return combinedFiles;
      case PLOT:
        return plotFiles;
      default:
        throw new IllegalArgumentException("Unknown category: " + category);
    }
  }

  public Map<FileCategory, Integer> counts() {
    return Map.of(
        FileCategory.ANNOTATION, annotationFiles.size(),
        FileCategory.SUMMARY, summaryFiles.size(),
        FileCategory.COMBINED, combinedFiles.size(),
        FileCategory.PLOT, plotFiles.size());
  }

  public int totalFiles() {
    return annotationFiles.size() + summaryFiles.size() + combinedFiles.size() + plotFiles.size();
  }

  public boolean isEmpty() {
    return totalFiles() == 0;
  }
}
