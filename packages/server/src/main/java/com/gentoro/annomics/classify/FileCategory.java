package com.gentoro.annomics.classify;

import java.util.Optional;

/** Semantic category of a file produced by the annotation script. */
public enum FileCategory {
  ANNOTATION,
  SUMMARY,
  COMBINED,
  PLOT;

  /**
   * Categorize by file name: {@code .tsv} files are summary, combined or annotation tables (in that
   * order of precedence); {@code .png}, {@code .pdf} and {@code .svg} files are plots. Extensions
   * are matched case-sensitively.
   */
  public static Optional<FileCategory> of(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0) {
      return Optional.empty();
    }
    String extension = fileName.substring(dot + 1);
    switch (extension) {
      case "tsv":
        if (fileName.contains("summary")) return Optional.of(SUMMARY);
        if (fileName.contains("combined")) return Optional.of(COMBINED);
        return Optional.of(ANNOTATION);
      case "png":
      case "pdf":
      case "svg":
        return Optional.of(PLOT);
      default:
        return Optional.empty();
    }
  }
}
