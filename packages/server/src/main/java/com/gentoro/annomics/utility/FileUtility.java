package com.gentoro.annomics.utility;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Small collection of text file helpers. */
public final class FileUtility {

  private FileUtility() {}

  /** First {@code maxLines} lines of a UTF-8 text file, verbatim. */
  public static List<String> head(Path file, int maxLines) throws IOException {
    List<String> lines = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while (lines.size() < maxLines && (line = reader.readLine()) != null) {
        lines.add(line);
      }
    }
    return lines;
  }
}
