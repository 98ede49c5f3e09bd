package com.gentoro.annomics.bed;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;

/**
 * Classifies a BED file from the column count of its first data line. Blank lines and lines
 * starting with {@code #} are skipped.
 */
public final class BedFormatDetector {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(BedFormatDetector.class);

  private BedFormatDetector() {}

  /** Returns {@link BedFormat#UNKNOWN} for unreadable or empty files. */
  public static BedFormat detect(Path file) {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
        return BedFormat.ofColumnCount(trimmed.split("\t", -1).length);
      }
    } catch (IOException | RuntimeException e) {
      log.debug("Could not read {} for format detection: {}", file, e.getMessage());
    }
    return BedFormat.UNKNOWN;
  }
}
