package com.gentoro.annomics.bed;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BedFormatDetectorTest {

  @TempDir Path dir;

  private Path write(String content) throws Exception {
    return Files.writeString(dir.resolve("peaks.bed"), content);
  }

  @Test
  void detectsBed3() throws Exception {
    assertEquals(BedFormat.BED3, BedFormatDetector.detect(write("chr1\t100\t200\n")));
  }

  @Test
  void detectsBed6AfterHeaderAndBlankLines() throws Exception {
    Path file = write("# track name=peaks\n\nchr1\t100\t200\tpeak1\t0\t+\n");
    assertEquals(BedFormat.BED6, BedFormatDetector.detect(file));
  }

  @Test
  void detectsBed12() throws Exception {
    Path file = write("chr1\t100\t900\tg\t0\t+\t100\t900\t0\t2\t100,200\t0,600\n");
    assertEquals(BedFormat.BED12, BedFormatDetector.detect(file));
  }

  @Test
  void unknownForTooFewColumnsOrEmptyOrMissingFiles() throws Exception {
    assertEquals(BedFormat.UNKNOWN, BedFormatDetector.detect(write("chr1 100 200\n")));
    assertEquals(BedFormat.UNKNOWN, BedFormatDetector.detect(write("# only a comment\n")));
    assertEquals(BedFormat.UNKNOWN, BedFormatDetector.detect(dir.resolve("missing.bed")));
  }

  @Test
  void columnCountsBetweenFlavoursRoundDown() {
    assertEquals(BedFormat.BED3, BedFormat.ofColumnCount(5));
    assertEquals(BedFormat.BED6, BedFormat.ofColumnCount(9));
    assertEquals(BedFormat.UNKNOWN, BedFormat.ofColumnCount(2));
  }
}
