package com.gentoro.annomics.tools;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ValidateBedFormatToolTest {

  @TempDir Path dir;

  private final ToolRegistry registry = new ToolRegistry().register(new ValidateBedFormatTool());

  private ToolResult validate(Path file) {
    return registry.dispatch(ValidateBedFormatTool.NAME, Map.of("file_path", file.toString()));
  }

  @Test
  void reportsDetectedFormatWithPreview() throws Exception {
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i <= 8; i++) {
      sb.append("chr1\t").append(i * 100).append('\t').append(i * 100 + 50);
      sb.append("\tpeak").append(i).append("\t0\t+\n");
    }
    Path bed = Files.writeString(dir.resolve("peaks.bed"), sb.toString());

    ToolResult result = validate(bed);

    assertFalse(result.isError(), result.text());
    assertTrue(result.text().contains("**Detected Format**: BED6"));
    assertTrue(result.text().contains("peak5"));
    assertFalse(result.text().contains("peak6"));
  }

  @Test
  void rejectsFilesThatAreNotBed() throws Exception {
    Path csv = Files.writeString(dir.resolve("table.csv"), "a,b,c\n1,2,3\n");

    ToolResult result = validate(csv);

    assertTrue(result.isError());
    assertTrue(result.text().contains("Not a BED file"));
  }

  @Test
  void missingFileIsAnError() {
    ToolResult result = validate(dir.resolve("absent.bed"));

    assertTrue(result.isError());
    assertTrue(result.text().contains("File not found"));
  }
}
