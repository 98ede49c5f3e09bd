package com.gentoro.annomics.tools;

import com.gentoro.annomics.bed.BedFormat;
import com.gentoro.annomics.bed.BedFormatDetector;
import com.gentoro.annomics.exception.ValidationException;
import com.gentoro.annomics.utility.FileUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Detects the BED flavour of a file and shows its first lines. */
public class ValidateBedFormatTool implements McpTool {
  public static final String NAME = "validate_bed_format";
  static final String FILE_PATH = "file_path";

  private static final int PREVIEW_LINES = 5;

  private static final ToolDescriptor DESCRIPTOR =
      new ToolDescriptor(
          NAME,
          "Validate BED file format and structure",
          List.of(
              ToolParameter.required(
                  FILE_PATH, ParameterType.STRING, "Path to BED file to validate")));

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public ToolResult handle(Map<String, Object> arguments) throws IOException {
    String filePath = (String) arguments.get(FILE_PATH);
    Path file = Path.of(filePath);
    if (!Files.isRegularFile(file)) {
      throw new ValidationException("File not found: " + filePath);
    }

    BedFormat format = BedFormatDetector.detect(file);
    if (format == BedFormat.UNKNOWN) {
      return ToolResult.error(
          "**BED File Validation Results**\n\n**File**: "
              + filePath
              + "\n**Status**: Not a BED file; a data line needs at least 3 tab-separated columns"
              + " (chrom, chromStart, chromEnd).");
    }

    List<String> preview = FileUtility.head(file, PREVIEW_LINES);
    return ToolResult.text(
        "**BED File Validation Results**\n\n"
            + "**File**: "
            + filePath
            + "\n**Detected Format**: "
            + format.name()
            + "\n**Status**: Valid BED format detected\n\n"
            + "**Preview** (first "
            + PREVIEW_LINES
            + " lines):\n```\n"
            + String.join("\n", preview)
            + "\n```\n\n"
            + "**Format Details**:\n"
            + "- BED3: chrom, chromStart, chromEnd (minimum required)\n"
            + "- BED6: + name, score, strand\n"
            + "- BED12: + thickStart, thickEnd, itemRgb, blockCount, blockSizes, blockStarts\n\n"
            + "This file can be used with the `"
            + AnnotateGenomicRegionsTool.NAME
            + "` tool.\n");
  }
}
