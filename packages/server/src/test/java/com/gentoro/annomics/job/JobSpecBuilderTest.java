package com.gentoro.annomics.job;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.annomics.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JobSpecBuilderTest {

  private final JobSpecBuilder builder = new JobSpecBuilder();

  private static Map<String, Object> args(Object inputFiles, String genome) {
    Map<String, Object> args = new HashMap<>();
    args.put(JobSpecBuilder.INPUT_FILES, inputFiles);
    args.put(JobSpecBuilder.GENOME_BUILD, genome);
    args.put(JobSpecBuilder.OUTPUT_DIRECTORY, "out");
    return args;
  }

  @Test
  @DisplayName("Optional arguments fall back to their defaults")
  void appliesDefaults() {
    JobSpec spec = builder.build(args("a.bed", "hg38"));

    assertEquals(List.of("a.bed"), spec.inputFiles());
    assertEquals("hg38", spec.genomeBuild());
    assertEquals("out", spec.outputDirectory());
    assertNull(spec.sampleName());
    assertTrue(spec.includeCpg());
    assertTrue(spec.includeGenic());
    assertEquals(Set.of(PlotFormat.PNG, PlotFormat.PDF), spec.plotFormats());
    assertFalse(spec.combineAnalysis());
    assertEquals("*.bed", spec.filePattern());
    assertEquals(300, spec.timeoutSeconds());
  }

  @Test
  @DisplayName("Comma-joined input strings are split and trimmed")
  void splitsCommaJoinedInputs() {
    JobSpec spec = builder.build(args(" a.bed , b.bed,,c.bed ", "mm10"));
    assertEquals(List.of("a.bed", "b.bed", "c.bed"), spec.inputFiles());
  }

  @Test
  void flattensListEntriesThatContainCommas() {
    JobSpec spec = builder.build(args(List.of("a.bed,b.bed", " c.bed"), "mm10"));
    assertEquals(List.of("a.bed", "b.bed", "c.bed"), spec.inputFiles());
  }

  @Test
  @DisplayName("An input list that normalizes to nothing is rejected")
  void rejectsEmptyInputList() {
    ValidationException ex =
        assertThrows(ValidationException.class, () -> builder.build(args(List.of(), "hg19")));
    assertTrue(ex.getMessage().contains("input_files"));

    assertThrows(ValidationException.class, () -> builder.build(args(" , ,", "hg19")));
  }

  @Test
  @DisplayName("Unknown genome builds are rejected and the supported ones listed")
  void rejectsUnsupportedGenome() {
    ValidationException ex =
        assertThrows(ValidationException.class, () -> builder.build(args("a.bed", "hg37")));
    assertTrue(ex.getMessage().contains("hg37"));
    assertTrue(ex.getMessage().contains("hg19"));
    assertTrue(ex.getMessage().contains("rn6"));
  }

  @Test
  void rejectsMissingRequiredArguments() {
    Map<String, Object> args = args("a.bed", "hg19");
    args.remove(JobSpecBuilder.OUTPUT_DIRECTORY);
    ValidationException ex = assertThrows(ValidationException.class, () -> builder.build(args));
    assertTrue(ex.getMessage().contains("output_directory"));

    assertThrows(ValidationException.class, () -> builder.build(null));
  }

  @Test
  void parsesOptionalArguments() {
    Map<String, Object> args = args(List.of("x.bed", "y.bed"), "dm6");
    args.put(JobSpecBuilder.SAMPLE_NAME, "  liver ");
    args.put(JobSpecBuilder.INCLUDE_CPG, "false");
    args.put(JobSpecBuilder.PLOT_FORMATS, List.of("SVG", "png"));
    args.put(JobSpecBuilder.COMBINE_ANALYSIS, true);
    args.put(JobSpecBuilder.PATTERN, "*.narrowPeak");
    args.put(JobSpecBuilder.TIMEOUT, "45");

    JobSpec spec = builder.build(args);

    assertEquals("liver", spec.sampleName());
    assertFalse(spec.includeCpg());
    assertTrue(spec.includeGenic());
    assertEquals(Set.of(PlotFormat.SVG, PlotFormat.PNG), spec.plotFormats());
    assertTrue(spec.combineAnalysis());
    assertEquals("*.narrowPeak", spec.filePattern());
    assertEquals(45, spec.timeoutSeconds());
  }

  @Test
  void usesConfiguredDefaultTimeout() {
    assertEquals(30, new JobSpecBuilder(30).build(args("a.bed", "hg19")).timeoutSeconds());
    assertThrows(IllegalArgumentException.class, () -> new JobSpecBuilder(0));
  }

  @Test
  @DisplayName("Timeouts must be positive whole seconds")
  void rejectsInvalidTimeouts() {
    for (Object bad : List.of(0, -5, 1.5, "soon")) {
      Map<String, Object> args = args("a.bed", "hg19");
      args.put(JobSpecBuilder.TIMEOUT, bad);
      assertThrows(ValidationException.class, () -> builder.build(args), "timeout " + bad);
    }
  }

  @Test
  @DisplayName("Timeouts beyond the int range fail validation instead of wrapping around")
  void rejectsOverflowingTimeouts() {
    for (Object tooLarge : List.of(4294967297L, 2147483648L, "99999999999")) {
      Map<String, Object> args = args("a.bed", "hg19");
      args.put(JobSpecBuilder.TIMEOUT, tooLarge);
      ValidationException ex =
          assertThrows(ValidationException.class, () -> builder.build(args), "timeout " + tooLarge);
      assertTrue(ex.getMessage().contains("timeout"));
      assertFalse(ex.getMessage().contains("positive"));
    }
  }

  @Test
  void rejectsUnknownPlotFormat() {
    Map<String, Object> args = args("a.bed", "hg19");
    args.put(JobSpecBuilder.PLOT_FORMATS, List.of("gif"));
    ValidationException ex = assertThrows(ValidationException.class, () -> builder.build(args));
    assertTrue(ex.getMessage().contains("gif"));
  }
}
