package com.gentoro.annomics.genome;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SupportedGenomesTest {

  @Test
  void listsBuildsInRegistryOrder() {
    assertEquals(
        List.of("hg19", "hg38", "mm9", "mm10", "dm3", "dm6", "rn4", "rn5", "rn6"),
        SupportedGenomes.names());
  }

  @Test
  void looksUpBuildDetails() {
    GenomeBuild mm10 = SupportedGenomes.get("mm10").orElseThrow();
    assertEquals("Mus musculus", mm10.species());
    assertEquals("GRCm38", mm10.assembly());
    assertEquals(List.of("cpg", "genic"), mm10.annotations());
    assertEquals("chr2L", SupportedGenomes.get("dm6").orElseThrow().chromosomeStyle());
  }

  @Test
  void lookupIsCaseSensitive() {
    assertTrue(SupportedGenomes.isSupported("hg38"));
    assertFalse(SupportedGenomes.isSupported("HG38"));
    assertFalse(SupportedGenomes.isSupported("hg37"));
    assertFalse(SupportedGenomes.isSupported(null));
    assertTrue(SupportedGenomes.get(null).isEmpty());
  }
}
