package com.gentoro.annomics.genome;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Fixed registry of the genome builds supported by the annotation script. */
public final class SupportedGenomes {
  private static final List<String> CPG_AND_GENIC = List.of("cpg", "genic");

  private static final Map<String, GenomeBuild> GENOMES;

  static {
    Map<String, GenomeBuild> map = new LinkedHashMap<>();
    add(map, "hg19", "Human (GRCh37)", "Homo sapiens", "GRCh37", "chr1");
    add(map, "hg38", "Human (GRCh38)", "Homo sapiens", "GRCh38", "chr1");
    add(map, "mm9", "Mouse (NCBI37)", "Mus musculus", "NCBI37", "chr1");
    add(map, "mm10", "Mouse (GRCm38)", "Mus musculus", "GRCm38", "chr1");
    add(map, "dm3", "Drosophila (BDGP Release 5)", "Drosophila melanogaster", "BDGP Release 5",
        "chr2L");
    add(map, "dm6", "Drosophila (BDGP Release 6)", "Drosophila melanogaster", "BDGP Release 6",
        "chr2L");
    add(map, "rn4", "Rat (RGSC 3.4)", "Rattus norvegicus", "RGSC 3.4", "chr1");
    add(map, "rn5", "Rat (RGSC 5.0)", "Rattus norvegicus", "RGSC 5.0", "chr1");
    add(map, "rn6", "Rat (RGSC 6.0)", "Rattus norvegicus", "RGSC 6.0", "chr1");
    GENOMES = Collections.unmodifiableMap(map);
  }

  private SupportedGenomes() {}

  private static void add(
      Map<String, GenomeBuild> map,
      String name,
      String description,
      String species,
      String assembly,
      String chromosomeStyle) {
    map.put(
        name,
        new GenomeBuild(name, description, species, assembly, chromosomeStyle, CPG_AND_GENIC));
  }

  public static Optional<GenomeBuild> get(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(GENOMES.get(name));
  }

  public static boolean isSupported(String name) {
    return name != null && GENOMES.containsKey(name);
  }

  /** Genome identifiers in registry order. */
  public static List<String> names() {
    return List.copyOf(GENOMES.keySet());
  }

  public static Collection<GenomeBuild> all() {
    return GENOMES.values();
  }
}
