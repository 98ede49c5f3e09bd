package com.gentoro.annomics.genome;

import java.util.List;

/**
 * Descriptive metadata of a genome build the annotation script understands.
 *
 * @param name identifier passed to the script ({@code -g})
 * @param description short human-readable label
 * @param species binomial species name
 * @param assembly assembly label of the reference
 * @param chromosomeStyle example chromosome name, e.g. {@code chr1}
 * @param annotations annotation kinds available for the build
 */
public record GenomeBuild(
    String name,
    String description,
    String species,
    String assembly,
    String chromosomeStyle,
    List<String> annotations) {

  public GenomeBuild {
    annotations = List.copyOf(annotations);
  }
}
