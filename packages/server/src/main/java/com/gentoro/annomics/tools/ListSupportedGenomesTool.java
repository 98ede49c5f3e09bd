package com.gentoro.annomics.tools;

import com.gentoro.annomics.genome.GenomeBuild;
import com.gentoro.annomics.genome.SupportedGenomes;
import java.util.List;
import java.util.Map;

/** Lists the genome builds accepted by {@code annotate_genomic_regions}. */
public class ListSupportedGenomesTool implements McpTool {
  public static final String NAME = "list_supported_genomes";

  private static final ToolDescriptor DESCRIPTOR =
      new ToolDescriptor(NAME, "List all supported genome builds and their details", List.of());

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public ToolResult handle(Map<String, Object> arguments) {
    StringBuilder sb = new StringBuilder("**Supported Genome Builds**\n\n");
    for (GenomeBuild genome : SupportedGenomes.all()) {
      sb.append("**").append(genome.name()).append("**: ");
      sb.append(genome.description()).append('\n');
      sb.append("  - Species: ").append(genome.species()).append('\n');
      sb.append("  - Assembly: ").append(genome.assembly()).append('\n');
      sb.append("  - Chromosome style: ").append(genome.chromosomeStyle()).append('\n');
      sb.append("  - Annotations: ").append(String.join(", ", genome.annotations())).append("\n\n");
    }
    sb.append("**Usage**: Specify any of these genome names in the `genome_build` parameter when ")
        .append("calling `")
        .append(AnnotateGenomicRegionsTool.NAME)
        .append("`.\n\n")
        .append("**Example**: Use \"mm10\" for mouse genome analysis or \"hg38\" for human ")
        .append("genome analysis.\n");
    return ToolResult.text(sb.toString());
  }
}
