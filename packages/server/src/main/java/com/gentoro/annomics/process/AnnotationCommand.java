package com.gentoro.annomics.process;

import com.gentoro.annomics.job.JobSpec;
import com.gentoro.annomics.job.PlotFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes a {@link JobSpec} into the command line of the annotation script:
 *
 * <pre>
 * &lt;executable&gt; &lt;script&gt; -i a.bed,b.bed -g mm10 -o out --formats png,pdf
 *     [-n sample] [--pattern glob] [--combine]
 * </pre>
 *
 * Optional flags are omitted when their value equals the script default.
 */
public final class AnnotationCommand {

  private AnnotationCommand() {}

  public static List<String> build(String executable, String script, JobSpec spec) {
    List<String> args = new ArrayList<>();
    args.add(executable);
    args.add(script);
    args.add("-i");
    args.add(String.join(",", spec.inputFiles()));
    args.add("-g");
    args.add(spec.genomeBuild());
    args.add("-o");
    args.add(spec.outputDirectory());
    args.add("--formats");
    args.add(
        spec.plotFormats().stream().map(PlotFormat::extension).collect(Collectors.joining(",")));

    if (spec.hasSampleName()) {
      args.add("-n");
      args.add(spec.sampleName());
    }
    if (spec.hasCustomFilePattern()) {
      args.add("--pattern");
      args.add(spec.filePattern());
    }
    if (spec.combineAnalysis()) {
      args.add("--combine");
    }
    return args;
  }

  public static List<String> build(RuntimeSettings settings, JobSpec spec) {
    return build(settings.executable(), settings.script().toString(), spec);
  }
}
