package com.gentoro.annomics.classify;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Walks an output directory and sorts the files it finds into a {@link FileManifest}.
 *
 * <p>Symbolic links are followed, so linked result files are reported like regular ones and link
 * cycles surface as failed entries. Entries that cannot be read (permission denied, vanished
 * while walking) are skipped and logged at debug level; the scan itself never fails. A missing
 * directory yields an empty manifest because the script creates its output root lazily.
 */
public class ResultClassifier {
  private static final Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(ResultClassifier.class);

  public FileManifest scan(Path outputDirectory) {
    if (outputDirectory == null || !Files.isDirectory(outputDirectory)) {
      return FileManifest.empty();
    }

    Map<FileCategory, List<String>> buckets = new EnumMap<>(FileCategory.class);
    for (FileCategory category : FileCategory.values()) {
      buckets.put(category, new ArrayList<>());
    }

    Path root = outputDirectory.normalize();
    try {
      Files.walkFileTree(
          root,
          EnumSet.of(FileVisitOption.FOLLOW_LINKS),
          Integer.MAX_VALUE,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (attrs.isRegularFile()) {
                FileCategory.of(file.getFileName().toString())
                    .ifPresent(c -> buckets.get(c).add(relative(root, file)));
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              log.debug("Skipping unreadable entry {}: {}", file, exc.getMessage());
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
              if (exc != null) {
                log.debug("Listing of {} ended early: {}", dir, exc.getMessage());
              }
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      log.debug("Output scan of {} stopped early: {}", root, e.getMessage());
    }

    return new FileManifest(
        buckets.get(FileCategory.ANNOTATION),
        buckets.get(FileCategory.SUMMARY),
        buckets.get(FileCategory.COMBINED),
        buckets.get(FileCategory.PLOT));
  }

  private static String relative(Path root, Path file) {
    return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
  }
}
