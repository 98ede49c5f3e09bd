package com.gentoro.annomics.job;

import com.gentoro.annomics.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Image formats the annotation script can render plots in. */
public enum PlotFormat {
  PNG,
  PDF,
  SVG;

  /** Lower-case name used on the command line and as file extension. */
  public String extension() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PlotFormat parse(String value) {
    if (value != null) {
      String normalized = value.trim().toUpperCase(Locale.ROOT);
      for (PlotFormat format : values()) {
        if (format.name().equals(normalized)) {
          return format;
        }
      }
    }
    throw new ValidationException(
        "Unsupported plot format '"
            + value
            + "'. Available: "
            + Arrays.stream(values()).map(PlotFormat::extension).collect(Collectors.joining(", ")));
  }
}
