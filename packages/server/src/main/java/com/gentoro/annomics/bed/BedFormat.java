package com.gentoro.annomics.bed;

/** BED flavours distinguished by column count. */
public enum BedFormat {
  BED3,
  BED6,
  BED12,
  UNKNOWN;

  static BedFormat ofColumnCount(int columns) {
    if (columns >= 12) return BED12;
    if (columns >= 6) return BED6;
    if (columns >= 3) return BED3;
    return UNKNOWN;
  }
}
