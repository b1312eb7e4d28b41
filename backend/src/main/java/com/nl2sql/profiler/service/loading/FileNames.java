package com.nl2sql.profiler.service.loading;

import java.util.Locale;
import java.util.Set;

/** File name helpers shared by extension dispatch and table-name derivation. */
public final class FileNames {

  public static final Set<String> KNOWN_EXTENSIONS = Set.of("csv", "tsv", "txt", "xlsx", "xls");

  private FileNames() {}

  /** Lower-cased extension without the dot, or an empty string when there is none. */
  public static String extension(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
  }

  /** Strips any directory part and a known tabular extension. */
  public static String baseName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return "";
    }
    String name = fileName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    String extension = extension(name);
    if (KNOWN_EXTENSIONS.contains(extension)) {
      name = name.substring(0, name.length() - extension.length() - 1);
    }
    return name;
  }
}
