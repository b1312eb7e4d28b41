package com.nl2sql.profiler.service.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.service.loading.FileNames;

/**
 * Turns arbitrary header text and file names into safe SQL identifiers. Rules apply in this order:
 *
 * <ol>
 *   <li>every character outside {@code [A-Za-z0-9_]} becomes {@code _}
 *   <li>lower-case
 *   <li>leading and trailing underscores are stripped
 *   <li>a leading digit gets a {@code col_} (columns) or {@code table_} (tables) prefix
 *   <li>an empty result is replaced by a placeholder
 *   <li>a name that is, or starts with, a reserved word gets a {@code _col} (columns) or {@code
 *       _tbl} (tables) suffix
 * </ol>
 *
 * Column sanitization is idempotent. Names never start with an underscore. Other keywords of the
 * target dialect are left alone; statements quote every identifier through {@link #quote}.
 */
@Component
public class IdentifierSanitizer {

  public static final Set<String> RESERVED_WORDS =
      Set.of(
          "order", "group", "table", "select", "where", "from", "insert", "update", "delete",
          "user", "index");

  private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
  private static final String COLUMN_SUFFIX = "_col";
  private static final String TABLE_SUFFIX = "_tbl";

  public String sanitizeColumn(String raw, int position) {
    String name = clean(raw);
    if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
      name = "col_" + name;
    }
    if (name.isEmpty()) {
      name = "col_" + position;
    }
    return withReservedSuffix(name, COLUMN_SUFFIX);
  }

  /**
   * Strips a known file extension, sanitizes and truncates to {@code maxLength}. A name that got
   * the {@code table_} prefix is not checked against the reserved words.
   */
  public String sanitizeTable(String fileName, int maxLength) {
    String name = clean(FileNames.baseName(fileName));
    boolean prefixed = !name.isEmpty() && Character.isDigit(name.charAt(0));
    if (prefixed) {
      name = "table_" + name;
    }
    if (name.length() > maxLength) {
      name = stripUnderscores(name.substring(0, maxLength));
    }
    if (name.isEmpty()) {
      name = "unnamed_table";
    }
    return prefixed ? name : withReservedSuffix(name, TABLE_SUFFIX);
  }

  /**
   * Resolves collisions in column order: the first occurrence keeps its name, later ones get the
   * lowest free {@code _1}, {@code _2}, ... suffix.
   */
  public List<String> deduplicate(List<String> names) {
    Set<String> used = new HashSet<>();
    List<String> unique = new ArrayList<>(names.size());
    for (String name : names) {
      String candidate = name;
      int suffix = 1;
      while (!used.add(candidate)) {
        candidate = name + "_" + suffix++;
      }
      unique.add(candidate);
    }
    return unique;
  }

  /**
   * Double-quotes a sanitized identifier for DDL and DML. Sanitized names are lower-case, so the
   * quoted form resolves to the same object as the unquoted one on lower-casing databases.
   */
  public static String quote(String identifier) {
    return '"' + identifier + '"';
  }

  public static boolean isReserved(String name) {
    int underscore = name.indexOf('_');
    String leadingWord = underscore < 0 ? name : name.substring(0, underscore);
    return RESERVED_WORDS.contains(leadingWord);
  }

  private static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String replaced = INVALID_CHARS.matcher(raw).replaceAll("_").toLowerCase(Locale.ROOT);
    return stripUnderscores(replaced);
  }

  private static String withReservedSuffix(String name, String suffix) {
    return isReserved(name) && !name.endsWith(suffix) ? name + suffix : name;
  }

  private static String stripUnderscores(String name) {
    int start = 0;
    int end = name.length();
    while (start < end && name.charAt(start) == '_') {
      start++;
    }
    while (end > start && name.charAt(end - 1) == '_') {
      end--;
    }
    return name.substring(start, end);
  }
}
