package com.nl2sql.profiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * A named column of a {@link ColumnarTable}. Values start out as raw strings (or null) from the
 * loader and are replaced exactly once by the type optimizer with their native representation:
 * {@code Long} for INTEGER, {@code Double} for FLOAT, {@code Boolean} for BOOLEAN, {@code
 * LocalDateTime} for DATE and {@code String} for TEXT.
 *
 * <p>A column is owned by a single task at a time; it is not thread-safe.
 */
@Getter
public class Column {

  private final String name;
  private List<Object> values;
  private SemanticType semanticType;
  private boolean categorical;
  private IntegerWidth integerWidth;
  private final List<TypeInferenceWarning> warnings = new ArrayList<>();
  private volatile boolean frozen;

  public Column(String name, List<?> values) {
    this.name = Objects.requireNonNull(name, "column name");
    this.values = new ArrayList<>(Objects.requireNonNull(values, "column values"));
  }

  public List<Object> getValues() {
    return Collections.unmodifiableList(values);
  }

  public List<TypeInferenceWarning> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  public int size() {
    return values.size();
  }

  public boolean isOptimized() {
    return semanticType != null;
  }

  public long nullCount() {
    return values.stream().filter(Objects::isNull).count();
  }

  /**
   * Replaces the raw values with their typed representation. The replacement must keep the row
   * count so the owning table stays rectangular.
   */
  public void applyType(
      SemanticType type, List<?> typedValues, boolean categorical, IntegerWidth integerWidth) {
    ensureMutable();
    Objects.requireNonNull(type, "semantic type");
    if (typedValues.size() != values.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Column '%s' has %d rows but %d typed values were supplied",
              name, values.size(), typedValues.size()));
    }
    this.values = new ArrayList<>(typedValues);
    this.semanticType = type;
    this.categorical = categorical;
    this.integerWidth = type == SemanticType.INTEGER ? integerWidth : null;
  }

  public void addWarning(TypeInferenceWarning warning) {
    ensureMutable();
    warnings.add(warning);
  }

  void freeze() {
    this.frozen = true;
  }

  private void ensureMutable() {
    if (frozen) {
      throw new IllegalStateException("Column '" + name + "' is read-only");
    }
  }
}
