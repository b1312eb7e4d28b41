package com.nl2sql.profiler.model;

/** Logical type of a column, decided once by the type optimizer. */
public enum SemanticType {
  INTEGER,
  FLOAT,
  BOOLEAN,
  DATE,
  TEXT;

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
