package com.nl2sql.profiler.model;

import lombok.Value;

/** Non-fatal note left on a column when a type heuristic could not be applied. */
@Value
public class TypeInferenceWarning {
  String columnName;
  String heuristic;
  String message;

  @Override
  public String toString() {
    return heuristic + ": " + message;
  }
}
