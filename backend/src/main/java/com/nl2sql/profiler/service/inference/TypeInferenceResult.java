package com.nl2sql.profiler.service.inference;

import java.util.List;

import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;
import com.nl2sql.profiler.model.TypeInferenceWarning;

import lombok.Builder;
import lombok.Value;

/** Outcome of optimizing one column. */
@Value
@Builder
public class TypeInferenceResult {
  String columnName;
  SemanticType semanticType;
  boolean categorical;
  IntegerWidth integerWidth;

  /** Non-null values that became null because they did not parse as dates. */
  long coercedCount;

  List<TypeInferenceWarning> warnings;
}
