package com.nl2sql.profiler.service.inference;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.model.SemanticType;

import lombok.RequiredArgsConstructor;

/**
 * Single definition of "categorical" shared by the type optimizer and the enum value listing. A
 * column is categorical when its distinct ratio is below
 * {@code profiler.inference.max-unique-ratio} or, if enabled, its distinct count is below
 * {@code profiler.inference.max-unique-count}.
 */
@Component
@RequiredArgsConstructor
public class CategoricalPolicy {

  private final ProfilerProperties properties;

  public boolean isCategorical(SemanticType type, long uniqueCount, long rowCount) {
    if (type == SemanticType.BOOLEAN || type == SemanticType.DATE) {
      return false;
    }
    if (rowCount <= 0 || uniqueCount <= 0) {
      return false;
    }
    ProfilerProperties.Inference inference = properties.getInference();
    double ratio = (double) uniqueCount / rowCount;
    if (ratio < inference.getMaxUniqueRatio()) {
      return true;
    }
    return inference.getMaxUniqueCount() > 0 && uniqueCount < inference.getMaxUniqueCount();
  }
}
