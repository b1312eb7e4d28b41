package com.nl2sql.profiler.service.quality;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.config.ProfilerProperties;

import lombok.RequiredArgsConstructor;

/** Majority vote of {@link SpecialPattern}s over a sample of text values. */
@Component
@RequiredArgsConstructor
public class SpecialPatternDetector {

  private final ProfilerProperties properties;
  private final PatternDetectionCache cache;

  /** Returns the first pattern matched by more than the configured share of the sample. */
  public Optional<SpecialPattern> detect(List<String> sample) {
    if (sample.isEmpty()) {
      return Optional.empty();
    }
    return cache.get(sample, () -> vote(sample));
  }

  private Optional<SpecialPattern> vote(List<String> sample) {
    double required = sample.size() * properties.getQuality().getPatternMatchThreshold();
    for (SpecialPattern pattern : SpecialPattern.values()) {
      long matches = sample.stream().filter(pattern::matches).count();
      if (matches > required) {
        return Optional.of(pattern);
      }
    }
    return Optional.empty();
  }
}
