package com.nl2sql.profiler.service.quality;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.nl2sql.profiler.config.ProfilerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded memo of special-pattern results keyed by the sampled values. Injected into the detector
 * and safe for concurrent column tasks.
 */
@Slf4j
@Component
public class PatternDetectionCache {

  private final Cache<List<String>, Optional<SpecialPattern>> cache;

  public PatternDetectionCache(ProfilerProperties properties) {
    ProfilerProperties.PatternCache config = properties.getQuality().getPatternCache();
    this.cache =
        CacheBuilder.newBuilder()
            .maximumSize(config.getMaxSize())
            .expireAfterAccess(config.getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
            .recordStats()
            .build();
  }

  public Optional<SpecialPattern> get(
      List<String> sample, Supplier<Optional<SpecialPattern>> detector) {
    List<String> key = List.copyOf(sample);
    Optional<SpecialPattern> cached = cache.getIfPresent(key);
    if (cached != null) {
      return cached;
    }
    Optional<SpecialPattern> detected = detector.get();
    cache.put(key, detected);
    return detected;
  }

  public long size() {
    return cache.size();
  }

  public long hitCount() {
    return cache.stats().hitCount();
  }

  public void invalidateAll() {
    log.debug("Evicting {} cached pattern results", cache.size());
    cache.invalidateAll();
  }
}
