package com.nl2sql.profiler.service.quality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.dto.profile.ColumnProfile.NumericStats;
import com.nl2sql.profiler.dto.profile.ColumnProfile.ValueCount;
import com.nl2sql.profiler.dto.profile.ColumnQuality;
import com.nl2sql.profiler.exception.ColumnAnalysisException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.SemanticType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the statistics block of one optimized column. Every call works only on the column it is
 * given; the pattern cache is the only shared collaborator.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityAnalyzer {

  private final ProfilerProperties properties;
  private final SpecialPatternDetector specialPatternDetector;

  /**
   * Analyzes one column.
   *
   * @param column an optimized column
   * @return the column's statistics
   * @throws ColumnAnalysisException if the statistics cannot be computed
   */
  public ColumnQuality analyze(Column column) {
    if (!column.isOptimized()) {
      throw new ColumnAnalysisException(
          column.getName(), "Column '" + column.getName() + "' has not been optimized", null);
    }
    try {
      return compute(column);
    } catch (RuntimeException e) {
      throw new ColumnAnalysisException(
          column.getName(),
          "Statistics failed for column '" + column.getName() + "': " + e.getMessage(),
          e);
    }
  }

  /** Best-effort block for a column whose analysis failed: counts only, plus the error marker. */
  public ColumnQuality degraded(Column column, Throwable failure) {
    long uniqueCount = 0;
    try {
      uniqueCount = column.getValues().stream().filter(v -> v != null).distinct().count();
    } catch (RuntimeException e) {
      log.debug("Unique count unavailable for '{}': {}", column.getName(), e.getMessage());
    }
    String error =
        failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    return ColumnQuality.builder()
        .columnName(column.getName())
        .semanticType(column.getSemanticType())
        .rowCount(column.size())
        .nullCount(column.nullCount())
        .uniqueCount(uniqueCount)
        .error(error)
        .build();
  }

  private ColumnQuality compute(Column column) {
    ProfilerProperties.Quality config = properties.getQuality();
    SemanticType type = column.getSemanticType();

    // insertion order doubles as first-seen order for ties and enum listing
    Map<Object, Long> counts = new LinkedHashMap<>();
    List<Object> nonNull = new ArrayList<>();
    long nullCount = 0;
    for (Object value : column.getValues()) {
      if (value == null) {
        nullCount++;
      } else {
        nonNull.add(value);
        counts.merge(value, 1L, Long::sum);
      }
    }

    List<String> sampleValues =
        nonNull.stream().limit(config.getSampleValues()).map(ValueFormats::display).toList();

    List<ValueCount> topValues =
        counts.entrySet().stream()
            .sorted(Map.Entry.<Object, Long>comparingByValue(Comparator.reverseOrder()))
            .limit(config.getTopValues())
            .map(
                e ->
                    ValueCount.builder()
                        .value(ValueFormats.display(e.getKey()))
                        .count(e.getValue())
                        .build())
            .toList();

    List<String> enumValues =
        column.isCategorical()
            ? counts.keySet().stream().map(ValueFormats::display).toList()
            : null;

    NumericStats numericStats =
        type.isNumeric() && !nonNull.isEmpty() ? numericStats(nonNull, config) : null;

    SpecialPattern specialPattern = null;
    if (type == SemanticType.TEXT && !column.isCategorical() && !nonNull.isEmpty()) {
      List<String> sample =
          nonNull.stream().limit(config.getPatternSampleSize()).map(Object::toString).toList();
      Optional<SpecialPattern> detected = specialPatternDetector.detect(sample);
      specialPattern = detected.orElse(null);
    }

    log.debug(
        "Analyzed column '{}': {} nulls, {} unique", column.getName(), nullCount, counts.size());

    return ColumnQuality.builder()
        .columnName(column.getName())
        .semanticType(type)
        .rowCount(column.size())
        .nullCount(nullCount)
        .uniqueCount(counts.size())
        .numericStats(numericStats)
        .sampleValues(sampleValues)
        .topValues(topValues)
        .enumValues(enumValues)
        .specialPattern(specialPattern)
        .build();
  }

  private static NumericStats numericStats(List<Object> values, ProfilerProperties.Quality config) {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    for (Object value : values) {
      stats.addValue(((Number) value).doubleValue());
    }
    double[] data = stats.getValues();
    return NumericStats.builder()
        .min(stats.getMin())
        .max(stats.getMax())
        .mean(stats.getMean())
        .median(stats.getPercentile(50))
        .stdDev(stats.getN() > 1 ? stats.getStandardDeviation() : null)
        .outlierCount(OutlierDetector.countOutliers(data, config.getOutlierZThreshold()))
        .build();
  }
}
