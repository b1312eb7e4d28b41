package com.nl2sql.profiler.service.inference;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;
import com.nl2sql.profiler.model.TypeInferenceWarning;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites a raw string column into its tightest native representation. Heuristics run in a fixed
 * order against the original values and the first that applies wins:
 *
 * <ol>
 *   <li>temporal, when more than the configured share of non-null values parse as dates
 *   <li>numeric, when every non-null value parses as an integer, else as a decimal
 *   <li>boolean, when the distinct lower-cased values fit one recognised pair
 *   <li>categorical text, when the distinct ratio is low enough
 *   <li>free text
 * </ol>
 *
 * A heuristic that throws is recorded as a warning on the column and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TypeOptimizer {

  private static final List<Set<String>> BOOLEAN_VOCABULARIES =
      List.of(
          Set.of("true", "false"), Set.of("0", "1"), Set.of("yes", "no"), Set.of("y", "n"));

  private final ProfilerProperties properties;
  private final CategoricalPolicy categoricalPolicy;

  public TypeInferenceResult optimize(Column column) {
    List<String> raw = rawValues(column);
    List<String> nonNull = raw.stream().filter(v -> v != null).toList();
    List<TypeInferenceWarning> warnings = new ArrayList<>();

    Outcome outcome = null;
    if (!nonNull.isEmpty()) {
      outcome = attempt(column, "temporal", warnings, () -> temporal(raw, nonNull.size()));
      if (outcome == null) {
        outcome = attempt(column, "numeric", warnings, () -> numeric(raw));
      }
      if (outcome == null) {
        outcome = attempt(column, "boolean", warnings, () -> bool(raw, nonNull));
      }
    }
    if (outcome == null) {
      outcome = new Outcome(SemanticType.TEXT, new ArrayList<>(raw), 0);
    }

    long uniqueCount = outcome.values.stream().filter(v -> v != null).distinct().count();
    boolean categorical =
        categoricalPolicy.isCategorical(outcome.type, uniqueCount, column.size());
    IntegerWidth width =
        outcome.type == SemanticType.INTEGER ? narrowWidth(outcome.values) : null;

    if (outcome.coerced > 0) {
      warnings.add(
          new TypeInferenceWarning(
              column.getName(),
              "temporal",
              outcome.coerced + " values could not be parsed as dates and were set to null"));
    }

    column.applyType(outcome.type, outcome.values, categorical, width);
    warnings.forEach(column::addWarning);
    log.debug(
        "Column '{}' optimized to {}{}",
        column.getName(),
        outcome.type,
        categorical ? " (categorical)" : "");

    return TypeInferenceResult.builder()
        .columnName(column.getName())
        .semanticType(outcome.type)
        .categorical(categorical)
        .integerWidth(width)
        .coercedCount(outcome.coerced)
        .warnings(List.copyOf(warnings))
        .build();
  }

  private Outcome temporal(List<String> raw, int nonNullCount) {
    TemporalParser parser = new TemporalParser(locale());
    double threshold = properties.getInference().getTemporalThreshold();
    int allowedFailures = (int) Math.floor(nonNullCount * (1 - threshold));

    List<Object> parsed = new ArrayList<>(raw.size());
    int failures = 0;
    for (String value : raw) {
      if (value == null) {
        parsed.add(null);
        continue;
      }
      Optional<LocalDateTime> date = parser.tryParse(value);
      if (date.isEmpty() && ++failures > allowedFailures) {
        return null;
      }
      parsed.add(date.orElse(null));
    }
    int successes = nonNullCount - failures;
    if (successes <= nonNullCount * threshold) {
      return null;
    }
    return new Outcome(SemanticType.DATE, parsed, failures);
  }

  private Outcome numeric(List<String> raw) {
    List<Object> longs = convertAll(raw, v -> ValueParsers.tryParseLong(v).orElse(null));
    if (longs != null) {
      return new Outcome(SemanticType.INTEGER, longs, 0);
    }
    List<Object> doubles = convertAll(raw, v -> ValueParsers.tryParseDouble(v).orElse(null));
    if (doubles != null) {
      return new Outcome(SemanticType.FLOAT, doubles, 0);
    }
    return null;
  }

  private Outcome bool(List<String> raw, List<String> nonNull) {
    Set<String> distinct = new HashSet<>();
    for (String value : nonNull) {
      distinct.add(value.trim().toLowerCase(Locale.ROOT));
    }
    boolean matches = BOOLEAN_VOCABULARIES.stream().anyMatch(vocab -> vocab.containsAll(distinct));
    if (!matches) {
      return null;
    }
    return new Outcome(
        SemanticType.BOOLEAN,
        convertAll(raw, v -> ValueParsers.tryParseBoolean(v).orElse(null)),
        0);
  }

  /** Converts every non-null value or returns null as soon as one fails. */
  private static List<Object> convertAll(List<String> raw, Function<String, Object> converter) {
    List<Object> converted = new ArrayList<>(raw.size());
    for (String value : raw) {
      if (value == null) {
        converted.add(null);
        continue;
      }
      Object typed = converter.apply(value);
      if (typed == null) {
        return null;
      }
      converted.add(typed);
    }
    return converted;
  }

  private static IntegerWidth narrowWidth(List<Object> values) {
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    boolean any = false;
    for (Object value : values) {
      if (value != null) {
        long v = (Long) value;
        min = Math.min(min, v);
        max = Math.max(max, v);
        any = true;
      }
    }
    return any ? IntegerWidth.narrowest(min, max) : IntegerWidth.INT64;
  }

  private Outcome attempt(
      Column column,
      String heuristic,
      List<TypeInferenceWarning> warnings,
      Supplier<Outcome> body) {
    try {
      return body.get();
    } catch (RuntimeException e) {
      log.debug("Heuristic {} failed on column '{}'", heuristic, column.getName(), e);
      warnings.add(
          new TypeInferenceWarning(
              column.getName(), heuristic, "heuristic skipped: " + e.getMessage()));
      return null;
    }
  }

  private static List<String> rawValues(Column column) {
    if (column.isOptimized()) {
      throw new IllegalStateException("Column '" + column.getName() + "' is already optimized");
    }
    List<String> raw = new ArrayList<>(column.size());
    for (Object value : column.getValues()) {
      raw.add(value == null ? null : value.toString());
    }
    return raw;
  }

  private Locale locale() {
    return Locale.forLanguageTag(properties.getInference().getLocale().replace('_', '-'));
  }

  private static final class Outcome {
    private final SemanticType type;
    private final List<Object> values;
    private final long coerced;

    private Outcome(SemanticType type, List<Object> values, long coerced) {
      this.type = type;
      this.values = values;
      this.coerced = coerced;
    }
  }
}
