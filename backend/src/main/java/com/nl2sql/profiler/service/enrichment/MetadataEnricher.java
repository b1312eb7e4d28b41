package com.nl2sql.profiler.service.enrichment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.ColumnProfile.NumericStats;
import com.nl2sql.profiler.model.SemanticType;
import com.nl2sql.profiler.service.quality.ValueFormats;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds advisory natural-language annotations to a column profile: synonyms, value mappings, example
 * questions and a description. Deterministic for identical input and never throws; a failure
 * leaves the annotations empty.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataEnricher {

  private static final Map<String, String> BOOLEAN_SPELLINGS = booleanSpellings();

  private static final Map<String, String> SHORT_CODE_LABELS =
      Map.of(
          "M", "M (possibly male, medium, or other)",
          "F", "F (possibly female, false, or other)",
          "Y", "Y (possibly yes or year)",
          "N", "N (possibly no or number)");

  private final SynonymCatalog synonymCatalog;

  public ColumnProfile enrich(ColumnProfile profile) {
    try {
      return profile.toBuilder()
          .synonymMappings(synonyms(profile))
          .valueMappings(valueMappings(profile))
          .exampleQueries(exampleQueries(profile))
          .description(description(profile))
          .build();
    } catch (RuntimeException e) {
      log.warn("Could not annotate column '{}': {}", profile.getName(), e.getMessage());
      return profile.toBuilder()
          .synonymMappings(Map.of())
          .valueMappings(Map.of())
          .exampleQueries(List.of())
          .description(profile.getName() + ": " + profile.getSemanticType() + " column.")
          .build();
    }
  }

  /** {@code order_date_col} reads as {@code order date}. */
  public static String humanize(String name) {
    String readable = name.endsWith("_col") ? name.substring(0, name.length() - 4) : name;
    return readable.replace('_', ' ').trim();
  }

  private Map<String, List<String>> synonyms(ColumnProfile profile) {
    String name = profile.getName();
    Set<String> phrasings = new LinkedHashSet<>();
    String humanized = humanize(name);
    if (!humanized.equals(name)) {
      phrasings.add(humanized);
    }
    for (String token : humanized.split(" ")) {
      phrasings.addAll(synonymCatalog.forKeyword(token.toLowerCase(Locale.ROOT)));
    }
    phrasings.addAll(synonymCatalog.forPattern(profile.getSpecialPattern()));
    phrasings.remove(name);

    Map<String, List<String>> synonyms = new LinkedHashMap<>();
    if (!phrasings.isEmpty()) {
      synonyms.put(name, List.copyOf(phrasings));
    }
    if (profile.getSemanticType() == SemanticType.BOOLEAN) {
      synonyms.put("true", List.of(name + " = TRUE"));
      synonyms.put("false", List.of(name + " = FALSE"));
      synonyms.put("yes", List.of(name + " = TRUE"));
      synonyms.put("no", List.of(name + " = FALSE"));
    }
    return Collections.unmodifiableMap(synonyms);
  }

  private Map<String, String> valueMappings(ColumnProfile profile) {
    if (profile.getSemanticType() == SemanticType.BOOLEAN) {
      return BOOLEAN_SPELLINGS;
    }
    Map<String, String> mappings = new LinkedHashMap<>();
    if (profile.getEnumValues() != null) {
      for (String value : profile.getEnumValues()) {
        String label = SHORT_CODE_LABELS.get(value.trim().toUpperCase(Locale.ROOT));
        if (label != null && value.trim().length() <= 3) {
          mappings.put(value, label);
        }
      }
    }
    return Collections.unmodifiableMap(mappings);
  }

  private List<String> exampleQueries(ColumnProfile profile) {
    String name = profile.getName();
    List<String> examples = new ArrayList<>();
    NumericStats stats = profile.getNumericStats();
    if (profile.getSemanticType() == SemanticType.BOOLEAN) {
      examples.add(String.format("How many records have %s as true?", name));
      examples.add(String.format("Show me all data where %s is false", name));
    } else if (profile.isCategorical()
        && profile.getTopValues() != null
        && !profile.getTopValues().isEmpty()) {
      String topValue = profile.getTopValues().get(0).getValue();
      examples.add(String.format("How many records have %s equal to '%s'?", name, topValue));
      examples.add(String.format("Show distribution of %s", name));
    } else if (profile.getSemanticType().isNumeric()) {
      if (stats != null && stats.getMin() != null && stats.getMax() != null) {
        double midpoint = (stats.getMin() + stats.getMax()) / 2;
        examples.add(String.format("What is the average %s?", name));
        examples.add(
            String.format(
                Locale.ROOT, "Show records where %s is greater than %.1f", name, midpoint));
      }
    } else if (profile.getSemanticType() == SemanticType.DATE) {
      examples.add(String.format("Show records from the latest %s", name));
      examples.add(String.format("Group by %s and count", name));
    } else if (profile.getSampleValues() != null && !profile.getSampleValues().isEmpty()) {
      examples.add(
          String.format("Find records where %s is '%s'", name, profile.getSampleValues().get(0)));
    }
    return List.copyOf(examples);
  }

  static String description(ColumnProfile profile) {
    StringBuilder text = new StringBuilder();
    text.append(profile.getName()).append(": ");
    text.append(profile.getSemanticType()).append(" column.");
    if (profile.getNullCount() > 0) {
      text.append(" Contains ").append(profile.getNullCount()).append(" null values.");
    }
    if (profile.isCategorical()) {
      text.append(" Has ").append(profile.getUniqueCount()).append(" unique values.");
    }
    NumericStats stats = profile.getNumericStats();
    if (stats != null && stats.getMin() != null) {
      text.append(" Range: ")
          .append(ValueFormats.number(stats.getMin()))
          .append(" to ")
          .append(ValueFormats.number(stats.getMax()))
          .append('.');
    }
    if (profile.getSpecialPattern() != null) {
      text.append(" Values look like ").append(profile.getSpecialPattern()).append('.');
    }
    if (profile.getAnalysisError() != null) {
      text.append(" Statistics unavailable.");
    }
    return text.toString();
  }

  private static Map<String, String> booleanSpellings() {
    Map<String, String> spellings = new LinkedHashMap<>();
    for (String truthy : List.of("true", "yes", "y", "1")) {
      spellings.put(truthy, "TRUE");
    }
    for (String falsy : List.of("false", "no", "n", "0")) {
      spellings.put(falsy, "FALSE");
    }
    return Collections.unmodifiableMap(spellings);
  }
}
