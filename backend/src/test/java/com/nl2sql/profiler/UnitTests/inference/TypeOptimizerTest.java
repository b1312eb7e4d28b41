package com.nl2sql.profiler.service.inference;

import static com.nl2sql.profiler.fixtures.TestFixtures.rawColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.nl2sql.profiler.config.ProfilerProperties;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;

@DisplayName("TypeOptimizer Tests")
class TypeOptimizerTest {

  private ProfilerProperties properties;
  private TypeOptimizer optimizer;

  @BeforeEach
  void setUp() {
    properties = new ProfilerProperties();
    optimizer = new TypeOptimizer(properties, new CategoricalPolicy(properties));
  }

  @Nested
  @DisplayName("Temporal heuristic")
  class Temporal {

    @Test
    @DisplayName("Should classify ISO dates as DATE")
    void shouldClassifyIsoDates() {
      Column column = rawColumn("joined", "2024-01-05", "2024-02-10", null, "2024-03-15");

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.DATE);
      assertThat(column.getSemanticType()).isEqualTo(SemanticType.DATE);
      assertThat(column.getValues())
          .containsExactly(
              LocalDateTime.of(2024, 1, 5, 0, 0),
              LocalDateTime.of(2024, 2, 10, 0, 0),
              null,
              LocalDateTime.of(2024, 3, 15, 0, 0));
      assertThat(result.getCoercedCount()).isZero();
      assertThat(result.isCategorical()).isFalse();
    }

    @Test
    @DisplayName("Should classify a column with 60% dates as DATE and null the rest")
    void shouldAcceptMajorityDates() {
      Column column =
          rawColumn("when", "2024-01-01", "2024-01-02", "2024-01-03", "apple", "banana");

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.DATE);
      assertThat(result.getCoercedCount()).isEqualTo(2);
      assertThat(column.getValues()).hasSize(5);
      assertThat(column.getValues().subList(3, 5)).containsOnlyNulls();
      assertThat(column.getWarnings())
          .singleElement()
          .satisfies(w -> assertThat(w.getHeuristic()).isEqualTo("temporal"));
    }

    @Test
    @DisplayName("Should not classify an even split of dates and words as DATE")
    void shouldRejectHalfDates() {
      Column column = rawColumn("when", "2024-01-01", "2024-01-02", "apple", "banana");

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.TEXT);
      assertThat(column.getValues()).containsExactly("2024-01-01", "2024-01-02", "apple", "banana");
    }

    @Test
    @DisplayName("Should never read plain numbers as dates")
    void shouldNotReadNumbersAsDates() {
      Column column = rawColumn("code", "20240101", "20240102", "20240103");

      assertThat(optimizer.optimize(column).getSemanticType()).isEqualTo(SemanticType.INTEGER);
    }
  }

  @Nested
  @DisplayName("Numeric heuristic")
  class Numeric {

    @Test
    @DisplayName("Should classify integers and narrow their width")
    void shouldClassifyIntegers() {
      Column column = rawColumn("qty", "1", "2", null, "300");

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.INTEGER);
      assertThat(result.getIntegerWidth()).isEqualTo(IntegerWidth.UINT16);
      assertThat(column.getValues()).containsExactly(1L, 2L, null, 300L);
    }

    @Test
    @DisplayName("Should pick a signed width for negative values")
    void shouldPickSignedWidth() {
      Column column = rawColumn("delta", "-5", "100");

      assertThat(optimizer.optimize(column).getIntegerWidth()).isEqualTo(IntegerWidth.INT8);
    }

    @Test
    @DisplayName("Should classify decimals as FLOAT")
    void shouldClassifyFloats() {
      Column column = rawColumn("price", "1.5", "2", "-0.25");

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.FLOAT);
      assertThat(result.getIntegerWidth()).isNull();
      assertThat(column.getValues()).containsExactly(1.5, 2.0, -0.25);
    }

    @Test
    @DisplayName("Should read a 0/1 column as INTEGER because numbers are tried first")
    void shouldPreferIntegerForZeroOne() {
      Column column = rawColumn("flag", "0", "1", "1");

      assertThat(optimizer.optimize(column).getSemanticType()).isEqualTo(SemanticType.INTEGER);
    }
  }

  @Nested
  @DisplayName("Boolean and text heuristics")
  class BooleanAndText {

    @Test
    @DisplayName("Should classify yes/no as BOOLEAN")
    void shouldClassifyYesNo() {
      Column column = rawColumn("paid", "yes", "no", "Yes", null);

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.BOOLEAN);
      assertThat(column.getValues()).containsExactly(true, false, true, null);
      assertThat(result.isCategorical()).isFalse();
    }

    @Test
    @DisplayName("Should classify true/false and y/n vocabularies as BOOLEAN")
    void shouldClassifyOtherVocabularies() {
      assertThat(optimizer.optimize(rawColumn("a", "TRUE", "false")).getSemanticType())
          .isEqualTo(SemanticType.BOOLEAN);
      assertThat(optimizer.optimize(rawColumn("b", "y", "N", "n")).getSemanticType())
          .isEqualTo(SemanticType.BOOLEAN);
    }

    @Test
    @DisplayName("Should not mix vocabularies")
    void shouldNotMixVocabularies() {
      assertThat(optimizer.optimize(rawColumn("c", "yes", "false")).getSemanticType())
          .isEqualTo(SemanticType.TEXT);
    }

    @Test
    @DisplayName("Should flag low-cardinality text as categorical")
    void shouldFlagCategoricalText() {
      List<String> values = new ArrayList<>();
      for (int i = 0; i < 100; i++) {
        values.add(i % 2 == 0 ? "open" : "closed");
      }
      Column column = new Column("status", values);

      TypeInferenceResult result = optimizer.optimize(column);

      assertThat(result.getSemanticType()).isEqualTo(SemanticType.TEXT);
      assertThat(result.isCategorical()).isTrue();
      assertThat(column.isCategorical()).isTrue();
    }

    @Test
    @DisplayName("Should honour the absolute distinct-count policy when enabled")
    void shouldHonourAbsoluteCount() {
      properties.getInference().setMaxUniqueCount(50);
      Column column = rawColumn("city", "Oslo", "Rome", "Lima");

      assertThat(optimizer.optimize(column).isCategorical()).isTrue();
    }

    @Test
    @DisplayName("Should leave free text and all-null columns as TEXT")
    void shouldDefaultToText() {
      Column text = rawColumn("name", "Ann", "Bo", "Cy");
      Column empty = rawColumn("blank", null, null);

      assertThat(optimizer.optimize(text).getSemanticType()).isEqualTo(SemanticType.TEXT);
      assertThat(optimizer.optimize(empty).getSemanticType())
          .isEqualTo(SemanticType.TEXT);
      assertThat(empty.getValues()).containsExactly(null, null);
    }
  }

  @Test
  @DisplayName("Should keep row count and null positions")
  void shouldPreserveShape() {
    Column column = rawColumn("n", null, "4", null, "5");

    optimizer.optimize(column);

    assertThat(column.size()).isEqualTo(4);
    assertThat(column.nullCount()).isEqualTo(2);
    assertThat(column.getValues().get(0)).isNull();
    assertThat(column.getValues().get(2)).isNull();
  }

  @Test
  @DisplayName("Should refuse to optimize a column twice")
  void shouldRejectSecondOptimization() {
    Column column = rawColumn("n", "1");
    optimizer.optimize(column);

    assertThatThrownBy(() -> optimizer.optimize(column))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already optimized");
  }
}
