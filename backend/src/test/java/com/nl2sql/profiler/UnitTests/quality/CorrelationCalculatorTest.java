package com.nl2sql.profiler.service.quality;

import static com.nl2sql.profiler.fixtures.TestFixtures.typedColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.SemanticType;

@DisplayName("CorrelationCalculator Tests")
class CorrelationCalculatorTest {

  private final CorrelationCalculator calculator = new CorrelationCalculator();

  @Test
  @DisplayName("Should return null for fewer than two numeric columns")
  void shouldSkipSingleColumn() {
    Column only = typedColumn("x", SemanticType.INTEGER, 1L, 2L);

    assertThat(calculator.correlate(List.of(only))).isNull();
    assertThat(calculator.correlate(List.of())).isNull();
  }

  @Test
  @DisplayName("Should build a symmetric matrix over complete pairs")
  void shouldBuildSymmetricMatrix() {
    Column x = typedColumn("x", SemanticType.INTEGER, 1L, 2L, 3L, 4L, null);
    Column y = typedColumn("y", SemanticType.FLOAT, 2.0, 4.0, 6.0, 8.0, 100.0);
    Column z = typedColumn("z", SemanticType.FLOAT, 4.0, 3.0, 2.0, 1.0, 0.0);

    Map<String, Map<String, Double>> matrix = calculator.correlate(List.of(x, y, z));

    assertThat(matrix).containsOnlyKeys("x", "y", "z");
    assertThat(matrix.get("x").get("y")).isCloseTo(1.0, within(1e-9));
    assertThat(matrix.get("y").get("x")).isEqualTo(matrix.get("x").get("y"));
    assertThat(matrix.get("x").get("z")).isCloseTo(-1.0, within(1e-9));
    assertThat(matrix.get("x").get("x")).isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("Should leave undefined coefficients empty")
  void shouldLeaveUndefinedEmpty() {
    Column constant = typedColumn("c", SemanticType.INTEGER, 5L, 5L, 5L);
    Column varying = typedColumn("v", SemanticType.INTEGER, 1L, 2L, 3L);

    Map<String, Map<String, Double>> matrix = calculator.correlate(List.of(constant, varying));

    assertThat(matrix.get("c")).containsEntry("v", null);
  }
}
