package com.nl2sql.profiler.service.schema;

import static com.nl2sql.profiler.fixtures.TestFixtures.typedColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.nl2sql.profiler.exception.SchemaSynthesisException;
import com.nl2sql.profiler.model.Column;
import com.nl2sql.profiler.model.IntegerWidth;
import com.nl2sql.profiler.model.SemanticType;

@DisplayName("SqlTypeMapper Tests")
class SqlTypeMapperTest {

  private final SqlTypeMapper mapper = new SqlTypeMapper();

  @Test
  @DisplayName("Should choose the smallest integer type covering the observed bounds")
  void shouldNarrowIntegers() {
    assertThat(mapper.sqlType(typedColumn("a", SemanticType.INTEGER, -32768L, 32767L)))
        .isEqualTo("SMALLINT");
    assertThat(mapper.sqlType(typedColumn("b", SemanticType.INTEGER, -40000L, 1L)))
        .isEqualTo("INTEGER");
    assertThat(mapper.sqlType(typedColumn("c", SemanticType.INTEGER, 5_000_000_000L)))
        .isEqualTo("BIGINT");
    assertThat(mapper.sqlType(typedColumn("d", SemanticType.INTEGER, null, null)))
        .isEqualTo("BIGINT");
  }

  @Test
  @DisplayName("Should map the remaining semantic types")
  void shouldMapOtherTypes() {
    assertThat(mapper.sqlType(typedColumn("f", SemanticType.FLOAT, 1.5)))
        .isEqualTo("DOUBLE PRECISION");
    assertThat(mapper.sqlType(typedColumn("b", SemanticType.BOOLEAN, true)))
        .isEqualTo("BOOLEAN");
    assertThat(mapper.sqlType(typedColumn("d", SemanticType.DATE, LocalDateTime.now())))
        .isEqualTo("TIMESTAMP");
    assertThat(mapper.sqlType(typedColumn("t", SemanticType.TEXT, "x".repeat(150), null)))
        .isEqualTo("VARCHAR(1000)");
  }

  @ParameterizedTest(name = "max length {0} -> VARCHAR({1})")
  @CsvSource({"0,20", "5,20", "6,50", "20,50", "21,200", "100,200", "101,1000", "500,1000",
      "501,5000", "100000,5000"})
  void shouldFollowVarcharLadder(int maxLength, int expected) {
    assertThat(SqlTypeMapper.varcharLength(maxLength)).isEqualTo(expected);
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource({
    "UINT8,SMALLINT", "INT8,SMALLINT", "INT16,SMALLINT", "UINT16,INTEGER", "INT32,INTEGER",
    "UINT32,BIGINT", "INT64,BIGINT"
  })
  @DisplayName("Should take the integer type from the storage width")
  void shouldFollowStorageWidth(IntegerWidth width, String expected) {
    Column column = new Column("n", List.of(1L, 2L));
    column.applyType(SemanticType.INTEGER, List.of(1L, 2L), false, width);

    assertThat(mapper.sqlType(column)).isEqualTo(expected);
  }

  @Test
  @DisplayName("Should fall back to BIGINT when no width was decided")
  void shouldUseBigintWithoutWidth() {
    Column column = new Column("n", List.of(1L));
    column.applyType(SemanticType.INTEGER, List.of(1L), false, null);

    assertThat(mapper.sqlType(column)).isEqualTo("BIGINT");
  }

  @Test
  @DisplayName("Should fail for a column without a semantic type")
  void shouldRejectUntypedColumn() {
    assertThatThrownBy(() -> mapper.sqlType(new Column("x", List.of("1"))))
        .isInstanceOf(SchemaSynthesisException.class)
        .hasMessageContaining("x");
  }
}
