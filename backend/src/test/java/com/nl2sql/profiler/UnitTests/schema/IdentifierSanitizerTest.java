package com.nl2sql.profiler.service.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("IdentifierSanitizer Tests")
class IdentifierSanitizerTest {

  private final IdentifierSanitizer sanitizer = new IdentifierSanitizer();

  @Nested
  @DisplayName("Column names")
  class Columns {

    @Test
    @DisplayName("Should sanitize 'Order Date!' to order_date_col")
    void shouldSanitizeOrderDate() {
      assertThat(sanitizer.sanitizeColumn("Order Date!", 1)).isEqualTo("order_date_col");
    }

    @ParameterizedTest(name = "{0} -> {2}")
    @CsvSource(
        delimiter = '|',
        value = {
          "Customer Name|1|customer_name",
          "  Amount ($) |2|amount",
          "123abc|3|col_123abc",
          "Select|4|select_col",
          "user_id|5|user_id_col",
          "username|6|username",
          "e-mail|7|e_mail",
          "Größe|8|gr__e",
          "___|9|col_9"
        })
    void shouldApplyRulesInOrder(String raw, int position, String expected) {
      assertThat(sanitizer.sanitizeColumn(raw, position)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should use a positional placeholder for empty names")
    void shouldUsePlaceholder() {
      assertThat(sanitizer.sanitizeColumn("", 3)).isEqualTo("col_3");
      assertThat(sanitizer.sanitizeColumn(null, 7)).isEqualTo("col_7");
    }

    @Test
    @DisplayName("Should be idempotent over random strings")
    void shouldBeIdempotent() {
      Random random = new Random(20241019L);
      String alphabet = "aZ9_ -!é.Oo$rdeRS tlcUIN0";
      for (int i = 0; i < 2000; i++) {
        StringBuilder raw = new StringBuilder();
        int length = random.nextInt(16);
        for (int j = 0; j < length; j++) {
          raw.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        int position = random.nextInt(50) + 1;
        String once = sanitizer.sanitizeColumn(raw.toString(), position);

        assertThat(sanitizer.sanitizeColumn(once, position))
            .as("input '%s'", raw)
            .isEqualTo(once);
        assertThat(once).matches("[a-z][a-z0-9_]*");
      }
    }
  }

  @Nested
  @DisplayName("Table names")
  class Tables {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(
        delimiter = '|',
        value = {
          "My Data.CSV|my_data",
          "2024 sales.xlsx|table_2024_sales",
          "2024_sales.csv|table_2024_sales",
          "7.csv|table_7",
          "order.csv|order_tbl",
          "table.csv|table_tbl",
          "table_2024.csv|table_2024_tbl",
          "!!!.csv|unnamed_table",
          "/uploads/q1-report.tsv|q1_report",
          "notes.final.txt|notes_final"
        })
    void shouldSanitizeTableNames(String fileName, String expected) {
      assertThat(sanitizer.sanitizeTable(fileName, 55)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should truncate long names and strip a trailing underscore")
    void shouldTruncate() {
      String name = sanitizer.sanitizeTable("abcdefghi_jklmnop.csv", 10);

      assertThat(name).isEqualTo("abcdefghi");
      assertThat(sanitizer.sanitizeTable("x".repeat(80) + ".csv", 55)).hasSize(55);
    }
  }

  @Nested
  @DisplayName("Deduplication")
  class Deduplication {

    @Test
    @DisplayName("Should suffix the second id with _1")
    void shouldSuffixDuplicates() {
      assertThat(sanitizer.deduplicate(List.of("id", "id"))).containsExactly("id", "id_1");
    }

    @Test
    @DisplayName("Should skip suffixes that are already taken")
    void shouldSkipTakenSuffixes() {
      assertThat(sanitizer.deduplicate(List.of("id_1", "id", "id", "id")))
          .containsExactly("id_1", "id", "id_2", "id_3");
    }
  }

  @Test
  @DisplayName("Should double-quote identifiers for statements")
  void shouldQuoteIdentifiers() {
    assertThat(IdentifierSanitizer.quote("limit")).isEqualTo("\"limit\"");
    assertThat(IdentifierSanitizer.quote(sanitizer.sanitizeColumn("To", 1))).isEqualTo("\"to\"");
  }
}
