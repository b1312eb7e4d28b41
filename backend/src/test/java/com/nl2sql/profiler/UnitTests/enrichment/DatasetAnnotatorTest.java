package com.nl2sql.profiler.service.enrichment;

import static com.nl2sql.profiler.fixtures.TestFixtures.amountProfile;
import static com.nl2sql.profiler.fixtures.TestFixtures.orderDateProfile;
import static com.nl2sql.profiler.fixtures.TestFixtures.paidProfile;
import static com.nl2sql.profiler.fixtures.TestFixtures.statusProfile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.nl2sql.profiler.dto.profile.ColumnProfile;
import com.nl2sql.profiler.dto.profile.ColumnProfile.ValueCount;

@DisplayName("DatasetAnnotator Tests")
class DatasetAnnotatorTest {

  private final DatasetAnnotator annotator = new DatasetAnnotator();
  private final MetadataEnricher enricher = new MetadataEnricher(new SynonymCatalog());

  private List<ColumnProfile> orderColumns() {
    return Stream.of(amountProfile(), statusProfile(), paidProfile(), orderDateProfile())
        .map(enricher::enrich)
        .toList();
  }

  @Test
  @DisplayName("Should build SQL examples from the first column of each kind")
  void shouldBuildExampleStatements() {
    assertThat(annotator.exampleQueries("orders", orderColumns()))
        .containsExactly(
            "SELECT COUNT(*) FROM orders",
            "SELECT * FROM orders WHERE status = 'shipped'",
            "SELECT status, COUNT(*) FROM orders GROUP BY status",
            "SELECT AVG(amount) FROM orders",
            "SELECT MAX(amount), MIN(amount) FROM orders",
            "SELECT * FROM orders WHERE amount > 62.8",
            "SELECT COUNT(*) FROM orders WHERE paid = TRUE",
            "SELECT COUNT(*) FROM orders WHERE paid = FALSE",
            "SELECT AVG(amount) FROM orders WHERE status = 'shipped'");
  }

  @Test
  @DisplayName("Should always offer a row count")
  void shouldOfferRowCountForAnyTable() {
    assertThat(annotator.exampleQueries("empty_tbl", List.of()))
        .containsExactly("SELECT COUNT(*) FROM empty_tbl");
  }

  @Test
  @DisplayName("Should escape quotes in category literals")
  void shouldEscapeQuotes() {
    ColumnProfile owner =
        statusProfile().toBuilder()
            .name("owner")
            .topValues(List.of(ValueCount.builder().value("O'Brien").count(2).build()))
            .build();

    assertThat(annotator.exampleQueries("t", List.of(owner)))
        .contains("SELECT * FROM t WHERE owner = 'O''Brien'");
  }

  @Test
  @DisplayName("Should give one hint per column that needs one")
  void shouldGiveQueryHints() {
    assertThat(annotator.queryHints(orderColumns()))
        .containsExactly(
            entry("amount", "Numeric range: 5.5 to 120.0"),
            entry("paid", "Use TRUE/FALSE for boolean queries"),
            entry(
                "order_date_col", "Timestamp column - compare with DATE 'yyyy-MM-dd' literals"));
  }

  @Test
  @DisplayName("Should point to value mappings of coded categories")
  void shouldHintAtValueMappings() {
    ColumnProfile gender =
        enricher.enrich(
            statusProfile().toBuilder().name("gender").enumValues(List.of("M", "F")).build());

    assertThat(annotator.queryHints(List.of(gender)))
        .containsEntry("gender", "Has value mappings - check value_mappings field");
  }

  @Test
  @DisplayName("Should summarize every column with its description")
  void shouldSummarizeSchema() {
    String summary = annotator.schemaSummary(orderColumns());

    assertThat(summary)
        .startsWith("Table has 4 columns:\n")
        .contains("- amount (DOUBLE PRECISION): amount: FLOAT column. Range: 5.5 to 120.\n")
        .contains(
            "- status (VARCHAR(50)): status: TEXT column. Has 2 unique values."
                + " [Categories: shipped, pending]\n")
        .contains("- paid (BOOLEAN): paid: BOOLEAN column.\n");
  }
}
