package com.nl2sql.profiler.service.enrichment;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.nl2sql.profiler.service.quality.SpecialPattern;

/** Fixed keyword tables used to phrase columns the way people ask about them. */
@Component
public class SynonymCatalog {

  private static final Map<String, List<String>> KEYWORDS =
      Map.ofEntries(
          Map.entry("amount", List.of("total", "sum", "value")),
          Map.entry("price", List.of("cost", "amount", "rate")),
          Map.entry("cost", List.of("price", "expense", "spend")),
          Map.entry("revenue", List.of("sales", "income", "earnings")),
          Map.entry("sales", List.of("revenue", "turnover")),
          Map.entry("qty", List.of("quantity", "count", "units")),
          Map.entry("quantity", List.of("qty", "count", "units")),
          Map.entry("count", List.of("number", "total")),
          Map.entry("date", List.of("day", "when", "time")),
          Map.entry("time", List.of("when", "timestamp")),
          Map.entry("created", List.of("added", "registered")),
          Map.entry("name", List.of("title", "label")),
          Map.entry("id", List.of("identifier", "key", "number")),
          Map.entry("email", List.of("email address", "e-mail", "mail")),
          Map.entry("phone", List.of("phone number", "telephone", "mobile")),
          Map.entry("city", List.of("town", "location")),
          Map.entry("country", List.of("nation", "region")),
          Map.entry("state", List.of("province", "region")),
          Map.entry("address", List.of("location", "street")),
          Map.entry("status", List.of("state", "condition")),
          Map.entry("category", List.of("type", "group", "class")),
          Map.entry("type", List.of("kind", "category")),
          Map.entry("age", List.of("years old")),
          Map.entry("gender", List.of("sex")),
          Map.entry("salary", List.of("pay", "wage", "income")),
          Map.entry("customer", List.of("client", "buyer")),
          Map.entry("product", List.of("item", "goods")),
          Map.entry("order", List.of("purchase", "transaction")),
          Map.entry("year", List.of("yr")),
          Map.entry("score", List.of("rating", "points")));

  private static final Map<SpecialPattern, List<String>> PATTERN_PHRASES =
      Map.of(
          SpecialPattern.EMAIL, List.of("email address"),
          SpecialPattern.PHONE, List.of("phone number"),
          SpecialPattern.URL, List.of("link", "website"),
          SpecialPattern.JSON, List.of("structured data"),
          SpecialPattern.DATE, List.of("date"),
          SpecialPattern.CURRENCY, List.of("money", "amount"),
          SpecialPattern.GEOLOCATION, List.of("coordinates", "location"));

  public List<String> forKeyword(String token) {
    return KEYWORDS.getOrDefault(token, List.of());
  }

  public List<String> forPattern(SpecialPattern pattern) {
    return pattern == null ? List.of() : PATTERN_PHRASES.getOrDefault(pattern, List.of());
  }
}
