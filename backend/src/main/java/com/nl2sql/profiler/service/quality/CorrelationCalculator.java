package com.nl2sql.profiler.service.quality;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import com.nl2sql.profiler.model.Column;

import lombok.extern.slf4j.Slf4j;

/**
 * Pairwise Pearson correlation between numeric columns, computed once per dataset over the rows
 * where both columns have a value. Undefined coefficients (constant or too few rows) are null.
 */
@Slf4j
@Component
public class CorrelationCalculator {

  /** Returns the symmetric matrix keyed by column name, or null with fewer than two columns. */
  public Map<String, Map<String, Double>> correlate(List<Column> numericColumns) {
    if (numericColumns.size() < 2) {
      return null;
    }
    Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
    for (Column column : numericColumns) {
      matrix.put(column.getName(), new LinkedHashMap<>());
    }
    PearsonsCorrelation pearson = new PearsonsCorrelation();
    for (int i = 0; i < numericColumns.size(); i++) {
      for (int j = i; j < numericColumns.size(); j++) {
        Column a = numericColumns.get(i);
        Column b = numericColumns.get(j);
        Double coefficient = coefficient(pearson, a, b);
        matrix.get(a.getName()).put(b.getName(), coefficient);
        matrix.get(b.getName()).put(a.getName(), coefficient);
      }
    }
    log.debug("Computed correlations for {} numeric columns", numericColumns.size());
    return matrix;
  }

  private static Double coefficient(PearsonsCorrelation pearson, Column a, Column b) {
    List<Object> left = a.getValues();
    List<Object> right = b.getValues();
    List<double[]> pairs = new ArrayList<>();
    for (int row = 0; row < left.size(); row++) {
      Object x = left.get(row);
      Object y = right.get(row);
      if (x != null && y != null) {
        pairs.add(new double[] {((Number) x).doubleValue(), ((Number) y).doubleValue()});
      }
    }
    if (pairs.size() < 2) {
      return null;
    }
    double[] xs = new double[pairs.size()];
    double[] ys = new double[pairs.size()];
    for (int k = 0; k < pairs.size(); k++) {
      xs[k] = pairs.get(k)[0];
      ys[k] = pairs.get(k)[1];
    }
    double r = pearson.correlation(xs, ys);
    return Double.isNaN(r) ? null : r;
  }
}
