package com.nl2sql.profiler.service.quality;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Counts outliers with the modified z-score {@code 0.6745 * |x - median| / MAD}. When the MAD is
 * zero the mean absolute deviation scaled by 1.2533 is used instead; when both are zero no value is
 * an outlier.
 */
final class OutlierDetector {

  private static final double MAD_SCALE = 0.6745;
  private static final double MEAN_AD_SCALE = 1.253314;

  private OutlierDetector() {}

  static int countOutliers(double[] values, double threshold) {
    if (values.length < 3) {
      return 0;
    }
    Median median = new Median();
    double center = median.evaluate(values);
    double[] deviations = new double[values.length];
    double deviationSum = 0;
    for (int i = 0; i < values.length; i++) {
      deviations[i] = Math.abs(values[i] - center);
      deviationSum += deviations[i];
    }
    double mad = median.evaluate(deviations);

    double scale;
    if (mad > 0) {
      scale = mad / MAD_SCALE;
    } else {
      double meanDeviation = deviationSum / values.length;
      if (meanDeviation == 0) {
        return 0;
      }
      scale = MEAN_AD_SCALE * meanDeviation;
    }

    int outliers = 0;
    for (double deviation : deviations) {
      if (deviation / scale > threshold) {
        outliers++;
      }
    }
    return outliers;
  }
}
