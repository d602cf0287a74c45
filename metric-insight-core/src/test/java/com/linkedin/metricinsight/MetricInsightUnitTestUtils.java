/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight;

import com.linkedin.metricinsight.model.MetricData;
import java.util.ArrayList;
import java.util.List;


public final class MetricInsightUnitTestUtils {
  public static final long START_MS = 1_700_000_000_000L;
  public static final double BASE = 100.0;
  public static final double AMPLITUDE = 10.0;

  private MetricInsightUnitTestUtils() {

  }

  /**
   * @param numPoints Number of timestamps.
   * @param periodSeconds Spacing between consecutive timestamps.
   * @return Regularly spaced timestamps starting at {@link #START_MS}.
   */
  public static long[] timestamps(int numPoints, long periodSeconds) {
    long[] timestamps = new long[numPoints];
    for (int i = 0; i < numPoints; i++) {
      timestamps[i] = START_MS + i * periodSeconds * 1000;
    }
    return timestamps;
  }

  /**
   * Generate {@code BASE + AMPLITUDE * sin(2 * pi * t / cycleSeconds) + slopePerPoint * i} sampled every
   * {@code periodSeconds}.
   */
  public static double[] seasonalValues(int numPoints, long periodSeconds, long cycleSeconds, double slopePerPoint) {
    double[] values = new double[numPoints];
    for (int i = 0; i < numPoints; i++) {
      double t = (double) i * periodSeconds;
      values[i] = BASE + AMPLITUDE * Math.sin(2 * Math.PI * t / cycleSeconds) + slopePerPoint * i;
    }
    return values;
  }

  public static double[] linearValues(int numPoints, double intercept, double slope) {
    double[] values = new double[numPoints];
    for (int i = 0; i < numPoints; i++) {
      values[i] = intercept + slope * i;
    }
    return values;
  }

  public static MetricData metricData(long[] timestamps, double[] values) {
    List<Long> timestampList = new ArrayList<>(timestamps.length);
    List<Double> valueList = new ArrayList<>(values.length);
    for (int i = 0; i < timestamps.length; i++) {
      timestampList.add(timestamps[i]);
      valueList.add(values[i]);
    }
    return new MetricData(timestampList, valueList);
  }
}
