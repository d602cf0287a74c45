/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class MetricStatisticsTest {
  private static final double DELTA = 1E-6;
  private static final double EPSILON = 1e-10;

  @Test
  public void testStatistics() {
    MetricStatistics statistics = MetricStatistics.of(new double[]{5.0, 1.0, 4.0, 2.0, 3.0}, EPSILON);
    assertEquals(1.0, statistics.min(), DELTA);
    assertEquals(5.0, statistics.max(), DELTA);
    assertEquals(Math.sqrt(2.0), statistics.stdDeviation(), DELTA);
    assertEquals(Math.sqrt(2.0) / 3.0, statistics.coefficientOfVariation(), DELTA);
    assertEquals(3.0, statistics.median(), DELTA);
  }

  @Test
  public void testMedianOfEvenCount() {
    assertEquals(2.5, MetricStatistics.of(new double[]{4.0, 1.0, 3.0, 2.0}, EPSILON).median(), DELTA);
  }

  @Test
  public void testConstantValues() {
    MetricStatistics statistics = MetricStatistics.of(new double[]{1000.0, 1000.0, 1000.0}, EPSILON);
    assertEquals(0.0, statistics.stdDeviation(), DELTA);
    assertEquals(0.0, statistics.coefficientOfVariation(), DELTA);
  }

  @Test
  public void testCoefficientOfVariationUsesAbsoluteMean() {
    MetricStatistics statistics = MetricStatistics.of(new double[]{-1.0, -2.0, -3.0}, EPSILON);
    assertTrue(statistics.coefficientOfVariation() > 0);
  }

  @Test
  public void testZeroMeanHasNoCoefficientOfVariation() {
    MetricStatistics statistics = MetricStatistics.of(new double[]{-1.0, 1.0, -1.0, 1.0}, EPSILON);
    assertEquals(1.0, statistics.stdDeviation(), DELTA);
    assertNull(statistics.coefficientOfVariation());
  }

  @Test
  public void testEmptyValues() {
    assertSame(MetricStatistics.EMPTY, MetricStatistics.of(new double[0], EPSILON));
    Map<String, Object> json = MetricStatistics.EMPTY.getJsonStructure();
    assertEquals(5, json.size());
    for (Object value : json.values()) {
      assertNull(value);
    }
  }
}
