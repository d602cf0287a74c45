/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class MetricDataTest {

  @Test
  public void testDefensiveCopy() {
    List<Long> timestamps = new ArrayList<>(Arrays.asList(1L, 2L));
    List<Double> values = new ArrayList<>(Arrays.asList(1.0, null));
    MetricData data = new MetricData(timestamps, values);
    timestamps.add(3L);
    values.add(3.0);
    assertEquals(2, data.size());
    assertNull(data.values().get(1));
    assertNull(data.requestedPeriodSeconds());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testImmutable() {
    new MetricData(Arrays.asList(1L, 2L), Arrays.asList(1.0, 2.0)).values().add(3.0);
  }

  @Test
  public void testEmpty() {
    assertTrue(new MetricData(Collections.emptyList(), Collections.emptyList()).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedLengths() {
    new MetricData(Arrays.asList(1L, 2L), Collections.singletonList(1.0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullTimestamp() {
    new MetricData(Arrays.asList(1L, null), Arrays.asList(1.0, 2.0));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullValues() {
    new MetricData(Collections.emptyList(), null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveRequestedPeriod() {
    new MetricData(Collections.emptyList(), Collections.emptyList(), 0);
  }

  @Test
  public void testDecompositionResultEquality() {
    assertEquals(new DecompositionResult(Seasonality.NONE, Trend.NONE), DecompositionResult.NO_SIGNAL);
    assertNotEquals(new DecompositionResult(Seasonality.ONE_DAY, Trend.NONE), DecompositionResult.NO_SIGNAL);
  }
}
