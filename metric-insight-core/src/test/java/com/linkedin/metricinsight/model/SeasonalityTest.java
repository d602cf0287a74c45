/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.Arrays;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class SeasonalityTest {

  @Test
  public void testSeconds() {
    assertEquals(0L, Seasonality.NONE.seconds());
    assertEquals(900L, Seasonality.FIFTEEN_MINUTES.seconds());
    assertEquals(3600L, Seasonality.ONE_HOUR.seconds());
    assertEquals(21600L, Seasonality.SIX_HOURS.seconds());
    assertEquals(86400L, Seasonality.ONE_DAY.seconds());
    assertEquals(604800L, Seasonality.ONE_WEEK.seconds());
  }

  @Test
  public void testFromSeconds() {
    assertEquals(Seasonality.ONE_HOUR, Seasonality.fromSeconds(3600));
    assertEquals(Seasonality.ONE_HOUR, Seasonality.fromSeconds(3300));
    assertEquals(Seasonality.ONE_HOUR, Seasonality.fromSeconds(3899.9));
    assertEquals(Seasonality.ONE_DAY, Seasonality.fromSeconds(90000));
    assertEquals(Seasonality.FIFTEEN_MINUTES, Seasonality.fromSeconds(950));
  }

  @Test
  public void testFromSecondsOutsideThreshold() {
    // 10% away is not close enough.
    assertEquals(Seasonality.NONE, Seasonality.fromSeconds(3960));
    assertEquals(Seasonality.NONE, Seasonality.fromSeconds(7200));
    assertEquals(Seasonality.NONE, Seasonality.fromSeconds(0));
    assertEquals(Seasonality.NONE, Seasonality.fromSeconds(-100));
    assertEquals(Seasonality.NONE, Seasonality.fromSeconds(400));
  }

  @Test
  public void testCandidates() {
    assertEquals(Arrays.asList(Seasonality.FIFTEEN_MINUTES, Seasonality.ONE_HOUR, Seasonality.SIX_HOURS,
                               Seasonality.ONE_DAY, Seasonality.ONE_WEEK), Seasonality.candidates());
    assertEquals(Arrays.asList(Seasonality.values()), Seasonality.cachedValues());
  }

  @Test
  public void testTrendJsonName() {
    assertEquals("none", Trend.NONE.jsonName());
    assertEquals("positive", Trend.POSITIVE.jsonName());
    assertEquals("negative", Trend.NEGATIVE.jsonName());
  }
}
