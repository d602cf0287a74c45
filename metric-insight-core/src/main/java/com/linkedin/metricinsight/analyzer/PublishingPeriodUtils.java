/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Utilities to infer how often a metric is published and how completely its datapoints cover that cadence.
 */
public final class PublishingPeriodUtils {
  private static final Logger LOG = LoggerFactory.getLogger(PublishingPeriodUtils.class);
  private static final long[] STANDARD_PERIODS_SECONDS;
  static {
    long[] subMinute = {1, 5, 10, 30};
    int numMinutePeriods = (int) (TimeUnit.HOURS.toMinutes(60));
    STANDARD_PERIODS_SECONDS = new long[subMinute.length + numMinutePeriods];
    System.arraycopy(subMinute, 0, STANDARD_PERIODS_SECONDS, 0, subMinute.length);
    for (int i = 0; i < numMinutePeriods; i++) {
      STANDARD_PERIODS_SECONDS[subMinute.length + i] = TimeUnit.MINUTES.toSeconds(i + 1);
    }
  }

  private PublishingPeriodUtils() {

  }

  /**
   * @return The standard publishing periods in seconds in ascending order: 1, 5, 10 and 30 seconds, then every whole
   * minute up to 60 hours.
   */
  public static long[] standardPeriodsSeconds() {
    return STANDARD_PERIODS_SECONDS.clone();
  }

  /**
   * Infer the publishing period from the most common gap between consecutive timestamps. If several gaps are equally
   * common, the smallest one is used. The gap is rounded to the closest standard period if it is within the given
   * relative tolerance of it.
   *
   * @param sortedTimestampsMs Timestamps in milliseconds since epoch, in ascending order.
   * @param snapTolerance Maximum relative distance to a standard period for the gap to be rounded to it.
   * @return The positive publishing period in seconds, or {@code null} if there are fewer than two timestamps, the most
   * common gap is zero (duplicate timestamps) or the period cannot be computed.
   */
  public static Double inferPublishingPeriodSeconds(long[] sortedTimestampsMs, double snapTolerance) {
    if (sortedTimestampsMs == null || sortedTimestampsMs.length < 2) {
      return null;
    }
    try {
      SortedMap<Long, Integer> gapCounts = new TreeMap<>();
      for (int i = 1; i < sortedTimestampsMs.length; i++) {
        gapCounts.merge(sortedTimestampsMs[i] - sortedTimestampsMs[i - 1], 1, Integer::sum);
      }
      long mostCommonGapMs = gapCounts.firstKey();
      int maxCount = 0;
      for (Map.Entry<Long, Integer> entry : gapCounts.entrySet()) {
        if (entry.getValue() > maxCount) {
          maxCount = entry.getValue();
          mostCommonGapMs = entry.getKey();
        }
      }
      if (mostCommonGapMs <= 0) {
        LOG.debug("Most common gap between {} timestamps is {} ms, no publishing period.", sortedTimestampsMs.length,
                  mostCommonGapMs);
        return null;
      }
      return snapToStandardPeriod(mostCommonGapMs / 1000.0, snapTolerance);
    } catch (RuntimeException e) {
      LOG.warn("Failed to infer publishing period from {} timestamps.", sortedTimestampsMs.length, e);
      return null;
    }
  }

  /**
   * Round the given period to the closest standard period if the relative distance between them is at most the given
   * tolerance. On equal distance the shorter standard period is used.
   *
   * @param periodSeconds Period in seconds.
   * @param snapTolerance Maximum relative distance.
   * @return The closest standard period, or the given period if it is not close enough to any standard period.
   */
  static double snapToStandardPeriod(double periodSeconds, double snapTolerance) {
    long closest = STANDARD_PERIODS_SECONDS[0];
    for (long standard : STANDARD_PERIODS_SECONDS) {
      if (Math.abs(standard - periodSeconds) < Math.abs(closest - periodSeconds)) {
        closest = standard;
      }
    }
    if (periodSeconds > 0 && Math.abs(closest - periodSeconds) / periodSeconds <= snapTolerance) {
      return closest;
    }
    return periodSeconds;
  }

  /**
   * Compute the fraction of datapoints that fall within the time span a perfectly periodic metric with the same number
   * of datapoints and the same first timestamp would cover.
   *
   * @param sortedTimestampsMs Timestamps in milliseconds since epoch, in ascending order.
   * @param periodSeconds The publishing period in seconds.
   * @return The density ratio in [0, 1], or {@code null} if the period is missing or not positive, or there are fewer
   * than two timestamps.
   */
  public static Double densityRatio(long[] sortedTimestampsMs, Double periodSeconds) {
    if (periodSeconds == null || periodSeconds <= 0 || sortedTimestampsMs == null || sortedTimestampsMs.length < 2) {
      return null;
    }
    int numPoints = sortedTimestampsMs.length;
    double idealEndMs = sortedTimestampsMs[0] + (numPoints - 1) * periodSeconds * 1000;
    int withinIdealSpan = 0;
    for (long timestamp : sortedTimestampsMs) {
      if (timestamp <= idealEndMs) {
        withinIdealSpan++;
      }
    }
    return (double) withinIdealSpan / numPoints;
  }
}
