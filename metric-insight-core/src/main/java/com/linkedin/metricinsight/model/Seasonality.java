/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;


/**
 * The seasonal periods a metric can be classified with. Each value carries its period length in whole seconds,
 * {@link #NONE} carries 0.
 *
 * <ul>
 *   <li>{@link #FIFTEEN_MINUTES}: the metric repeats every 15 minutes.</li>
 *   <li>{@link #ONE_HOUR}: the metric repeats every hour.</li>
 *   <li>{@link #SIX_HOURS}: the metric repeats every six hours.</li>
 *   <li>{@link #ONE_DAY}: the metric repeats daily.</li>
 *   <li>{@link #ONE_WEEK}: the metric repeats weekly.</li>
 * </ul>
 */
public enum Seasonality {
  NONE(0),
  FIFTEEN_MINUTES(TimeUnit.MINUTES.toSeconds(15)),
  ONE_HOUR(TimeUnit.HOURS.toSeconds(1)),
  SIX_HOURS(TimeUnit.HOURS.toSeconds(6)),
  ONE_DAY(TimeUnit.DAYS.toSeconds(1)),
  ONE_WEEK(TimeUnit.DAYS.toSeconds(7));

  // Maximum relative distance between a duration and an enumerated period for the duration to resolve to it.
  public static final double ROUNDING_THRESHOLD = 0.1;
  private static final List<Seasonality> CACHED_VALUES = List.of(values());
  private static final List<Seasonality> CANDIDATES = List.of(FIFTEEN_MINUTES, ONE_HOUR, SIX_HOURS, ONE_DAY, ONE_WEEK);

  private final long _seconds;

  Seasonality(long seconds) {
    _seconds = seconds;
  }

  /**
   * @return The period length in seconds, 0 for {@link #NONE}.
   */
  public long seconds() {
    return _seconds;
  }

  /**
   * Resolve an arbitrary duration to the closest enumerated period. The duration is truncated to whole seconds
   * before the comparison.
   *
   * @param seconds Duration in seconds.
   * @return The closest period if it is within {@link #ROUNDING_THRESHOLD} of the duration, {@link #NONE} otherwise.
   */
  public static Seasonality fromSeconds(double seconds) {
    long truncated = (long) seconds;
    Seasonality closest = NONE;
    for (Seasonality seasonality : CACHED_VALUES) {
      if (Math.abs(seasonality._seconds - truncated) < Math.abs(closest._seconds - truncated)) {
        closest = seasonality;
      }
    }
    return Math.abs(closest._seconds - truncated) < closest._seconds * ROUNDING_THRESHOLD ? closest : NONE;
  }

  /**
   * Use this instead of values() because values() creates a new array each time.
   * @return enumerated values in the same order as values()
   */
  public static List<Seasonality> cachedValues() {
    return Collections.unmodifiableList(CACHED_VALUES);
  }

  /**
   * @return The seasonal periods searched during decomposition, shortest first.
   */
  public static List<Seasonality> candidates() {
    return CANDIDATES;
  }
}
