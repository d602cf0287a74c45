/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;


/**
 * How many valid datapoints a metric has, how often it is published and how completely the datapoints cover that
 * cadence.
 */
public final class DataQuality {
  private static final String TOTAL_POINTS = "total_points";
  private static final String DENSITY_RATIO = "density_ratio";
  private static final String PUBLISHING_PERIOD_SECONDS = "publishing_period_seconds";
  private static final String REQUESTED_PERIOD_SECONDS = "requested_period_seconds";
  private final int _totalPoints;
  private final Double _densityRatio;
  private final Double _publishingPeriodSeconds;
  private final Integer _requestedPeriodSeconds;

  /**
   * @param totalPoints Number of valid datapoints.
   * @param densityRatio Density ratio, or {@code null} if unknown.
   * @param publishingPeriodSeconds Inferred publishing period, or {@code null} if unknown.
   * @param requestedPeriodSeconds The aggregation period the datapoints were requested with, or {@code null}.
   */
  public DataQuality(int totalPoints, Double densityRatio, Double publishingPeriodSeconds, Integer requestedPeriodSeconds) {
    _totalPoints = totalPoints;
    _densityRatio = densityRatio;
    _publishingPeriodSeconds = publishingPeriodSeconds;
    _requestedPeriodSeconds = requestedPeriodSeconds;
  }

  public int totalPoints() {
    return _totalPoints;
  }

  public Double densityRatio() {
    return _densityRatio;
  }

  public Double publishingPeriodSeconds() {
    return _publishingPeriodSeconds;
  }

  public Integer requestedPeriodSeconds() {
    return _requestedPeriodSeconds;
  }

  /**
   * Return an object that can be further used to encode into JSON.
   *
   * @return The map describing the data quality.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> dataQuality = new HashMap<>();
    dataQuality.put(TOTAL_POINTS, _totalPoints);
    dataQuality.put(DENSITY_RATIO, _densityRatio);
    dataQuality.put(PUBLISHING_PERIOD_SECONDS, _publishingPeriodSeconds);
    dataQuality.put(REQUESTED_PERIOD_SECONDS, _requestedPeriodSeconds);
    return dataQuality;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DataQuality that = (DataQuality) o;
    return _totalPoints == that._totalPoints && Objects.equals(_densityRatio, that._densityRatio)
           && Objects.equals(_publishingPeriodSeconds, that._publishingPeriodSeconds)
           && Objects.equals(_requestedPeriodSeconds, that._requestedPeriodSeconds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_totalPoints, _densityRatio, _publishingPeriodSeconds, _requestedPeriodSeconds);
  }

  @Override
  public String toString() {
    return String.format("{totalPoints: %d, densityRatio: %s, publishingPeriodSeconds: %s, requestedPeriodSeconds: %s}",
                         _totalPoints, _densityRatio, _publishingPeriodSeconds, _requestedPeriodSeconds);
  }
}
