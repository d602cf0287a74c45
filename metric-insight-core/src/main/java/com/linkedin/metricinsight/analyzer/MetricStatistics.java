/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * Summary statistics of the valid values of a metric. Every statistic is {@code null} if there are no values.
 */
public final class MetricStatistics {
  public static final MetricStatistics EMPTY = new MetricStatistics(null, null, null, null, null);
  private static final String MIN = "min";
  private static final String MAX = "max";
  private static final String STD_DEVIATION = "std_deviation";
  private static final String COEFFICIENT_OF_VARIATION = "coefficient_of_variation";
  private static final String MEDIAN = "median";
  private final Double _min;
  private final Double _max;
  private final Double _stdDeviation;
  private final Double _coefficientOfVariation;
  private final Double _median;

  MetricStatistics(Double min, Double max, Double stdDeviation, Double coefficientOfVariation, Double median) {
    _min = min;
    _max = max;
    _stdDeviation = stdDeviation;
    _coefficientOfVariation = coefficientOfVariation;
    _median = median;
  }

  /**
   * Compute the statistics of the given values.
   *
   * @param values Finite values.
   * @param numericalStabilityThreshold Means whose magnitude is below this value leave the coefficient of variation
   *                                    undefined.
   * @return The statistics of the values, {@link #EMPTY} if there are none.
   */
  public static MetricStatistics of(double[] values, double numericalStabilityThreshold) {
    if (values == null || values.length == 0) {
      return EMPTY;
    }
    double mean = StatUtils.mean(values);
    double stdDeviation = Math.sqrt(StatUtils.populationVariance(values, mean));
    Double coefficientOfVariation = Math.abs(mean) < numericalStabilityThreshold ? null : stdDeviation / Math.abs(mean);
    double median = new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(values, 50.0);
    return new MetricStatistics(StatUtils.min(values), StatUtils.max(values), stdDeviation, coefficientOfVariation,
                                median);
  }

  public Double min() {
    return _min;
  }

  public Double max() {
    return _max;
  }

  /**
   * @return Population standard deviation.
   */
  public Double stdDeviation() {
    return _stdDeviation;
  }

  /**
   * @return Standard deviation divided by the absolute mean, {@code null} if the mean is too close to zero.
   */
  public Double coefficientOfVariation() {
    return _coefficientOfVariation;
  }

  public Double median() {
    return _median;
  }

  /**
   * Return an object that can be further used to encode into JSON.
   *
   * @return The map describing the statistics.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> statistics = new HashMap<>();
    statistics.put(MIN, _min);
    statistics.put(MAX, _max);
    statistics.put(STD_DEVIATION, _stdDeviation);
    statistics.put(COEFFICIENT_OF_VARIATION, _coefficientOfVariation);
    statistics.put(MEDIAN, _median);
    return statistics;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricStatistics that = (MetricStatistics) o;
    return Objects.equals(_min, that._min) && Objects.equals(_max, that._max)
           && Objects.equals(_stdDeviation, that._stdDeviation)
           && Objects.equals(_coefficientOfVariation, that._coefficientOfVariation)
           && Objects.equals(_median, that._median);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_min, _max, _stdDeviation, _coefficientOfVariation, _median);
  }

  @Override
  public String toString() {
    return String.format("{min: %s, max: %s, stdDeviation: %s, coefficientOfVariation: %s, median: %s}",
                         _min, _max, _stdDeviation, _coefficientOfVariation, _median);
  }
}
