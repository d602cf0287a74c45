/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.Objects;

import static com.linkedin.metricinsight.common.utils.Utils.validateNotNull;


/**
 * The seasonal period and trend direction detected for a metric.
 */
public final class DecompositionResult {
  public static final DecompositionResult NO_SIGNAL = new DecompositionResult(Seasonality.NONE, Trend.NONE);
  private final Seasonality _seasonality;
  private final Trend _trend;

  public DecompositionResult(Seasonality seasonality, Trend trend) {
    _seasonality = validateNotNull(seasonality, "Seasonality cannot be null.");
    _trend = validateNotNull(trend, "Trend cannot be null.");
  }

  public Seasonality seasonality() {
    return _seasonality;
  }

  public Trend trend() {
    return _trend;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DecompositionResult that = (DecompositionResult) o;
    return _seasonality == that._seasonality && _trend == that._trend;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_seasonality, _trend);
  }

  @Override
  public String toString() {
    return String.format("{seasonality: %s, trend: %s}", _seasonality, _trend);
  }
}
