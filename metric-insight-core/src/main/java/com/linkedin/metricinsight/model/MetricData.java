/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.linkedin.metricinsight.common.utils.Utils.validateNotNull;


/**
 * The raw datapoints of a single metric as returned by a monitoring backend: epoch-millisecond timestamps and their
 * values. Timestamps need not be sorted and values may be {@code null}, NaN or infinite; such values are dropped
 * during analysis.
 */
public final class MetricData {
  private final List<Long> _timestamps;
  private final List<Double> _values;
  private final Integer _requestedPeriodSeconds;

  /**
   * @param timestamps Timestamps in milliseconds since epoch.
   * @param values Values, one per timestamp.
   */
  public MetricData(List<Long> timestamps, List<Double> values) {
    this(timestamps, values, null);
  }

  /**
   * @param timestamps Timestamps in milliseconds since epoch.
   * @param values Values, one per timestamp.
   * @param requestedPeriodSeconds The aggregation period the datapoints were requested with, or {@code null} if unknown.
   */
  public MetricData(List<Long> timestamps, List<Double> values, Integer requestedPeriodSeconds) {
    validateNotNull(timestamps, "Timestamps cannot be null.");
    validateNotNull(values, "Values cannot be null.");
    if (timestamps.size() != values.size()) {
      throw new IllegalArgumentException(String.format("Timestamps and values must have the same length (%d != %d).",
                                                       timestamps.size(), values.size()));
    }
    if (timestamps.contains(null)) {
      throw new IllegalArgumentException("Timestamps cannot contain null.");
    }
    if (requestedPeriodSeconds != null && requestedPeriodSeconds <= 0) {
      throw new IllegalArgumentException(String.format("Requested period (%d) must be positive.", requestedPeriodSeconds));
    }
    _timestamps = Collections.unmodifiableList(new ArrayList<>(timestamps));
    _values = Collections.unmodifiableList(new ArrayList<>(values));
    _requestedPeriodSeconds = requestedPeriodSeconds;
  }

  public List<Long> timestamps() {
    return _timestamps;
  }

  public List<Double> values() {
    return _values;
  }

  /**
   * @return The aggregation period the datapoints were requested with, or {@code null} if unknown.
   */
  public Integer requestedPeriodSeconds() {
    return _requestedPeriodSeconds;
  }

  public int size() {
    return _timestamps.size();
  }

  public boolean isEmpty() {
    return _timestamps.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("MetricData{size=%d, requestedPeriodSeconds=%s}", _timestamps.size(), _requestedPeriodSeconds);
  }
}
