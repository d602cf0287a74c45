/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import com.linkedin.metricinsight.common.utils.Utils;
import com.linkedin.metricinsight.model.MetricData;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;


/**
 * The valid datapoints of a metric sorted by timestamp. Datapoints with a {@code null}, NaN or infinite value are
 * dropped; datapoints sharing a timestamp keep their input order.
 */
final class CleanedSeries {
  private final long[] _timestampsMs;
  private final double[] _values;

  private CleanedSeries(long[] timestampsMs, double[] values) {
    _timestampsMs = timestampsMs;
    _values = values;
  }

  static CleanedSeries from(MetricData metricData) {
    List<Integer> valid = new ArrayList<>(metricData.size());
    List<Long> timestamps = metricData.timestamps();
    List<Double> values = metricData.values();
    for (int i = 0; i < metricData.size(); i++) {
      if (Utils.isFinite(values.get(i))) {
        valid.add(i);
      }
    }
    // List.sort is stable.
    valid.sort(Comparator.comparingLong(timestamps::get));
    long[] sortedTimestamps = new long[valid.size()];
    double[] sortedValues = new double[valid.size()];
    for (int i = 0; i < valid.size(); i++) {
      sortedTimestamps[i] = timestamps.get(valid.get(i));
      sortedValues[i] = values.get(valid.get(i));
    }
    return new CleanedSeries(sortedTimestamps, sortedValues);
  }

  long[] timestampsMs() {
    return _timestampsMs;
  }

  double[] values() {
    return _values;
  }

  int size() {
    return _values.length;
  }
}
