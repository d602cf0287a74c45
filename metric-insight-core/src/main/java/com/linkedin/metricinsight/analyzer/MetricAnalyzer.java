/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import com.linkedin.metricinsight.config.MetricAnalyzerConfig;
import com.linkedin.metricinsight.decomposer.MetricDataDecomposer;
import com.linkedin.metricinsight.model.DecompositionResult;
import com.linkedin.metricinsight.model.MetricData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricinsight.common.utils.Utils.validateNotNull;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.NUMERICAL_STABILITY_THRESHOLD_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.PUBLISHING_PERIOD_SNAP_TOLERANCE_CONFIG;


/**
 * Analyzes the datapoints of a metric: infers its publishing period and density, detects its seasonality and trend,
 * and summarizes its values.
 *
 * Failures never propagate to the caller. Missing or insufficient data and unexpected computational failures are
 * reported through the message of a degraded {@link MetricAnalysisResult}.
 */
public class MetricAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(MetricAnalyzer.class);
  private final MetricDataDecomposer _decomposer;
  private final double _snapTolerance;
  private final double _numericalStabilityThreshold;

  public MetricAnalyzer() {
    this(MetricAnalyzerConfig.defaults());
  }

  public MetricAnalyzer(MetricAnalyzerConfig config) {
    this(config, new MetricDataDecomposer(config));
  }

  MetricAnalyzer(MetricAnalyzerConfig config, MetricDataDecomposer decomposer) {
    validateNotNull(config, "Metric analyzer config cannot be null.");
    _decomposer = validateNotNull(decomposer, "Decomposer cannot be null.");
    _snapTolerance = config.getDouble(PUBLISHING_PERIOD_SNAP_TOLERANCE_CONFIG);
    _numericalStabilityThreshold = config.getDouble(NUMERICAL_STABILITY_THRESHOLD_CONFIG);
  }

  /**
   * Analyze the given metric.
   *
   * @param metricData Datapoints of the metric.
   * @return The analysis result.
   */
  public MetricAnalysisResult analyzeMetricData(MetricData metricData) {
    validateNotNull(metricData, "Metric data cannot be null.");
    if (metricData.isEmpty()) {
      return MetricAnalysisResult.degraded(MetricAnalysisResult.NO_DATA_MESSAGE);
    }
    CleanedSeries series = CleanedSeries.from(metricData);
    if (series.size() < 2) {
      LOG.debug("Only {} of {} datapoints are valid.", series.size(), metricData.size());
      return MetricAnalysisResult.degraded(MetricAnalysisResult.INSUFFICIENT_DATA_MESSAGE);
    }

    Double publishingPeriodSeconds = PublishingPeriodUtils.inferPublishingPeriodSeconds(series.timestampsMs(),
                                                                                        _snapTolerance);
    Double densityRatio = publishingPeriodSeconds == null
                          ? Double.valueOf(0.0)
                          : PublishingPeriodUtils.densityRatio(series.timestampsMs(), publishingPeriodSeconds);

    DecompositionResult decomposition;
    if (publishingPeriodSeconds == null || densityRatio == null) {
      decomposition = DecompositionResult.NO_SIGNAL;
    } else {
      try {
        decomposition = _decomposer.detectSeasonalityAndTrend(series.timestampsMs(), series.values(), densityRatio,
                                                              publishingPeriodSeconds);
      } catch (RuntimeException e) {
        LOG.warn("Failed to decompose {} with publishing period {}s and density ratio {}.", metricData,
                 publishingPeriodSeconds, densityRatio, e);
        return MetricAnalysisResult.degraded(MetricAnalysisResult.UNABLE_TO_ANALYZE_MESSAGE);
      }
    }

    MetricStatistics statistics;
    try {
      statistics = MetricStatistics.of(series.values(), _numericalStabilityThreshold);
    } catch (RuntimeException e) {
      LOG.warn("Failed to compute statistics of {}.", metricData, e);
      return MetricAnalysisResult.degraded(MetricAnalysisResult.UNABLE_TO_ANALYZE_MESSAGE);
    }

    DataQuality dataQuality = new DataQuality(series.size(), densityRatio, publishingPeriodSeconds,
                                              metricData.requestedPeriodSeconds());
    LOG.debug("Analyzed {} valid datapoints from {} to {}: {}, {}.", series.size(), series.timestampsMs()[0],
              series.timestampsMs()[series.size() - 1], decomposition, dataQuality);
    return MetricAnalysisResult.success(metricData.size(), decomposition, statistics, dataQuality);
  }
}
