/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.config;

import com.linkedin.metricinsight.common.config.AbstractConfig;
import com.linkedin.metricinsight.common.config.ConfigDef;
import com.linkedin.metricinsight.model.Seasonality;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.linkedin.metricinsight.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.metricinsight.common.config.ConfigDef.Range.between;


/**
 * The configuration of the metric analyzer and its decomposer.
 */
public class MetricAnalyzerConfig extends AbstractConfig {
  /**
   * <code>metric.analyzer.density.ratio.threshold</code>
   */
  public static final String DENSITY_RATIO_THRESHOLD_CONFIG = "metric.analyzer.density.ratio.threshold";
  public static final double DEFAULT_DENSITY_RATIO_THRESHOLD = 0.5;
  public static final String DENSITY_RATIO_THRESHOLD_DOC = "The density ratio at or below which a metric is considered "
      + "too sparse for seasonality and trend detection. The density ratio is the fraction of datapoints that fall "
      + "within the time span a perfectly periodic metric with the same number of datapoints would cover.";

  /**
   * <code>metric.analyzer.seasonality.strength.threshold</code>
   */
  public static final String SEASONALITY_STRENGTH_THRESHOLD_CONFIG = "metric.analyzer.seasonality.strength.threshold";
  public static final double DEFAULT_SEASONALITY_STRENGTH_THRESHOLD = 0.6;
  public static final String SEASONALITY_STRENGTH_THRESHOLD_DOC = "The seasonal strength a candidate period must exceed "
      + "to be reported. Seasonal strength is 1 - Var(remainder) / Var(detrended) of the classical decomposition.";

  /**
   * <code>metric.analyzer.trend.significance.threshold</code>
   */
  public static final String TREND_SIGNIFICANCE_THRESHOLD_CONFIG = "metric.analyzer.trend.significance.threshold";
  public static final double DEFAULT_TREND_SIGNIFICANCE_THRESHOLD = 0.05;
  public static final String TREND_SIGNIFICANCE_THRESHOLD_DOC = "The p-value of the fitted slope must be below this "
      + "value for a trend to be reported.";

  /**
   * <code>metric.analyzer.winsorize.lower.percentile</code>
   */
  public static final String WINSORIZE_LOWER_PERCENTILE_CONFIG = "metric.analyzer.winsorize.lower.percentile";
  public static final double DEFAULT_WINSORIZE_LOWER_PERCENTILE = 0.1;
  public static final String WINSORIZE_LOWER_PERCENTILE_DOC = "Values below this percentile are raised to it before "
      + "seasonality and trend detection.";

  /**
   * <code>metric.analyzer.winsorize.upper.percentile</code>
   */
  public static final String WINSORIZE_UPPER_PERCENTILE_CONFIG = "metric.analyzer.winsorize.upper.percentile";
  public static final double DEFAULT_WINSORIZE_UPPER_PERCENTILE = 99.9;
  public static final String WINSORIZE_UPPER_PERCENTILE_DOC = "Values above this percentile are lowered to it before "
      + "seasonality and trend detection.";

  /**
   * <code>metric.analyzer.publishing.period.snap.tolerance</code>
   */
  public static final String PUBLISHING_PERIOD_SNAP_TOLERANCE_CONFIG = "metric.analyzer.publishing.period.snap.tolerance";
  public static final double DEFAULT_PUBLISHING_PERIOD_SNAP_TOLERANCE = 0.1;
  public static final String PUBLISHING_PERIOD_SNAP_TOLERANCE_DOC = "The maximum relative distance between the most "
      + "common gap of a metric and the closest standard period for the gap to be rounded to that period.";

  /**
   * <code>metric.analyzer.numerical.stability.threshold</code>
   */
  public static final String NUMERICAL_STABILITY_THRESHOLD_CONFIG = "metric.analyzer.numerical.stability.threshold";
  public static final double DEFAULT_NUMERICAL_STABILITY_THRESHOLD = 1e-10;
  public static final String NUMERICAL_STABILITY_THRESHOLD_DOC = "Variances, standard deviations and means whose "
      + "magnitude is below this value are treated as zero.";

  /**
   * <code>metric.analyzer.min.seasonal.cycles</code>
   */
  public static final String MIN_SEASONAL_CYCLES_CONFIG = "metric.analyzer.min.seasonal.cycles";
  public static final int DEFAULT_MIN_SEASONAL_CYCLES = 2;
  public static final String MIN_SEASONAL_CYCLES_DOC = "The minimum number of full cycles of a candidate period the "
      + "metric must cover for the candidate to be evaluated.";

  /**
   * <code>metric.analyzer.seasonality.candidates</code>
   */
  public static final String SEASONALITY_CANDIDATES_CONFIG = "metric.analyzer.seasonality.candidates";
  public static final String DEFAULT_SEASONALITY_CANDIDATES =
      Seasonality.candidates().stream().map(Seasonality::name).collect(Collectors.joining(","));
  public static final String SEASONALITY_CANDIDATES_DOC = "The seasonal periods to search. Candidates are always "
      + "evaluated from the shortest to the longest period; on equal strength the shorter period wins.";

  private static final ConfigDef CONFIG =
      new ConfigDef().define(DENSITY_RATIO_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_DENSITY_RATIO_THRESHOLD,
                             between(0.0, 1.0),
                             ConfigDef.Importance.HIGH,
                             DENSITY_RATIO_THRESHOLD_DOC)
                     .define(SEASONALITY_STRENGTH_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_SEASONALITY_STRENGTH_THRESHOLD,
                             between(0.0, 1.0),
                             ConfigDef.Importance.HIGH,
                             SEASONALITY_STRENGTH_THRESHOLD_DOC)
                     .define(TREND_SIGNIFICANCE_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_TREND_SIGNIFICANCE_THRESHOLD,
                             between(0.0, 1.0),
                             ConfigDef.Importance.HIGH,
                             TREND_SIGNIFICANCE_THRESHOLD_DOC)
                     .define(WINSORIZE_LOWER_PERCENTILE_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_WINSORIZE_LOWER_PERCENTILE,
                             between(0.0001, 100.0),
                             ConfigDef.Importance.MEDIUM,
                             WINSORIZE_LOWER_PERCENTILE_DOC)
                     .define(WINSORIZE_UPPER_PERCENTILE_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_WINSORIZE_UPPER_PERCENTILE,
                             between(0.0001, 100.0),
                             ConfigDef.Importance.MEDIUM,
                             WINSORIZE_UPPER_PERCENTILE_DOC)
                     .define(PUBLISHING_PERIOD_SNAP_TOLERANCE_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_PUBLISHING_PERIOD_SNAP_TOLERANCE,
                             between(0.0, 1.0),
                             ConfigDef.Importance.MEDIUM,
                             PUBLISHING_PERIOD_SNAP_TOLERANCE_DOC)
                     .define(NUMERICAL_STABILITY_THRESHOLD_CONFIG,
                             ConfigDef.Type.DOUBLE,
                             DEFAULT_NUMERICAL_STABILITY_THRESHOLD,
                             atLeast(0.0),
                             ConfigDef.Importance.LOW,
                             NUMERICAL_STABILITY_THRESHOLD_DOC)
                     .define(MIN_SEASONAL_CYCLES_CONFIG,
                             ConfigDef.Type.INT,
                             DEFAULT_MIN_SEASONAL_CYCLES,
                             atLeast(1),
                             ConfigDef.Importance.LOW,
                             MIN_SEASONAL_CYCLES_DOC)
                     .define(SEASONALITY_CANDIDATES_CONFIG,
                             ConfigDef.Type.LIST,
                             DEFAULT_SEASONALITY_CANDIDATES,
                             ConfigDef.ValidList.in(Seasonality.candidates().stream()
                                                               .map(Seasonality::name)
                                                               .toArray(String[]::new)),
                             ConfigDef.Importance.MEDIUM,
                             SEASONALITY_CANDIDATES_DOC);

  public MetricAnalyzerConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public MetricAnalyzerConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckPercentiles();
  }

  /**
   * @return A configuration with every key at its default value.
   */
  public static MetricAnalyzerConfig defaults() {
    return new MetricAnalyzerConfig(Collections.emptyMap(), false);
  }

  /**
   * @return The configured seasonality candidates in search order, i.e. from the shortest to the longest period.
   */
  public List<Seasonality> seasonalityCandidates() {
    List<String> names = getList(SEASONALITY_CANDIDATES_CONFIG);
    List<Seasonality> candidates = new ArrayList<>();
    for (Seasonality seasonality : Seasonality.candidates()) {
      if (names.contains(seasonality.name())) {
        candidates.add(seasonality);
      }
    }
    return Collections.unmodifiableList(candidates);
  }

  /**
   * Sanity check to ensure that {@link #WINSORIZE_LOWER_PERCENTILE_CONFIG} is not larger than
   * {@link #WINSORIZE_UPPER_PERCENTILE_CONFIG}.
   */
  private void sanityCheckPercentiles() {
    double lowerPercentile = getDouble(WINSORIZE_LOWER_PERCENTILE_CONFIG);
    double upperPercentile = getDouble(WINSORIZE_UPPER_PERCENTILE_CONFIG);
    if (lowerPercentile > upperPercentile) {
      throw new IllegalArgumentException(String.format("Lower winsorize percentile (%f) is larger than upper "
                                                       + "winsorize percentile (%f).", lowerPercentile, upperPercentile));
    }
  }
}
