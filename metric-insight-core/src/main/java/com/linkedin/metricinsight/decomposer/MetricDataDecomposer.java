/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.decomposer;

import com.linkedin.metricinsight.config.MetricAnalyzerConfig;
import com.linkedin.metricinsight.model.DecompositionResult;
import com.linkedin.metricinsight.model.Seasonality;
import com.linkedin.metricinsight.model.Trend;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricinsight.common.utils.Utils.validateNotNull;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.DENSITY_RATIO_THRESHOLD_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.MIN_SEASONAL_CYCLES_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.NUMERICAL_STABILITY_THRESHOLD_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.SEASONALITY_STRENGTH_THRESHOLD_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.TREND_SIGNIFICANCE_THRESHOLD_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.WINSORIZE_LOWER_PERCENTILE_CONFIG;
import static com.linkedin.metricinsight.config.MetricAnalyzerConfig.WINSORIZE_UPPER_PERCENTILE_CONFIG;


/**
 * Decomposes the datapoints of a metric into a seasonal and a trend component.
 *
 * The datapoints are first resampled onto a regular grid spaced at the publishing period of the metric and
 * winsorized. Each candidate {@link Seasonality} with at least {@link MetricAnalyzerConfig#MIN_SEASONAL_CYCLES_CONFIG}
 * full cycles of data is then scored with the seasonal strength of a classical decomposition:
 * <pre>
 *   strength = max(0, 1 - Var(remainder) / Var(detrended))
 * </pre>
 * where the trend is a centered moving average over one cycle and the seasonal pattern is the per-phase mean across
 * cycles. The strongest candidate is reported if its strength exceeds
 * {@link MetricAnalyzerConfig#SEASONALITY_STRENGTH_THRESHOLD_CONFIG}, and the trend is computed on the series with
 * that candidate's seasonal pattern removed. Otherwise no seasonality is reported and the trend is computed on the
 * winsorized series.
 *
 * The trend is the sign of an ordinary least squares slope over the normalized datapoint index, reported only if the
 * slope is significant at {@link MetricAnalyzerConfig#TREND_SIGNIFICANCE_THRESHOLD_CONFIG}.
 *
 * This class holds no mutable state and is safe for concurrent use.
 */
public class MetricDataDecomposer {
  private static final Logger LOG = LoggerFactory.getLogger(MetricDataDecomposer.class);
  /**
   * The largest regular grid the datapoints are resampled onto, i.e. about 115 days at a one second publishing
   * period. Larger grids are rejected with an {@link IllegalArgumentException}.
   */
  public static final long MAX_GRID_POINTS = 10_000_000L;
  private final double _densityRatioThreshold;
  private final double _seasonalityStrengthThreshold;
  private final double _trendSignificanceThreshold;
  private final double _winsorizeLowerPercentile;
  private final double _winsorizeUpperPercentile;
  private final double _numericalStabilityThreshold;
  private final int _minSeasonalCycles;
  private final List<Seasonality> _candidates;

  public MetricDataDecomposer() {
    this(MetricAnalyzerConfig.defaults());
  }

  public MetricDataDecomposer(MetricAnalyzerConfig config) {
    validateNotNull(config, "Metric analyzer config cannot be null.");
    _densityRatioThreshold = config.getDouble(DENSITY_RATIO_THRESHOLD_CONFIG);
    _seasonalityStrengthThreshold = config.getDouble(SEASONALITY_STRENGTH_THRESHOLD_CONFIG);
    _trendSignificanceThreshold = config.getDouble(TREND_SIGNIFICANCE_THRESHOLD_CONFIG);
    _winsorizeLowerPercentile = config.getDouble(WINSORIZE_LOWER_PERCENTILE_CONFIG);
    _winsorizeUpperPercentile = config.getDouble(WINSORIZE_UPPER_PERCENTILE_CONFIG);
    _numericalStabilityThreshold = config.getDouble(NUMERICAL_STABILITY_THRESHOLD_CONFIG);
    _minSeasonalCycles = config.getInt(MIN_SEASONAL_CYCLES_CONFIG);
    _candidates = config.seasonalityCandidates();
  }

  /**
   * Detect the strongest seasonal period and the trend direction of the given datapoints.
   *
   * @param timestampsMs Timestamps of the datapoints in milliseconds since epoch.
   * @param values Finite values of the datapoints, one per timestamp.
   * @param densityRatio The density ratio of the datapoints.
   * @param publishingPeriodSeconds The publishing period of the metric in seconds, used as the resampling step.
   * @return The detected seasonality and trend, {@link DecompositionResult#NO_SIGNAL} if the datapoints are empty or
   * too sparse.
   */
  public DecompositionResult detectSeasonalityAndTrend(long[] timestampsMs,
                                                       double[] values,
                                                       double densityRatio,
                                                       double publishingPeriodSeconds) {
    validateNotNull(timestampsMs, "Timestamps cannot be null.");
    validateNotNull(values, "Values cannot be null.");
    if (timestampsMs.length == 0 || values.length == 0 || densityRatio <= _densityRatioThreshold) {
      LOG.debug("Skip decomposition of {} datapoints with density ratio {}.", values.length, densityRatio);
      return DecompositionResult.NO_SIGNAL;
    }
    if (timestampsMs.length != values.length) {
      throw new IllegalArgumentException(String.format("Timestamps and values must have the same length (%d != %d).",
                                                       timestampsMs.length, values.length));
    }

    RegularSeries regularSeries = interpolateToRegularGrid(timestampsMs, values, publishingPeriodSeconds);
    double[] winsorized = winsorize(regularSeries.values());

    Seasonality bestSeasonality = Seasonality.NONE;
    SeasonalStrength best = SeasonalStrength.NONE;
    for (Seasonality candidate : _candidates) {
      double datapointsPerPeriod = candidate.seconds() / publishingPeriodSeconds;
      if (winsorized.length < _minSeasonalCycles * datapointsPerPeriod || datapointsPerPeriod <= 0) {
        continue;
      }
      SeasonalStrength strength = seasonalStrength(winsorized, (int) datapointsPerPeriod);
      LOG.trace("Seasonal strength of {} over {} datapoints: {}.", candidate, winsorized.length, strength.strength());
      // Strictly greater: shorter periods win ties.
      if (strength.strength() > best.strength()) {
        best = strength;
        bestSeasonality = candidate;
      }
    }

    if (best.strength() > _seasonalityStrengthThreshold && best.deseasonalized() != null) {
      return new DecompositionResult(bestSeasonality, computeTrend(best.deseasonalized()));
    }
    return new DecompositionResult(Seasonality.NONE, computeTrend(winsorized));
  }

  /**
   * Resample the datapoints onto a grid that starts at the earliest timestamp and advances by the given period for as
   * long as the grid point is before the latest timestamp plus one period. Values are linearly interpolated between
   * the surrounding datapoints and clamped to the edge values outside the sampled range. Datapoints sharing a
   * timestamp are replaced by their mean.
   *
   * @param timestampsMs Timestamps of the datapoints in milliseconds since epoch.
   * @param values Values of the datapoints.
   * @param periodSeconds Grid step in seconds.
   * @return The resampled series, or the given datapoints if there are fewer than two of them.
   */
  RegularSeries interpolateToRegularGrid(long[] timestampsMs, double[] values, double periodSeconds) {
    if (timestampsMs.length < 2) {
      return new RegularSeries(timestampsMs.clone(), values.clone());
    }
    long periodMs = (long) (periodSeconds * 1000);
    if (periodMs <= 0) {
      throw new IllegalArgumentException(String.format("Grid period (%f seconds) must be at least one millisecond.",
                                                       periodSeconds));
    }

    Integer[] order = IntStream.range(0, timestampsMs.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingLong(index -> timestampsMs[index]));
    List<Double> knots = new ArrayList<>();
    List<Double> knotValues = new ArrayList<>();
    int i = 0;
    while (i < order.length) {
      long timestamp = timestampsMs[order[i]];
      double sum = 0.0;
      int count = 0;
      while (i < order.length && timestampsMs[order[i]] == timestamp) {
        sum += values[order[i]];
        count++;
        i++;
      }
      knots.add((double) timestamp);
      knotValues.add(sum / count);
    }

    long start = timestampsMs[order[0]];
    long end = timestampsMs[order[order.length - 1]];
    // Grid points are strictly before end + period.
    long span = end - start;
    long gridSize = span / periodMs + (span % periodMs == 0 ? 1 : 2);
    if (gridSize > MAX_GRID_POINTS) {
      throw new IllegalArgumentException(String.format("Resampling %d datapoints spanning %d ms every %d ms needs %d grid "
                                                       + "points, more than the maximum of %d.", timestampsMs.length,
                                                       span, periodMs, gridSize, MAX_GRID_POINTS));
    }
    int numPoints = (int) gridSize;
    long[] gridTimestamps = new long[numPoints];
    double[] gridValues = new double[numPoints];
    if (knots.size() == 1) {
      gridTimestamps[0] = start;
      gridValues[0] = knotValues.get(0);
      return new RegularSeries(gridTimestamps, gridValues);
    }

    double[] x = knots.stream().mapToDouble(Double::doubleValue).toArray();
    double[] y = knotValues.stream().mapToDouble(Double::doubleValue).toArray();
    PolynomialSplineFunction interpolation = new LinearInterpolator().interpolate(x, y);
    for (int j = 0; j < numPoints; j++) {
      long timestamp = start + j * periodMs;
      gridTimestamps[j] = timestamp;
      gridValues[j] = interpolation.value(Math.min(Math.max(timestamp, x[0]), x[x.length - 1]));
    }
    return new RegularSeries(gridTimestamps, gridValues);
  }

  /**
   * Clip the values to the configured lower and upper percentiles.
   *
   * @param values Values to winsorize.
   * @return A new array holding the winsorized values.
   */
  double[] winsorize(double[] values) {
    if (values.length == 0) {
      return new double[0];
    }
    Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    percentile.setData(values);
    double lower = percentile.evaluate(_winsorizeLowerPercentile);
    double upper = percentile.evaluate(_winsorizeUpperPercentile);
    double[] winsorized = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      winsorized[i] = Math.min(Math.max(values[i], lower), upper);
    }
    return winsorized;
  }

  /**
   * Measure the strength of a seasonal pattern with the given number of datapoints per cycle. Trailing datapoints
   * that do not complete a cycle are ignored.
   *
   * @param values Regularly spaced values.
   * @param seasonalPeriod Number of datapoints per cycle.
   * @return The seasonal strength and the deseasonalized values, {@link SeasonalStrength#NONE} if there are not enough
   * cycles or the detrended values have no variance.
   */
  SeasonalStrength seasonalStrength(double[] values, int seasonalPeriod) {
    if (seasonalPeriod <= 0 || values.length < (long) seasonalPeriod * _minSeasonalCycles) {
      return SeasonalStrength.NONE;
    }
    int numCycles = values.length / seasonalPeriod;
    if (numCycles <= 0) {
      return SeasonalStrength.NONE;
    }
    int length = numCycles * seasonalPeriod;
    double[] truncated = Arrays.copyOf(values, length);

    double[] pattern = new double[seasonalPeriod];
    for (int i = 0; i < length; i++) {
      pattern[i % seasonalPeriod] += truncated[i];
    }
    for (int phase = 0; phase < seasonalPeriod; phase++) {
      pattern[phase] /= numCycles;
    }

    double[] movingAverage = centeredMovingAverage(truncated, seasonalPeriod);
    double[] detrended = new double[length];
    double[] remainder = new double[length];
    double[] deseasonalized = new double[length];
    for (int i = 0; i < length; i++) {
      detrended[i] = truncated[i] - movingAverage[i];
      remainder[i] = detrended[i] - pattern[i % seasonalPeriod];
      deseasonalized[i] = truncated[i] - pattern[i % seasonalPeriod];
    }

    double detrendedVariance = StatUtils.populationVariance(detrended);
    if (detrendedVariance <= _numericalStabilityThreshold) {
      return SeasonalStrength.NONE;
    }
    double strength = Math.max(0.0, 1.0 - StatUtils.populationVariance(remainder) / detrendedVariance);
    return new SeasonalStrength(strength, deseasonalized);
  }

  /**
   * Compute the trend direction of the given values with an ordinary least squares fit of the values against their
   * normalized index. NaN and infinite values are skipped.
   *
   * @param values Values ordered by time.
   * @return The sign of the slope if it is statistically significant, {@link Trend#NONE} otherwise.
   */
  Trend computeTrend(double[] values) {
    if (values.length <= 2) {
      return Trend.NONE;
    }
    try {
      List<Integer> indices = new ArrayList<>();
      for (int i = 0; i < values.length; i++) {
        if (Double.isFinite(values[i])) {
          indices.add(i);
        }
      }
      int n = indices.size();
      if (n <= 2) {
        return Trend.NONE;
      }
      double[] y = new double[n];
      for (int i = 0; i < n; i++) {
        y[i] = values[indices.get(i)];
      }
      if (Math.sqrt(StatUtils.populationVariance(y)) < _numericalStabilityThreshold) {
        return Trend.NONE;
      }

      double minIndex = indices.get(0);
      double indexRange = indices.get(n - 1) - minIndex + _numericalStabilityThreshold;
      double[][] x = new double[n][1];
      for (int i = 0; i < n; i++) {
        x[i][0] = (indices.get(i) - minIndex) / indexRange;
      }

      OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
      regression.newSampleData(y, x);
      double slope = regression.estimateRegressionParameters()[1];
      double slopeStdErr = regression.estimateRegressionParametersStandardErrors()[1];
      double tStatistic = Math.abs(slope / slopeStdErr);
      double pValue = 2.0 * (1.0 - new TDistribution(n - 2).cumulativeProbability(tStatistic));
      LOG.trace("Trend slope {} with p-value {} over {} datapoints.", slope, pValue, n);

      if (Double.isNaN(pValue) || pValue >= _trendSignificanceThreshold) {
        return Trend.NONE;
      }
      return slope > 0 ? Trend.POSITIVE : Trend.NEGATIVE;
    } catch (RuntimeException e) {
      LOG.warn("Failed to compute trend over {} values.", values.length, e);
      return Trend.NONE;
    }
  }

  /**
   * Rolling mean over a window of the given size centered on each datapoint. Windows are truncated at the edges of the
   * series; an even window extends one datapoint further into the past than into the future.
   */
  private static double[] centeredMovingAverage(double[] values, int window) {
    double[] prefixSums = new double[values.length + 1];
    for (int i = 0; i < values.length; i++) {
      prefixSums[i + 1] = prefixSums[i] + values[i];
    }
    int offset = (window - 1) / 2;
    double[] average = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      int end = Math.min(values.length, i + 1 + offset);
      int start = Math.max(0, i + 1 + offset - window);
      average[i] = (prefixSums[end] - prefixSums[start]) / (end - start);
    }
    return average;
  }

  /**
   * A regularly spaced series.
   */
  static final class RegularSeries {
    private final long[] _timestampsMs;
    private final double[] _values;

    RegularSeries(long[] timestampsMs, double[] values) {
      _timestampsMs = timestampsMs;
      _values = values;
    }

    long[] timestampsMs() {
      return _timestampsMs;
    }

    double[] values() {
      return _values;
    }
  }
}
