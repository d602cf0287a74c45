/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.metricinsight.model.DecompositionResult;
import com.linkedin.metricinsight.model.Seasonality;
import com.linkedin.metricinsight.model.Trend;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static com.linkedin.metricinsight.common.utils.Utils.validateNotNull;


/**
 * The outcome of analyzing one metric. A successful analysis carries every field. A degraded analysis, i.e. one with
 * no data, too few valid datapoints or a computational failure, carries only the message explaining why.
 */
public final class MetricAnalysisResult {
  public static final String NO_DATA_MESSAGE = "No metric data available for analysis";
  public static final String INSUFFICIENT_DATA_MESSAGE = "Insufficient valid data points for analysis";
  public static final String SUCCESS_MESSAGE = "Metric analysis completed successfully";
  public static final String UNABLE_TO_ANALYZE_MESSAGE = "Unable to analyze metric data";
  private static final String DATA_POINTS_FOUND = "data_points_found";
  private static final String SEASONALITY_SECONDS = "seasonality_seconds";
  private static final String TREND = "trend";
  private static final String STATISTICS = "statistics";
  private static final String DATA_QUALITY = "data_quality";
  private static final String MESSAGE = "message";
  private static final Gson GSON = new GsonBuilder().serializeNulls().create();
  private final boolean _successful;
  private final Integer _dataPointsFound;
  private final Seasonality _seasonality;
  private final Trend _trend;
  private final MetricStatistics _statistics;
  private final DataQuality _dataQuality;
  private final String _message;

  private MetricAnalysisResult(boolean successful,
                               Integer dataPointsFound,
                               Seasonality seasonality,
                               Trend trend,
                               MetricStatistics statistics,
                               DataQuality dataQuality,
                               String message) {
    _successful = successful;
    _dataPointsFound = dataPointsFound;
    _seasonality = seasonality;
    _trend = trend;
    _statistics = statistics;
    _dataQuality = dataQuality;
    _message = message;
  }

  /**
   * @param dataPointsFound Number of datapoints in the input, valid or not.
   * @param decomposition Detected seasonality and trend.
   * @param statistics Statistics of the valid values.
   * @param dataQuality Data quality of the valid datapoints.
   * @return A successful result.
   */
  public static MetricAnalysisResult success(int dataPointsFound,
                                             DecompositionResult decomposition,
                                             MetricStatistics statistics,
                                             DataQuality dataQuality) {
    validateNotNull(decomposition, "Decomposition cannot be null.");
    validateNotNull(statistics, "Statistics cannot be null.");
    validateNotNull(dataQuality, "Data quality cannot be null.");
    return new MetricAnalysisResult(true, dataPointsFound, decomposition.seasonality(), decomposition.trend(),
                                    statistics, dataQuality, SUCCESS_MESSAGE);
  }

  /**
   * @param message Why the analysis could not complete.
   * @return A result carrying only the given message.
   */
  public static MetricAnalysisResult degraded(String message) {
    return new MetricAnalysisResult(false, null, null, null, null, null,
                                    validateNotNull(message, "Message cannot be null."));
  }

  public boolean isSuccessful() {
    return _successful;
  }

  /**
   * @return Number of datapoints in the input including invalid ones, {@code null} for a degraded result.
   */
  public Integer dataPointsFound() {
    return _dataPointsFound;
  }

  public Seasonality seasonality() {
    return _seasonality;
  }

  public Trend trend() {
    return _trend;
  }

  public MetricStatistics statistics() {
    return _statistics;
  }

  public DataQuality dataQuality() {
    return _dataQuality;
  }

  public String message() {
    return _message;
  }

  /**
   * Return an object that can be further used to encode into JSON. A degraded result only has the message key.
   *
   * @return The map describing the result.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> result = new HashMap<>();
    if (_successful) {
      result.put(DATA_POINTS_FOUND, _dataPointsFound);
      result.put(SEASONALITY_SECONDS, _seasonality.seconds());
      result.put(TREND, _trend.jsonName());
      result.put(STATISTICS, _statistics.getJsonStructure());
      result.put(DATA_QUALITY, _dataQuality.getJsonStructure());
    }
    result.put(MESSAGE, _message);
    return result;
  }

  /**
   * @return The JSON representation of this result, with {@code null} statistics written out explicitly.
   */
  public String toJson() {
    return GSON.toJson(getJsonStructure());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricAnalysisResult that = (MetricAnalysisResult) o;
    return _successful == that._successful && Objects.equals(_dataPointsFound, that._dataPointsFound)
           && _seasonality == that._seasonality && _trend == that._trend
           && Objects.equals(_statistics, that._statistics) && Objects.equals(_dataQuality, that._dataQuality)
           && _message.equals(that._message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_successful, _dataPointsFound, _seasonality, _trend, _statistics, _dataQuality, _message);
  }

  @Override
  public String toString() {
    return toJson();
  }
}
