/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.analyzer;

import com.linkedin.metricinsight.config.MetricAnalyzerConfig;
import com.linkedin.metricinsight.decomposer.MetricDataDecomposer;
import com.linkedin.metricinsight.model.MetricData;
import com.linkedin.metricinsight.model.Seasonality;
import com.linkedin.metricinsight.model.Trend;
import java.util.Arrays;
import java.util.Collections;
import org.easymock.EasyMock;
import org.junit.Test;

import static com.linkedin.metricinsight.MetricInsightUnitTestUtils.metricData;
import static com.linkedin.metricinsight.MetricInsightUnitTestUtils.seasonalValues;
import static com.linkedin.metricinsight.MetricInsightUnitTestUtils.timestamps;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class MetricAnalyzerTest {
  private static final double DELTA = 1E-6;
  private final MetricAnalyzer _analyzer = new MetricAnalyzer();

  @Test
  public void testFivePointsAtFiveMinutes() {
    MetricData data = new MetricData(Arrays.asList(0L, 300000L, 600000L, 900000L, 1200000L),
                                     Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(data);
    assertTrue(result.isSuccessful());
    assertEquals(MetricAnalysisResult.SUCCESS_MESSAGE, result.message());
    assertEquals(5, result.dataPointsFound().intValue());
    assertEquals(Seasonality.NONE, result.seasonality());
    assertEquals(Trend.POSITIVE, result.trend());
    assertEquals(300.0, result.dataQuality().publishingPeriodSeconds(), DELTA);
    assertEquals(1.0, result.dataQuality().densityRatio(), DELTA);
    assertEquals(5, result.dataQuality().totalPoints());
    assertEquals(3.0, result.statistics().median(), DELTA);
  }

  @Test
  public void testEmptyData() {
    MetricAnalysisResult result =
        _analyzer.analyzeMetricData(new MetricData(Collections.emptyList(), Collections.emptyList()));
    assertFalse(result.isSuccessful());
    assertEquals(MetricAnalysisResult.NO_DATA_MESSAGE, result.message());
    assertNull(result.statistics());
  }

  @Test
  public void testInsufficientValidData() {
    MetricData allInvalid = new MetricData(Arrays.asList(0L, 60000L, 120000L),
                                           Arrays.asList(null, Double.NaN, Double.NEGATIVE_INFINITY));
    assertEquals(MetricAnalysisResult.INSUFFICIENT_DATA_MESSAGE, _analyzer.analyzeMetricData(allInvalid).message());
    MetricData oneValid = new MetricData(Arrays.asList(0L, 60000L), Arrays.asList(1.0, Double.POSITIVE_INFINITY));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(oneValid);
    assertFalse(result.isSuccessful());
    assertEquals(MetricAnalysisResult.INSUFFICIENT_DATA_MESSAGE, result.message());
    assertNull(result.dataQuality());
  }

  @Test
  public void testInvalidValuesAreDropped() {
    MetricData data = new MetricData(Arrays.asList(0L, 60000L, 120000L, 180000L, 240000L, 300000L),
                                     Arrays.asList(4.0, null, 2.0, Double.NaN, 8.0, 6.0));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(data);
    assertTrue(result.isSuccessful());
    assertEquals(6, result.dataPointsFound().intValue());
    assertEquals(4, result.dataQuality().totalPoints());
    assertEquals(2.0, result.statistics().min(), DELTA);
    assertEquals(8.0, result.statistics().max(), DELTA);
    assertEquals(5.0, result.statistics().median(), DELTA);
  }

  @Test
  public void testUnsortedInputMatchesSortedInput() {
    MetricData sorted = new MetricData(Arrays.asList(0L, 300000L, 600000L, 900000L, 1200000L),
                                       Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    MetricData unsorted = new MetricData(Arrays.asList(900000L, 0L, 1200000L, 300000L, 600000L),
                                         Arrays.asList(4.0, 1.0, 5.0, 2.0, 3.0));
    assertEquals(_analyzer.analyzeMetricData(sorted), _analyzer.analyzeMetricData(unsorted));
  }

  @Test
  public void testAnalysisIsIdempotent() {
    MetricData data = metricData(timestamps(336, 3600), seasonalValues(336, 3600, 86400, 0.2));
    MetricAnalysisResult first = _analyzer.analyzeMetricData(data);
    MetricAnalysisResult second = _analyzer.analyzeMetricData(data);
    assertEquals(first, second);
    assertEquals(first.toJson(), second.toJson());
    assertEquals(Seasonality.ONE_DAY, first.seasonality());
    assertEquals(Trend.POSITIVE, first.trend());
    assertEquals(3600.0, first.dataQuality().publishingPeriodSeconds(), DELTA);
  }

  @Test
  public void testSparseDataHasNoSignal() {
    // Half of the datapoints are published far beyond the span the inferred period accounts for.
    MetricData data = new MetricData(Arrays.asList(0L, 60000L, 120000L, 180000L, 10000000L, 20000000L, 30000000L,
                                                   40000000L),
                                     Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(data);
    assertTrue(result.isSuccessful());
    assertEquals(0.5, result.dataQuality().densityRatio(), DELTA);
    assertEquals(Seasonality.NONE, result.seasonality());
    assertEquals(Trend.NONE, result.trend());
  }

  @Test
  public void testDuplicateTimestampsHaveNoSignal() {
    MetricData data = new MetricData(Arrays.asList(1000L, 1000L, 1000L), Arrays.asList(1.0, 2.0, 3.0));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(data);
    assertTrue(result.isSuccessful());
    assertNull(result.dataQuality().publishingPeriodSeconds());
    assertEquals(0.0, result.dataQuality().densityRatio(), DELTA);
    assertEquals(Seasonality.NONE, result.seasonality());
    assertEquals(Trend.NONE, result.trend());
  }

  @Test
  public void testRequestedPeriodIsReported() {
    MetricData data = new MetricData(Arrays.asList(0L, 60000L, 120000L), Arrays.asList(1.0, 1.0, 1.0), 60);
    MetricAnalysisResult result = _analyzer.analyzeMetricData(data);
    assertEquals(60, result.dataQuality().requestedPeriodSeconds().intValue());
    assertEquals(0.0, result.statistics().coefficientOfVariation(), DELTA);
  }

  @Test
  public void testDecomposerFailureDegradesResult() {
    MetricDataDecomposer decomposer = EasyMock.createMock(MetricDataDecomposer.class);
    EasyMock.expect(decomposer.detectSeasonalityAndTrend(EasyMock.anyObject(), EasyMock.anyObject(),
                                                         EasyMock.anyDouble(), EasyMock.anyDouble()))
            .andThrow(new IllegalStateException("Singular matrix"));
    EasyMock.replay(decomposer);

    MetricAnalyzer analyzer = new MetricAnalyzer(MetricAnalyzerConfig.defaults(), decomposer);
    MetricData data = new MetricData(Arrays.asList(0L, 300000L, 600000L, 900000L, 1200000L),
                                     Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    MetricAnalysisResult result = analyzer.analyzeMetricData(data);
    assertFalse(result.isSuccessful());
    assertEquals(MetricAnalysisResult.UNABLE_TO_ANALYZE_MESSAGE, result.message());
    EasyMock.verify(decomposer);
  }

  @Test
  public void testOversizedGridDegradesResult() {
    MetricData millisecondsThenFarFuture = new MetricData(Arrays.asList(0L, 1L, 2L, 3L, 10_000_000_000_000L),
                                                          Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    MetricAnalysisResult result = _analyzer.analyzeMetricData(millisecondsThenFarFuture);
    assertFalse(result.isSuccessful());
    assertEquals(MetricAnalysisResult.UNABLE_TO_ANALYZE_MESSAGE, result.message());

    MetricData secondsThenFarFuture = new MetricData(Arrays.asList(0L, 1000L, 2000L, 3000L, 10_000_000_000_000L),
                                                     Arrays.asList(1.0, 2.0, 3.0, 4.0, 5.0));
    assertEquals(MetricAnalysisResult.UNABLE_TO_ANALYZE_MESSAGE,
                 _analyzer.analyzeMetricData(secondsThenFarFuture).message());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullMetricDataIsRejected() {
    _analyzer.analyzeMetricData(null);
  }
}
