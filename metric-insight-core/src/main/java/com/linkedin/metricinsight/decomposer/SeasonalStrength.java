/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.decomposer;

/**
 * The strength of one candidate seasonal pattern and the series with that pattern removed.
 */
final class SeasonalStrength {
  static final SeasonalStrength NONE = new SeasonalStrength(0.0, null);
  private final double _strength;
  private final double[] _deseasonalized;

  SeasonalStrength(double strength, double[] deseasonalized) {
    _strength = strength;
    _deseasonalized = deseasonalized;
  }

  /**
   * @return Seasonal strength in [0, 1].
   */
  double strength() {
    return _strength;
  }

  /**
   * @return The truncated series minus the tiled seasonal pattern, or {@code null} if no pattern was measured.
   */
  double[] deseasonalized() {
    return _deseasonalized;
  }
}
