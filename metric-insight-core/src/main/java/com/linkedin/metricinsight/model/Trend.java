/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricinsight.model;

import java.util.Locale;


/**
 * Direction of a statistically significant linear drift. A trend carries no magnitude.
 */
public enum Trend {
  NONE, POSITIVE, NEGATIVE;

  /**
   * @return The lower-case name used in JSON responses.
   */
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
