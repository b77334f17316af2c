/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Locale;


/**
 * How the deviation of a value from its baseline mean is measured.
 */
public enum ThresholdType {
  /**
   * Relative deviation, in percent of the absolute mean.
   */
  PERCENTAGE,
  /**
   * Difference in the unit of the metric.
   */
  ABSOLUTE;

  /**
   * @param value Observed value.
   * @param mean Baseline mean.
   * @return Signed deviation of the value from the mean. A percentage deviation from a zero mean is 0 for a zero value
   * and 100% in the direction of the value otherwise.
   */
  public double deviation(double value, double mean) {
    if (this == ABSOLUTE) {
      return value - mean;
    }
    if (mean == 0.0) {
      return value == 0.0 ? 0.0 : Math.signum(value) * 100.0;
    }
    return (value - mean) * 100.0 / Math.abs(mean);
  }

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
