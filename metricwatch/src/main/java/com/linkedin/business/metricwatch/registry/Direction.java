/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Locale;


/**
 * The direction of a deviation that is worth alerting on.
 */
public enum Direction {
  ABOVE, BELOW, EITHER;

  /**
   * @param deviation Signed deviation from the baseline.
   * @return True if the deviation points in this direction. A zero deviation only matches {@link #EITHER}.
   */
  public boolean matches(double deviation) {
    switch (this) {
      case ABOVE:
        return deviation > 0;
      case BELOW:
        return deviation < 0;
      default:
        return true;
    }
  }

  /**
   * @param deviation Signed deviation from the baseline.
   * @param threshold Non-negative threshold.
   * @return True if the deviation reaches the threshold, inclusive, in this direction.
   */
  public boolean breaches(double deviation, double threshold) {
    switch (this) {
      case ABOVE:
        return deviation >= threshold;
      case BELOW:
        return -deviation >= threshold;
      default:
        return Math.abs(deviation) >= threshold;
    }
  }

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
