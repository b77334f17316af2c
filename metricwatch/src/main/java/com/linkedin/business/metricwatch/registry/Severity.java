/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Locale;


/**
 * Alert severities in increasing order of urgency.
 */
public enum Severity {
  LOW, MEDIUM, HIGH, CRITICAL;

  private static final Severity[] CACHED_VALUES = values();

  /**
   * @param levels Number of levels to escalate by.
   * @return The severity the given number of levels above this one, capped at {@link #CRITICAL}.
   */
  public Severity escalate(int levels) {
    int index = Math.min(ordinal() + Math.max(levels, 0), CACHED_VALUES.length - 1);
    return CACHED_VALUES[index];
  }

  public boolean isHigherThan(Severity other) {
    return compareTo(other) > 0;
  }

  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
