/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Objects;


/**
 * Bounds of the baseline window of a metric.
 */
public final class HistoricalSpec {
  public static final int DEFAULT_MIN_SAMPLES = 30;
  public static final int DEFAULT_MAX_SAMPLES = 90;
  private final int _minSamples;
  private final int _maxSamples;
  private final boolean _seedOnStart;

  public HistoricalSpec(int minSamples, int maxSamples, boolean seedOnStart) {
    _minSamples = minSamples;
    _maxSamples = maxSamples;
    _seedOnStart = seedOnStart;
  }

  public static HistoricalSpec defaults() {
    return new HistoricalSpec(DEFAULT_MIN_SAMPLES, DEFAULT_MAX_SAMPLES, true);
  }

  /**
   * @return The number of samples needed before a model may be trained.
   */
  public int minSamples() {
    return _minSamples;
  }

  /**
   * @return The capacity of the baseline window.
   */
  public int maxSamples() {
    return _maxSamples;
  }

  /**
   * @return True if an empty window is warmed with the historical series of the source when monitoring starts.
   */
  public boolean seedOnStart() {
    return _seedOnStart;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HistoricalSpec that = (HistoricalSpec) o;
    return _minSamples == that._minSamples && _maxSamples == that._maxSamples && _seedOnStart == that._seedOnStart;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_minSamples, _maxSamples, _seedOnStart);
  }
}
