/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.monitor.sampling;

import java.util.Objects;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * A single reading of a metric: the time it was taken and the observed value.
 */
public final class Sample implements Comparable<Sample> {
  private final long _timestampMs;
  private final double _value;

  public Sample(long timestampMs, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("Sample value must be finite, got " + value);
    }
    _timestampMs = timestampMs;
    _value = value;
  }

  /**
   * @return The time at which the value was observed, in epoch milliseconds.
   */
  public long timestampMs() {
    return _timestampMs;
  }

  /**
   * @return The observed value.
   */
  public double value() {
    return _value;
  }

  @Override
  public int compareTo(Sample other) {
    return Long.compare(_timestampMs, other._timestampMs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Sample sample = (Sample) o;
    return _timestampMs == sample._timestampMs && Double.compare(sample._value, _value) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_timestampMs, _value);
  }

  @Override
  public String toString() {
    return String.format("{%s: %s}", utcDateFor(_timestampMs), _value);
  }
}
