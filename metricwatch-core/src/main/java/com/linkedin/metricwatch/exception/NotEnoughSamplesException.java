/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.exception;

/**
 * The exception indicates that the baseline window of a metric does not hold enough samples to train a model yet.
 * This is expected while a metric is warming up.
 */
public class NotEnoughSamplesException extends MetricWatchException {
  private final int _available;
  private final int _required;

  public NotEnoughSamplesException(String metricId, int available, int required) {
    super(String.format("Metric %s has %d samples in its baseline window, at least %d are required.", metricId, available, required));
    _available = available;
    _required = required;
  }

  public int available() {
    return _available;
  }

  public int required() {
    return _required;
  }
}
