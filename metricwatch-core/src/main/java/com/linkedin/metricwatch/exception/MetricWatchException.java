/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.exception;

public class MetricWatchException extends Exception {

  public MetricWatchException(String message, Throwable cause) {
    super(message, cause);
  }

  public MetricWatchException(String message) {
    super(message);
  }

  public MetricWatchException(Throwable cause) {
    super(cause);
  }
}
