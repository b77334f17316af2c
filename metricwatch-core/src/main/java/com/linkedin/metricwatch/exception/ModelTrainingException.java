/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.exception;

/**
 * Thrown if fitting a scoring model fails for a reason other than missing samples.
 */
public class ModelTrainingException extends MetricWatchException {
  public ModelTrainingException(String message, Throwable cause) {
    super(message, cause);
  }

  public ModelTrainingException(String message) {
    super(message);
  }
}
