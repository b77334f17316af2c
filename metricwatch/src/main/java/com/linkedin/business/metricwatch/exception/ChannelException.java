/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.exception;

import com.linkedin.metricwatch.exception.MetricWatchException;


/**
 * Thrown when an alert channel fails to deliver an alert.
 */
public class ChannelException extends MetricWatchException {

  public ChannelException(String message, Throwable cause) {
    super(message, cause);
  }

  public ChannelException(String message) {
    super(message);
  }
}
