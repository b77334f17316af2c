/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

/**
 * The outcome of a single poll of a metric.
 */
public enum PollOutcome {
  /** Outside the active hours or weekdays of the metric. */
  INACTIVE,
  /** The source failed, no sample was recorded. */
  SKIPPED,
  /** A sample was recorded and is not anomalous. */
  NORMAL,
  /** A sample was recorded and is anomalous. */
  ANOMALY,
  /** The worker was interrupted while waiting to retry. */
  CANCELLED
}
