/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;

/**
 * Utils class for MetricWatch
 */
public final class MetricWatchUtils {
  private static final DateTimeFormatter UTC_SECONDS = new DateTimeFormatterBuilder().appendInstant(0).toFormatter();

  private MetricWatchUtils() {

  }

  /**
   * @param timeMs Time in milliseconds.
   * @return The date for the given time in ISO 8601 format with date, hour, minute, and seconds.
   */
  public static String utcDateFor(long timeMs) {
    return UTC_SECONDS.format(Instant.ofEpochMilli(timeMs).truncatedTo(ChronoUnit.SECONDS));
  }
}
