/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;


/**
 * Conversions shared by the data source connectors.
 */
public final class SourceUtils {

  private SourceUtils() {

  }

  /**
   * Convert a timestamp as found in a source to epoch milliseconds. Numbers are epoch milliseconds. Strings may be an
   * ISO-8601 instant, offset date-time, local date-time or date; local values are interpreted in the given zone.
   *
   * @param raw Raw timestamp.
   * @param zone Zone of local timestamps.
   * @return The timestamp in epoch milliseconds.
   * @throws SourceException of kind PARSE if the timestamp cannot be interpreted.
   */
  public static long toEpochMs(Object raw, ZoneId zone) throws SourceException {
    if (raw instanceof Number) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof Date) {
      return ((Date) raw).getTime();
    }
    if (raw instanceof LocalDateTime) {
      return ((LocalDateTime) raw).atZone(zone).toInstant().toEpochMilli();
    }
    if (raw instanceof OffsetDateTime) {
      return ((OffsetDateTime) raw).toInstant().toEpochMilli();
    }
    if (raw instanceof ZonedDateTime) {
      return ((ZonedDateTime) raw).toInstant().toEpochMilli();
    }
    if (raw instanceof LocalDate) {
      return ((LocalDate) raw).atStartOfDay(zone).toInstant().toEpochMilli();
    }
    if (raw instanceof String) {
      return parseEpochMs(((String) raw).trim(), zone);
    }
    throw new SourceException(SourceException.Kind.PARSE, "Unsupported timestamp " + raw);
  }

  private static long parseEpochMs(String text, ZoneId zone) throws SourceException {
    if (text.matches("-?\\d+")) {
      return Long.parseLong(text);
    }
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text).atStartOfDay(zone).toInstant().toEpochMilli();
      }
      if (text.endsWith("Z")) {
        return Instant.parse(text).toEpochMilli();
      }
      try {
        return OffsetDateTime.parse(text).toInstant().toEpochMilli();
      } catch (DateTimeParseException e) {
        return LocalDateTime.parse(text.replace(' ', 'T')).atZone(zone).toInstant().toEpochMilli();
      }
    } catch (DateTimeParseException e) {
      throw new SourceException(SourceException.Kind.PARSE, "Unparseable timestamp '" + text + "'", e);
    }
  }

  /**
   * @param raw Raw value.
   * @return The value as a finite double.
   * @throws SourceException of kind PARSE if the value is not a finite number, NOT_FOUND if it is {@code null}.
   */
  public static double toValue(Object raw) throws SourceException {
    if (raw == null) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "The source returned no value.");
    }
    double value;
    if (raw instanceof Number) {
      value = ((Number) raw).doubleValue();
    } else {
      try {
        value = Double.parseDouble(raw.toString().trim());
      } catch (NumberFormatException e) {
        throw new SourceException(SourceException.Kind.PARSE, "Value '" + raw + "' is not a number.", e);
      }
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new SourceException(SourceException.Kind.PARSE, "Value " + raw + " is not finite.");
    }
    return value;
  }

  /**
   * @param samples Samples in any order.
   * @return A new list holding the given samples ascending by timestamp.
   */
  public static List<Sample> ascending(List<Sample> samples) {
    List<Sample> sorted = new ArrayList<>(samples);
    Collections.sort(sorted);
    return sorted;
  }
}
