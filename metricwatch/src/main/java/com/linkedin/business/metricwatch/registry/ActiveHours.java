/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;


/**
 * A daily time window written as <code>HH:mm-HH:mm</code>. The start is inclusive and the end exclusive. A window
 * whose end precedes its start wraps past midnight, and a window whose start equals its end covers the whole day.
 */
public final class ActiveHours {
  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("HH:mm");
  private final LocalTime _start;
  private final LocalTime _end;

  public ActiveHours(LocalTime start, LocalTime end) {
    _start = start;
    _end = end;
  }

  /**
   * @param window Window in <code>HH:mm-HH:mm</code> form.
   * @return The parsed window.
   * @throws IllegalArgumentException if the window cannot be parsed.
   */
  public static ActiveHours parse(String window) {
    String[] bounds = window.trim().split("-");
    if (bounds.length != 2) {
      throw new IllegalArgumentException("Expected HH:mm-HH:mm, got " + window);
    }
    try {
      return new ActiveHours(LocalTime.parse(bounds[0].trim(), FORMAT), LocalTime.parse(bounds[1].trim(), FORMAT));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Expected HH:mm-HH:mm, got " + window, e);
    }
  }

  public boolean contains(LocalTime time) {
    if (_start.equals(_end)) {
      return true;
    }
    if (_start.isBefore(_end)) {
      return !time.isBefore(_start) && time.isBefore(_end);
    }
    return !time.isBefore(_start) || time.isBefore(_end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ActiveHours that = (ActiveHours) o;
    return _start.equals(that._start) && _end.equals(that._end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_start, _end);
  }

  @Override
  public String toString() {
    return FORMAT.format(_start) + "-" + FORMAT.format(_end);
  }
}
