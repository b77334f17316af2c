/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;


/**
 * When a metric is polled.
 */
public final class MonitoringConfig {
  private final long _pollIntervalSeconds;
  private final ActiveHours _activeHours;
  private final Set<DayOfWeek> _activeWeekdays;

  /**
   * @param pollIntervalSeconds Delay between the end of a poll and the start of the next one.
   * @param activeHours Daily window in which polls run, or {@code null} for the whole day.
   * @param activeWeekdays Days on which polls run. Empty means every day.
   */
  public MonitoringConfig(long pollIntervalSeconds, ActiveHours activeHours, Set<DayOfWeek> activeWeekdays) {
    _pollIntervalSeconds = pollIntervalSeconds;
    _activeHours = activeHours;
    _activeWeekdays = activeWeekdays.isEmpty() ? Collections.unmodifiableSet(EnumSet.allOf(DayOfWeek.class))
                                               : Collections.unmodifiableSet(EnumSet.copyOf(activeWeekdays));
  }

  public long pollIntervalSeconds() {
    return _pollIntervalSeconds;
  }

  public long pollIntervalMs() {
    return TimeUnit.SECONDS.toMillis(_pollIntervalSeconds);
  }

  public ActiveHours activeHours() {
    return _activeHours;
  }

  public Set<DayOfWeek> activeWeekdays() {
    return _activeWeekdays;
  }

  /**
   * @param nowMs Current time.
   * @param zone Zone the window is evaluated in.
   * @return True if the given time falls on an active weekday and within the active hours.
   */
  public boolean isActive(long nowMs, ZoneId zone) {
    ZonedDateTime now = ZonedDateTime.ofInstant(Instant.ofEpochMilli(nowMs), zone);
    if (!_activeWeekdays.contains(now.getDayOfWeek())) {
      return false;
    }
    return _activeHours == null || _activeHours.contains(now.toLocalTime());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MonitoringConfig that = (MonitoringConfig) o;
    return _pollIntervalSeconds == that._pollIntervalSeconds && Objects.equals(_activeHours, that._activeHours)
           && _activeWeekdays.equals(that._activeWeekdays);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_pollIntervalSeconds, _activeHours, _activeWeekdays);
  }
}
