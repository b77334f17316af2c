/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumSet;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MonitoringConfigTest {

  private static long at(int year, int month, int day, int hour, int minute, ZoneId zone) {
    return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, zone).toInstant().toEpochMilli();
  }

  @Test
  public void testActiveHours() {
    ActiveHours window = ActiveHours.parse("08:00-20:00");
    assertTrue(window.contains(LocalTime.of(8, 0)));
    assertTrue(window.contains(LocalTime.of(19, 59)));
    assertFalse(window.contains(LocalTime.of(20, 0)));
    assertFalse(window.contains(LocalTime.of(7, 59)));
    assertEquals("08:00-20:00", window.toString());
  }

  @Test
  public void testActiveHoursWrappingMidnight() {
    ActiveHours window = ActiveHours.parse("22:00-06:00");
    assertTrue(window.contains(LocalTime.of(23, 30)));
    assertTrue(window.contains(LocalTime.of(5, 59)));
    assertFalse(window.contains(LocalTime.of(6, 0)));
    assertFalse(window.contains(LocalTime.of(12, 0)));
    assertTrue(ActiveHours.parse("00:00-00:00").contains(LocalTime.NOON));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidActiveHours() {
    ActiveHours.parse("25:00-26:00");
  }

  @Test
  public void testIsActive() {
    MonitoringConfig config = new MonitoringConfig(60L, ActiveHours.parse("09:00-17:00"),
                                                   EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
    // 2024-03-04 is a Monday.
    assertTrue(config.isActive(at(2024, 3, 4, 10, 0, ZoneOffset.UTC), ZoneOffset.UTC));
    assertFalse(config.isActive(at(2024, 3, 4, 18, 0, ZoneOffset.UTC), ZoneOffset.UTC));
    assertFalse(config.isActive(at(2024, 3, 5, 10, 0, ZoneOffset.UTC), ZoneOffset.UTC));
    // 10:00 in Tokyo is 01:00 UTC.
    ZoneId tokyo = ZoneId.of("Asia/Tokyo");
    assertTrue(config.isActive(at(2024, 3, 4, 10, 0, tokyo), tokyo));
    assertFalse(config.isActive(at(2024, 3, 4, 10, 0, tokyo), ZoneOffset.UTC));
  }

  @Test
  public void testEmptyWeekdaysMeansEveryDay() {
    MonitoringConfig config = new MonitoringConfig(60L, null, Collections.emptySet());
    assertEquals(EnumSet.allOf(DayOfWeek.class), config.activeWeekdays());
    assertTrue(config.isActive(at(2024, 3, 9, 3, 0, ZoneOffset.UTC), ZoneOffset.UTC));
    assertEquals(60_000L, config.pollIntervalMs());
  }
}
