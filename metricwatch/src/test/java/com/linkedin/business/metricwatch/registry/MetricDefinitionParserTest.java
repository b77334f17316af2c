/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.StringReader;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Unit test for {@link MetricDefinitionParser}.
 */
public class MetricDefinitionParserTest {
  private static final String RELATIONAL_METRIC =
      "{\"id\": \"daily_orders\", \"name\": \"Daily orders\","
      + " \"source\": {\"type\": \"relational\", \"connection_id\": \"orders_db\","
      + "   \"query\": \"SELECT COUNT(*) AS total FROM orders\", \"value_column\": \"total\"},"
      + " \"historical\": {\"min_samples\": 20, \"max_samples\": 60},"
      + " \"scoring\": {\"contamination\": 0.05, \"threshold\": -0.1, \"features\": [\"day_of_week\", \"hour_of_day\"]},"
      + " \"alert\": {\"severity\": \"high\", \"threshold_type\": \"percentage\", \"threshold_value\": 15,"
      + "   \"direction\": \"below\", \"cooldown_minutes\": 30, \"channels\": [\"slack\", \"email\"],"
      + "   \"recipients\": [\"ops@example.com\"]},"
      + " \"monitoring\": {\"poll_interval_seconds\": 3600, \"active_hours\": \"08:00-20:00\","
      + "   \"active_weekdays\": [\"MON\", \"tue\", \"Wednesday\"]}}";

  private static final String HTTP_METRIC =
      "{\"id\": \"conversion\", \"name\": \"Conversion\", \"enabled\": false,"
      + " \"source\": {\"type\": \"http\", \"url\": \"https://api.example.com/stats\","
      + "   \"headers\": {\"Authorization\": \"Bearer ${env:API_TOKEN}\"}, \"response_field_path\": \"$.data.rate\"},"
      + " \"alert\": {\"severity\": \"low\", \"threshold_type\": \"absolute\", \"threshold_value\": 0.02},"
      + " \"monitoring\": {\"poll_interval_seconds\": 300}}";

  private static JsonObject json(String definition) {
    return JsonParser.parseString(definition).getAsJsonObject();
  }

  private static void assertInvalid(JsonObject definition, String metricId, String field) {
    try {
      MetricDefinitionParser.parse(definition);
      fail("Should throw ConfigException");
    } catch (ConfigException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("'" + metricId + "'"));
      assertTrue(e.getMessage(), e.getMessage().contains("'" + field + "'"));
    }
  }

  @Test
  public void testParseRelationalDefinition() {
    MetricDefinition definition = MetricDefinitionParser.parse(json(RELATIONAL_METRIC));
    assertEquals("daily_orders", definition.id());
    assertTrue(definition.enabled());
    RelationalQuerySpec source = (RelationalQuerySpec) definition.source();
    assertEquals("orders_db", source.connectionId());
    assertEquals("total", source.valueColumn());
    assertNull(source.historicalQuery());
    assertEquals(new HistoricalSpec(20, 60, true), definition.historical());
    assertEquals(0.05, definition.scoring().contamination(), 0.0);
    assertEquals(-0.1, definition.scoring().threshold(), 0.0);
    assertEquals(Arrays.asList(ScoringConfig.Feature.VALUE, ScoringConfig.Feature.DAY_OF_WEEK,
                               ScoringConfig.Feature.HOUR_OF_DAY), definition.scoring().features());
    AlertConfig alert = definition.alert();
    assertEquals(Severity.HIGH, alert.severity());
    assertEquals(ThresholdType.PERCENTAGE, alert.thresholdType());
    assertEquals(Direction.BELOW, alert.direction());
    assertEquals(30, alert.cooldownMinutes());
    assertEquals(Arrays.asList("slack", "email"), alert.channels());
    MonitoringConfig monitoring = definition.monitoring();
    assertEquals(3600L, monitoring.pollIntervalSeconds());
    assertEquals(new ActiveHours(LocalTime.of(8, 0), LocalTime.of(20, 0)), monitoring.activeHours());
    assertEquals(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY), monitoring.activeWeekdays());
  }

  @Test
  public void testDefaults() {
    MetricDefinition definition = MetricDefinitionParser.parse(json(HTTP_METRIC));
    assertFalse(definition.enabled());
    assertEquals(HistoricalSpec.defaults(), definition.historical());
    assertEquals(ScoringConfig.DEFAULT_CONTAMINATION, definition.scoring().contamination(), 0.0);
    assertEquals(Direction.EITHER, definition.alert().direction());
    assertEquals(AlertConfig.DEFAULT_COOLDOWN_MINUTES, definition.alert().cooldownMinutes());
    assertTrue(definition.alert().channels().isEmpty());
    assertNull(definition.monitoring().activeHours());
    assertEquals(EnumSet.allOf(DayOfWeek.class), definition.monitoring().activeWeekdays());
    HttpSourceSpec source = (HttpSourceSpec) definition.source();
    assertEquals(HttpSourceSpec.Method.GET, source.method());
    assertEquals("Bearer ${env:API_TOKEN}", source.headers().get("Authorization"));
  }

  @Test
  public void testErrorsNameMetricAndField() {
    JsonObject negativeThreshold = json(RELATIONAL_METRIC);
    negativeThreshold.getAsJsonObject("alert").addProperty("threshold_value", -1);
    assertInvalid(negativeThreshold, "daily_orders", "alert.threshold_value");

    JsonObject badContamination = json(RELATIONAL_METRIC);
    badContamination.getAsJsonObject("scoring").addProperty("contamination", 0.6);
    assertInvalid(badContamination, "daily_orders", "scoring.contamination");

    JsonObject missingQuery = json(RELATIONAL_METRIC);
    missingQuery.getAsJsonObject("source").remove("query");
    assertInvalid(missingQuery, "daily_orders", "source.query");

    JsonObject unknownType = json(RELATIONAL_METRIC);
    unknownType.getAsJsonObject("source").addProperty("type", "kafka");
    assertInvalid(unknownType, "daily_orders", "source.type");

    JsonObject badWindow = json(RELATIONAL_METRIC);
    badWindow.getAsJsonObject("monitoring").addProperty("active_hours", "8am-5pm");
    assertInvalid(badWindow, "daily_orders", "monitoring.active_hours");

    JsonObject zeroInterval = json(RELATIONAL_METRIC);
    zeroInterval.getAsJsonObject("monitoring").addProperty("poll_interval_seconds", 0);
    assertInvalid(zeroInterval, "daily_orders", "monitoring.poll_interval_seconds");

    JsonObject maxBelowMin = json(RELATIONAL_METRIC);
    maxBelowMin.getAsJsonObject("historical").addProperty("max_samples", 10);
    assertInvalid(maxBelowMin, "daily_orders", "historical.max_samples");

    JsonObject badSeverity = json(RELATIONAL_METRIC);
    badSeverity.getAsJsonObject("alert").addProperty("severity", "urgent");
    assertInvalid(badSeverity, "daily_orders", "alert.severity");

    JsonObject noId = json(RELATIONAL_METRIC);
    noId.remove("id");
    assertInvalid(noId, MetricDefinitionParser.UNKNOWN_ID, "id");
  }

  @Test
  public void testDuplicateIdsAreRejected() {
    String definitions = "[" + RELATIONAL_METRIC + ", " + RELATIONAL_METRIC + "]";
    try {
      MetricDefinitionParser.parseAll(new StringReader(definitions));
      fail("Should throw ConfigException");
    } catch (ConfigException e) {
      assertTrue(e.getMessage().contains("duplicate"));
    }
  }

  @Test(expected = ConfigException.class)
  public void testMalformedJson() {
    MetricDefinitionParser.parseAll(new StringReader("[{\"id\": "));
  }

  @Test(expected = ConfigException.class)
  public void testRootMustBeArray() {
    MetricDefinitionParser.parseAll(new StringReader(RELATIONAL_METRIC));
  }

  @Test
  public void testJsonFormIsAcceptedBack() {
    List<MetricDefinition> definitions =
        MetricDefinitionParser.parseAll(new StringReader("[" + RELATIONAL_METRIC + ", " + HTTP_METRIC + "]"));
    for (MetricDefinition definition : definitions) {
      assertEquals(definition, MetricDefinitionParser.parse(MetricDefinitionParser.toJson(definition)));
    }
  }
}
