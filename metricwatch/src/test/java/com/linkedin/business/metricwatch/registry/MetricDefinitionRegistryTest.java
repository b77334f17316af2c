/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.metricDefinition;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.percentageAlert;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MetricDefinitionRegistryTest {
  private static final String DEFINITIONS =
      "[{\"id\": \"orders\", \"name\": \"Orders\","
      + "  \"source\": {\"type\": \"internal\", \"counter_key\": \"orders\", \"aggregation\": \"value\"},"
      + "  \"alert\": {\"severity\": \"high\", \"threshold_type\": \"percentage\", \"threshold_value\": 15},"
      + "  \"monitoring\": {\"poll_interval_seconds\": 60}},"
      + " {\"id\": \"refunds\", \"name\": \"Refunds\", \"enabled\": false,"
      + "  \"source\": {\"type\": \"internal\", \"counter_key\": \"refunds\", \"aggregation\": \"one_minute_rate\"},"
      + "  \"alert\": {\"severity\": \"low\", \"threshold_type\": \"absolute\", \"threshold_value\": 3},"
      + "  \"monitoring\": {\"poll_interval_seconds\": 60}}]";

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private MockTime _time;
  private MetricDefinitionRegistry _registry;

  @Before
  public void setUp() {
    _time = new MockTime(0, 1_700_000_000_000L, 0);
    _registry = new MetricDefinitionRegistry(_time);
  }

  @Test
  public void testLoad() {
    RegistrySnapshot snapshot = _registry.load(new StringReader(DEFINITIONS));
    assertSame(snapshot, _registry.snapshot());
    assertEquals(2, snapshot.size());
    assertEquals(1, _registry.listEnabled().size());
    assertEquals("orders", _registry.listEnabled().get(0).id());
    assertTrue(_registry.get("refunds").isPresent());
    assertEquals(_time.milliseconds(), snapshot.loadedAtMs());
  }

  @Test
  public void testInvalidLoadKeepsCurrentSnapshot() {
    RegistrySnapshot before = _registry.load(new StringReader(DEFINITIONS));
    try {
      _registry.load(new StringReader("[{\"id\": \"broken\"}]"));
      fail("Should throw ConfigException");
    } catch (ConfigException e) {
      assertTrue(e.getMessage().contains("broken"));
    }
    assertSame(before, _registry.snapshot());
  }

  @Test
  public void testLoadFile() throws IOException {
    File file = _folder.newFile("metrics.json");
    Files.write(file.toPath(), DEFINITIONS.getBytes(StandardCharsets.UTF_8));
    assertEquals(2, _registry.load(file.toPath()).size());
  }

  @Test(expected = ConfigException.class)
  public void testLoadMissingFile() throws IOException {
    _registry.load(_folder.getRoot().toPath().resolve("missing.json"));
  }

  @Test
  public void testPutAndRemovePublishNewSnapshots() {
    RegistrySnapshot before = _registry.load(new StringReader(DEFINITIONS));
    MetricDefinition signups = metricDefinition("signups", percentageAlert(Severity.MEDIUM));
    RegistrySnapshot after = _registry.put(signups);
    assertNotSame(before, after);
    assertEquals(2, before.size());
    assertEquals(3, after.size());
    assertEquals(signups, _registry.get("signups").get());

    assertTrue(_registry.remove("signups"));
    assertFalse(_registry.remove("signups"));
    assertFalse(_registry.get("signups").isPresent());
    assertTrue(after.get("signups").isPresent());
  }
}
