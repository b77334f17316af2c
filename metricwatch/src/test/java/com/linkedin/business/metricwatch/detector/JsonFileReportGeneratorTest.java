/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.business.metricwatch.registry.Severity;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class JsonFileReportGeneratorTest {
  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();

  @Test
  public void testGenerate() throws MetricWatchException, IOException {
    MockTime time = new MockTime(0, 1_700_000_000_000L, 0);
    JsonFileReportGenerator generator = new JsonFileReportGenerator(time);
    File directory = new File(_folder.getRoot(), "reports");
    generator.configure(Collections.singletonMap(JsonFileReportGenerator.REPORT_DIRECTORY_CONFIG,
                                                 directory.getAbsolutePath()));

    String reference = generator.generate(Arrays.asList(
        new AnomalyEvent("orders", 1000L, 60.0, 100.0, -40.0, -0.3, Severity.CRITICAL, 0.9, ScoringPath.MODEL),
        new AnomalyEvent("orders", 2000L, 140.0, 100.0, 40.0, -0.3, Severity.CRITICAL, 0.9, ScoringPath.MODEL),
        new AnomalyEvent("signups", 3000L, 5.0, 20.0, -15.0, 0.0, Severity.LOW, 0.4, ScoringPath.FALLBACK)));

    Path report = Paths.get(reference);
    assertTrue(Files.exists(report));
    assertEquals("anomaly-report-1700000000000.json", report.getFileName().toString());
    JsonObject json = JsonParser.parseString(new String(Files.readAllBytes(report), StandardCharsets.UTF_8))
                                .getAsJsonObject();
    assertEquals(3, json.get("num_anomalies").getAsInt());
    assertEquals(2, json.getAsJsonObject("anomalies_by_metric").get("orders").getAsInt());
    assertEquals(3, json.getAsJsonArray("anomalies").size());
  }

  @Test(expected = MetricWatchException.class)
  public void testUnwritableDirectory() throws MetricWatchException, IOException {
    File notADirectory = _folder.newFile("reports");
    JsonFileReportGenerator generator = new JsonFileReportGenerator();
    generator.configure(Collections.singletonMap(JsonFileReportGenerator.REPORT_DIRECTORY_CONFIG,
                                                 notADirectory.getAbsolutePath()));
    generator.generate(Collections.emptyList());
  }
}
