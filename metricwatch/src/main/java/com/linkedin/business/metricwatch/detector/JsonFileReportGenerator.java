/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.kafka.common.utils.Time;


/**
 * Writes anomaly reports as JSON documents into a directory. The reference of a report is the path of its file.
 * The directory is set by {@value #REPORT_DIRECTORY_CONFIG}.
 */
public class JsonFileReportGenerator implements AnomalyReportGenerator {
  public static final String REPORT_DIRECTORY_CONFIG = "anomaly.report.directory";
  public static final String DEFAULT_REPORT_DIRECTORY = "fileStore/reports";
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
  private final Time _time;
  private Path _directory;

  public JsonFileReportGenerator() {
    this(Time.SYSTEM);
  }

  public JsonFileReportGenerator(Time time) {
    _time = time;
    _directory = Paths.get(DEFAULT_REPORT_DIRECTORY);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object directory = configs.get(REPORT_DIRECTORY_CONFIG);
    if (directory != null) {
      _directory = Paths.get(directory.toString());
    }
  }

  @Override
  public String generate(List<AnomalyEvent> anomalies) throws MetricWatchException {
    long now = _time.milliseconds();
    Map<String, Integer> countByMetric = new TreeMap<>();
    List<Map<String, Object>> events = new ArrayList<>(anomalies.size());
    for (AnomalyEvent anomaly : anomalies) {
      countByMetric.merge(anomaly.metricId(), 1, Integer::sum);
      events.add(anomaly.getJsonStructure());
    }
    Map<String, Object> report = new LinkedHashMap<>();
    report.put("generated_at", now);
    report.put("num_anomalies", anomalies.size());
    report.put("anomalies_by_metric", countByMetric);
    report.put("anomalies", events);

    Path file = _directory.resolve("anomaly-report-" + now + ".json");
    try {
      Files.createDirectories(_directory);
      try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
        GSON.toJson(report, writer);
      }
    } catch (IOException e) {
      throw new MetricWatchException("Failed to write anomaly report " + file, e);
    }
    return file.toString();
  }
}
