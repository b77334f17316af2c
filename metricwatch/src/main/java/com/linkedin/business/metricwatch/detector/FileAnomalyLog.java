/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.ANOMALY_LOG_FILE_PATH_CONFIG;
import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.DEFAULT_ANOMALY_LOG_FILE_PATH;


/**
 * An anomaly log that also appends every event as a JSON line to a file. On configure, the most recent events of an
 * existing file are loaded back into memory.
 */
public class FileAnomalyLog extends InMemoryAnomalyLog {
  private static final Logger LOG = LoggerFactory.getLogger(FileAnomalyLog.class);
  private static final Gson GSON = new Gson();
  private Path _file;

  @Override
  public void configure(Map<String, ?> configs) {
    super.configure(configs);
    Object path = configs.get(ANOMALY_LOG_FILE_PATH_CONFIG);
    _file = Paths.get(path == null ? DEFAULT_ANOMALY_LOG_FILE_PATH : path.toString());
    try {
      Path parent = _file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (Files.exists(_file)) {
        load();
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open anomaly log " + _file, e);
    }
  }

  private void load() throws IOException {
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(_file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          JsonObject json = JsonParser.parseString(line).getAsJsonObject();
          super.append(AnomalyEvent.fromJson(json));
        } catch (JsonParseException | IllegalStateException | IllegalArgumentException | NullPointerException e) {
          LOG.warn("Skip malformed line {} of anomaly log {}.", lineNumber, _file, e);
        }
      }
    }
    LOG.info("Loaded {} anomaly events from {}.", size(), _file);
  }

  @Override
  public synchronized void append(AnomalyEvent event) {
    super.append(event);
    try (BufferedWriter writer = Files.newBufferedWriter(_file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                                                         StandardOpenOption.APPEND)) {
      writer.write(GSON.toJson(event.getJsonStructure()));
      writer.newLine();
    } catch (IOException e) {
      LOG.warn("Failed to persist anomaly event {} to {}.", event, _file, e);
    }
  }
}
