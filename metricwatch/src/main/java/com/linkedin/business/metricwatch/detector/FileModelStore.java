/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.DEFAULT_MODEL_STORE_DIRECTORY;
import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.MODEL_STORE_DIRECTORY_CONFIG;


/**
 * A model store that keeps one JSON file per metric, named after the metric id, in the directory set by
 * {@value com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig#MODEL_STORE_DIRECTORY_CONFIG}.
 * A model is written to a temporary file first and then moved over the previous one.
 */
public class FileModelStore implements ModelStore {
  private static final Logger LOG = LoggerFactory.getLogger(FileModelStore.class);
  static final String MODEL_FILE_SUFFIX = ".json";
  private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();
  private Path _directory;

  @Override
  public void configure(Map<String, ?> configs) {
    Object directory = configs.get(MODEL_STORE_DIRECTORY_CONFIG);
    _directory = Paths.get(directory == null ? DEFAULT_MODEL_STORE_DIRECTORY : directory.toString());
    try {
      Files.createDirectories(_directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create model store directory " + _directory, e);
    }
  }

  private Path modelFile(String metricId) {
    return _directory.resolve(metricId + MODEL_FILE_SUFFIX);
  }

  @Override
  public synchronized void storeModel(ScorerModel model) throws MetricWatchException {
    Path file = modelFile(model.metricId());
    Path tmp = _directory.resolve(model.metricId() + MODEL_FILE_SUFFIX + ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        GSON.toJson(model, writer);
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new MetricWatchException("Failed to store the model of metric " + model.metricId() + " to " + file, e);
    }
    LOG.debug("Stored model of metric {} to {}.", model.metricId(), file);
  }

  @Override
  public synchronized List<ScorerModel> loadModels() throws MetricWatchException {
    List<ScorerModel> models = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(_directory, "*" + MODEL_FILE_SUFFIX)) {
      for (Path file : files) {
        ScorerModel model = readModel(file);
        if (model != null) {
          models.add(model);
        }
      }
    } catch (IOException e) {
      throw new MetricWatchException("Failed to list the models in " + _directory, e);
    }
    LOG.info("Loaded {} models from {}.", models.size(), _directory);
    return models;
  }

  private static ScorerModel readModel(Path file) {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      ScorerModel model = GSON.fromJson(reader, ScorerModel.class);
      if (model == null || model.metricId() == null || model.forest() == null || model.standardizer() == null) {
        LOG.warn("Skip incomplete model file {}.", file);
        return null;
      }
      return model;
    } catch (IOException | JsonParseException e) {
      LOG.warn("Skip unreadable model file {}.", file, e);
      return null;
    }
  }

  @Override
  public synchronized void deleteModel(String metricId) {
    Path file = modelFile(metricId);
    try {
      if (Files.deleteIfExists(file)) {
        LOG.info("Deleted stored model of metric {}.", metricId);
      }
    } catch (IOException e) {
      LOG.warn("Failed to delete stored model {}.", file, e);
    }
  }

  @Override
  public synchronized int evictModelsBefore(long timestampMs) {
    int evicted = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(_directory, "*" + MODEL_FILE_SUFFIX)) {
      for (Path file : files) {
        ScorerModel model = readModel(file);
        if (model != null && model.trainedAtMs() < timestampMs) {
          Files.deleteIfExists(file);
          evicted++;
          LOG.info("Evicted model of metric {} trained at {}.", model.metricId(), model.trainedAtMs());
        }
      }
    } catch (IOException e) {
      LOG.warn("Failed to evict old models from {}.", _directory, e);
    }
    return evicted;
  }
}
