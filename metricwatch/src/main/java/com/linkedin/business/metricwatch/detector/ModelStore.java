/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.metricwatch.common.MetricWatchConfigurable;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.util.List;


/**
 * Persists trained models so that a restarted MetricWatch scores with them before its first retrain.
 */
public interface ModelStore extends MetricWatchConfigurable {

  /**
   * Store the given model, replacing the stored model of the same metric.
   *
   * @param model The model to store.
   * @throws MetricWatchException If the model cannot be stored.
   */
  void storeModel(ScorerModel model) throws MetricWatchException;

  /**
   * Load every stored model.
   *
   * @return The stored models. Unreadable models are skipped.
   * @throws MetricWatchException If the store cannot be read.
   */
  List<ScorerModel> loadModels() throws MetricWatchException;

  /**
   * Delete the stored model of the given metric, if any.
   *
   * @param metricId Id of the metric.
   */
  void deleteModel(String metricId);

  /**
   * Delete the stored models trained before the given time.
   *
   * @param timestampMs Models trained before this time are deleted.
   * @return Number of deleted models.
   */
  int evictModelsBefore(long timestampMs);
}
