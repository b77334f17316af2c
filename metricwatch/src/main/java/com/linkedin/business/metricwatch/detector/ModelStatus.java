/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.business.metricwatch.registry.ScoringConfig.Feature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * A point-in-time view of the model of a metric.
 */
public final class ModelStatus {
  private final String _metricId;
  private final ModelState _state;
  private final ScorerModel _model;

  public ModelStatus(String metricId, ModelState state, ScorerModel model) {
    _metricId = metricId;
    _state = state;
    _model = model;
  }

  public String metricId() {
    return _metricId;
  }

  public ModelState state() {
    return _state;
  }

  public boolean trained() {
    return _model != null;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("metric_id", _metricId);
    json.put("trained", trained());
    json.put("state", _state.name());
    if (_model != null) {
      json.put("trained_at", _model.trainedAtMs());
      json.put("sample_count", _model.sampleCount());
      json.put("training_anomaly_rate", _model.trainingAnomalyRate());
      List<String> features = new ArrayList<>();
      for (Feature feature : _model.features()) {
        features.add(feature.jsonName());
      }
      json.put("features", features);
    }
    return json;
  }
}
