/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

import com.linkedin.business.metricwatch.detector.ModelState;
import com.linkedin.business.metricwatch.detector.notifier.AlertRecord;
import com.linkedin.business.metricwatch.exception.SourceException;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Poll health of a single metric. Updated by the worker of the metric, read by the management API.
 */
public class MetricHealth {
  private final String _metricId;
  private long _lastSuccessfulPollMs = -1L;
  private long _lastErrorMs = -1L;
  private String _lastError;
  private SourceException.Kind _lastErrorKind;
  private int _consecutiveFailures;
  private long _numPolls;
  private AlertRecord _lastAlert;

  public MetricHealth(String metricId) {
    _metricId = metricId;
  }

  public String metricId() {
    return _metricId;
  }

  synchronized void recordSuccess(long timeMs) {
    _numPolls++;
    _lastSuccessfulPollMs = timeMs;
    _consecutiveFailures = 0;
  }

  synchronized void recordFailure(long timeMs, SourceException e) {
    _numPolls++;
    _lastErrorMs = timeMs;
    _lastError = e.getMessage();
    _lastErrorKind = e.kind();
    _consecutiveFailures++;
  }

  synchronized void recordAlert(AlertRecord record) {
    _lastAlert = record;
  }

  public synchronized long lastSuccessfulPollMs() {
    return _lastSuccessfulPollMs;
  }

  public synchronized String lastError() {
    return _lastError;
  }

  public synchronized SourceException.Kind lastErrorKind() {
    return _lastErrorKind;
  }

  public synchronized int consecutiveFailures() {
    return _consecutiveFailures;
  }

  public synchronized long numPolls() {
    return _numPolls;
  }

  public synchronized AlertRecord lastAlert() {
    return _lastAlert;
  }

  /**
   * @param modelState Current model state of the metric.
   * @param windowSize Current baseline window size of the metric.
   * @return An object that can be further used to encode into JSON.
   */
  public synchronized Map<String, Object> getJsonStructure(ModelState modelState, int windowSize) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("metric_id", _metricId);
    json.put("last_successful_poll", _lastSuccessfulPollMs);
    json.put("num_polls", _numPolls);
    json.put("consecutive_failures", _consecutiveFailures);
    if (_lastError != null) {
      json.put("last_error", _lastError);
      json.put("last_error_kind", _lastErrorKind.name());
      json.put("last_error_time", _lastErrorMs);
    }
    json.put("model_state", modelState.name());
    json.put("window_size", windowSize);
    if (_lastAlert != null) {
      json.put("last_alert", _lastAlert.getJsonStructure());
    }
    return json;
  }
}
