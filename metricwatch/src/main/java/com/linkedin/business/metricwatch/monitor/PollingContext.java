/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

import com.linkedin.business.metricwatch.baseline.BaselineStore;
import com.linkedin.business.metricwatch.detector.AnomalyLog;
import com.linkedin.business.metricwatch.detector.AnomalyScorer;
import com.linkedin.business.metricwatch.detector.MetricWatchSensors;
import com.linkedin.business.metricwatch.detector.ModelLifecycleManager;
import com.linkedin.business.metricwatch.detector.notifier.AlertDispatcher;
import com.linkedin.business.metricwatch.source.DataSourceConnector;
import java.time.ZoneId;
import org.apache.kafka.common.utils.Time;


/**
 * The collaborators every metric worker shares.
 */
public final class PollingContext {
  private final DataSourceConnector _connector;
  private final BaselineStore _baselineStore;
  private final AnomalyScorer _scorer;
  private final ModelLifecycleManager _lifecycleManager;
  private final AlertDispatcher _dispatcher;
  private final AnomalyLog _anomalyLog;
  private final MetricWatchSensors _sensors;
  private final RetryPolicy _retryPolicy;
  private final ZoneId _zone;
  private final Time _time;

  public PollingContext(DataSourceConnector connector,
                        BaselineStore baselineStore,
                        AnomalyScorer scorer,
                        ModelLifecycleManager lifecycleManager,
                        AlertDispatcher dispatcher,
                        AnomalyLog anomalyLog,
                        MetricWatchSensors sensors,
                        RetryPolicy retryPolicy,
                        ZoneId zone,
                        Time time) {
    _connector = connector;
    _baselineStore = baselineStore;
    _scorer = scorer;
    _lifecycleManager = lifecycleManager;
    _dispatcher = dispatcher;
    _anomalyLog = anomalyLog;
    _sensors = sensors;
    _retryPolicy = retryPolicy;
    _zone = zone;
    _time = time;
  }

  public DataSourceConnector connector() {
    return _connector;
  }

  public BaselineStore baselineStore() {
    return _baselineStore;
  }

  public AnomalyScorer scorer() {
    return _scorer;
  }

  public ModelLifecycleManager lifecycleManager() {
    return _lifecycleManager;
  }

  public AlertDispatcher dispatcher() {
    return _dispatcher;
  }

  public AnomalyLog anomalyLog() {
    return _anomalyLog;
  }

  public MetricWatchSensors sensors() {
    return _sensors;
  }

  public RetryPolicy retryPolicy() {
    return _retryPolicy;
  }

  public ZoneId zone() {
    return _zone;
  }

  public Time time() {
    return _time;
  }
}
