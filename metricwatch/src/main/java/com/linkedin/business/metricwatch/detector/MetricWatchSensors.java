/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.SENSOR_PREFIX;


/**
 * The sensors MetricWatch reports about itself.
 */
public class MetricWatchSensors {
  private final MetricRegistry _dropwizardMetricRegistry;
  private final Timer _pollTimer;
  private final Meter _pollFailures;
  private final Meter _anomalies;
  private final Meter _alertsDispatched;
  private final Meter _alertsSuppressed;
  private final Meter _alertsFailed;
  private final Meter _modelTrainings;
  private final Meter _modelTrainingFailures;

  public MetricWatchSensors(MetricRegistry dropwizardMetricRegistry) {
    _dropwizardMetricRegistry = dropwizardMetricRegistry;
    _pollTimer = dropwizardMetricRegistry.timer(MetricRegistry.name(SENSOR_PREFIX, "poll-timer"));
    _pollFailures = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "poll-failure-rate"));
    _anomalies = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "anomaly-rate"));
    _alertsDispatched = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "alert-dispatched-rate"));
    _alertsSuppressed = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "alert-suppressed-rate"));
    _alertsFailed = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "alert-failed-rate"));
    _modelTrainings = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "model-training-rate"));
    _modelTrainingFailures = dropwizardMetricRegistry.meter(MetricRegistry.name(SENSOR_PREFIX, "model-training-failure-rate"));
  }

  public MetricRegistry registry() {
    return _dropwizardMetricRegistry;
  }

  public Timer pollTimer() {
    return _pollTimer;
  }

  public Meter pollFailures() {
    return _pollFailures;
  }

  public Meter anomalies() {
    return _anomalies;
  }

  public Meter alertsDispatched() {
    return _alertsDispatched;
  }

  public Meter alertsSuppressed() {
    return _alertsSuppressed;
  }

  public Meter alertsFailed() {
    return _alertsFailed;
  }

  public Meter modelTrainings() {
    return _modelTrainings;
  }

  public Meter modelTrainingFailures() {
    return _modelTrainingFailures;
  }
}
