/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.ThresholdType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * An alert rendered for delivery: the anomaly event together with the human readable details of its metric.
 */
public final class RenderedAlert {
  private final String _metricName;
  private final ThresholdType _thresholdType;
  private final List<String> _recipients;
  private final AnomalyEvent _event;

  public RenderedAlert(MetricDefinition definition, AnomalyEvent event) {
    _metricName = definition.name();
    _thresholdType = definition.alert().thresholdType();
    _recipients = Collections.unmodifiableList(definition.alert().recipients());
    _event = event;
  }

  public String metricName() {
    return _metricName;
  }

  public List<String> recipients() {
    return _recipients;
  }

  public AnomalyEvent event() {
    return _event;
  }

  public String title() {
    return String.format("[%s] Anomaly detected on %s", _event.severity().name(), _metricName);
  }

  private String formattedDeviation() {
    return _thresholdType == ThresholdType.PERCENTAGE ? String.format("%+.2f%%", _event.deviation())
                                                      : String.format("%+.4f", _event.deviation());
  }

  /**
   * @return Plain text body of the alert.
   */
  public String text() {
    return String.format("Metric %s (%s) observed %.4f at %s, expected %.4f (deviation %s).%n"
                         + "Severity: %s, confidence: %.2f, scored by %s.",
                         _metricName, _event.metricId(), _event.value(), utcDateFor(_event.timestampMs()),
                         _event.expected(), formattedDeviation(), _event.severity().jsonName(), _event.confidence(),
                         _event.path().name().toLowerCase(Locale.ROOT));
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>(_event.getJsonStructure());
    json.put("metric_name", _metricName);
    json.put("threshold_type", _thresholdType.jsonName());
    json.put("title", title());
    json.put("recipients", _recipients);
    return json;
  }
}
