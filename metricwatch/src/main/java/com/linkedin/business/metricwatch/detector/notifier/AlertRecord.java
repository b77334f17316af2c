/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.registry.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * A write-once record of an alert that passed the dispatch gates, whether or not any channel delivered it.
 */
public final class AlertRecord {
  public enum Status {
    DISPATCHED, FAILED
  }

  private final String _metricId;
  private final long _createdMs;
  private final long _eventTimestampMs;
  private final Severity _severity;
  private final Map<String, ChannelDeliveryResult> _deliveries;
  private final Status _status;

  /**
   * @param metricId Metric id.
   * @param createdMs Time the record was created, the start of its cooldown.
   * @param eventTimestampMs Timestamp of the anomaly event.
   * @param severity Severity of the alert.
   * @param deliveries Delivery result by channel name, in the order the channels were attempted.
   */
  public AlertRecord(String metricId,
                     long createdMs,
                     long eventTimestampMs,
                     Severity severity,
                     Map<String, ChannelDeliveryResult> deliveries) {
    _metricId = metricId;
    _createdMs = createdMs;
    _eventTimestampMs = eventTimestampMs;
    _severity = severity;
    _deliveries = Collections.unmodifiableMap(new LinkedHashMap<>(deliveries));
    _status = deliveries.values().stream().anyMatch(ChannelDeliveryResult::isDelivered) ? Status.DISPATCHED
                                                                                        : Status.FAILED;
  }

  public String metricId() {
    return _metricId;
  }

  public long createdMs() {
    return _createdMs;
  }

  public long eventTimestampMs() {
    return _eventTimestampMs;
  }

  public Severity severity() {
    return _severity;
  }

  public List<String> channelsAttempted() {
    return new ArrayList<>(_deliveries.keySet());
  }

  public Map<String, ChannelDeliveryResult> deliveries() {
    return _deliveries;
  }

  public Status status() {
    return _status;
  }

  public String dedupKey() {
    return _metricId + ":" + _severity.jsonName() + ":" + _eventTimestampMs;
  }

  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("metric_id", _metricId);
    json.put("created_at", _createdMs);
    json.put("timestamp", _eventTimestampMs);
    json.put("severity", _severity.jsonName());
    json.put("dedup_key", dedupKey());
    json.put("status", _status.name());
    List<Map<String, Object>> deliveries = new ArrayList<>();
    _deliveries.values().forEach(d -> deliveries.add(d.getJsonStructure()));
    json.put("deliveries", deliveries);
    return json;
  }

  @Override
  public String toString() {
    return String.format("AlertRecord{%s, status=%s, deliveries=%s}", dedupKey(), _status, _deliveries.values());
  }
}
