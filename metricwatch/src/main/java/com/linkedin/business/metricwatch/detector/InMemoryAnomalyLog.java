/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.ANOMALY_LOG_MAX_ENTRIES_CONFIG;
import static com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig.DEFAULT_ANOMALY_LOG_MAX_ENTRIES;


/**
 * An anomaly log holding the most recent events in memory. The oldest events are dropped beyond the configured
 * number of entries.
 */
public class InMemoryAnomalyLog implements AnomalyLog {
  protected final Deque<AnomalyEvent> _events;
  protected int _maxEntries;

  public InMemoryAnomalyLog() {
    _events = new ArrayDeque<>();
    _maxEntries = DEFAULT_ANOMALY_LOG_MAX_ENTRIES;
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object maxEntries = configs.get(ANOMALY_LOG_MAX_ENTRIES_CONFIG);
    if (maxEntries != null) {
      _maxEntries = Integer.parseInt(maxEntries.toString());
    }
  }

  @Override
  public synchronized void append(AnomalyEvent event) {
    _events.addLast(event);
    while (_events.size() > _maxEntries) {
      _events.removeFirst();
    }
  }

  @Override
  public synchronized List<AnomalyEvent> since(long sinceMs) {
    List<AnomalyEvent> events = new ArrayList<>();
    for (AnomalyEvent event : _events) {
      if (event.timestampMs() >= sinceMs) {
        events.add(event);
      }
    }
    return events;
  }

  @Override
  public synchronized int size() {
    return _events.size();
  }
}
