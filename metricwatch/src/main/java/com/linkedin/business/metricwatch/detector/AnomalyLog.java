/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.metricwatch.common.MetricWatchConfigurable;
import java.util.List;


/**
 * Keeps the detected anomaly events so they can be queried by time.
 */
public interface AnomalyLog extends MetricWatchConfigurable {

  /**
   * Record an anomaly event.
   *
   * @param event Event to record.
   */
  void append(AnomalyEvent event);

  /**
   * @param sinceMs Lower bound of event timestamps, inclusive.
   * @return Recorded events with a timestamp at or after the given time, oldest first.
   */
  List<AnomalyEvent> since(long sinceMs);

  /**
   * @return Number of recorded events.
   */
  int size();
}
