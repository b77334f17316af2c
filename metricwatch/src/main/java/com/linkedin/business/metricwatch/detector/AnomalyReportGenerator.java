/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.metricwatch.common.MetricWatchConfigurable;
import com.linkedin.metricwatch.exception.MetricWatchException;
import java.util.List;


/**
 * Turns a batch of anomaly events into a report document.
 */
public interface AnomalyReportGenerator extends MetricWatchConfigurable {

  /**
   * @param anomalies Anomaly events to report on, oldest first.
   * @return A reference to the generated document.
   * @throws MetricWatchException If the report cannot be generated.
   */
  String generate(List<AnomalyEvent> anomalies) throws MetricWatchException;
}
