/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.util.List;


/**
 * Reads metric values from a data source. Every call is bounded by a timeout. Connectors do not retry; the caller
 * decides whether a {@link SourceException#isTransient() transient} failure is worth another attempt.
 */
public interface DataSourceConnector {

  /**
   * @param spec Source of the metric.
   * @return The current value of the metric.
   * @throws SourceException if the value cannot be read.
   */
  double fetchCurrent(DataSourceSpec spec) throws SourceException;

  /**
   * @param spec Source of the metric.
   * @return The historical series of the metric, ascending by timestamp. Empty if the source keeps no history.
   * @throws SourceException if the series cannot be read.
   */
  List<Sample> fetchHistorical(DataSourceSpec spec) throws SourceException;
}
