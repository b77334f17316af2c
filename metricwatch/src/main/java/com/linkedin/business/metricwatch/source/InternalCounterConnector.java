/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Counting;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Metered;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Sampling;
import com.codahale.metrics.Snapshot;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.business.metricwatch.registry.InternalSourceSpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.util.Collections;
import java.util.List;


/**
 * Reads sensors of the process metric registry. Sensors keep no history, so the historical series is always empty.
 */
public class InternalCounterConnector implements DataSourceConnector {
  private final MetricRegistry _metricRegistry;

  public InternalCounterConnector(MetricRegistry metricRegistry) {
    _metricRegistry = metricRegistry;
  }

  @Override
  public double fetchCurrent(DataSourceSpec spec) throws SourceException {
    InternalSourceSpec internal = (InternalSourceSpec) spec;
    Metric metric = _metricRegistry.getMetrics().get(internal.counterKey());
    if (metric == null) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "No sensor named " + internal.counterKey());
    }
    InternalSourceSpec.Aggregation aggregation = internal.aggregation();
    switch (aggregation) {
      case COUNT:
        if (metric instanceof Counting) {
          return ((Counting) metric).getCount();
        }
        break;
      case ONE_MINUTE_RATE:
        if (metric instanceof Metered) {
          return ((Metered) metric).getOneMinuteRate();
        }
        break;
      case MEAN:
      case MIN:
      case MAX:
      case P95:
      case P99:
        if (metric instanceof Sampling) {
          return fromSnapshot(((Sampling) metric).getSnapshot(), aggregation);
        }
        break;
      case VALUE:
        if (metric instanceof Gauge) {
          return SourceUtils.toValue(((Gauge<?>) metric).getValue());
        }
        if (metric instanceof Counter) {
          return ((Counter) metric).getCount();
        }
        break;
      default:
        break;
    }
    throw new SourceException(SourceException.Kind.PARSE, String.format("Aggregation %s does not apply to sensor %s of type %s.",
                                                                         aggregation, internal.counterKey(), metric.getClass().getSimpleName()));
  }

  private static double fromSnapshot(Snapshot snapshot, InternalSourceSpec.Aggregation aggregation) {
    switch (aggregation) {
      case MEAN:
        return snapshot.getMean();
      case MIN:
        return snapshot.getMin();
      case MAX:
        return snapshot.getMax();
      case P95:
        return snapshot.get95thPercentile();
      case P99:
        return snapshot.get99thPercentile();
      default:
        throw new IllegalArgumentException("Unsupported snapshot aggregation " + aggregation);
    }
  }

  @Override
  public List<Sample> fetchHistorical(DataSourceSpec spec) {
    return Collections.emptyList();
  }
}
