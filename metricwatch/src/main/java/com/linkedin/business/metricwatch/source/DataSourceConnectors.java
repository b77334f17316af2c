/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.business.metricwatch.registry.SourceType;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;


/**
 * Routes each call to the connector registered for the type of the given source.
 */
public class DataSourceConnectors implements DataSourceConnector {
  private final Map<SourceType, DataSourceConnector> _connectors;

  public DataSourceConnectors(Map<SourceType, DataSourceConnector> connectors) {
    _connectors = Collections.unmodifiableMap(new EnumMap<>(connectors));
  }

  private DataSourceConnector connectorFor(DataSourceSpec spec) throws SourceException {
    DataSourceConnector connector = _connectors.get(spec.type());
    if (connector == null) {
      throw new SourceException(SourceException.Kind.NOT_FOUND, "No connector is registered for source type " + spec.type());
    }
    return connector;
  }

  @Override
  public double fetchCurrent(DataSourceSpec spec) throws SourceException {
    return connectorFor(spec).fetchCurrent(spec);
  }

  @Override
  public List<Sample> fetchHistorical(DataSourceSpec spec) throws SourceException {
    return connectorFor(spec).fetchHistorical(spec);
  }
}
