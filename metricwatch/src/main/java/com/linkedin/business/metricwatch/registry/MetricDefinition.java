/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Objects;
import java.util.regex.Pattern;


/**
 * What to monitor, how to read it, how to score it, when to alert on it and when to poll it. Definitions are
 * immutable and compared by value, so an unchanged definition can be recognized across reloads.
 */
public final class MetricDefinition {
  public static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");
  private final String _id;
  private final String _name;
  private final String _description;
  private final boolean _enabled;
  private final DataSourceSpec _source;
  private final HistoricalSpec _historical;
  private final ScoringConfig _scoring;
  private final AlertConfig _alert;
  private final MonitoringConfig _monitoring;

  public MetricDefinition(String id,
                          String name,
                          String description,
                          boolean enabled,
                          DataSourceSpec source,
                          HistoricalSpec historical,
                          ScoringConfig scoring,
                          AlertConfig alert,
                          MonitoringConfig monitoring) {
    _id = id;
    _name = name;
    _description = description;
    _enabled = enabled;
    _source = source;
    _historical = historical;
    _scoring = scoring;
    _alert = alert;
    _monitoring = monitoring;
  }

  public String id() {
    return _id;
  }

  public String name() {
    return _name;
  }

  public String description() {
    return _description;
  }

  public boolean enabled() {
    return _enabled;
  }

  public DataSourceSpec source() {
    return _source;
  }

  public HistoricalSpec historical() {
    return _historical;
  }

  public ScoringConfig scoring() {
    return _scoring;
  }

  public AlertConfig alert() {
    return _alert;
  }

  public MonitoringConfig monitoring() {
    return _monitoring;
  }

  /**
   * @param enabled New enabled flag.
   * @return A copy of this definition with the given enabled flag.
   */
  public MetricDefinition withEnabled(boolean enabled) {
    return new MetricDefinition(_id, _name, _description, enabled, _source, _historical, _scoring, _alert, _monitoring);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    MetricDefinition that = (MetricDefinition) o;
    return _enabled == that._enabled && _id.equals(that._id) && _name.equals(that._name) && _description.equals(that._description)
           && _source.equals(that._source) && _historical.equals(that._historical) && _scoring.equals(that._scoring)
           && _alert.equals(that._alert) && _monitoring.equals(that._monitoring);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_id, _name, _description, _enabled, _source, _historical, _scoring, _alert, _monitoring);
  }

  @Override
  public String toString() {
    return String.format("MetricDefinition{id=%s, enabled=%s, source=%s}", _id, _enabled, _source);
  }
}
