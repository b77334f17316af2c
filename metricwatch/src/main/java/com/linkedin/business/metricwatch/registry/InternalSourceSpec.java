/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;


/**
 * A sensor of the process metric registry, read through an aggregation.
 */
public final class InternalSourceSpec implements DataSourceSpec {
  /**
   * Aggregations over a sensor. Not every aggregation applies to every sensor type.
   */
  public enum Aggregation {
    COUNT, MEAN, MIN, MAX, P95, P99, ONE_MINUTE_RATE, VALUE;

    public static Optional<Aggregation> forName(String name) {
      return Arrays.stream(values()).filter(a -> a.name().equalsIgnoreCase(name)).findFirst();
    }

    public String jsonName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String _counterKey;
  private final Aggregation _aggregation;

  public InternalSourceSpec(String counterKey, Aggregation aggregation) {
    _counterKey = counterKey;
    _aggregation = aggregation;
  }

  @Override
  public SourceType type() {
    return SourceType.INTERNAL;
  }

  public String counterKey() {
    return _counterKey;
  }

  public Aggregation aggregation() {
    return _aggregation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    InternalSourceSpec that = (InternalSourceSpec) o;
    return _counterKey.equals(that._counterKey) && _aggregation == that._aggregation;
  }

  @Override
  public int hashCode() {
    return Objects.hash(_counterKey, _aggregation);
  }

  @Override
  public String toString() {
    return String.format("InternalSourceSpec{%s(%s)}", _aggregation, _counterKey);
  }
}
