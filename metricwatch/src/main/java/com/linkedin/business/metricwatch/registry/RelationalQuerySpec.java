/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Objects;


/**
 * A SQL query against a connection of the connection registry. The current value is read from the value column of
 * the first row.
 */
public final class RelationalQuerySpec implements DataSourceSpec {
  private final String _connectionId;
  private final String _query;
  private final String _valueColumn;
  private final String _timestampColumn;
  private final String _historicalQuery;

  public RelationalQuerySpec(String connectionId, String query, String valueColumn, String timestampColumn, String historicalQuery) {
    _connectionId = connectionId;
    _query = query;
    _valueColumn = valueColumn;
    _timestampColumn = timestampColumn;
    _historicalQuery = historicalQuery;
  }

  @Override
  public SourceType type() {
    return SourceType.RELATIONAL;
  }

  public String connectionId() {
    return _connectionId;
  }

  public String query() {
    return _query;
  }

  public String valueColumn() {
    return _valueColumn;
  }

  /**
   * @return The column holding row timestamps in historical results, or {@code null}.
   */
  public String timestampColumn() {
    return _timestampColumn;
  }

  /**
   * @return The query returning the historical series, or {@code null} if the source has no history.
   */
  public String historicalQuery() {
    return _historicalQuery;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    RelationalQuerySpec that = (RelationalQuerySpec) o;
    return _connectionId.equals(that._connectionId) && _query.equals(that._query) && _valueColumn.equals(that._valueColumn)
           && Objects.equals(_timestampColumn, that._timestampColumn) && Objects.equals(_historicalQuery, that._historicalQuery);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_connectionId, _query, _valueColumn, _timestampColumn, _historicalQuery);
  }

  @Override
  public String toString() {
    return String.format("RelationalQuerySpec{connectionId=%s, valueColumn=%s}", _connectionId, _valueColumn);
  }
}
