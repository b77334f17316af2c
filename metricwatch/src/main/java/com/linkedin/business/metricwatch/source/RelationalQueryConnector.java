/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.config.ConnectionRegistry;
import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.DataSourceSpec;
import com.linkedin.business.metricwatch.registry.RelationalQuerySpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs SQL queries through JDBC against a connection of the {@link ConnectionRegistry}. A new connection is opened
 * for every call and closed before it returns.
 */
public class RelationalQueryConnector implements DataSourceConnector {
  private static final Logger LOG = LoggerFactory.getLogger(RelationalQueryConnector.class);
  private static final String SQL_STATE_AUTH_CLASS = "28";
  private static final String SQL_STATE_CONNECTION_CLASS = "08";
  private final ConnectionRegistry _connections;
  private final EnvResolver _env;
  private final long _defaultTimeoutMs;
  private final ZoneId _zone;

  public RelationalQueryConnector(ConnectionRegistry connections, EnvResolver env, long defaultTimeoutMs, ZoneId zone) {
    _connections = connections;
    _env = env;
    _defaultTimeoutMs = defaultTimeoutMs;
    _zone = zone;
  }

  @Override
  public double fetchCurrent(DataSourceSpec spec) throws SourceException {
    RelationalQuerySpec query = (RelationalQuerySpec) spec;
    ConnectionRegistry.ConnectionInfo info = connectionInfo(query);
    try (Connection connection = connect(info);
         Statement statement = connection.createStatement()) {
      statement.setQueryTimeout(timeoutSeconds(info));
      try (ResultSet resultSet = statement.executeQuery(query.query())) {
        if (!resultSet.next()) {
          throw new SourceException(SourceException.Kind.NOT_FOUND, "Query on " + query.connectionId() + " returned no rows.");
        }
        return SourceUtils.toValue(resultSet.getObject(query.valueColumn()));
      }
    } catch (SQLException e) {
      throw translate(query, e);
    }
  }

  @Override
  public List<Sample> fetchHistorical(DataSourceSpec spec) throws SourceException {
    RelationalQuerySpec query = (RelationalQuerySpec) spec;
    if (query.historicalQuery() == null || query.timestampColumn() == null) {
      return Collections.emptyList();
    }
    ConnectionRegistry.ConnectionInfo info = connectionInfo(query);
    List<Sample> samples = new ArrayList<>();
    try (Connection connection = connect(info);
         Statement statement = connection.createStatement()) {
      statement.setQueryTimeout(timeoutSeconds(info));
      try (ResultSet resultSet = statement.executeQuery(query.historicalQuery())) {
        while (resultSet.next()) {
          Object value = resultSet.getObject(query.valueColumn());
          if (value == null) {
            LOG.debug("Skipping a historical row without value from {}.", query.connectionId());
            continue;
          }
          samples.add(new Sample(SourceUtils.toEpochMs(resultSet.getObject(query.timestampColumn()), _zone), SourceUtils.toValue(value)));
        }
      }
    } catch (SQLException e) {
      throw translate(query, e);
    }
    return SourceUtils.ascending(samples);
  }

  private ConnectionRegistry.ConnectionInfo connectionInfo(RelationalQuerySpec query) throws SourceException {
    return _connections.get(query.connectionId()).orElseThrow(
        () -> new SourceException(SourceException.Kind.NOT_FOUND, "Unknown connection id " + query.connectionId()));
  }

  private Connection connect(ConnectionRegistry.ConnectionInfo info) throws SQLException, SourceException {
    String password;
    try {
      password = info.password(_env);
    } catch (IllegalStateException e) {
      throw new SourceException(SourceException.Kind.AUTH, e.getMessage(), e);
    }
    return DriverManager.getConnection(info.url(), info.username(), password);
  }

  private int timeoutSeconds(ConnectionRegistry.ConnectionInfo info) {
    long timeoutMs = info.timeoutMs() != null ? info.timeoutMs() : _defaultTimeoutMs;
    return (int) Math.max(1, (timeoutMs + 999) / 1000);
  }

  static SourceException translate(RelationalQuerySpec query, SQLException e) {
    String message = String.format("Query on connection %s failed: %s", query.connectionId(), e.getMessage());
    String sqlState = e.getSQLState() == null ? "" : e.getSQLState();
    SourceException.Kind kind;
    if (e instanceof SQLTimeoutException) {
      kind = SourceException.Kind.TIMEOUT;
    } else if (e instanceof SQLInvalidAuthorizationSpecException || sqlState.startsWith(SQL_STATE_AUTH_CLASS)) {
      kind = SourceException.Kind.AUTH;
    } else if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException
               || sqlState.startsWith(SQL_STATE_CONNECTION_CLASS)) {
      kind = SourceException.Kind.CONNECTION;
    } else {
      kind = SourceException.Kind.PARSE;
    }
    return new SourceException(kind, message, e);
  }
}
