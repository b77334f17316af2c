/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.source;

import com.linkedin.business.metricwatch.config.ConnectionRegistry;
import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.RelationalQuerySpec;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Unit test for {@link RelationalQueryConnector} against an in-memory H2 database.
 */
public class RelationalQueryConnectorTest {
  private static final String URL = "jdbc:h2:mem:metricwatch_orders;DB_CLOSE_DELAY=-1";
  private static final String USER = "sa";
  private static final String PASSWORD = "orders-secret";
  private static final String PASSWORD_ENV = "METRICWATCH_TEST_ORDERS_DB_PASSWORD";
  private Connection _keepAlive;
  private RelationalQueryConnector _connector;

  @Before
  public void setUp() throws SQLException {
    _keepAlive = DriverManager.getConnection(URL, USER, PASSWORD);
    try (Statement statement = _keepAlive.createStatement()) {
      statement.execute("DROP TABLE IF EXISTS daily_totals");
      statement.execute("CREATE TABLE daily_totals (recorded_at_ms BIGINT, total DOUBLE)");
      statement.execute("INSERT INTO daily_totals VALUES (3000, 103.0), (1000, 101.0), (2000, NULL), (4000, 99.5)");
    }
    Map<String, ConnectionRegistry.ConnectionInfo> connections = new HashMap<>();
    connections.put("orders_db", new ConnectionRegistry.ConnectionInfo(URL, USER, PASSWORD_ENV, 5000L));
    connections.put("wrong_password", new ConnectionRegistry.ConnectionInfo(URL, USER, "METRICWATCH_TEST_WRONG", null));
    connections.put("no_password_env", new ConnectionRegistry.ConnectionInfo(URL, USER, "METRICWATCH_TEST_UNSET", null));
    Map<String, String> env = new HashMap<>();
    env.put(PASSWORD_ENV, PASSWORD);
    env.put("METRICWATCH_TEST_WRONG", "not-the-password");
    _connector = new RelationalQueryConnector(new ConnectionRegistry(connections), new EnvResolver(env), 10_000L,
                                              ZoneOffset.UTC);
  }

  @After
  public void tearDown() throws SQLException {
    try (Statement statement = _keepAlive.createStatement()) {
      statement.execute("DROP TABLE IF EXISTS daily_totals");
    }
    _keepAlive.close();
  }

  private static RelationalQuerySpec query(String connectionId, String query) {
    return new RelationalQuerySpec(connectionId, query, "total", "recorded_at_ms",
                                   "SELECT recorded_at_ms, total FROM daily_totals");
  }

  private void assertFailsWith(RelationalQuerySpec spec, SourceException.Kind kind) {
    try {
      _connector.fetchCurrent(spec);
      fail("Should throw SourceException");
    } catch (SourceException e) {
      assertEquals(e.getMessage(), kind, e.kind());
    }
  }

  @Test
  public void testFetchCurrent() throws SourceException {
    RelationalQuerySpec spec = query("orders_db", "SELECT total FROM daily_totals ORDER BY recorded_at_ms DESC LIMIT 1");
    assertEquals(99.5, _connector.fetchCurrent(spec), 0.0);
  }

  @Test
  public void testFetchHistoricalIsAscendingAndSkipsNulls() throws SourceException {
    List<Sample> samples = _connector.fetchHistorical(query("orders_db", "SELECT 1 AS total"));
    assertEquals(3, samples.size());
    assertEquals(new Sample(1000L, 101.0), samples.get(0));
    assertEquals(new Sample(3000L, 103.0), samples.get(1));
    assertEquals(new Sample(4000L, 99.5), samples.get(2));
  }

  @Test
  public void testNoHistoricalQuery() throws SourceException {
    RelationalQuerySpec spec = new RelationalQuerySpec("orders_db", "SELECT 1 AS total", "total", null, null);
    assertTrue(_connector.fetchHistorical(spec).isEmpty());
  }

  @Test
  public void testFailureKinds() {
    assertFailsWith(query("orders_db", "SELECT total FROM daily_totals WHERE total > 1000"),
                    SourceException.Kind.NOT_FOUND);
    assertFailsWith(query("orders_db", "SELECT total FROM daily_totals WHERE recorded_at_ms = 2000"),
                    SourceException.Kind.NOT_FOUND);
    assertFailsWith(query("orders_db", "SELECT total FROM no_such_table"), SourceException.Kind.PARSE);
    assertFailsWith(query("unknown_db", "SELECT 1 AS total"), SourceException.Kind.NOT_FOUND);
    assertFailsWith(query("wrong_password", "SELECT 1 AS total"), SourceException.Kind.AUTH);
    assertFailsWith(query("no_password_env", "SELECT 1 AS total"), SourceException.Kind.AUTH);
    assertFailsWith(query("orders_db", "SELECT 'n/a' AS total"), SourceException.Kind.PARSE);
  }

  @Test
  public void testTranslate() {
    RelationalQuerySpec spec = query("orders_db", "SELECT 1");
    assertEquals(SourceException.Kind.TIMEOUT,
                 RelationalQueryConnector.translate(spec, new SQLTimeoutException("timeout")).kind());
    assertEquals(SourceException.Kind.AUTH,
                 RelationalQueryConnector.translate(spec, new SQLInvalidAuthorizationSpecException("denied")).kind());
    assertEquals(SourceException.Kind.CONNECTION,
                 RelationalQueryConnector.translate(spec, new SQLNonTransientConnectionException("refused")).kind());
    assertEquals(SourceException.Kind.CONNECTION,
                 RelationalQueryConnector.translate(spec, new SQLException("refused", "08001")).kind());
    assertTrue(RelationalQueryConnector.translate(spec, new SQLTimeoutException("timeout")).isTransient());
  }
}
