/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.business.metricwatch.baseline.BaselineStore;
import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.AnomalyScorer;
import com.linkedin.business.metricwatch.detector.InMemoryAnomalyLog;
import com.linkedin.business.metricwatch.detector.MetricWatchSensors;
import com.linkedin.business.metricwatch.detector.ModelLifecycleManager;
import com.linkedin.business.metricwatch.detector.notifier.AlertChannel;
import com.linkedin.business.metricwatch.detector.notifier.AlertDispatcher;
import com.linkedin.business.metricwatch.detector.notifier.AlertRecord;
import com.linkedin.business.metricwatch.detector.notifier.RenderedAlert;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.ActiveHours;
import com.linkedin.business.metricwatch.registry.HistoricalSpec;
import com.linkedin.business.metricwatch.registry.InternalSourceSpec;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.MetricDefinitionRegistry;
import com.linkedin.business.metricwatch.registry.MonitoringConfig;
import com.linkedin.business.metricwatch.registry.ScoringConfig;
import com.linkedin.business.metricwatch.registry.Severity;
import com.linkedin.business.metricwatch.source.DataSourceConnector;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.easymock.EasyMock;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.POLL_INTERVAL_SECONDS;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.alternating;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.metricDefinition;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.percentageAlert;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.samples;
import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link MetricWorker}.
 */
public class MetricWorkerTest {
  // 2023-11-14T22:13:20Z, a Tuesday.
  private static final long START_MS = 1_700_000_000_000L;
  private MockTime _time;
  private DataSourceConnector _connector;
  private BaselineStore _baselineStore;
  private InMemoryAnomalyLog _anomalyLog;
  private MetricWatchSensors _sensors;
  private List<RenderedAlert> _delivered;
  private AlertDispatcher _dispatcher;
  private MetricDefinitionRegistry _registry;
  private PollingContext _context;

  @Before
  public void setUp() {
    _time = new MockTime(0, START_MS, 0);
    _connector = EasyMock.mock(DataSourceConnector.class);
    _registry = new MetricDefinitionRegistry(_time);
    _baselineStore = new BaselineStore(id -> _registry.get(id).map(MetricDefinition::historical).orElse(null));
    _anomalyLog = new InMemoryAnomalyLog();
    _sensors = new MetricWatchSensors(new MetricRegistry());
    _delivered = new ArrayList<>();
    AlertChannel channel = new AlertChannel() {
      @Override
      public void configure(Map<String, ?> configs) {

      }

      @Override
      public String name() {
        return "test";
      }

      @Override
      public void deliver(RenderedAlert alert) {
        _delivered.add(alert);
      }
    };
    _dispatcher = new AlertDispatcher(Collections.singletonList(channel), 10, _time, _sensors);
    AnomalyScorer scorer = new AnomalyScorer(ZoneOffset.UTC, _time);
    ModelLifecycleManager lifecycleManager = new ModelLifecycleManager(scorer, _baselineStore, _registry, _time,
                                                                       TimeUnit.DAYS.toMillis(1), 1000, _sensors);
    _context = new PollingContext(_connector, _baselineStore, scorer, lifecycleManager, _dispatcher, _anomalyLog,
                                  _sensors, new RetryPolicy(3, 10L, 40L), ZoneOffset.UTC, _time);
  }

  @After
  public void tearDown() {
    EasyMock.verify(_connector);
  }

  private MetricDefinition register(MetricDefinition definition) {
    _registry.put(definition);
    return definition;
  }

  @Test
  public void testTransientFailuresExhaustRetries() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    _baselineStore.appendAll("orders", samples(START_MS - 3_600_000L, alternating(10, 98, 102)));
    expect(_connector.fetchCurrent(definition.source()))
        .andThrow(new SourceException(SourceException.Kind.TIMEOUT, "query timed out")).times(3);
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    MetricWorker worker = new MetricWorker(definition, _context, health);
    assertEquals(PollOutcome.SKIPPED, worker.poll());

    assertEquals(10, _baselineStore.size("orders"));
    assertEquals(1, health.consecutiveFailures());
    assertEquals(SourceException.Kind.TIMEOUT, health.lastErrorKind());
    assertTrue(health.lastError().contains("query timed out"));
    assertEquals(-1L, health.lastSuccessfulPollMs());
    // Backoffs of 10 and 20 ms between the three attempts.
    assertEquals(START_MS + 30L, _time.milliseconds());
    assertEquals(1L, _sensors.pollFailures().getCount());
    assertEquals(0, _anomalyLog.size());
  }

  @Test
  public void testPermanentFailureIsNotRetried() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    expect(_connector.fetchCurrent(definition.source()))
        .andThrow(new SourceException(SourceException.Kind.AUTH, "bad credentials"));
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    assertEquals(PollOutcome.SKIPPED, new MetricWorker(definition, _context, health).poll());
    assertEquals(SourceException.Kind.AUTH, health.lastErrorKind());
    assertEquals(START_MS, _time.milliseconds());
  }

  @Test
  public void testTransientFailureThenSuccess() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    expect(_connector.fetchCurrent(definition.source()))
        .andThrow(new SourceException(SourceException.Kind.CONNECTION, "connection refused"));
    expect(_connector.fetchCurrent(definition.source())).andReturn(101.0);
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    assertEquals(PollOutcome.NORMAL, new MetricWorker(definition, _context, health).poll());
    assertEquals(1, _baselineStore.size("orders"));
    assertEquals(0, health.consecutiveFailures());
    assertEquals(START_MS + 10L, health.lastSuccessfulPollMs());
  }

  @Test
  public void testAnomalyIsLoggedAndAlerted() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    _baselineStore.appendAll("orders", samples(START_MS - 3_600_000L, alternating(30, 98, 102)));
    expect(_connector.fetchCurrent(definition.source())).andReturn(60.0);
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    assertEquals(PollOutcome.ANOMALY, new MetricWorker(definition, _context, health).poll());

    assertEquals(1, _anomalyLog.size());
    AnomalyEvent event = _anomalyLog.since(0L).get(0);
    assertEquals(-40.0, event.deviation(), 1e-9);
    assertEquals(100.0, event.expected(), 1e-9);
    // 40% is more than twice the 15% threshold, so HIGH escalates one level.
    assertEquals(Severity.CRITICAL, event.severity());
    assertEquals(1, _delivered.size());
    AlertRecord record = health.lastAlert();
    assertNotNull(record);
    assertEquals(AlertRecord.Status.DISPATCHED, record.status());
    assertEquals(31, _baselineStore.size("orders"));
    assertEquals(1L, _sensors.anomalies().getCount());
  }

  @Test
  public void testNormalValueIsAppendedWithoutAlert() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    _baselineStore.appendAll("orders", samples(START_MS - 3_600_000L, alternating(30, 98, 102)));
    expect(_connector.fetchCurrent(definition.source())).andReturn(103.0);
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    assertEquals(PollOutcome.NORMAL, new MetricWorker(definition, _context, health).poll());
    assertEquals(31, _baselineStore.size("orders"));
    assertEquals(0, _anomalyLog.size());
    assertNull(health.lastAlert());
    assertTrue(_delivered.isEmpty());
  }

  @Test
  public void testInactiveHoursSkipPolling() {
    MonitoringConfig officeHours = new MonitoringConfig(POLL_INTERVAL_SECONDS,
                                                        new ActiveHours(LocalTime.of(8, 0), LocalTime.of(18, 0)),
                                                        Collections.emptySet());
    MetricDefinition definition = register(metricDefinition("orders",
                                                            new InternalSourceSpec("test.orders",
                                                                                   InternalSourceSpec.Aggregation.VALUE),
                                                            new HistoricalSpec(30, 90, false),
                                                            ScoringConfig.defaults(),
                                                            percentageAlert(Severity.HIGH),
                                                            officeHours));
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    assertEquals(PollOutcome.INACTIVE, new MetricWorker(definition, _context, health).poll());
    assertEquals(0L, health.numPolls());
  }

  @Test
  public void testSeedOnStartFillsEmptyWindowOnce() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", new HistoricalSpec(30, 90, true),
                                                            percentageAlert(Severity.HIGH)));
    List<Sample> history = samples(START_MS - 3_600_000L, alternating(30, 98, 102));
    expect(_connector.fetchHistorical(definition.source())).andReturn(history).once();
    expect(_connector.fetchCurrent(definition.source())).andReturn(100.0).times(2);
    EasyMock.replay(_connector);

    MetricWorker worker = new MetricWorker(definition, _context, new MetricHealth("orders"));
    assertEquals(PollOutcome.NORMAL, worker.poll());
    assertEquals(31, _baselineStore.size("orders"));
    assertEquals(PollOutcome.NORMAL, worker.poll());
    assertEquals(32, _baselineStore.size("orders"));
  }

  @Test
  public void testSeedFailureDoesNotStopPolling() throws SourceException {
    MetricDefinition definition = register(metricDefinition("orders", new HistoricalSpec(30, 90, true),
                                                            percentageAlert(Severity.HIGH)));
    expect(_connector.fetchHistorical(anyObject()))
        .andThrow(new SourceException(SourceException.Kind.NOT_FOUND, "no history"));
    expect(_connector.fetchCurrent(definition.source())).andReturn(100.0);
    EasyMock.replay(_connector);

    assertEquals(PollOutcome.NORMAL, new MetricWorker(definition, _context, new MetricHealth("orders")).poll());
    assertEquals(1, _baselineStore.size("orders"));
  }

  @Test
  public void testStartAndStop() throws Exception {
    MetricDefinition definition = register(metricDefinition("orders", percentageAlert(Severity.HIGH)));
    expect(_connector.fetchCurrent(definition.source())).andReturn(100.0).anyTimes();
    EasyMock.replay(_connector);

    MetricHealth health = new MetricHealth("orders");
    MetricWorker worker = new MetricWorker(definition, _context, health);
    worker.start();
    assertTrue(worker.isRunning());
    long deadline = System.currentTimeMillis() + 10_000L;
    while (health.numPolls() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10L);
    }
    assertTrue(worker.stop(5_000L));
    assertEquals(1L, health.numPolls());
    assertEquals(false, worker.isRunning());
  }
}
