/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.codahale.metrics.MetricRegistry;
import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.MetricWatchSensors;
import com.linkedin.business.metricwatch.detector.ScoringPath;
import com.linkedin.business.metricwatch.exception.ChannelException;
import com.linkedin.business.metricwatch.registry.AlertConfig;
import com.linkedin.business.metricwatch.registry.Direction;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.Severity;
import com.linkedin.business.metricwatch.registry.ThresholdType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.MockTime;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.alertConfig;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.metricDefinition;
import static com.linkedin.business.metricwatch.MetricWatchUnitTestUtils.percentageAlert;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * Unit test for {@link AlertDispatcher}.
 */
public class AlertDispatcherTest {
  private static final long START_MS = 1_700_000_000_000L;
  private MockTime _time;
  private MetricWatchSensors _sensors;
  private RecordingChannel _testChannel;

  /**
   * An alert channel remembering what it delivered, and failing on demand.
   */
  private static class RecordingChannel implements AlertChannel {
    private final String _name;
    private final List<RenderedAlert> _delivered = new ArrayList<>();
    private boolean _fail;

    RecordingChannel(String name) {
      _name = name;
    }

    @Override
    public void configure(Map<String, ?> configs) {

    }

    @Override
    public String name() {
      return _name;
    }

    @Override
    public void deliver(RenderedAlert alert) throws ChannelException {
      if (_fail) {
        throw new ChannelException(_name + " is down");
      }
      _delivered.add(alert);
    }
  }

  @Before
  public void setUp() {
    _time = new MockTime(0, START_MS, 0);
    _sensors = new MetricWatchSensors(new MetricRegistry());
    _testChannel = new RecordingChannel("test");
  }

  private AlertDispatcher dispatcher(AlertChannel... channels) {
    return new AlertDispatcher(Arrays.asList(channels), 10, _time, _sensors);
  }

  private AnomalyEvent event(String metricId, double deviation, Severity severity) {
    return new AnomalyEvent(metricId, _time.milliseconds(), 100.0 + deviation, 100.0, deviation, -0.2, severity, 0.8,
                            ScoringPath.FALLBACK);
  }

  @Test
  public void testSecondAlertWithinCooldownIsSuppressed() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.HIGH));

    AlertResult first = dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH));
    assertFalse(first.isSuppressed());
    assertEquals(AlertRecord.Status.DISPATCHED, first.record().status());
    assertEquals(1, _testChannel._delivered.size());

    _time.sleep(TimeUnit.MINUTES.toMillis(5));
    AlertResult second = dispatcher.maybeAlert(definition, event("orders", -42.0, Severity.HIGH));
    assertTrue(second.isSuppressed());
    assertEquals(AlertResult.SuppressionReason.COOLDOWN, second.suppressionReason());
    assertEquals(1, _testChannel._delivered.size());
    assertEquals(1, dispatcher.history("orders").size());
    assertEquals(1L, _sensors.alertsSuppressed().getCount());
  }

  @Test
  public void testAlertAfterCooldown() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.HIGH));

    dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH));
    _time.sleep(TimeUnit.MINUTES.toMillis(60) - 1);
    assertTrue(dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH)).isSuppressed());
    _time.sleep(1);
    AlertResult result = dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH));
    assertFalse(result.isSuppressed());
    assertEquals(2, _testChannel._delivered.size());
    assertSame(result.record(), dispatcher.lastRecord("orders"));
  }

  @Test
  public void testHigherSeverityBypassesCooldown() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.MEDIUM));

    dispatcher.maybeAlert(definition, event("orders", -20.0, Severity.MEDIUM));
    _time.sleep(TimeUnit.MINUTES.toMillis(1));
    assertTrue(dispatcher.maybeAlert(definition, event("orders", -20.0, Severity.LOW)).isSuppressed());
    AlertResult escalated = dispatcher.maybeAlert(definition, event("orders", -50.0, Severity.CRITICAL));
    assertFalse(escalated.isSuppressed());
    assertEquals(Severity.CRITICAL, escalated.record().severity());
    // The escalated record starts a new cooldown.
    assertTrue(dispatcher.maybeAlert(definition, event("orders", -20.0, Severity.HIGH)).isSuppressed());
  }

  @Test
  public void testDeviationBelowThresholdIsSuppressed() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.HIGH));

    AlertResult result = dispatcher.maybeAlert(definition, event("orders", 10.0, Severity.HIGH));
    assertTrue(result.isSuppressed());
    assertEquals(AlertResult.SuppressionReason.BELOW_THRESHOLD, result.suppressionReason());
    assertNull(dispatcher.lastRecord("orders"));

    AlertConfig belowOnly = alertConfig(Severity.HIGH, ThresholdType.PERCENTAGE, 15.0, Direction.BELOW, 60,
                                       Collections.singletonList("test"));
    MetricDefinition belowDefinition = metricDefinition("signups", belowOnly);
    assertTrue(dispatcher.maybeAlert(belowDefinition, event("signups", 40.0, Severity.HIGH)).isSuppressed());
    assertFalse(dispatcher.maybeAlert(belowDefinition, event("signups", -15.0, Severity.HIGH)).isSuppressed());
    assertTrue(_testChannel._delivered.stream().allMatch(a -> a.event().metricId().equals("signups")));
  }

  @Test
  public void testZeroThresholdAlertsEveryEvent() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    AlertConfig noThreshold = alertConfig(Severity.LOW, ThresholdType.ABSOLUTE, 0.0, Direction.EITHER, 0,
                                          Collections.singletonList("test"));
    MetricDefinition definition = metricDefinition("orders", noThreshold);
    assertFalse(dispatcher.maybeAlert(definition, event("orders", 0.5, Severity.LOW)).isSuppressed());
    assertFalse(dispatcher.maybeAlert(definition, event("orders", 0.5, Severity.LOW)).isSuppressed());
    assertEquals(2, _testChannel._delivered.size());
  }

  @Test
  public void testChannelFailureDoesNotBlockOtherChannels() {
    RecordingChannel broken = new RecordingChannel("broken");
    broken._fail = true;
    AlertDispatcher dispatcher = dispatcher(broken, _testChannel);
    AlertConfig alert = alertConfig(Severity.HIGH, ThresholdType.PERCENTAGE, 15.0, Direction.EITHER, 60,
                                    Arrays.asList("broken", "test"));
    MetricDefinition definition = metricDefinition("orders", alert);

    AlertRecord record = dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH)).record();
    assertEquals(AlertRecord.Status.DISPATCHED, record.status());
    assertEquals(Arrays.asList("broken", "test"), record.channelsAttempted());
    assertFalse(record.deliveries().get("broken").isDelivered());
    assertEquals("broken is down", record.deliveries().get("broken").error());
    assertTrue(record.deliveries().get("test").isDelivered());
    assertEquals(1, _testChannel._delivered.size());
    assertEquals(1L, _sensors.alertsDispatched().getCount());
  }

  @Test
  public void testAllChannelsFailing() {
    _testChannel._fail = true;
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.HIGH));

    AlertRecord record = dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH)).record();
    assertEquals(AlertRecord.Status.FAILED, record.status());
    assertEquals(1L, _sensors.alertsFailed().getCount());
    // A failed record still starts the cooldown.
    _time.sleep(TimeUnit.MINUTES.toMillis(1));
    _testChannel._fail = false;
    AlertResult retry = dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH));
    assertEquals(AlertResult.SuppressionReason.COOLDOWN, retry.suppressionReason());
  }

  @Test
  public void testUnknownChannel() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    AlertConfig alert = alertConfig(Severity.HIGH, ThresholdType.PERCENTAGE, 15.0, Direction.EITHER, 60,
                                    Collections.singletonList("pagerduty"));
    AlertRecord record = dispatcher.maybeAlert(metricDefinition("orders", alert),
                                               event("orders", -40.0, Severity.HIGH)).record();
    assertEquals(AlertRecord.Status.FAILED, record.status());
    assertEquals("Alert channel is not configured.", record.deliveries().get("pagerduty").error());
  }

  @Test
  public void testDedupKeyAndRecordContent() {
    AlertDispatcher dispatcher = dispatcher(_testChannel);
    AnomalyEvent anomaly = event("orders", -40.0, Severity.HIGH);
    AlertRecord record = dispatcher.maybeAlert(metricDefinition("orders", percentageAlert(Severity.HIGH)), anomaly)
                                   .record();
    assertEquals("orders:high:" + anomaly.timestampMs(), record.dedupKey());
    assertEquals(START_MS, record.createdMs());
    assertEquals("orders", record.getJsonStructure().get("metric_id"));
    assertEquals("DISPATCHED", record.getJsonStructure().get("status"));
    RenderedAlert rendered = _testChannel._delivered.get(0);
    assertEquals(Collections.singletonList("oncall@example.com"), rendered.recipients());
    assertTrue(rendered.title().contains("Metric orders"));
  }

  @Test
  public void testHistoryIsBoundedAndRemovable() {
    AlertDispatcher dispatcher = new AlertDispatcher(Collections.singletonList(_testChannel), 3, _time, _sensors);
    AlertConfig noCooldown = alertConfig(Severity.HIGH, ThresholdType.PERCENTAGE, 15.0, Direction.EITHER, 0,
                                         Collections.singletonList("test"));
    MetricDefinition definition = metricDefinition("orders", noCooldown);
    for (int i = 0; i < 5; i++) {
      dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH));
      _time.sleep(1000L);
    }
    List<AlertRecord> history = dispatcher.history("orders");
    assertEquals(3, history.size());
    assertEquals(START_MS + 2000L, history.get(0).createdMs());
    dispatcher.remove("orders");
    assertTrue(dispatcher.history("orders").isEmpty());
  }

  @Test
  public void testRemoveWaitsForAlertInFlight() throws Exception {
    CountDownLatch deliveryStarted = new CountDownLatch(1);
    CountDownLatch releaseDelivery = new CountDownLatch(1);
    AlertChannel slowChannel = new RecordingChannel("test") {
      @Override
      public void deliver(RenderedAlert alert) throws ChannelException {
        deliveryStarted.countDown();
        try {
          releaseDelivery.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        super.deliver(alert);
      }
    };
    AlertDispatcher dispatcher = dispatcher(slowChannel);
    MetricDefinition definition = metricDefinition("orders", percentageAlert(Severity.HIGH));

    Thread alerter = new Thread(() -> dispatcher.maybeAlert(definition, event("orders", -40.0, Severity.HIGH)));
    alerter.start();
    assertTrue(deliveryStarted.await(10, TimeUnit.SECONDS));
    Thread remover = new Thread(() -> dispatcher.remove("orders"));
    remover.start();
    Thread.sleep(100);
    assertTrue(remover.isAlive());

    releaseDelivery.countDown();
    alerter.join(10000);
    remover.join(10000);
    assertFalse(remover.isAlive());
    assertTrue(dispatcher.history("orders").isEmpty());
    assertNull(dispatcher.lastRecord("orders"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateChannelNames() {
    dispatcher(new RecordingChannel("test"), new RecordingChannel("test"));
  }
}
