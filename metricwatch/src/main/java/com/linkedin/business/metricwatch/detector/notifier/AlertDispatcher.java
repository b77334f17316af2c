/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.MetricWatchSensors;
import com.linkedin.business.metricwatch.exception.ChannelException;
import com.linkedin.business.metricwatch.registry.AlertConfig;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.metricwatch.common.utils.AutoCloseableLock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.OPERATION_LOGGER;


/**
 * Decides whether an anomaly event becomes an alert, and delivers alerts to the channels of their metric.
 *
 * <ol>
 *   <li>Threshold gate: the deviation of the event must reach the threshold of the metric in its direction. A zero
 *   threshold disables the gate.</li>
 *   <li>Cooldown: within the cooldown of the last alert record of the metric, only an event of strictly higher
 *   severity is alerted.</li>
 *   <li>Delivery: the alert is delivered to every configured channel independently. The record is
 *   {@link AlertRecord.Status#DISPATCHED} if at least one channel delivered it, and
 *   {@link AlertRecord.Status#FAILED} otherwise.</li>
 * </ol>
 *
 * Every record created, failed ones included, starts a new cooldown. The decision and the delivery of an alert are
 * atomic per metric; alerts of different metrics do not wait on each other.
 */
public class AlertDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);
  private static final Logger OPERATION_LOG = LoggerFactory.getLogger(OPERATION_LOGGER);
  private final Map<String, AlertChannel> _channels;
  private final int _historyPerMetric;
  private final Time _time;
  private final MetricWatchSensors _sensors;
  private final Map<String, ReentrantLock> _locks;
  private final Map<String, Deque<AlertRecord>> _history;

  /**
   * @param channels Configured alert channels.
   * @param historyPerMetric Number of alert records kept per metric.
   * @param time The time.
   * @param sensors Sensors to report alert rates to.
   */
  public AlertDispatcher(Collection<AlertChannel> channels, int historyPerMetric, Time time, MetricWatchSensors sensors) {
    _channels = new LinkedHashMap<>();
    for (AlertChannel channel : channels) {
      if (_channels.put(channel.name(), channel) != null) {
        throw new IllegalArgumentException("Alert channel " + channel.name() + " is configured more than once.");
      }
    }
    _historyPerMetric = historyPerMetric;
    _time = time;
    _sensors = sensors;
    _locks = new ConcurrentHashMap<>();
    _history = new ConcurrentHashMap<>();
  }

  /**
   * Offer an anomaly event of the given metric for alerting.
   *
   * @param definition Definition of the metric.
   * @param event The anomaly event.
   * @return The alert record, or the reason the alert was suppressed.
   */
  public AlertResult maybeAlert(MetricDefinition definition, AnomalyEvent event) {
    String metricId = definition.id();
    AlertConfig alert = definition.alert();
    if (alert.thresholdValue() > 0.0 && !alert.direction().breaches(event.deviation(), alert.thresholdValue())) {
      LOG.debug("Alert of metric {} suppressed, deviation {} is below threshold {}.", metricId, event.deviation(),
                alert.thresholdValue());
      _sensors.alertsSuppressed().mark();
      return AlertResult.suppressed(AlertResult.SuppressionReason.BELOW_THRESHOLD);
    }
    ReentrantLock lock = _locks.computeIfAbsent(metricId, id -> new ReentrantLock());
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      long now = _time.milliseconds();
      AlertRecord last = lastRecord(metricId);
      if (last != null && now - last.createdMs() < alert.cooldownMs() && !event.severity().isHigherThan(last.severity())) {
        LOG.info("Alert of metric {} with severity {} suppressed, last alert {} is in cooldown.", metricId,
                 event.severity(), last.dedupKey());
        _sensors.alertsSuppressed().mark();
        return AlertResult.suppressed(AlertResult.SuppressionReason.COOLDOWN);
      }
      AlertRecord record = new AlertRecord(metricId, now, event.timestampMs(), event.severity(),
                                           deliver(definition, new RenderedAlert(definition, event)));
      Deque<AlertRecord> history = _history.computeIfAbsent(metricId, id -> new ArrayDeque<>());
      synchronized (history) {
        history.addLast(record);
        while (history.size() > _historyPerMetric) {
          history.removeFirst();
        }
      }
      if (record.status() == AlertRecord.Status.DISPATCHED) {
        _sensors.alertsDispatched().mark();
        OPERATION_LOG.info("Alert {} dispatched: {}.", record.dedupKey(), record.deliveries().values());
      } else {
        _sensors.alertsFailed().mark();
        LOG.warn("Alert {} was not delivered by any channel: {}.", record.dedupKey(), record.deliveries().values());
      }
      return AlertResult.dispatched(record);
    }
  }

  private Map<String, ChannelDeliveryResult> deliver(MetricDefinition definition, RenderedAlert alert) {
    Map<String, ChannelDeliveryResult> deliveries = new LinkedHashMap<>();
    for (String name : definition.alert().channels()) {
      AlertChannel channel = _channels.get(name);
      if (channel == null) {
        deliveries.put(name, ChannelDeliveryResult.failed(name, "Alert channel is not configured."));
        continue;
      }
      try {
        channel.deliver(alert);
        deliveries.put(name, ChannelDeliveryResult.delivered(name));
      } catch (ChannelException e) {
        LOG.warn("Failed to deliver alert of metric {} to channel {}.", definition.id(), name, e);
        deliveries.put(name, ChannelDeliveryResult.failed(name, e.getMessage()));
      } catch (RuntimeException e) {
        LOG.error("Unexpected failure of channel {} while delivering alert of metric {}.", name, definition.id(), e);
        deliveries.put(name, ChannelDeliveryResult.failed(name, String.valueOf(e)));
      }
    }
    return deliveries;
  }

  /**
   * @param metricId Metric id.
   * @return The most recent alert record of the metric, or null if there is none.
   */
  public AlertRecord lastRecord(String metricId) {
    Deque<AlertRecord> history = _history.get(metricId);
    if (history == null) {
      return null;
    }
    synchronized (history) {
      return history.peekLast();
    }
  }

  /**
   * @param metricId Metric id.
   * @return The kept alert records of the metric, oldest first.
   */
  public List<AlertRecord> history(String metricId) {
    Deque<AlertRecord> history = _history.get(metricId);
    if (history == null) {
      return Collections.emptyList();
    }
    synchronized (history) {
      return new ArrayList<>(history);
    }
  }

  /**
   * Forget the alert records of the given metric. Waits for an ongoing alert of the metric to be recorded first.
   *
   * @param metricId Metric id.
   */
  public void remove(String metricId) {
    ReentrantLock lock = _locks.computeIfAbsent(metricId, id -> new ReentrantLock());
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      _history.remove(metricId);
    } finally {
      _locks.remove(metricId, lock);
    }
  }

  public Collection<String> channelNames() {
    return Collections.unmodifiableSet(_channels.keySet());
  }
}
