/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

import com.codahale.metrics.Timer;
import com.linkedin.business.metricwatch.common.MetricWatchThreadFactory;
import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.AnomalyScoreResult;
import com.linkedin.business.metricwatch.detector.notifier.AlertResult;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.shutdownAndAwait;
import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * Polls a single metric on its own single-thread executor with a fixed delay between polls, so polls of a metric
 * never overlap. Each poll fetches the current value, scores it against the baseline window as it stood before the
 * value was appended, and offers anomalies to the alert dispatcher. Transient source failures are retried with
 * bounded backoff; a failed poll records nothing in the baseline.
 */
public class MetricWorker {
  private static final Logger LOG = LoggerFactory.getLogger(MetricWorker.class);
  private final MetricDefinition _definition;
  private final PollingContext _context;
  private final MetricHealth _health;
  private ScheduledExecutorService _executor;
  private boolean _seeded;

  public MetricWorker(MetricDefinition definition, PollingContext context, MetricHealth health) {
    _definition = definition;
    _context = context;
    _health = health;
    _seeded = false;
  }

  public MetricDefinition definition() {
    return _definition;
  }

  public MetricHealth health() {
    return _health;
  }

  /**
   * Start polling. The first poll runs immediately.
   */
  public synchronized void start() {
    if (_executor != null) {
      throw new IllegalStateException("Worker of metric " + _definition.id() + " is already started.");
    }
    _executor = Executors.newSingleThreadScheduledExecutor(new MetricWatchThreadFactory("MetricWorker-" + _definition.id()));
    _executor.scheduleWithFixedDelay(this::run, 0L, _definition.monitoring().pollIntervalMs(), TimeUnit.MILLISECONDS);
    LOG.info("Started worker of metric {} polling every {} s.", _definition.id(),
             _definition.monitoring().pollIntervalSeconds());
  }

  /**
   * Cancel polling and wait for an in-flight poll to finish.
   *
   * @param timeoutMs Time to wait for the in-flight poll.
   * @return True if the worker stopped within the timeout.
   */
  public synchronized boolean stop(long timeoutMs) {
    if (_executor == null) {
      return true;
    }
    boolean stopped = shutdownAndAwait(_executor, "Worker of metric " + _definition.id(), timeoutMs);
    _executor = null;
    LOG.info("Stopped worker of metric {}.", _definition.id());
    return stopped;
  }

  public synchronized boolean isRunning() {
    return _executor != null;
  }

  private void run() {
    try {
      poll();
    } catch (Throwable t) {
      LOG.error("Unexpected exception while polling metric {}.", _definition.id(), t);
    }
  }

  /**
   * Run a single poll of the metric.
   *
   * @return The outcome of the poll.
   */
  public PollOutcome poll() {
    String metricId = _definition.id();
    long now = _context.time().milliseconds();
    if (!_definition.monitoring().isActive(now, _context.zone())) {
      LOG.trace("Metric {} is not active at {}.", metricId, utcDateFor(now));
      return PollOutcome.INACTIVE;
    }
    maybeSeed();

    double value;
    try (Timer.Context ignored = _context.sensors().pollTimer().time()) {
      value = fetchWithRetry();
    } catch (SourceException e) {
      long failedAt = _context.time().milliseconds();
      _health.recordFailure(failedAt, e);
      _context.sensors().pollFailures().mark();
      LOG.warn("Poll of metric {} failed with {} at {}, skipping this cycle: {}", metricId, e.kind(),
               utcDateFor(failedAt), e.getMessage());
      return PollOutcome.SKIPPED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.info("Poll of metric {} was cancelled.", metricId);
      return PollOutcome.CANCELLED;
    }

    Sample sample = new Sample(_context.time().milliseconds(), value);
    List<Sample> baseline = _context.baselineStore().window(metricId);
    _context.baselineStore().append(metricId, sample);
    _health.recordSuccess(sample.timestampMs());
    AnomalyScoreResult result = _context.scorer().score(_definition, baseline, sample);
    _context.lifecycleManager().check(_definition);
    if (!result.isAnomaly()) {
      LOG.debug("Metric {} sample {} is normal: {}.", metricId, sample, result);
      return PollOutcome.NORMAL;
    }

    AnomalyEvent event = _context.scorer().toEvent(_definition, sample, result);
    _context.sensors().anomalies().mark();
    _context.anomalyLog().append(event);
    LOG.info("Detected {}.", event);
    AlertResult alert = _context.dispatcher().maybeAlert(_definition, event);
    if (!alert.isSuppressed()) {
      _health.recordAlert(alert.record());
    }
    return PollOutcome.ANOMALY;
  }

  private double fetchWithRetry() throws SourceException, InterruptedException {
    RetryPolicy retryPolicy = _context.retryPolicy();
    for (int attempt = 1; ; attempt++) {
      try {
        return _context.connector().fetchCurrent(_definition.source());
      } catch (SourceException e) {
        if (!e.isTransient() || attempt >= retryPolicy.maxAttempts()) {
          throw e;
        }
        long backoffMs = retryPolicy.backoffMs(attempt);
        LOG.info("Attempt {}/{} to poll metric {} failed with {}, retrying in {} ms.", attempt,
                 retryPolicy.maxAttempts(), _definition.id(), e.kind(), backoffMs);
        _context.time().sleep(backoffMs);
        if (Thread.interrupted()) {
          throw new InterruptedException();
        }
      }
    }
  }

  /**
   * Warm up an empty window with the historical series of the metric, once per worker.
   */
  private void maybeSeed() {
    String metricId = _definition.id();
    if (_seeded || !_definition.historical().seedOnStart() || _context.baselineStore().size(metricId) > 0) {
      _seeded = true;
      return;
    }
    _seeded = true;
    try {
      List<Sample> history = _context.connector().fetchHistorical(_definition.source());
      if (!history.isEmpty() && _context.baselineStore().appendIfEmpty(metricId, history)) {
        LOG.info("Seeded window of metric {} with {} historical samples.", metricId, history.size());
        _context.lifecycleManager().windowSeeded(metricId);
        _context.lifecycleManager().check(_definition);
      }
    } catch (SourceException e) {
      LOG.warn("Failed to seed window of metric {} with {}: {}", metricId, e.kind(), e.getMessage());
    }
  }
}
