/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.RegistrySnapshot;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.SENSOR_PREFIX;


/**
 * Runs one {@link MetricWorker} per enabled metric and reconciles the running workers with registry snapshots.
 */
public class MetricScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(MetricScheduler.class);
  private final PollingContext _context;
  private final long _shutdownTimeoutMs;
  private final Map<String, MetricWorker> _workers;
  private final Map<String, MetricHealth> _health;
  private volatile boolean _shutdown;

  public MetricScheduler(PollingContext context, long shutdownTimeoutMs) {
    _context = context;
    _shutdownTimeoutMs = shutdownTimeoutMs;
    _workers = new ConcurrentHashMap<>();
    _health = new ConcurrentHashMap<>();
    _shutdown = false;
    context.sensors().registry().register(MetricRegistry.name(SENSOR_PREFIX, "num-running-workers"),
                                          (Gauge<Integer>) this::numRunningWorkers);
  }

  /**
   * Bring the running workers in line with the given snapshot. Workers of removed or disabled metrics stop, new
   * metrics get a worker, metrics whose definition changed are restarted, and unchanged metrics keep running.
   *
   * @param snapshot The registry snapshot to reconcile with.
   */
  public synchronized void reconcile(RegistrySnapshot snapshot) {
    if (_shutdown) {
      throw new IllegalStateException("The scheduler is shut down.");
    }
    Set<String> enabled = new HashSet<>();
    int started = 0;
    int restarted = 0;
    int stopped = 0;
    for (MetricDefinition definition : snapshot.listEnabled()) {
      enabled.add(definition.id());
      MetricWorker current = _workers.get(definition.id());
      if (current == null) {
        startWorker(definition);
        started++;
      } else if (!current.definition().equals(definition)) {
        current.stop(_shutdownTimeoutMs);
        _context.lifecycleManager().definitionChanged(definition.id());
        startWorker(definition);
        restarted++;
      }
    }
    for (String metricId : new HashSet<>(_workers.keySet())) {
      if (!enabled.contains(metricId)) {
        _workers.remove(metricId).stop(_shutdownTimeoutMs);
        dropState(metricId);
        stopped++;
      }
    }
    LOG.info("Reconciled workers with {} metric definitions: {} started, {} restarted, {} stopped, {} running.",
             snapshot.size(), started, restarted, stopped, _workers.size());
  }

  private void startWorker(MetricDefinition definition) {
    MetricHealth health = _health.computeIfAbsent(definition.id(), MetricHealth::new);
    MetricWorker worker = new MetricWorker(definition, _context, health);
    _workers.put(definition.id(), worker);
    worker.start();
  }

  private void dropState(String metricId) {
    _health.remove(metricId);
    _context.baselineStore().clear(metricId);
    _context.lifecycleManager().remove(metricId);
    _context.dispatcher().remove(metricId);
  }

  /**
   * Stop every worker, waiting a bounded time for each in-flight poll.
   */
  public synchronized void shutdown() {
    if (_shutdown) {
      return;
    }
    _shutdown = true;
    LOG.info("Shutting down {} metric workers.", _workers.size());
    for (MetricWorker worker : _workers.values()) {
      if (!worker.stop(_shutdownTimeoutMs)) {
        LOG.warn("Worker of metric {} did not stop in time.", worker.definition().id());
      }
    }
    _workers.clear();
  }

  public int numRunningWorkers() {
    return _workers.size();
  }

  public Set<String> runningMetricIds() {
    return new HashSet<>(_workers.keySet());
  }

  public Optional<MetricHealth> health(String metricId) {
    return Optional.ofNullable(_health.get(metricId));
  }

  public SortedMap<String, MetricHealth> health() {
    return new TreeMap<>(_health);
  }
}
