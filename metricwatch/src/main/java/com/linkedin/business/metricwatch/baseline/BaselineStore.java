/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.baseline;

import com.linkedin.business.metricwatch.registry.HistoricalSpec;
import com.linkedin.metricwatch.common.utils.AutoCloseableLock;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;


/**
 * Bounded rolling windows of samples, one per metric. A window never holds more than the max samples of its metric;
 * the oldest samples are evicted first. Each window is guarded by its own lock, so appends and reads of different
 * metrics never contend.
 */
public class BaselineStore {
  private final ConcurrentMap<String, Window> _windows;
  private final Function<String, HistoricalSpec> _historicalSpecs;

  /**
   * @param historicalSpecs Looks up the window bounds of a metric. Unknown metrics get the default bounds.
   */
  public BaselineStore(Function<String, HistoricalSpec> historicalSpecs) {
    _windows = new ConcurrentHashMap<>();
    _historicalSpecs = metricId -> {
      HistoricalSpec spec = historicalSpecs.apply(metricId);
      return spec == null ? HistoricalSpec.defaults() : spec;
    };
  }

  private Window window(String metricId, boolean create) {
    return create ? _windows.computeIfAbsent(metricId, id -> new Window()) : _windows.get(metricId);
  }

  /**
   * Append a sample to the window of the given metric, evicting the oldest samples beyond capacity.
   *
   * @param metricId Metric id.
   * @param sample Sample to append.
   */
  public void append(String metricId, Sample sample) {
    appendAll(metricId, Collections.singletonList(sample));
  }

  /**
   * Append the given samples, in order, to the window of the given metric.
   *
   * @param metricId Metric id.
   * @param samples Samples to append.
   */
  public void appendAll(String metricId, List<Sample> samples) {
    int maxSamples = _historicalSpecs.apply(metricId).maxSamples();
    Window window = window(metricId, true);
    try (AutoCloseableLock ignored = new AutoCloseableLock(window._lock)) {
      window.append(samples, maxSamples);
    }
  }

  /**
   * Append the given samples to the window of the given metric only if the window holds no sample yet. The check and
   * the append happen under the window lock, so that concurrent seeders of the same window append at most once.
   *
   * @param metricId Metric id.
   * @param samples Samples to append.
   * @return {@code true} if the samples were appended, {@code false} if the window already held samples.
   */
  public boolean appendIfEmpty(String metricId, List<Sample> samples) {
    int maxSamples = _historicalSpecs.apply(metricId).maxSamples();
    Window window = window(metricId, true);
    try (AutoCloseableLock ignored = new AutoCloseableLock(window._lock)) {
      if (!window._samples.isEmpty()) {
        return false;
      }
      window.append(samples, maxSamples);
      return true;
    }
  }

  /**
   * @param metricId Metric id.
   * @return A copy of the window of the metric, oldest sample first.
   */
  public List<Sample> window(String metricId) {
    Window window = window(metricId, false);
    if (window == null) {
      return Collections.emptyList();
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(window._lock)) {
      return new ArrayList<>(window._samples);
    }
  }

  public int size(String metricId) {
    Window window = window(metricId, false);
    if (window == null) {
      return 0;
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(window._lock)) {
      return window._samples.size();
    }
  }

  /**
   * @param metricId Metric id.
   * @return True if the window holds at least the min samples of the metric.
   */
  public boolean hasMinimumSamples(String metricId) {
    return size(metricId) >= _historicalSpecs.apply(metricId).minSamples();
  }

  /**
   * @param metricId Metric id.
   * @return The number of samples ever appended to the window of the metric, including evicted ones.
   */
  public long appendedCount(String metricId) {
    Window window = window(metricId, false);
    if (window == null) {
      return 0L;
    }
    try (AutoCloseableLock ignored = new AutoCloseableLock(window._lock)) {
      return window._appendedCount;
    }
  }

  /**
   * Drop the window of the given metric.
   *
   * @param metricId Metric id.
   */
  public void clear(String metricId) {
    _windows.remove(metricId);
  }

  private static final class Window {
    private final ReentrantLock _lock = new ReentrantLock();
    private final Deque<Sample> _samples = new ArrayDeque<>();
    private long _appendedCount = 0L;

    // Caller holds _lock.
    private void append(List<Sample> samples, int maxSamples) {
      for (Sample sample : samples) {
        _samples.addLast(sample);
        _appendedCount++;
      }
      while (_samples.size() > maxSamples) {
        _samples.removeFirst();
      }
    }
  }
}
