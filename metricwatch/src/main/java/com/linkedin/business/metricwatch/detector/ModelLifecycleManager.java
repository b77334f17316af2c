/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.business.metricwatch.baseline.BaselineStore;
import com.linkedin.business.metricwatch.common.MetricWatchThreadFactory;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.MetricDefinitionRegistry;
import com.linkedin.metricwatch.common.utils.AutoCloseableLock;
import com.linkedin.metricwatch.exception.MetricWatchException;
import com.linkedin.metricwatch.exception.ModelTrainingException;
import com.linkedin.metricwatch.exception.NotEnoughSamplesException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.OPERATION_LOGGER;
import static com.linkedin.business.metricwatch.BusinessMetricWatchUtils.shutdownAndAwait;


/**
 * Keeps the model of every enabled metric fresh.
 *
 * <p>A metric starts {@link ModelState#UNTRAINED} and becomes {@link ModelState#TRAINED} once its window holds the
 * minimum samples and training succeeds. A trained model becomes {@link ModelState#STALE} when the retrain interval
 * elapses, when enough new samples accumulated since training, or when the definition of the metric changes. A stale
 * model keeps scoring until a retrain succeeds; a failed retrain leaves the previous model in place.</p>
 *
 * <p>Training of a metric is serialized by a per-metric lock. The new model is swapped in by a single
 * {@link AnomalyScorer#installModel(ScorerModel)} call and then saved to the {@link ModelStore}, so that a restart
 * can resume scoring without retraining.</p>
 */
public class ModelLifecycleManager {
  private static final Logger LOG = LoggerFactory.getLogger(ModelLifecycleManager.class);
  private static final Logger OPERATION_LOG = LoggerFactory.getLogger(OPERATION_LOGGER);
  private final AnomalyScorer _scorer;
  private final BaselineStore _baselineStore;
  private final MetricDefinitionRegistry _registry;
  private final Time _time;
  private final long _retrainIntervalMs;
  private final int _retrainMinNewSamples;
  private final MetricWatchSensors _sensors;
  private final ModelStore _modelStore;
  private final Map<String, ModelState> _states;
  private final Map<String, ReentrantLock> _trainingLocks;
  private ScheduledExecutorService _checkExecutor;

  public ModelLifecycleManager(AnomalyScorer scorer,
                               BaselineStore baselineStore,
                               MetricDefinitionRegistry registry,
                               Time time,
                               long retrainIntervalMs,
                               int retrainMinNewSamples,
                               MetricWatchSensors sensors) {
    this(scorer, baselineStore, registry, time, retrainIntervalMs, retrainMinNewSamples, sensors, new NoopModelStore());
  }

  public ModelLifecycleManager(AnomalyScorer scorer,
                               BaselineStore baselineStore,
                               MetricDefinitionRegistry registry,
                               Time time,
                               long retrainIntervalMs,
                               int retrainMinNewSamples,
                               MetricWatchSensors sensors,
                               ModelStore modelStore) {
    _scorer = scorer;
    _baselineStore = baselineStore;
    _registry = registry;
    _time = time;
    _retrainIntervalMs = retrainIntervalMs;
    _retrainMinNewSamples = retrainMinNewSamples;
    _sensors = sensors;
    _modelStore = modelStore;
    _states = new ConcurrentHashMap<>();
    _trainingLocks = new ConcurrentHashMap<>();
  }

  /**
   * Install the stored models of the enabled metrics of the registry. Stored models trained before the retention
   * cutoff are deleted first. A stored model whose features no longer match the definition of its metric is skipped
   * and trained again once the window allows.
   *
   * @param retentionMs Maximum age of a stored model.
   * @return Number of models installed.
   */
  public int loadStoredModels(long retentionMs) {
    int evicted = _modelStore.evictModelsBefore(_time.milliseconds() - retentionMs);
    if (evicted > 0) {
      LOG.info("Deleted {} stored models older than {} ms.", evicted, retentionMs);
    }
    List<ScorerModel> models;
    try {
      models = _modelStore.loadModels();
    } catch (MetricWatchException e) {
      LOG.warn("Failed to load stored models, all metrics start untrained.", e);
      return 0;
    }
    int loaded = 0;
    for (ScorerModel model : models) {
      String metricId = model.metricId();
      Optional<MetricDefinition> definition = _registry.get(metricId);
      if (definition.isEmpty() || !definition.get().enabled()) {
        LOG.debug("Skip stored model of metric {} which is not enabled.", metricId);
        continue;
      }
      if (!model.features().equals(definition.get().scoring().features())) {
        LOG.info("Skip stored model of metric {} trained on features {}.", metricId, model.features());
        continue;
      }
      ReentrantLock lock = _trainingLocks.computeIfAbsent(metricId, id -> new ReentrantLock());
      try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
        _scorer.installModel(model.withBaselineSequence(_baselineStore.appendedCount(metricId)));
        _states.put(metricId, ModelState.TRAINED);
      }
      loaded++;
    }
    if (loaded > 0) {
      OPERATION_LOG.info("Loaded {} stored models.", loaded);
    }
    return loaded;
  }

  /**
   * Start checking the model of every enabled metric periodically.
   *
   * @param checkIntervalMs Interval between two checks.
   */
  public synchronized void startUp(long checkIntervalMs) {
    if (_checkExecutor != null) {
      return;
    }
    _checkExecutor = Executors.newSingleThreadScheduledExecutor(new MetricWatchThreadFactory("ModelLifecycleChecker"));
    _checkExecutor.scheduleWithFixedDelay(this::checkAllSafely, checkIntervalMs, checkIntervalMs, TimeUnit.MILLISECONDS);
    LOG.info("Model lifecycle checks started with interval {} ms.", checkIntervalMs);
  }

  public synchronized void shutdown(long timeoutMs) {
    if (_checkExecutor != null) {
      shutdownAndAwait(_checkExecutor, "Model lifecycle checker", timeoutMs);
      _checkExecutor = null;
    }
  }

  private void checkAllSafely() {
    try {
      checkAll();
    } catch (Throwable t) {
      LOG.error("Unexpected exception while checking models.", t);
    }
  }

  /**
   * Check the model of every enabled metric, training and retraining as needed.
   */
  public void checkAll() {
    for (MetricDefinition definition : _registry.listEnabled()) {
      check(definition);
    }
  }

  /**
   * Check the model of the given metric, training it if it is untrained and retraining it if it is stale.
   * Training failures are logged, never thrown.
   *
   * @param definition Definition of the metric.
   * @return The state of the model after the check.
   */
  public ModelState check(MetricDefinition definition) {
    String metricId = definition.id();
    ModelState state = state(metricId);
    if (state == ModelState.TRAINED && isStale(metricId)) {
      markStale(metricId, "retrain is due");
      state = ModelState.STALE;
    }
    if (state == ModelState.TRAINED || !_baselineStore.hasMinimumSamples(metricId)) {
      return state;
    }
    try {
      train(metricId);
    } catch (IllegalArgumentException | IllegalStateException e) {
      LOG.info("Skip training the model of metric {}: {}", metricId, e.getMessage());
    } catch (NotEnoughSamplesException e) {
      LOG.info("Not ready to train the model of metric {}: {}", metricId, e.getMessage());
    } catch (ModelTrainingException e) {
      LOG.warn("Failed to train the model of metric {}, the model stays {}.", metricId, state(metricId), e);
    }
    return state(metricId);
  }

  /**
   * Train the model of the given metric now, regardless of its state.
   *
   * @param metricId Id of the metric.
   * @return The new model.
   * @throws IllegalArgumentException If the metric is unknown.
   * @throws IllegalStateException If the metric is disabled.
   * @throws NotEnoughSamplesException If the window holds fewer than the minimum samples.
   * @throws ModelTrainingException If training fails.
   */
  public ScorerModel trainNow(String metricId) throws NotEnoughSamplesException, ModelTrainingException {
    return train(metricId);
  }

  /**
   * Retrain the model of every enabled metric that has the minimum samples.
   *
   * @return Number of models retrained.
   */
  public int retrainAll() {
    int retrained = 0;
    for (MetricDefinition definition : _registry.listEnabled()) {
      if (!_baselineStore.hasMinimumSamples(definition.id())) {
        LOG.info("Skip retraining metric {} with {} samples.", definition.id(), _baselineStore.size(definition.id()));
        continue;
      }
      try {
        train(definition.id());
        retrained++;
      } catch (IllegalArgumentException | IllegalStateException e) {
        LOG.info("Skip retraining metric {}: {}", definition.id(), e.getMessage());
      } catch (NotEnoughSamplesException | ModelTrainingException e) {
        LOG.warn("Failed to retrain the model of metric {}.", definition.id(), e);
      }
    }
    return retrained;
  }

  private ScorerModel train(String metricId) throws NotEnoughSamplesException, ModelTrainingException {
    ReentrantLock lock = _trainingLocks.computeIfAbsent(metricId, id -> new ReentrantLock());
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      // The metric may have been removed or disabled while waiting for the lock.
      MetricDefinition definition = _registry.get(metricId)
                                             .orElseThrow(() -> new IllegalArgumentException("Unknown metric " + metricId));
      if (!definition.enabled()) {
        throw new IllegalStateException("Metric " + metricId + " is disabled.");
      }
      long sequence = _baselineStore.appendedCount(metricId);
      ScorerModel model;
      try {
        model = _scorer.train(definition, _baselineStore.window(metricId), sequence);
      } catch (ModelTrainingException e) {
        _sensors.modelTrainingFailures().mark();
        throw e;
      }
      ScorerModel previous = _scorer.installModel(model);
      _states.put(metricId, ModelState.TRAINED);
      _sensors.modelTrainings().mark();
      try {
        _modelStore.storeModel(model);
      } catch (MetricWatchException e) {
        LOG.warn("Failed to store the model of metric {}, it will be retrained after a restart.", metricId, e);
      }
      OPERATION_LOG.info("{} model of metric {} on {} samples, training anomaly rate {}.",
                         previous == null ? "Trained" : "Retrained", metricId, model.sampleCount(),
                         model.trainingAnomalyRate());
      return model;
    }
  }

  private boolean isStale(String metricId) {
    ScorerModel model = _scorer.model(metricId);
    if (model == null) {
      return true;
    }
    long newSamples = _baselineStore.appendedCount(metricId) - model.baselineSequence();
    return _time.milliseconds() - model.trainedAtMs() >= _retrainIntervalMs || newSamples >= _retrainMinNewSamples;
  }

  private void markStale(String metricId, String reason) {
    if (_states.replace(metricId, ModelState.TRAINED, ModelState.STALE)) {
      LOG.info("Model of metric {} is stale: {}.", metricId, reason);
    }
  }

  /**
   * Rebase the installed model of the given metric, if any, after its empty window was seeded with history. Seeded
   * samples do not count as new samples for a model loaded from the model store.
   *
   * @param metricId Id of the metric.
   */
  public void windowSeeded(String metricId) {
    ReentrantLock lock = _trainingLocks.computeIfAbsent(metricId, id -> new ReentrantLock());
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      ScorerModel model = _scorer.model(metricId);
      if (model != null) {
        _scorer.installModel(model.withBaselineSequence(_baselineStore.appendedCount(metricId)));
      }
    }
  }

  /**
   * Mark the model of the given metric stale after its definition changed.
   *
   * @param metricId Id of the metric.
   */
  public void definitionChanged(String metricId) {
    markStale(metricId, "definition changed");
  }

  /**
   * Drop the model, stored model and state of the given metric. Waits for an ongoing training of the metric to finish.
   *
   * @param metricId Id of the metric.
   */
  public void remove(String metricId) {
    ReentrantLock lock = _trainingLocks.computeIfAbsent(metricId, id -> new ReentrantLock());
    try (AutoCloseableLock ignored = new AutoCloseableLock(lock)) {
      _states.remove(metricId);
      _modelStore.deleteModel(metricId);
      if (_scorer.removeModel(metricId) != null) {
        OPERATION_LOG.info("Dropped model of metric {}.", metricId);
      }
    } finally {
      _trainingLocks.remove(metricId, lock);
    }
  }

  public ModelState state(String metricId) {
    return _states.getOrDefault(metricId, ModelState.UNTRAINED);
  }

  /**
   * @return Status of the model of every enabled metric, by metric id.
   */
  public SortedMap<String, ModelStatus> modelStatus() {
    SortedMap<String, ModelStatus> status = new TreeMap<>();
    for (MetricDefinition definition : _registry.listEnabled()) {
      String metricId = definition.id();
      status.put(metricId, new ModelStatus(metricId, state(metricId), _scorer.model(metricId)));
    }
    return status;
  }
}
