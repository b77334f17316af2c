/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch;

import com.codahale.metrics.MetricRegistry;
import com.google.gson.JsonObject;
import com.linkedin.business.metricwatch.baseline.BaselineStore;
import com.linkedin.business.metricwatch.config.ConnectionRegistry;
import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.config.MetricWatchConfig;
import com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig;
import com.linkedin.business.metricwatch.config.constants.MonitorConfig;
import com.linkedin.business.metricwatch.config.constants.NotifierConfig;
import com.linkedin.business.metricwatch.detector.AnomalyEvent;
import com.linkedin.business.metricwatch.detector.AnomalyLog;
import com.linkedin.business.metricwatch.detector.AnomalyReportGenerator;
import com.linkedin.business.metricwatch.detector.AnomalyScorer;
import com.linkedin.business.metricwatch.detector.MetricWatchSensors;
import com.linkedin.business.metricwatch.detector.ModelLifecycleManager;
import com.linkedin.business.metricwatch.detector.ModelStore;
import com.linkedin.business.metricwatch.detector.ModelStatus;
import com.linkedin.business.metricwatch.detector.ScorerModel;
import com.linkedin.business.metricwatch.detector.notifier.AlertChannel;
import com.linkedin.business.metricwatch.detector.notifier.AlertDispatcher;
import com.linkedin.business.metricwatch.exception.SourceException;
import com.linkedin.business.metricwatch.monitor.MetricHealth;
import com.linkedin.business.metricwatch.monitor.MetricScheduler;
import com.linkedin.business.metricwatch.monitor.PollingContext;
import com.linkedin.business.metricwatch.monitor.RetryPolicy;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.MetricDefinitionParser;
import com.linkedin.business.metricwatch.registry.MetricDefinitionRegistry;
import com.linkedin.business.metricwatch.registry.RegistrySnapshot;
import com.linkedin.business.metricwatch.registry.SourceType;
import com.linkedin.business.metricwatch.source.DataSourceConnector;
import com.linkedin.business.metricwatch.source.DataSourceConnectors;
import com.linkedin.business.metricwatch.source.FileSourceConnector;
import com.linkedin.business.metricwatch.source.HttpSourceConnector;
import com.linkedin.business.metricwatch.source.InternalCounterConnector;
import com.linkedin.business.metricwatch.source.RelationalQueryConnector;
import com.linkedin.metricwatch.exception.MetricWatchException;
import com.linkedin.metricwatch.exception.ModelTrainingException;
import com.linkedin.metricwatch.exception.NotEnoughSamplesException;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The main class of MetricWatch. It wires the metric registry, data sources, baseline windows, models, workers and
 * alert dispatch together, and serves as the facade of the management API and the command line.
 */
public class MetricWatch {
  private static final Logger LOG = LoggerFactory.getLogger(MetricWatch.class);
  private final MetricWatchConfig _config;
  private final Time _time;
  private final Path _definitionsFile;
  private final MetricDefinitionRegistry _registry;
  private final DataSourceConnector _connector;
  private final BaselineStore _baselineStore;
  private final AnomalyScorer _scorer;
  private final ModelLifecycleManager _lifecycleManager;
  private final AlertDispatcher _dispatcher;
  private final AnomalyLog _anomalyLog;
  private final AnomalyReportGenerator _reportGenerator;
  private final MetricScheduler _scheduler;
  private final List<Closeable> _closeables;
  private volatile boolean _started;

  /**
   * Construct MetricWatch with the data source connectors for every source type.
   *
   * @param config The configurations for MetricWatch.
   * @param time The time.
   * @param dropwizardMetricRegistry Registry of the sensors of MetricWatch, also backing internal sources.
   */
  public MetricWatch(MetricWatchConfig config, Time time, MetricRegistry dropwizardMetricRegistry)
      throws MetricWatchException {
    this(config, time, dropwizardMetricRegistry, null);
  }

  /**
   * Package private for unit tests.
   */
  MetricWatch(MetricWatchConfig config, Time time, MetricRegistry dropwizardMetricRegistry, DataSourceConnector connector)
      throws MetricWatchException {
    _config = config;
    _time = time;
    _definitionsFile = Paths.get(config.getString(MonitorConfig.METRIC_DEFINITIONS_FILE_CONFIG));
    _registry = new MetricDefinitionRegistry(time);
    _closeables = new ArrayList<>();
    ZoneId zone = config.timeZone();
    _connector = connector != null ? connector : defaultConnector(config, zone, dropwizardMetricRegistry);
    _baselineStore = new BaselineStore(id -> _registry.get(id).map(MetricDefinition::historical).orElse(null));
    _scorer = new AnomalyScorer(zone,
                                config.getInt(AnomalyDetectorConfig.MODEL_NUM_TREES_CONFIG),
                                config.getInt(AnomalyDetectorConfig.MODEL_MAX_SAMPLES_CONFIG),
                                config.getLong(AnomalyDetectorConfig.MODEL_RANDOM_SEED_CONFIG),
                                time);
    MetricWatchSensors sensors = new MetricWatchSensors(dropwizardMetricRegistry);
    _lifecycleManager = new ModelLifecycleManager(_scorer, _baselineStore, _registry, time,
                                                  config.getLong(AnomalyDetectorConfig.MODEL_RETRAIN_INTERVAL_MS_CONFIG),
                                                  config.getInt(AnomalyDetectorConfig.MODEL_RETRAIN_MIN_NEW_SAMPLES_CONFIG),
                                                  sensors,
                                                  config.getConfiguredInstance(AnomalyDetectorConfig.MODEL_STORE_CLASS_CONFIG,
                                                                               ModelStore.class));
    List<AlertChannel> channels = config.getConfiguredInstances(NotifierConfig.ALERT_CHANNEL_CLASSES_CONFIG,
                                                                AlertChannel.class, Collections.emptyMap());
    _dispatcher = new AlertDispatcher(channels, config.getInt(NotifierConfig.ALERT_HISTORY_PER_METRIC_CONFIG), time, sensors);
    _anomalyLog = config.getConfiguredInstance(AnomalyDetectorConfig.ANOMALY_LOG_CLASS_CONFIG, AnomalyLog.class);
    _reportGenerator = config.getConfiguredInstance(AnomalyDetectorConfig.ANOMALY_REPORT_GENERATOR_CLASS_CONFIG,
                                                    AnomalyReportGenerator.class);
    RetryPolicy retryPolicy = new RetryPolicy(config.getInt(MonitorConfig.POLL_RETRY_ATTEMPTS_CONFIG),
                                              config.getLong(MonitorConfig.POLL_RETRY_BACKOFF_MS_CONFIG),
                                              config.getLong(MonitorConfig.POLL_RETRY_MAX_BACKOFF_MS_CONFIG));
    PollingContext context = new PollingContext(_connector, _baselineStore, _scorer, _lifecycleManager, _dispatcher,
                                                _anomalyLog, sensors, retryPolicy, zone, time);
    _scheduler = new MetricScheduler(context, config.getLong(MonitorConfig.SCHEDULER_SHUTDOWN_TIMEOUT_MS_CONFIG));
    _started = false;
    LOG.info("MetricWatch is configured with alert channels {}.", _dispatcher.channelNames());
  }

  private DataSourceConnector defaultConnector(MetricWatchConfig config, ZoneId zone, MetricRegistry dropwizardMetricRegistry) {
    ConnectionRegistry connections;
    try {
      connections = ConnectionRegistry.load(Paths.get(config.getString(MonitorConfig.CONNECTIONS_FILE_CONFIG)));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read the connection registry.", e);
    }
    EnvResolver env = new EnvResolver();
    HttpSourceConnector http = new HttpSourceConnector(connections, env,
                                                       config.sourceTimeoutMs(MonitorConfig.HTTP_SOURCE_TIMEOUT_MS_CONFIG), zone);
    _closeables.add(http);
    Map<SourceType, DataSourceConnector> connectors = new EnumMap<>(SourceType.class);
    connectors.put(SourceType.RELATIONAL,
                   new RelationalQueryConnector(connections, env,
                                                config.sourceTimeoutMs(MonitorConfig.RELATIONAL_SOURCE_TIMEOUT_MS_CONFIG), zone));
    connectors.put(SourceType.FILE, new FileSourceConnector(zone));
    connectors.put(SourceType.HTTP, http);
    connectors.put(SourceType.INTERNAL, new InternalCounterConnector(dropwizardMetricRegistry));
    return new DataSourceConnectors(connectors);
  }

  /**
   * Load the metric definitions and the stored models, then start a worker for every enabled metric.
   *
   * @throws IOException If the metric definitions file cannot be read.
   */
  public synchronized void startUp() throws IOException {
    if (_started) {
      return;
    }
    LOG.info("Starting MetricWatch.");
    RegistrySnapshot snapshot = _registry.load(_definitionsFile);
    _lifecycleManager.loadStoredModels(_config.getLong(AnomalyDetectorConfig.MODEL_STORE_RETENTION_MS_CONFIG));
    _scheduler.reconcile(snapshot);
    _lifecycleManager.startUp(_config.getLong(AnomalyDetectorConfig.MODEL_LIFECYCLE_CHECK_INTERVAL_MS_CONFIG));
    _started = true;
    LOG.info("MetricWatch started with {} enabled metrics.", snapshot.listEnabled().size());
  }

  /**
   * Load the metric definitions without starting any worker.
   *
   * @throws IOException If the metric definitions file cannot be read.
   */
  public void loadDefinitions() throws IOException {
    _registry.load(_definitionsFile);
  }

  /**
   * Shutdown MetricWatch.
   */
  public synchronized void shutdown() {
    LOG.info("Shutting down MetricWatch.");
    long timeoutMs = _config.getLong(MonitorConfig.SCHEDULER_SHUTDOWN_TIMEOUT_MS_CONFIG);
    _scheduler.shutdown();
    _lifecycleManager.shutdown(timeoutMs);
    for (Closeable closeable : _closeables) {
      try {
        closeable.close();
      } catch (IOException e) {
        LOG.warn("Failed to close {}.", closeable, e);
      }
    }
    _started = false;
    LOG.info("MetricWatch shutdown completed.");
  }

  /**
   * @return All metric definitions, enabled or not.
   */
  public List<MetricDefinition> listMetrics() {
    return _registry.snapshot().all();
  }

  public Optional<MetricDefinition> metric(String metricId) {
    return _registry.get(metricId);
  }

  /**
   * Register a new metric and start its worker if it is enabled. Metrics created this way are kept in memory only;
   * a reload replaces them with the content of the definitions file.
   *
   * @param json JSON object of the metric definition.
   * @return The registered definition.
   */
  public MetricDefinition createMetric(JsonObject json) {
    MetricDefinition definition = MetricDefinitionParser.parse(json);
    synchronized (this) {
      if (_registry.get(definition.id()).isPresent()) {
        throw new IllegalArgumentException("Metric " + definition.id() + " already exists.");
      }
      RegistrySnapshot snapshot = _registry.put(definition);
      if (_started) {
        _scheduler.reconcile(snapshot);
      }
    }
    return definition;
  }

  /**
   * Remove a metric and stop its worker.
   *
   * @param metricId Id of the metric.
   * @return True if the metric existed.
   */
  public synchronized boolean deleteMetric(String metricId) {
    boolean removed = _registry.remove(metricId);
    if (removed && _started) {
      _scheduler.reconcile(_registry.snapshot());
    }
    return removed;
  }

  /**
   * Reload the metric definitions file and reconcile the running workers with it.
   *
   * @return The new registry snapshot.
   * @throws IOException If the metric definitions file cannot be read.
   */
  public synchronized RegistrySnapshot reload() throws IOException {
    RegistrySnapshot snapshot = _registry.load(_definitionsFile);
    if (_started) {
      _scheduler.reconcile(snapshot);
    }
    return snapshot;
  }

  /**
   * Train the model of a metric now. An empty window is first filled with the historical series of the metric.
   *
   * @param metricId Id of the metric.
   * @return The new model.
   * @throws IllegalArgumentException If the metric is unknown.
   * @throws IllegalStateException If the metric is disabled.
   * @throws NotEnoughSamplesException If the window holds fewer than the minimum samples.
   * @throws ModelTrainingException If training fails.
   */
  public ScorerModel trainModel(String metricId) throws NotEnoughSamplesException, ModelTrainingException {
    MetricDefinition definition = _registry.get(metricId)
                                           .orElseThrow(() -> new IllegalArgumentException("Unknown metric " + metricId));
    if (!definition.enabled()) {
      throw new IllegalStateException("Metric " + metricId + " is disabled.");
    }
    if (_baselineStore.size(metricId) == 0) {
      try {
        List<Sample> history = _connector.fetchHistorical(definition.source());
        if (_baselineStore.appendIfEmpty(metricId, history)) {
          LOG.info("Loaded {} historical samples of metric {} for training.", history.size(), metricId);
        }
      } catch (SourceException e) {
        LOG.warn("Failed to load historical samples of metric {}: {}", metricId, e.getMessage());
      }
    }
    return _lifecycleManager.trainNow(metricId);
  }

  public int retrainAll() {
    return _lifecycleManager.retrainAll();
  }

  public SortedMap<String, ModelStatus> modelStatus() {
    return _lifecycleManager.modelStatus();
  }

  /**
   * @param sinceMs Lower bound of event timestamps, inclusive.
   * @return Anomaly events since the given time, oldest first.
   */
  public List<AnomalyEvent> listAnomalies(long sinceMs) {
    return _anomalyLog.since(sinceMs);
  }

  /**
   * @param metricId Id of the metric.
   * @return The health of the metric, or empty if the metric has no running worker.
   */
  public Optional<Map<String, Object>> metricHealth(String metricId) {
    return _scheduler.health(metricId)
                     .map(h -> h.getJsonStructure(_lifecycleManager.state(metricId), _baselineStore.size(metricId)));
  }

  /**
   * @return The health of MetricWatch and of every monitored metric.
   */
  public Map<String, Object> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    SortedMap<String, MetricHealth> metricHealth = _scheduler.health();
    long failing = metricHealth.values().stream().filter(h -> h.consecutiveFailures() > 0).count();
    health.put("status", !_started ? "STOPPED" : failing == 0 ? "OK" : "DEGRADED");
    health.put("registry_loaded_at", _registry.snapshot().loadedAtMs());
    health.put("num_metrics", _registry.snapshot().size());
    health.put("num_running_workers", _scheduler.numRunningWorkers());
    health.put("num_failing_metrics", failing);
    health.put("num_anomalies", _anomalyLog.size());
    Map<String, Object> metrics = new LinkedHashMap<>();
    metricHealth.forEach((id, h) -> metrics.put(id, h.getJsonStructure(_lifecycleManager.state(id), _baselineStore.size(id))));
    health.put("metrics", metrics);
    return health;
  }

  /**
   * Generate a report of the anomalies since the given time.
   *
   * @param sinceMs Lower bound of event timestamps, inclusive.
   * @return Reference of the generated document.
   * @throws MetricWatchException If the report cannot be generated.
   */
  public String generateReport(long sinceMs) throws MetricWatchException {
    if (_reportGenerator == null) {
      throw new IllegalStateException("No anomaly report generator is configured.");
    }
    String reference = _reportGenerator.generate(_anomalyLog.since(sinceMs));
    LOG.info("Generated anomaly report {}.", reference);
    return reference;
  }

  public MetricWatchConfig config() {
    return _config;
  }

  public Time time() {
    return _time;
  }
}
