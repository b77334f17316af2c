/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config.constants;

import com.linkedin.business.metricwatch.detector.InMemoryAnomalyLog;
import com.linkedin.business.metricwatch.detector.NoopModelStore;
import com.linkedin.metricwatch.common.config.ConfigDef;
import com.linkedin.metricwatch.model.forest.IsolationForest;
import java.util.concurrent.TimeUnit;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;
import static com.linkedin.metricwatch.common.config.ConfigDef.Range.between;


/**
 * A class to keep MetricWatch Anomaly Detector Configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class AnomalyDetectorConfig {

  /**
   * <code>model.num.trees</code>
   */
  public static final String MODEL_NUM_TREES_CONFIG = "model.num.trees";
  public static final int DEFAULT_MODEL_NUM_TREES = IsolationForest.DEFAULT_NUM_TREES;
  public static final String MODEL_NUM_TREES_DOC = "The number of isolation trees in the scoring model of a metric.";

  /**
   * <code>model.max.samples</code>
   */
  public static final String MODEL_MAX_SAMPLES_CONFIG = "model.max.samples";
  public static final int DEFAULT_MODEL_MAX_SAMPLES = IsolationForest.DEFAULT_MAX_SAMPLES;
  public static final String MODEL_MAX_SAMPLES_DOC = "The maximum number of baseline samples drawn to grow one isolation tree.";

  /**
   * <code>model.random.seed</code>
   */
  public static final String MODEL_RANDOM_SEED_CONFIG = "model.random.seed";
  public static final long DEFAULT_MODEL_RANDOM_SEED = IsolationForest.DEFAULT_SEED;
  public static final String MODEL_RANDOM_SEED_DOC = "The seed used to grow scoring models. A fixed seed makes training "
      + "reproducible for the same baseline window.";

  /**
   * <code>model.retrain.interval.ms</code>
   */
  public static final String MODEL_RETRAIN_INTERVAL_MS_CONFIG = "model.retrain.interval.ms";
  public static final long DEFAULT_MODEL_RETRAIN_INTERVAL_MS = TimeUnit.HOURS.toMillis(24);
  public static final String MODEL_RETRAIN_INTERVAL_MS_DOC = "The age in ms after which a trained model is considered stale.";

  /**
   * <code>model.retrain.min.new.samples</code>
   */
  public static final String MODEL_RETRAIN_MIN_NEW_SAMPLES_CONFIG = "model.retrain.min.new.samples";
  public static final int DEFAULT_MODEL_RETRAIN_MIN_NEW_SAMPLES = 24;
  public static final String MODEL_RETRAIN_MIN_NEW_SAMPLES_DOC = "The number of samples appended to the baseline of a metric "
      + "since its last training after which its model is considered stale.";

  /**
   * <code>model.lifecycle.check.interval.ms</code>
   */
  public static final String MODEL_LIFECYCLE_CHECK_INTERVAL_MS_CONFIG = "model.lifecycle.check.interval.ms";
  public static final long DEFAULT_MODEL_LIFECYCLE_CHECK_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);
  public static final String MODEL_LIFECYCLE_CHECK_INTERVAL_MS_DOC = "The interval in ms at which the model lifecycle manager "
      + "trains untrained models and retrains stale ones.";

  /**
   * <code>model.store.class</code>
   */
  public static final String MODEL_STORE_CLASS_CONFIG = "model.store.class";
  public static final String DEFAULT_MODEL_STORE_CLASS = NoopModelStore.class.getName();
  public static final String MODEL_STORE_CLASS_DOC = "The store that trained models are saved to and loaded from at startup.";

  /**
   * <code>model.store.directory</code>
   */
  public static final String MODEL_STORE_DIRECTORY_CONFIG = "model.store.directory";
  public static final String DEFAULT_MODEL_STORE_DIRECTORY = "fileStore/models";
  public static final String MODEL_STORE_DIRECTORY_DOC = "The directory that a file based model store keeps one model file "
      + "per metric in.";

  /**
   * <code>model.store.retention.ms</code>
   */
  public static final String MODEL_STORE_RETENTION_MS_CONFIG = "model.store.retention.ms";
  public static final long DEFAULT_MODEL_STORE_RETENTION_MS = TimeUnit.DAYS.toMillis(30);
  public static final String MODEL_STORE_RETENTION_MS_DOC = "Stored models trained longer ago than this are deleted at "
      + "startup instead of being loaded.";

  /**
   * <code>anomaly.log.class</code>
   */
  public static final String ANOMALY_LOG_CLASS_CONFIG = "anomaly.log.class";
  public static final String DEFAULT_ANOMALY_LOG_CLASS = InMemoryAnomalyLog.class.getName();
  public static final String ANOMALY_LOG_CLASS_DOC = "The append-only log that anomaly events are written to.";

  /**
   * <code>anomaly.log.max.entries</code>
   */
  public static final String ANOMALY_LOG_MAX_ENTRIES_CONFIG = "anomaly.log.max.entries";
  public static final int DEFAULT_ANOMALY_LOG_MAX_ENTRIES = 1000;
  public static final String ANOMALY_LOG_MAX_ENTRIES_DOC = "The number of most recent anomaly events kept in memory.";

  /**
   * <code>anomaly.log.file.path</code>
   */
  public static final String ANOMALY_LOG_FILE_PATH_CONFIG = "anomaly.log.file.path";
  public static final String DEFAULT_ANOMALY_LOG_FILE_PATH = "fileStore/anomalies.jsonl";
  public static final String ANOMALY_LOG_FILE_PATH_DOC = "The file that a file based anomaly log appends JSON lines to.";

  /**
   * <code>anomaly.report.generator.class</code>
   */
  public static final String ANOMALY_REPORT_GENERATOR_CLASS_CONFIG = "anomaly.report.generator.class";
  public static final String DEFAULT_ANOMALY_REPORT_GENERATOR_CLASS = null;
  public static final String ANOMALY_REPORT_GENERATOR_CLASS_DOC = "The report generator that receives batches of anomaly events "
      + "on request. Reports are unavailable if not set.";

  private AnomalyDetectorConfig() {
  }

  /**
   * Define configs for Anomaly Detector.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Anomaly Detector.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(MODEL_NUM_TREES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MODEL_NUM_TREES,
                            between(1, 1000),
                            ConfigDef.Importance.LOW,
                            MODEL_NUM_TREES_DOC)
                    .define(MODEL_MAX_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MODEL_MAX_SAMPLES,
                            atLeast(2),
                            ConfigDef.Importance.LOW,
                            MODEL_MAX_SAMPLES_DOC)
                    .define(MODEL_RANDOM_SEED_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_RANDOM_SEED,
                            ConfigDef.Importance.LOW,
                            MODEL_RANDOM_SEED_DOC)
                    .define(MODEL_RETRAIN_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_RETRAIN_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MODEL_RETRAIN_INTERVAL_MS_DOC)
                    .define(MODEL_RETRAIN_MIN_NEW_SAMPLES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_MODEL_RETRAIN_MIN_NEW_SAMPLES,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            MODEL_RETRAIN_MIN_NEW_SAMPLES_DOC)
                    .define(MODEL_LIFECYCLE_CHECK_INTERVAL_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_LIFECYCLE_CHECK_INTERVAL_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MODEL_LIFECYCLE_CHECK_INTERVAL_MS_DOC)
                    .define(MODEL_STORE_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_MODEL_STORE_CLASS,
                            ConfigDef.Importance.LOW,
                            MODEL_STORE_CLASS_DOC)
                    .define(MODEL_STORE_DIRECTORY_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_MODEL_STORE_DIRECTORY,
                            ConfigDef.Importance.LOW,
                            MODEL_STORE_DIRECTORY_DOC)
                    .define(MODEL_STORE_RETENTION_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_MODEL_STORE_RETENTION_MS,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            MODEL_STORE_RETENTION_MS_DOC)
                    .define(ANOMALY_LOG_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ANOMALY_LOG_CLASS,
                            ConfigDef.Importance.LOW,
                            ANOMALY_LOG_CLASS_DOC)
                    .define(ANOMALY_LOG_MAX_ENTRIES_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ANOMALY_LOG_MAX_ENTRIES,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            ANOMALY_LOG_MAX_ENTRIES_DOC)
                    .define(ANOMALY_LOG_FILE_PATH_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_ANOMALY_LOG_FILE_PATH,
                            ConfigDef.Importance.LOW,
                            ANOMALY_LOG_FILE_PATH_DOC)
                    .define(ANOMALY_REPORT_GENERATOR_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_ANOMALY_REPORT_GENERATOR_CLASS,
                            ConfigDef.Importance.LOW,
                            ANOMALY_REPORT_GENERATOR_CLASS_DOC);
  }
}
