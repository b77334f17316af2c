/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;
import java.util.concurrent.TimeUnit;

import static com.linkedin.metricwatch.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep MetricWatch Monitor Configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class MonitorConfig {

  /**
   * <code>metric.definitions.file</code>
   */
  public static final String METRIC_DEFINITIONS_FILE_CONFIG = "metric.definitions.file";
  public static final String DEFAULT_METRIC_DEFINITIONS_FILE = "config/metrics.json";
  public static final String METRIC_DEFINITIONS_FILE_DOC = "The JSON file holding the array of metric definitions to monitor.";

  /**
   * <code>connections.file</code>
   */
  public static final String CONNECTIONS_FILE_CONFIG = "connections.file";
  public static final String DEFAULT_CONNECTIONS_FILE = "config/connections.json";
  public static final String CONNECTIONS_FILE_DOC = "The JSON file mapping connection ids to connection parameters. "
      + "Credentials are referenced by environment variable name, never embedded.";

  /**
   * <code>monitoring.time.zone</code>
   */
  public static final String MONITORING_TIME_ZONE_CONFIG = "monitoring.time.zone";
  public static final String DEFAULT_MONITORING_TIME_ZONE = "UTC";
  public static final String MONITORING_TIME_ZONE_DOC = "The time zone used to evaluate active hours, active weekdays and "
      + "calendar features of samples.";

  /**
   * <code>source.timeout.ms</code>
   */
  public static final String SOURCE_TIMEOUT_MS_CONFIG = "source.timeout.ms";
  public static final long DEFAULT_SOURCE_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(30);
  public static final String SOURCE_TIMEOUT_MS_DOC = "The default timeout in ms of a single data source call.";

  /**
   * <code>relational.source.timeout.ms</code>
   */
  public static final String RELATIONAL_SOURCE_TIMEOUT_MS_CONFIG = "relational.source.timeout.ms";
  public static final Long DEFAULT_RELATIONAL_SOURCE_TIMEOUT_MS = null;
  public static final String RELATIONAL_SOURCE_TIMEOUT_MS_DOC = "The timeout in ms of a relational query. If not specified, "
      + SOURCE_TIMEOUT_MS_CONFIG + " is used. A connection level timeout_ms takes precedence.";

  /**
   * <code>http.source.timeout.ms</code>
   */
  public static final String HTTP_SOURCE_TIMEOUT_MS_CONFIG = "http.source.timeout.ms";
  public static final Long DEFAULT_HTTP_SOURCE_TIMEOUT_MS = null;
  public static final String HTTP_SOURCE_TIMEOUT_MS_DOC = "The timeout in ms of an HTTP source request. If not specified, "
      + SOURCE_TIMEOUT_MS_CONFIG + " is used. A connection level timeout_ms takes precedence.";

  /**
   * <code>poll.retry.attempts</code>
   */
  public static final String POLL_RETRY_ATTEMPTS_CONFIG = "poll.retry.attempts";
  public static final int DEFAULT_POLL_RETRY_ATTEMPTS = 3;
  public static final String POLL_RETRY_ATTEMPTS_DOC = "The maximum number of attempts to fetch the current value of a metric "
      + "in one poll when the data source reports a transient error.";

  /**
   * <code>poll.retry.backoff.ms</code>
   */
  public static final String POLL_RETRY_BACKOFF_MS_CONFIG = "poll.retry.backoff.ms";
  public static final long DEFAULT_POLL_RETRY_BACKOFF_MS = TimeUnit.SECONDS.toMillis(2);
  public static final String POLL_RETRY_BACKOFF_MS_DOC = "The base backoff in ms between two attempts. The backoff doubles "
      + "after every failed attempt.";

  /**
   * <code>poll.retry.max.backoff.ms</code>
   */
  public static final String POLL_RETRY_MAX_BACKOFF_MS_CONFIG = "poll.retry.max.backoff.ms";
  public static final long DEFAULT_POLL_RETRY_MAX_BACKOFF_MS = TimeUnit.SECONDS.toMillis(30);
  public static final String POLL_RETRY_MAX_BACKOFF_MS_DOC = "The upper bound in ms of the backoff between two attempts.";

  /**
   * <code>scheduler.shutdown.timeout.ms</code>
   */
  public static final String SCHEDULER_SHUTDOWN_TIMEOUT_MS_CONFIG = "scheduler.shutdown.timeout.ms";
  public static final long DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_MS = TimeUnit.SECONDS.toMillis(10);
  public static final String SCHEDULER_SHUTDOWN_TIMEOUT_MS_DOC = "The time in ms to wait for metric workers to terminate on shutdown.";

  private MonitorConfig() {
  }

  /**
   * Define configs for Monitor.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Monitor.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(METRIC_DEFINITIONS_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_METRIC_DEFINITIONS_FILE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.HIGH,
                            METRIC_DEFINITIONS_FILE_DOC)
                    .define(CONNECTIONS_FILE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_CONNECTIONS_FILE,
                            ConfigDef.Importance.HIGH,
                            CONNECTIONS_FILE_DOC)
                    .define(MONITORING_TIME_ZONE_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_MONITORING_TIME_ZONE,
                            new ConfigDef.NonEmptyString(),
                            ConfigDef.Importance.MEDIUM,
                            MONITORING_TIME_ZONE_DOC)
                    .define(SOURCE_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_SOURCE_TIMEOUT_MS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            SOURCE_TIMEOUT_MS_DOC)
                    .define(RELATIONAL_SOURCE_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_RELATIONAL_SOURCE_TIMEOUT_MS,
                            ConfigDef.Importance.LOW,
                            RELATIONAL_SOURCE_TIMEOUT_MS_DOC)
                    .define(HTTP_SOURCE_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_HTTP_SOURCE_TIMEOUT_MS,
                            ConfigDef.Importance.LOW,
                            HTTP_SOURCE_TIMEOUT_MS_DOC)
                    .define(POLL_RETRY_ATTEMPTS_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_POLL_RETRY_ATTEMPTS,
                            atLeast(1),
                            ConfigDef.Importance.MEDIUM,
                            POLL_RETRY_ATTEMPTS_DOC)
                    .define(POLL_RETRY_BACKOFF_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_POLL_RETRY_BACKOFF_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            POLL_RETRY_BACKOFF_MS_DOC)
                    .define(POLL_RETRY_MAX_BACKOFF_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_POLL_RETRY_MAX_BACKOFF_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            POLL_RETRY_MAX_BACKOFF_MS_DOC)
                    .define(SCHEDULER_SHUTDOWN_TIMEOUT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_MS,
                            atLeast(0),
                            ConfigDef.Importance.LOW,
                            SCHEDULER_SHUTDOWN_TIMEOUT_MS_DOC);
  }
}
