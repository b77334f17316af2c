/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config;

import com.linkedin.business.metricwatch.config.constants.AnomalyDetectorConfig;
import com.linkedin.business.metricwatch.config.constants.MonitorConfig;
import com.linkedin.business.metricwatch.config.constants.NotifierConfig;
import com.linkedin.business.metricwatch.config.constants.WebServerConfig;
import com.linkedin.metricwatch.common.config.AbstractConfig;
import com.linkedin.metricwatch.common.config.ConfigDef;
import com.linkedin.metricwatch.common.config.ConfigException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;


/**
 * The configuration class of MetricWatch.
 *
 * To avoid having a huge monolithic class that mixes unrelated configs, config names, their defaults, and definitions
 * reside in the relevant classes under {@link com.linkedin.business.metricwatch.config.constants}.
 */
public class MetricWatchConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = NotifierConfig.define(AnomalyDetectorConfig.define(MonitorConfig.define(WebServerConfig.define(new ConfigDef()))));
  }

  public MetricWatchConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public MetricWatchConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckRetryBackoff();
    sanityCheckTimeZone();
    sanityCheckWebServerUrlPrefix();
  }

  /**
   * Read the MetricWatch config from the given properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The parsed config.
   */
  public static MetricWatchConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new MetricWatchConfig(props);
  }

  /**
   * @return The zone used to evaluate active hours and calendar features.
   */
  public ZoneId timeZone() {
    return ZoneId.of(getString(MonitorConfig.MONITORING_TIME_ZONE_CONFIG));
  }

  /**
   * @param sourceTypeTimeoutConfig The per source type timeout config, which may be unset.
   * @return The timeout in ms to use for the given source type.
   */
  public long sourceTimeoutMs(String sourceTypeTimeoutConfig) {
    Long timeoutMs = getLong(sourceTypeTimeoutConfig);
    return timeoutMs != null ? timeoutMs : getLong(MonitorConfig.SOURCE_TIMEOUT_MS_CONFIG);
  }

  private void sanityCheckRetryBackoff() {
    long base = getLong(MonitorConfig.POLL_RETRY_BACKOFF_MS_CONFIG);
    long max = getLong(MonitorConfig.POLL_RETRY_MAX_BACKOFF_MS_CONFIG);
    if (max < base) {
      throw new ConfigException(String.format("Attempt to configure %s (%d) below %s (%d).", MonitorConfig.POLL_RETRY_MAX_BACKOFF_MS_CONFIG,
                                              max, MonitorConfig.POLL_RETRY_BACKOFF_MS_CONFIG, base));
    }
    for (String key : new String[]{MonitorConfig.RELATIONAL_SOURCE_TIMEOUT_MS_CONFIG, MonitorConfig.HTTP_SOURCE_TIMEOUT_MS_CONFIG}) {
      Long timeoutMs = getLong(key);
      if (timeoutMs != null && timeoutMs <= 0) {
        throw new ConfigException(key, timeoutMs, "Timeout must be positive.");
      }
    }
  }

  private void sanityCheckTimeZone() {
    String zone = getString(MonitorConfig.MONITORING_TIME_ZONE_CONFIG);
    try {
      ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw new ConfigException(MonitorConfig.MONITORING_TIME_ZONE_CONFIG, zone, "Unknown time zone.");
    }
  }

  private void sanityCheckWebServerUrlPrefix() {
    String prefix = getString(WebServerConfig.WEBSERVER_API_URLPREFIX_CONFIG);
    if (!prefix.startsWith("/") || !prefix.endsWith("/*")) {
      throw new ConfigException(WebServerConfig.WEBSERVER_API_URLPREFIX_CONFIG, prefix, "Expect the prefix to start with / and end with /*.");
    }
  }
}
