/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.config.constants;

import com.linkedin.metricwatch.common.config.ConfigDef;
import java.util.Collections;
import java.util.List;


/**
 * A class to keep MetricWatch Notifier Configs and defaults. Settings of an individual alert channel are defined by
 * the channel itself and read from the originals when the channel is configured.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class NotifierConfig {

  /**
   * <code>alert.channel.classes</code>
   */
  public static final String ALERT_CHANNEL_CLASSES_CONFIG = "alert.channel.classes";
  public static final List<String> DEFAULT_ALERT_CHANNEL_CLASSES = Collections.emptyList();
  public static final String ALERT_CHANNEL_CLASSES_DOC = "The alert channel classes available to metrics. A metric refers to "
      + "a channel by its name, e.g. email, slack or webhook.";

  /**
   * <code>alert.history.per.metric</code>
   */
  public static final String ALERT_HISTORY_PER_METRIC_CONFIG = "alert.history.per.metric";
  public static final int DEFAULT_ALERT_HISTORY_PER_METRIC = 20;
  public static final String ALERT_HISTORY_PER_METRIC_DOC = "The number of most recent alert records kept for each metric.";

  private NotifierConfig() {
  }

  /**
   * Define configs for Notifier.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for Notifier.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(ALERT_CHANNEL_CLASSES_CONFIG,
                            ConfigDef.Type.LIST,
                            DEFAULT_ALERT_CHANNEL_CLASSES,
                            ConfigDef.Importance.MEDIUM,
                            ALERT_CHANNEL_CLASSES_DOC)
                    .define(ALERT_HISTORY_PER_METRIC_CONFIG,
                            ConfigDef.Type.INT,
                            DEFAULT_ALERT_HISTORY_PER_METRIC,
                            ConfigDef.Range.atLeast(1),
                            ConfigDef.Importance.LOW,
                            ALERT_HISTORY_PER_METRIC_DOC);
  }
}
