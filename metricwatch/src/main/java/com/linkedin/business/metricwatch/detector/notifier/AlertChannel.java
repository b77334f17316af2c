/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.linkedin.business.metricwatch.exception.ChannelException;
import com.linkedin.metricwatch.common.MetricWatchConfigurable;


/**
 * A destination alerts are delivered to. Channels are instantiated from {@code alert.channel.classes} and referred
 * to by their {@link #name()} from the alert config of a metric.
 */
public interface AlertChannel extends MetricWatchConfigurable {

  /**
   * @return The name metric definitions refer to this channel by.
   */
  String name();

  /**
   * Deliver the given alert. Implementations do not retry.
   *
   * @param alert Alert to deliver.
   * @throws ChannelException If the alert could not be delivered.
   */
  void deliver(RenderedAlert alert) throws ChannelException;
}
