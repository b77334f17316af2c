/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;


/**
 * Alerting policy of a metric.
 */
public final class AlertConfig {
  public static final int DEFAULT_COOLDOWN_MINUTES = 60;
  private final Severity _severity;
  private final ThresholdType _thresholdType;
  private final double _thresholdValue;
  private final Direction _direction;
  private final int _cooldownMinutes;
  private final List<String> _channels;
  private final List<String> _recipients;

  public AlertConfig(Severity severity,
                     ThresholdType thresholdType,
                     double thresholdValue,
                     Direction direction,
                     int cooldownMinutes,
                     List<String> channels,
                     List<String> recipients) {
    _severity = severity;
    _thresholdType = thresholdType;
    _thresholdValue = thresholdValue;
    _direction = direction;
    _cooldownMinutes = cooldownMinutes;
    _channels = Collections.unmodifiableList(channels);
    _recipients = Collections.unmodifiableList(recipients);
  }

  public Severity severity() {
    return _severity;
  }

  public ThresholdType thresholdType() {
    return _thresholdType;
  }

  public double thresholdValue() {
    return _thresholdValue;
  }

  public Direction direction() {
    return _direction;
  }

  public int cooldownMinutes() {
    return _cooldownMinutes;
  }

  public long cooldownMs() {
    return TimeUnit.MINUTES.toMillis(_cooldownMinutes);
  }

  public List<String> channels() {
    return _channels;
  }

  public List<String> recipients() {
    return _recipients;
  }

  /**
   * @param value Observed value.
   * @param mean Baseline mean.
   * @return The signed deviation of the value, measured per the threshold type.
   */
  public double deviation(double value, double mean) {
    return _thresholdType.deviation(value, mean);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AlertConfig that = (AlertConfig) o;
    return Double.compare(that._thresholdValue, _thresholdValue) == 0 && _cooldownMinutes == that._cooldownMinutes
           && _severity == that._severity && _thresholdType == that._thresholdType && _direction == that._direction
           && _channels.equals(that._channels) && _recipients.equals(that._recipients);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_severity, _thresholdType, _thresholdValue, _direction, _cooldownMinutes, _channels, _recipients);
  }
}
