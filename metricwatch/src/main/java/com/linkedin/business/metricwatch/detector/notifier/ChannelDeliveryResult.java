/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * The outcome of delivering an alert to a single channel.
 */
public final class ChannelDeliveryResult {
  private final String _channel;
  private final boolean _delivered;
  private final String _error;

  private ChannelDeliveryResult(String channel, boolean delivered, String error) {
    _channel = channel;
    _delivered = delivered;
    _error = error;
  }

  public static ChannelDeliveryResult delivered(String channel) {
    return new ChannelDeliveryResult(channel, true, null);
  }

  public static ChannelDeliveryResult failed(String channel, String error) {
    return new ChannelDeliveryResult(channel, false, error);
  }

  public String channel() {
    return _channel;
  }

  public boolean isDelivered() {
    return _delivered;
  }

  /**
   * @return The delivery error, or null if the alert was delivered.
   */
  public String error() {
    return _error;
  }

  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("channel", _channel);
    json.put("delivered", _delivered);
    if (_error != null) {
      json.put("error", _error);
    }
    return json;
  }

  @Override
  public String toString() {
    return _delivered ? _channel + ": delivered" : _channel + ": failed (" + _error + ")";
  }
}
