/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

import com.google.gson.Gson;
import com.linkedin.business.metricwatch.config.EnvResolver;
import com.linkedin.business.metricwatch.exception.ChannelException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;


/**
 * Posts alerts as JSON documents to a generic HTTP endpoint.
 *
 * <ul>
 *   <li>{@value #WEBHOOK_ALERT_CHANNEL_URL}: The endpoint, required.</li>
 *   <li>{@value #WEBHOOK_ALERT_CHANNEL_TOKEN_ENV}: Name of an environment variable holding a bearer token,
 *   optional.</li>
 *   <li>{@value #WEBHOOK_ALERT_CHANNEL_TIMEOUT_MS}: Request timeout, optional.</li>
 * </ul>
 */
public class WebhookAlertChannel implements AlertChannel {
  public static final String NAME = "webhook";
  public static final String WEBHOOK_ALERT_CHANNEL_URL = "webhook.alert.channel.url";
  public static final String WEBHOOK_ALERT_CHANNEL_TOKEN_ENV = "webhook.alert.channel.token.env";
  public static final String WEBHOOK_ALERT_CHANNEL_TIMEOUT_MS = "webhook.alert.channel.timeout.ms";
  private static final Gson GSON = new Gson();
  private final EnvResolver _envResolver;
  protected String _url;
  protected String _tokenEnv;
  protected int _timeoutMs;

  public WebhookAlertChannel() {
    this(new EnvResolver());
  }

  public WebhookAlertChannel(EnvResolver envResolver) {
    _envResolver = envResolver;
  }

  @Override
  public void configure(Map<String, ?> config) {
    _url = (String) config.get(WEBHOOK_ALERT_CHANNEL_URL);
    _tokenEnv = (String) config.get(WEBHOOK_ALERT_CHANNEL_TOKEN_ENV);
    Object timeoutMs = config.get(WEBHOOK_ALERT_CHANNEL_TIMEOUT_MS);
    _timeoutMs = timeoutMs == null ? NotifierUtils.DEFAULT_TIMEOUT_MS : Integer.parseInt(timeoutMs.toString());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void deliver(RenderedAlert alert) throws ChannelException {
    if (_url == null) {
      throw new ChannelException("Webhook url is null, can't send webhook alert");
    }
    Map<String, String> headers = new HashMap<>();
    if (_tokenEnv != null) {
      String token = _envResolver.get(_tokenEnv);
      if (token == null) {
        throw new ChannelException("Environment variable " + _tokenEnv + " holding the webhook token is not set.");
      }
      headers.put("Authorization", "Bearer " + token);
    }
    try {
      post(GSON.toJson(alert.getJsonStructure()), headers);
    } catch (IOException e) {
      throw new ChannelException("ERROR sending alert to webhook " + _url, e);
    }
  }

  protected void post(String payload, Map<String, String> headers) throws IOException {
    NotifierUtils.sendMessage(payload, _url, headers, _timeoutMs);
  }
}
