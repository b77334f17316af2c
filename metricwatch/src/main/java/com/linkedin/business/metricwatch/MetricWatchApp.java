/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import com.linkedin.business.metricwatch.config.MetricWatchConfig;
import com.linkedin.business.metricwatch.config.constants.MonitorConfig;
import com.linkedin.business.metricwatch.config.constants.WebServerConfig;
import com.linkedin.business.metricwatch.vertx.MainVerticle;
import com.linkedin.metricwatch.exception.MetricWatchException;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Runs MetricWatch with its sensors reported over JMX and, if enabled, the management API served by Vert.x.
 */
public class MetricWatchApp {
  protected static final Logger LOG = LoggerFactory.getLogger(MetricWatchApp.class);
  protected static final String METRIC_DOMAIN = "metricwatch";

  protected final MetricWatchConfig _config;
  protected final MetricWatch _metricWatch;
  protected final JmxReporter _jmxReporter;
  protected final MetricRegistry _metricRegistry;
  protected final boolean _httpEnabled;
  protected final int _port;
  protected final String _hostname;
  protected MainVerticle _verticle;
  private final CountDownLatch _stopped;
  private Vertx _vertx;

  public MetricWatchApp(MetricWatchConfig config) throws MetricWatchException {
    _config = config;
    _metricRegistry = new MetricRegistry();
    _jmxReporter = JmxReporter.forRegistry(_metricRegistry).inDomain(METRIC_DOMAIN).build();
    _jmxReporter.start();
    _httpEnabled = config.getBoolean(WebServerConfig.WEBSERVER_HTTP_ENABLE_CONFIG);
    _port = config.getInt(WebServerConfig.WEBSERVER_HTTP_PORT_CONFIG);
    _hostname = config.getString(WebServerConfig.WEBSERVER_HTTP_ADDRESS_CONFIG);
    _metricWatch = new MetricWatch(config, Time.SYSTEM, _metricRegistry);
    _stopped = new CountDownLatch(1);
  }

  public MetricWatch metricWatch() {
    return _metricWatch;
  }

  public String serverUrl() {
    if (_verticle == null) {
      return null;
    }
    try {
      return new URL("http", _hostname, _verticle.getServer().actualPort(), "/").toString();
    } catch (MalformedURLException e) {
      LOG.error("Could not create URL from the given port and host.", e);
    }
    return null;
  }

  /**
   * Start monitoring, then the management API if it is enabled.
   *
   * @throws IOException If the metric definitions cannot be read.
   */
  public void start() throws IOException {
    _metricWatch.startUp();
    if (_httpEnabled) {
      _vertx = Vertx.vertx();
      CountDownLatch startupLatch = new CountDownLatch(1);
      _verticle = new MainVerticle(_metricWatch, _port, _hostname);
      _vertx.deployVerticle(_verticle, event -> {
        if (event.failed()) {
          LOG.error("Failed to start the management API.", event.cause());
        }
        startupLatch.countDown();
      });
      try {
        if (!startupLatch.await(1, TimeUnit.MINUTES)) {
          throw new IllegalStateException("The management API did not start within a minute.");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Startup interrupted", e);
      }
    }
    printStartupInfo();
  }

  /**
   * Block until {@link #stop()} completes. The workers of MetricWatch run on daemon threads, so the caller of
   * {@link #start()} waits here to keep the process alive.
   *
   * @throws InterruptedException If interrupted while waiting.
   */
  public void awaitShutdown() throws InterruptedException {
    _stopped.await();
  }

  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "MetricWatchShutdownHook"));
  }

  /**
   * Stops MetricWatch and releases the callers of {@link #awaitShutdown()}. Only the first call has an effect.
   */
  public synchronized void stop() {
    if (_stopped.getCount() == 0) {
      return;
    }
    if (_vertx != null) {
      CountDownLatch closeLatch = new CountDownLatch(1);
      _vertx.close(event -> {
        if (event.failed()) {
          LOG.warn("Failed to stop the management API.", event.cause());
        }
        closeLatch.countDown();
      });
      try {
        closeLatch.await(1, TimeUnit.MINUTES);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.warn("Interrupted while stopping the management API.");
      }
      _vertx = null;
    }
    _metricWatch.shutdown();
    _jmxReporter.close();
    _stopped.countDown();
  }

  protected void printStartupInfo() {
    String webApiUrlPrefix = _config.getString(WebServerConfig.WEBSERVER_API_URLPREFIX_CONFIG);
    System.out.println(">> ********************************************* <<");
    System.out.println(">> Application directory            : " + System.getProperty("user.dir"));
    System.out.println(">> Metric definitions               : " + _config.getString(MonitorConfig.METRIC_DEFINITIONS_FILE_CONFIG));
    System.out.println(">> Monitoring time zone             : " + _config.timeZone());
    System.out.println(">> REST API available on           : " + (_httpEnabled ? webApiUrlPrefix : "disabled"));
    System.out.println(">> MetricWatch started on           : " + serverUrl());
    System.out.println(">> ********************************************* <<");
  }
}
