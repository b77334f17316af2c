/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Util class for convenience.
 */
public final class BusinessMetricWatchUtils {
  private static final Logger LOG = LoggerFactory.getLogger(BusinessMetricWatchUtils.class);
  public static final String OPERATION_LOGGER = "operationLogger";
  public static final String SENSOR_PREFIX = "MetricWatch";

  private BusinessMetricWatchUtils() {

  }

  /**
   * Shut down the given executor and wait for its termination up to the given timeout. Running tasks are interrupted
   * if they do not finish in time.
   *
   * @param executor Executor to shut down.
   * @param name Name of the executor, used in logs.
   * @param timeoutMs Time to wait for termination.
   * @return True if the executor terminated.
   */
  public static boolean shutdownAndAwait(ExecutorService executor, String name, long timeoutMs) {
    executor.shutdownNow();
    try {
      if (executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
        return true;
      }
      LOG.warn("{} did not terminate within {} ms.", name, timeoutMs);
    } catch (InterruptedException e) {
      LOG.warn("Interrupted while waiting for {} to terminate.", name);
      Thread.currentThread().interrupt();
    }
    return false;
  }
}
