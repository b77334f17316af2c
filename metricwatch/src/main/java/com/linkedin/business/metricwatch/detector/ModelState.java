/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

/**
 * Freshness of the model of a metric.
 *
 * <ul>
 *   <li>{@link #UNTRAINED}: No model yet. Samples are scored by the fallback.</li>
 *   <li>{@link #TRAINED}: A fresh model scores samples.</li>
 *   <li>{@link #STALE}: The model is due for retraining but keeps scoring until a retrain succeeds.</li>
 * </ul>
 */
public enum ModelState {
  UNTRAINED, TRAINED, STALE
}
