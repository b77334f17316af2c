/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

/**
 * How a sample was scored: by a trained isolation forest, or by the deviation from the baseline mean.
 */
public enum ScoringPath {
  MODEL, FALLBACK
}
