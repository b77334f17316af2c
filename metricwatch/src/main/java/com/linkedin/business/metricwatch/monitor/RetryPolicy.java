/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.monitor;

/**
 * Bounded exponential backoff for transient source failures.
 */
public final class RetryPolicy {
  private final int _maxAttempts;
  private final long _backoffMs;
  private final long _maxBackoffMs;

  /**
   * @param maxAttempts Total number of attempts, the first one included.
   * @param backoffMs Wait before the second attempt. Each further wait doubles.
   * @param maxBackoffMs Upper bound of a single wait.
   */
  public RetryPolicy(int maxAttempts, long backoffMs, long maxBackoffMs) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("At least one attempt is required, got " + maxAttempts);
    }
    _maxAttempts = maxAttempts;
    _backoffMs = backoffMs;
    _maxBackoffMs = maxBackoffMs;
  }

  public int maxAttempts() {
    return _maxAttempts;
  }

  /**
   * @param failedAttempt Number of the attempt that just failed, starting at 1.
   * @return The wait before the next attempt.
   */
  public long backoffMs(int failedAttempt) {
    long backoff = _backoffMs;
    for (int i = 1; i < failedAttempt && backoff < _maxBackoffMs; i++) {
      backoff *= 2;
    }
    return Math.min(backoff, _maxBackoffMs);
  }
}
