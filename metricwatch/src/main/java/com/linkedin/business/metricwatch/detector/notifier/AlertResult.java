/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector.notifier;

/**
 * The result of offering an anomaly event to the {@link AlertDispatcher}: either an alert record, or the reason the
 * alert was suppressed.
 */
public final class AlertResult {
  public enum SuppressionReason {
    BELOW_THRESHOLD, COOLDOWN
  }

  private final AlertRecord _record;
  private final SuppressionReason _suppressionReason;

  private AlertResult(AlertRecord record, SuppressionReason suppressionReason) {
    _record = record;
    _suppressionReason = suppressionReason;
  }

  public static AlertResult dispatched(AlertRecord record) {
    return new AlertResult(record, null);
  }

  public static AlertResult suppressed(SuppressionReason reason) {
    return new AlertResult(null, reason);
  }

  public boolean isSuppressed() {
    return _record == null;
  }

  /**
   * @return The alert record, or null if the alert was suppressed.
   */
  public AlertRecord record() {
    return _record;
  }

  /**
   * @return The suppression reason, or null if an alert record was created.
   */
  public SuppressionReason suppressionReason() {
    return _suppressionReason;
  }

  @Override
  public String toString() {
    return isSuppressed() ? "Suppressed(" + _suppressionReason + ")" : _record.toString();
  }
}
