/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

/**
 * The result of scoring a single sample.
 */
public final class AnomalyScoreResult {
  private final double _score;
  private final boolean _isAnomaly;
  private final double _confidence;
  private final ScoringPath _path;
  private final double _baselineMean;
  private final double _deviation;

  public AnomalyScoreResult(double score, boolean isAnomaly, double confidence, ScoringPath path, double baselineMean,
                            double deviation) {
    _score = score;
    _isAnomaly = isAnomaly;
    _confidence = confidence;
    _path = path;
    _baselineMean = baselineMean;
    _deviation = deviation;
  }

  /**
   * @return Anomaly score in [-1, 1], lower is more anomalous.
   */
  public double score() {
    return _score;
  }

  public boolean isAnomaly() {
    return _isAnomaly;
  }

  /**
   * @return Confidence in [0, 1]. Fallback results never exceed 0.5.
   */
  public double confidence() {
    return _confidence;
  }

  public ScoringPath path() {
    return _path;
  }

  public double baselineMean() {
    return _baselineMean;
  }

  /**
   * @return Signed deviation of the sample from the baseline mean, in the unit of the alert threshold type.
   */
  public double deviation() {
    return _deviation;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnomalyScoreResult that = (AnomalyScoreResult) o;
    return Double.compare(that._score, _score) == 0 && _isAnomaly == that._isAnomaly
           && Double.compare(that._confidence, _confidence) == 0 && _path == that._path
           && Double.compare(that._baselineMean, _baselineMean) == 0 && Double.compare(that._deviation, _deviation) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(_score);
    result = 31 * result + Boolean.hashCode(_isAnomaly);
    result = 31 * result + Double.hashCode(_confidence);
    result = 31 * result + _path.hashCode();
    result = 31 * result + Double.hashCode(_baselineMean);
    result = 31 * result + Double.hashCode(_deviation);
    return result;
  }

  @Override
  public String toString() {
    return String.format("{score=%.4f, anomaly=%s, confidence=%.2f, path=%s, mean=%.4f, deviation=%.4f}",
                         _score, _isAnomaly, _confidence, _path, _baselineMean, _deviation);
  }
}
