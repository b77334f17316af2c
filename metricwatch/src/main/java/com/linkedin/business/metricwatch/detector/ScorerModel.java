/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.business.metricwatch.registry.ScoringConfig.Feature;
import com.linkedin.metricwatch.model.forest.IsolationForest;
import com.linkedin.metricwatch.model.forest.Standardizer;
import java.util.Collections;
import java.util.List;


/**
 * An immutable trained model of a single metric. A model is replaced as a whole on retrain, never modified.
 */
public final class ScorerModel {
  private final String _metricId;
  private final IsolationForest _forest;
  private final Standardizer _standardizer;
  private final List<Feature> _features;
  private final double _contamination;
  private final long _trainedAtMs;
  private final int _sampleCount;
  private final double _trainingAnomalyRate;
  private final long _baselineSequence;

  /**
   * @param metricId Id of the metric this model scores.
   * @param forest The trained forest.
   * @param standardizer Standardization parameters of the training features.
   * @param features Feature schema of the rows the forest was trained on.
   * @param contamination Contamination the decision offset was calibrated with.
   * @param trainedAtMs Training time.
   * @param sampleCount Number of training samples.
   * @param trainingAnomalyRate Proportion of training samples scored below the decision threshold.
   * @param baselineSequence Number of samples ever appended to the baseline window at training time.
   */
  public ScorerModel(String metricId,
                     IsolationForest forest,
                     Standardizer standardizer,
                     List<Feature> features,
                     double contamination,
                     long trainedAtMs,
                     int sampleCount,
                     double trainingAnomalyRate,
                     long baselineSequence) {
    _metricId = metricId;
    _forest = forest;
    _standardizer = standardizer;
    _features = Collections.unmodifiableList(features);
    _contamination = contamination;
    _trainedAtMs = trainedAtMs;
    _sampleCount = sampleCount;
    _trainingAnomalyRate = trainingAnomalyRate;
    _baselineSequence = baselineSequence;
  }

  public String metricId() {
    return _metricId;
  }

  public IsolationForest forest() {
    return _forest;
  }

  public Standardizer standardizer() {
    return _standardizer;
  }

  public List<Feature> features() {
    return _features;
  }

  public double contamination() {
    return _contamination;
  }

  public long trainedAtMs() {
    return _trainedAtMs;
  }

  public int sampleCount() {
    return _sampleCount;
  }

  public double trainingAnomalyRate() {
    return _trainingAnomalyRate;
  }

  public long baselineSequence() {
    return _baselineSequence;
  }

  /**
   * @param baselineSequence Number of samples ever appended to the baseline window.
   * @return A copy of this model that counts new samples from the given sequence number.
   */
  public ScorerModel withBaselineSequence(long baselineSequence) {
    return new ScorerModel(_metricId, _forest, _standardizer, _features, _contamination, _trainedAtMs, _sampleCount,
                           _trainingAnomalyRate, baselineSequence);
  }

  /**
   * @param row Raw, unstandardized feature row.
   * @return Decision score of the row, negative for outliers.
   */
  public double decisionScore(double[] row) {
    return _forest.decisionFunction(_standardizer.transform(row));
  }

  @Override
  public String toString() {
    return String.format("ScorerModel{metric=%s, trees=%d, samples=%d, features=%s, trainedAt=%d}",
                         _metricId, _forest.numTrees(), _sampleCount, _features, _trainedAtMs);
  }
}
