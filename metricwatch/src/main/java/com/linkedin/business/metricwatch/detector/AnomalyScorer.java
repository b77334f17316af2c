/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.business.metricwatch.registry.AlertConfig;
import com.linkedin.business.metricwatch.registry.MetricDefinition;
import com.linkedin.business.metricwatch.registry.ScoringConfig;
import com.linkedin.business.metricwatch.registry.Severity;
import com.linkedin.metricwatch.exception.ModelTrainingException;
import com.linkedin.metricwatch.exception.NotEnoughSamplesException;
import com.linkedin.metricwatch.model.forest.IsolationForest;
import com.linkedin.metricwatch.model.forest.Standardizer;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.metricwatch.common.utils.Utils.clamp;


/**
 * Scores samples of a metric against its baseline window.
 *
 * <p>With a trained model and a window holding at least the minimum samples, a sample is scored by an isolation
 * forest over its standardized features. Otherwise the sample is scored by its deviation from the window mean, with
 * a confidence capped at 0.5. Scoring never throws.</p>
 *
 * <p>The scorer also holds the current model of each metric. Models are swapped by replacing the map entry.</p>
 */
public class AnomalyScorer {
  private static final Logger LOG = LoggerFactory.getLogger(AnomalyScorer.class);
  static final double MAX_FALLBACK_CONFIDENCE = 0.5;
  private final ZoneId _zone;
  private final int _numTrees;
  private final int _maxSamples;
  private final long _seed;
  private final Time _time;
  private final Map<String, ScorerModel> _models;

  public AnomalyScorer(ZoneId zone, Time time) {
    this(zone, IsolationForest.DEFAULT_NUM_TREES, IsolationForest.DEFAULT_MAX_SAMPLES, IsolationForest.DEFAULT_SEED, time);
  }

  public AnomalyScorer(ZoneId zone, int numTrees, int maxSamples, long seed, Time time) {
    _zone = zone;
    _numTrees = numTrees;
    _maxSamples = maxSamples;
    _seed = seed;
    _time = time;
    _models = new ConcurrentHashMap<>();
  }

  /**
   * Train a model of the given metric on the given window. The model is not installed.
   *
   * @param definition Definition of the metric.
   * @param window Baseline window to train on.
   * @param baselineSequence Number of samples ever appended to the window.
   * @return The trained model.
   * @throws NotEnoughSamplesException If the window holds fewer samples than the minimum of the metric.
   * @throws ModelTrainingException If the forest cannot be fit.
   */
  public ScorerModel train(MetricDefinition definition, List<Sample> window, long baselineSequence)
      throws NotEnoughSamplesException, ModelTrainingException {
    int required = definition.historical().minSamples();
    if (window.size() < required) {
      throw new NotEnoughSamplesException(definition.id(), window.size(), required);
    }
    ScoringConfig scoring = definition.scoring();
    double[][] rows = FeatureExtractor.extract(window, scoring.features(), _zone);
    try {
      Standardizer standardizer = Standardizer.fit(rows);
      double[][] standardized = standardizer.transform(rows);
      IsolationForest forest = IsolationForest.fit(standardized, _numTrees, _maxSamples, scoring.contamination(), _seed);
      int flagged = 0;
      for (double[] row : standardized) {
        if (forest.decisionFunction(row) < scoring.threshold()) {
          flagged++;
        }
      }
      ScorerModel model = new ScorerModel(definition.id(), forest, standardizer, scoring.features(),
                                          scoring.contamination(), _time.milliseconds(), window.size(),
                                          (double) flagged / rows.length, baselineSequence);
      LOG.debug("Trained {}.", model);
      return model;
    } catch (IllegalArgumentException e) {
      throw new ModelTrainingException(String.format("Failed to train model of metric %s.", definition.id()), e);
    }
  }

  /**
   * Score a sample with the installed model of its metric, or with the fallback if there is none.
   *
   * @param definition Definition of the metric.
   * @param baseline Baseline window the sample is compared against.
   * @param sample Sample to score.
   * @return The score result.
   */
  public AnomalyScoreResult score(MetricDefinition definition, List<Sample> baseline, Sample sample) {
    return score(_models.get(definition.id()), definition, baseline, sample);
  }

  /**
   * Score a sample. The model path is used only if the model is non-null and compatible with the scoring features of
   * the definition, and the baseline holds at least the minimum samples. For a fixed model and input the result is
   * always the same.
   *
   * @param model Model to score with, may be null.
   * @param definition Definition of the metric.
   * @param baseline Baseline window the sample is compared against.
   * @param sample Sample to score.
   * @return The score result.
   */
  public AnomalyScoreResult score(ScorerModel model, MetricDefinition definition, List<Sample> baseline, Sample sample) {
    AlertConfig alert = definition.alert();
    if (baseline.isEmpty()) {
      return new AnomalyScoreResult(0.0, false, 0.0, ScoringPath.FALLBACK, Double.NaN, 0.0);
    }
    double mean = mean(baseline);
    double deviation = alert.deviation(sample.value(), mean);
    boolean useModel = model != null
                       && model.features().equals(definition.scoring().features())
                       && baseline.size() >= definition.historical().minSamples();
    if (useModel) {
      ScoringConfig scoring = definition.scoring();
      double score = clamp(model.decisionScore(FeatureExtractor.extract(sample, model.features(), _zone)), -1.0, 1.0);
      boolean isAnomaly = score < scoring.threshold() && alert.direction().matches(deviation);
      double confidence = clamp(2.0 * Math.abs(score - scoring.threshold()) * (1.0 - model.contamination()), 0.0, 1.0);
      return new AnomalyScoreResult(score, isAnomaly, confidence, ScoringPath.MODEL, mean, deviation);
    }
    return fallback(alert, mean, deviation);
  }

  private static AnomalyScoreResult fallback(AlertConfig alert, double mean, double deviation) {
    double threshold = alert.thresholdValue();
    if (threshold <= 0.0) {
      return new AnomalyScoreResult(1.0, false, 0.0, ScoringPath.FALLBACK, mean, deviation);
    }
    double magnitude = Math.abs(deviation);
    boolean isAnomaly = alert.direction().breaches(deviation, threshold);
    double score = clamp(1.0 - magnitude / threshold, -1.0, 1.0);
    double confidence = MAX_FALLBACK_CONFIDENCE * clamp(magnitude / (2.0 * threshold), 0.0, 1.0);
    return new AnomalyScoreResult(score, isAnomaly, confidence, ScoringPath.FALLBACK, mean, deviation);
  }

  /**
   * Build the event of an anomalous score result. The configured severity is escalated by one level for each full
   * additional multiple of the threshold the deviation reaches, up to critical.
   *
   * @param definition Definition of the metric.
   * @param sample The scored sample.
   * @param result The score result.
   * @return The anomaly event.
   */
  public AnomalyEvent toEvent(MetricDefinition definition, Sample sample, AnomalyScoreResult result) {
    return new AnomalyEvent(definition.id(), sample.timestampMs(), sample.value(), result.baselineMean(),
                            result.deviation(), result.score(), severityFor(definition.alert(), result.deviation()),
                            result.confidence(), result.path());
  }

  static Severity severityFor(AlertConfig alert, double deviation) {
    double threshold = alert.thresholdValue();
    if (threshold <= 0.0) {
      return alert.severity();
    }
    int multiples = (int) Math.floor(Math.abs(deviation) / threshold);
    return alert.severity().escalate(Math.max(0, multiples - 1));
  }

  private static double mean(List<Sample> baseline) {
    double[] values = new double[baseline.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = baseline.get(i).value();
    }
    return new Mean().evaluate(values);
  }

  /**
   * Install the given model as the current model of its metric.
   *
   * @param model Model to install.
   * @return The previously installed model, or null.
   */
  public ScorerModel installModel(ScorerModel model) {
    return _models.put(model.metricId(), model);
  }

  public ScorerModel model(String metricId) {
    return _models.get(metricId);
  }

  public ScorerModel removeModel(String metricId) {
    return _models.remove(metricId);
  }

  public ZoneId zone() {
    return _zone;
  }
}
