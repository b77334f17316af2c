/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.google.gson.JsonObject;
import com.linkedin.business.metricwatch.registry.Severity;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static com.linkedin.metricwatch.MetricWatchUtils.utcDateFor;


/**
 * A detected anomaly of a single metric. Events are write-once.
 */
public final class AnomalyEvent {
  public static final String METRIC_ID = "metric_id";
  public static final String TIMESTAMP = "timestamp";
  public static final String VALUE = "value";
  public static final String EXPECTED = "expected";
  public static final String DEVIATION = "deviation";
  public static final String SCORE = "score";
  public static final String SEVERITY = "severity";
  public static final String CONFIDENCE = "confidence";
  public static final String SCORING_PATH = "scoring_path";
  private final String _metricId;
  private final long _timestampMs;
  private final double _value;
  private final double _expected;
  private final double _deviation;
  private final double _score;
  private final Severity _severity;
  private final double _confidence;
  private final ScoringPath _path;

  public AnomalyEvent(String metricId,
                      long timestampMs,
                      double value,
                      double expected,
                      double deviation,
                      double score,
                      Severity severity,
                      double confidence,
                      ScoringPath path) {
    _metricId = metricId;
    _timestampMs = timestampMs;
    _value = value;
    _expected = expected;
    _deviation = deviation;
    _score = score;
    _severity = severity;
    _confidence = confidence;
    _path = path;
  }

  public String metricId() {
    return _metricId;
  }

  public long timestampMs() {
    return _timestampMs;
  }

  public double value() {
    return _value;
  }

  /**
   * @return The baseline mean the value was compared against.
   */
  public double expected() {
    return _expected;
  }

  public double deviation() {
    return _deviation;
  }

  public double score() {
    return _score;
  }

  public Severity severity() {
    return _severity;
  }

  public double confidence() {
    return _confidence;
  }

  public ScoringPath path() {
    return _path;
  }

  /**
   * @return An object that can be further used to encode into JSON.
   */
  public Map<String, Object> getJsonStructure() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put(METRIC_ID, _metricId);
    json.put(TIMESTAMP, _timestampMs);
    json.put(VALUE, _value);
    json.put(EXPECTED, _expected);
    json.put(DEVIATION, _deviation);
    json.put(SCORE, _score);
    json.put(SEVERITY, _severity.jsonName());
    json.put(CONFIDENCE, _confidence);
    json.put(SCORING_PATH, _path.name());
    return json;
  }

  /**
   * @param json A JSON object in the shape of {@link #getJsonStructure()}.
   * @return The event the JSON object describes.
   */
  public static AnomalyEvent fromJson(JsonObject json) {
    return new AnomalyEvent(json.get(METRIC_ID).getAsString(),
                            json.get(TIMESTAMP).getAsLong(),
                            json.get(VALUE).getAsDouble(),
                            json.get(EXPECTED).getAsDouble(),
                            json.get(DEVIATION).getAsDouble(),
                            json.get(SCORE).getAsDouble(),
                            Severity.valueOf(json.get(SEVERITY).getAsString().toUpperCase(Locale.ROOT)),
                            json.get(CONFIDENCE).getAsDouble(),
                            ScoringPath.valueOf(json.get(SCORING_PATH).getAsString()));
  }

  @Override
  public String toString() {
    return String.format("%s anomaly of %s at %s: value %.4f vs expected %.4f (deviation %.2f, score %.4f, "
                         + "confidence %.2f, %s)", _severity, _metricId, utcDateFor(_timestampMs), _value, _expected,
                         _deviation, _score, _confidence, _path);
  }
}
