/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.registry;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;


/**
 * Parameters of the scoring model of a metric.
 */
public final class ScoringConfig {
  public static final double DEFAULT_CONTAMINATION = 0.1;
  public static final double DEFAULT_THRESHOLD = 0.0;

  /**
   * Features a sample is scored on. The calendar features are derived from the sample timestamp.
   */
  public enum Feature {
    VALUE, HOUR_OF_DAY, DAY_OF_WEEK, DAY_OF_MONTH;

    public static Optional<Feature> forName(String name) {
      return Arrays.stream(values()).filter(f -> f.name().equalsIgnoreCase(name)).findFirst();
    }

    /**
     * @param timestampMs Sample timestamp.
     * @param value Sample value.
     * @param zone Zone the calendar features are evaluated in.
     * @return The value of this feature for the given sample.
     */
    public double extract(long timestampMs, double value, ZoneId zone) {
      if (this == VALUE) {
        return value;
      }
      ZonedDateTime time = ZonedDateTime.ofInstant(Instant.ofEpochMilli(timestampMs), zone);
      switch (this) {
        case HOUR_OF_DAY:
          return time.getHour();
        case DAY_OF_WEEK:
          return time.getDayOfWeek().getValue();
        case DAY_OF_MONTH:
          return time.getDayOfMonth();
        default:
          throw new IllegalStateException("Unsupported feature " + this);
      }
    }

    public String jsonName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final double _contamination;
  private final double _threshold;
  private final List<Feature> _features;

  /**
   * @param contamination Expected proportion of anomalies in the baseline window.
   * @param threshold Decision threshold, scores strictly below are anomalous.
   * @param features Features to score on. {@link Feature#VALUE} is always added first.
   */
  public ScoringConfig(double contamination, double threshold, List<Feature> features) {
    _contamination = contamination;
    _threshold = threshold;
    List<Feature> normalized = new ArrayList<>();
    normalized.add(Feature.VALUE);
    for (Feature feature : features) {
      if (!normalized.contains(feature)) {
        normalized.add(feature);
      }
    }
    _features = Collections.unmodifiableList(normalized);
  }

  public static ScoringConfig defaults() {
    return new ScoringConfig(DEFAULT_CONTAMINATION, DEFAULT_THRESHOLD, Collections.singletonList(Feature.VALUE));
  }

  public double contamination() {
    return _contamination;
  }

  public double threshold() {
    return _threshold;
  }

  public List<Feature> features() {
    return _features;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ScoringConfig that = (ScoringConfig) o;
    return Double.compare(that._contamination, _contamination) == 0 && Double.compare(that._threshold, _threshold) == 0
           && _features.equals(that._features);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_contamination, _threshold, _features);
  }
}
