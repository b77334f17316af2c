/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.business.metricwatch.detector;

import com.linkedin.business.metricwatch.registry.ScoringConfig.Feature;
import com.linkedin.metricwatch.monitor.sampling.Sample;
import java.time.ZoneId;
import java.util.List;


/**
 * Turns samples into feature rows, in the order of the given feature schema.
 */
public final class FeatureExtractor {

  private FeatureExtractor() {

  }

  public static double[] extract(Sample sample, List<Feature> features, ZoneId zone) {
    double[] row = new double[features.size()];
    for (int i = 0; i < row.length; i++) {
      row[i] = features.get(i).extract(sample.timestampMs(), sample.value(), zone);
    }
    return row;
  }

  public static double[][] extract(List<Sample> samples, List<Feature> features, ZoneId zone) {
    double[][] rows = new double[samples.size()][];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = extract(samples.get(i), features, zone);
    }
    return rows;
  }
}
