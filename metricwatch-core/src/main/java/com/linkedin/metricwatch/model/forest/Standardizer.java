/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.model.forest;

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;


/**
 * Column-wise standardization to zero mean and unit variance, using the population standard deviation. Columns
 * without variance are only centered.
 */
public final class Standardizer {
  private final double[] _means;
  private final double[] _scales;

  private Standardizer(double[] means, double[] scales) {
    _means = means;
    _scales = scales;
  }

  public static Standardizer fit(double[][] rows) {
    if (rows.length == 0) {
      throw new IllegalArgumentException("Cannot standardize an empty set of rows.");
    }
    int numFeatures = rows[0].length;
    double[] means = new double[numFeatures];
    double[] scales = new double[numFeatures];
    StandardDeviation populationStd = new StandardDeviation(false);
    Mean mean = new Mean();
    double[] column = new double[rows.length];
    for (int f = 0; f < numFeatures; f++) {
      for (int i = 0; i < rows.length; i++) {
        column[i] = rows[i][f];
      }
      means[f] = mean.evaluate(column);
      double std = populationStd.evaluate(column);
      scales[f] = std > 0.0 ? std : 1.0;
    }
    return new Standardizer(means, scales);
  }

  public double[] transform(double[] x) {
    double[] result = new double[x.length];
    for (int f = 0; f < x.length; f++) {
      result[f] = (x[f] - _means[f]) / _scales[f];
    }
    return result;
  }

  public double[][] transform(double[][] rows) {
    double[][] result = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      result[i] = transform(rows[i]);
    }
    return result;
  }

  public double[] means() {
    return Arrays.copyOf(_means, _means.length);
  }

  public double[] scales() {
    return Arrays.copyOf(_scales, _scales.length);
  }
}
