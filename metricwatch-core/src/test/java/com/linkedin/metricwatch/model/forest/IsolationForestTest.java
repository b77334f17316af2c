/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.metricwatch.model.forest;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class IsolationForestTest {
  private static final double EPSILON = 1E-9;

  private static double[][] normalRows(int n, long seed) {
    MersenneTwister random = new MersenneTwister(seed);
    double[][] rows = new double[n][];
    for (int i = 0; i < n; i++) {
      rows[i] = new double[]{100.0 + random.nextGaussian()};
    }
    return rows;
  }

  @Test
  public void testAveragePathLength() {
    assertEquals(0.0, IsolationForest.averagePathLength(1), EPSILON);
    assertEquals(1.0, IsolationForest.averagePathLength(2), EPSILON);
    // 2 * (ln(255) + gamma) - 2 * 255 / 256
    assertEquals(10.2447, IsolationForest.averagePathLength(256), 1E-4);
  }

  @Test
  public void testOutlierScoresLowerThanInlier() {
    double[][] rows = Standardizer.fit(normalRows(200, 7)).transform(normalRows(200, 7));
    IsolationForest forest = IsolationForest.fit(rows, 0.1);
    assertEquals(IsolationForest.DEFAULT_NUM_TREES, forest.numTrees());
    double inlier = forest.decisionFunction(new double[]{0.0});
    double outlier = forest.decisionFunction(new double[]{8.0});
    assertTrue(inlier > 0.0);
    assertTrue(outlier < 0.0);
    assertTrue(outlier >= -1.0 && inlier <= 1.0);
  }

  @Test
  public void testContaminationCalibratesOffset() {
    double[][] rows = normalRows(500, 11);
    IsolationForest forest = IsolationForest.fit(rows, 0.1);
    int below = 0;
    for (double[] row : rows) {
      if (forest.decisionFunction(row) < 0) {
        below++;
      }
    }
    // Roughly 10% of the training points fall below the offset.
    assertTrue("below=" + below, below >= 25 && below <= 75);
  }

  @Test
  public void testDeterministicForSameSeed() {
    double[][] rows = normalRows(120, 3);
    IsolationForest first = IsolationForest.fit(rows, 0.1);
    IsolationForest second = IsolationForest.fit(rows, 0.1);
    double[] row = {97.5};
    assertEquals(first.offset(), second.offset(), 0.0);
    assertEquals(first.decisionFunction(row), second.decisionFunction(row), 0.0);
    assertEquals(first.decisionFunction(row), first.decisionFunction(row), 0.0);
  }

  @Test
  public void testConstantTrainingSet() {
    double[][] rows = new double[30][];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = new double[]{5.0};
    }
    IsolationForest forest = IsolationForest.fit(rows, 0.1);
    assertEquals(0.0, forest.decisionFunction(new double[]{5.0}), EPSILON);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidContamination() {
    IsolationForest.fit(normalRows(10, 1), 0.6);
  }

  @Test
  public void testStandardizer() {
    double[][] rows = {{1.0, 10.0}, {3.0, 10.0}};
    Standardizer standardizer = Standardizer.fit(rows);
    assertEquals(2.0, standardizer.means()[0], EPSILON);
    assertEquals(1.0, standardizer.scales()[0], EPSILON);
    // Constant columns are centered only.
    assertEquals(1.0, standardizer.scales()[1], EPSILON);
    double[] transformed = standardizer.transform(new double[]{5.0, 12.0});
    assertEquals(3.0, transformed[0], EPSILON);
    assertEquals(2.0, transformed[1], EPSILON);
  }
}
