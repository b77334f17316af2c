/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.model.forest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;


/**
 * An ensemble of {@link IsolationTree}s. Points that are isolated after few random partitions are considered
 * anomalous.
 *
 * <ul>
 *   <li>{@link #scoreSamples(double[])} returns {@code -2^(-E[h(x)] / c(psi))}, in [-1, 0]. Lower is more abnormal.</li>
 *   <li>{@link #decisionFunction(double[])} returns the sample score minus the offset calibrated on the training set so
 *   that roughly a {@code contamination} fraction of the training points score below zero. The result lies in
 *   [-1, 1].</li>
 * </ul>
 *
 * Building a forest is deterministic for a given seed and training set, and a built forest is immutable, so scoring is
 * a pure function of the forest and the input.
 */
public final class IsolationForest {
  public static final int DEFAULT_NUM_TREES = 100;
  public static final int DEFAULT_MAX_SAMPLES = 256;
  public static final long DEFAULT_SEED = 42L;
  private static final double EULER_MASCHERONI = 0.5772156649015329;

  private final List<IsolationTree> _trees;
  private final int _subsampleSize;
  private final double _offset;
  private final int _trainingSize;
  private final int _numFeatures;

  private IsolationForest(List<IsolationTree> trees, int subsampleSize, int trainingSize, int numFeatures,
                          double contamination, double[][] rows) {
    _trees = Collections.unmodifiableList(trees);
    _subsampleSize = subsampleSize;
    _trainingSize = trainingSize;
    _numFeatures = numFeatures;
    double[] trainingScores = new double[rows.length];
    for (int i = 0; i < rows.length; i++) {
      trainingScores[i] = scoreSamples(rows[i]);
    }
    // Linear interpolation between closest ranks, the same estimation numpy uses by default.
    Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
    _offset = percentile.evaluate(trainingScores, 100.0 * contamination);
  }

  /**
   * Fit a forest with the default number of trees, subsample size and seed.
   *
   * @param rows Training rows, one feature vector per row. Every row must have the same length.
   * @param contamination Expected proportion of anomalies in the training rows, in (0, 0.5].
   * @return A fitted forest.
   */
  public static IsolationForest fit(double[][] rows, double contamination) {
    return fit(rows, DEFAULT_NUM_TREES, DEFAULT_MAX_SAMPLES, contamination, DEFAULT_SEED);
  }

  /**
   * Fit a forest.
   *
   * @param rows Training rows, one feature vector per row. Every row must have the same length.
   * @param numTrees Number of trees in the ensemble.
   * @param maxSamples Maximum number of rows drawn, without replacement, to grow each tree.
   * @param contamination Expected proportion of anomalies in the training rows, in (0, 0.5].
   * @param seed Seed of the random generator.
   * @return A fitted forest.
   */
  public static IsolationForest fit(double[][] rows, int numTrees, int maxSamples, double contamination, long seed) {
    if (rows.length < 2) {
      throw new IllegalArgumentException("At least 2 rows are required to fit an isolation forest, got " + rows.length);
    }
    if (numTrees < 1 || maxSamples < 2) {
      throw new IllegalArgumentException(String.format("Invalid forest shape: %d trees, %d max samples.", numTrees, maxSamples));
    }
    if (!(contamination > 0.0 && contamination <= 0.5)) {
      throw new IllegalArgumentException("Contamination must be in (0, 0.5], got " + contamination);
    }
    int numFeatures = rows[0].length;
    for (double[] row : rows) {
      if (row.length != numFeatures) {
        throw new IllegalArgumentException("All rows must have " + numFeatures + " features.");
      }
    }
    int subsampleSize = Math.min(maxSamples, rows.length);
    int heightLimit = (int) Math.ceil(Math.log(subsampleSize) / Math.log(2));
    RandomGenerator random = new MersenneTwister(seed);
    int[] all = new int[rows.length];
    for (int i = 0; i < all.length; i++) {
      all[i] = i;
    }
    List<IsolationTree> trees = new ArrayList<>(numTrees);
    for (int t = 0; t < numTrees; t++) {
      trees.add(IsolationTree.grow(rows, subsample(all, subsampleSize, random), heightLimit, random));
    }
    return new IsolationForest(trees, subsampleSize, rows.length, numFeatures, contamination, rows);
  }

  private static int[] subsample(int[] all, int size, RandomGenerator random) {
    int[] pool = all.clone();
    // Partial Fisher-Yates shuffle.
    for (int i = 0; i < size; i++) {
      int j = i + random.nextInt(pool.length - i);
      int tmp = pool[i];
      pool[i] = pool[j];
      pool[j] = tmp;
    }
    int[] picked = new int[size];
    System.arraycopy(pool, 0, picked, 0, size);
    return picked;
  }

  /**
   * The average path length of an unsuccessful search in a binary search tree of n nodes.
   *
   * @param n Number of nodes.
   * @return Normalization factor c(n).
   */
  static double averagePathLength(int n) {
    if (n <= 1) {
      return 0.0;
    }
    if (n == 2) {
      return 1.0;
    }
    double harmonic = Math.log(n - 1) + EULER_MASCHERONI;
    return 2.0 * harmonic - 2.0 * (n - 1) / (double) n;
  }

  /**
   * @param x Feature vector, standardized the same way as the training rows.
   * @return Raw anomaly score in [-1, 0]; lower means more abnormal.
   */
  public double scoreSamples(double[] x) {
    if (x.length != _numFeatures) {
      throw new IllegalArgumentException("Expected " + _numFeatures + " features, got " + x.length);
    }
    double totalPathLength = 0.0;
    for (IsolationTree tree : _trees) {
      totalPathLength += tree.pathLength(x);
    }
    double meanPathLength = totalPathLength / _trees.size();
    return -Math.pow(2.0, -meanPathLength / averagePathLength(_subsampleSize));
  }

  /**
   * @param x Feature vector, standardized the same way as the training rows.
   * @return Score shifted by the contamination offset; negative values are outliers with respect to the training set.
   */
  public double decisionFunction(double[] x) {
    return scoreSamples(x) - _offset;
  }

  public double offset() {
    return _offset;
  }

  public int numTrees() {
    return _trees.size();
  }

  public int trainingSize() {
    return _trainingSize;
  }

  public int numFeatures() {
    return _numFeatures;
  }
}
