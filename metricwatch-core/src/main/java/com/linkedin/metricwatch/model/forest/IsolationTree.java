/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.metricwatch.model.forest;

import org.apache.commons.math3.random.RandomGenerator;


/**
 * A single randomized partitioning tree. Each internal node splits on a random feature at a random value drawn
 * uniformly between the minimum and maximum of that feature among the rows reaching the node. Growth stops at the
 * height limit or when a node holds a single distinct row.
 */
final class IsolationTree {
  private static final int LEAF = -1;

  private final Node _root;

  private IsolationTree(Node root) {
    _root = root;
  }

  static IsolationTree grow(double[][] rows, int[] rowIndices, int heightLimit, RandomGenerator random) {
    return new IsolationTree(grow(rows, rowIndices, 0, heightLimit, random));
  }

  private static Node grow(double[][] rows, int[] indices, int depth, int heightLimit, RandomGenerator random) {
    if (depth >= heightLimit || indices.length <= 1) {
      return Node.leaf(indices.length);
    }
    int numFeatures = rows[indices[0]].length;
    // Only features that still vary among the rows at this node can separate them.
    int[] candidates = new int[numFeatures];
    int numCandidates = 0;
    for (int f = 0; f < numFeatures; f++) {
      double min = Double.POSITIVE_INFINITY;
      double max = Double.NEGATIVE_INFINITY;
      for (int i : indices) {
        min = Math.min(min, rows[i][f]);
        max = Math.max(max, rows[i][f]);
      }
      if (max > min) {
        candidates[numCandidates++] = f;
      }
    }
    if (numCandidates == 0) {
      return Node.leaf(indices.length);
    }
    int feature = candidates[random.nextInt(numCandidates)];
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (int i : indices) {
      min = Math.min(min, rows[i][feature]);
      max = Math.max(max, rows[i][feature]);
    }
    double split = min + random.nextDouble() * (max - min);

    int numLeft = 0;
    for (int i : indices) {
      if (rows[i][feature] < split) {
        numLeft++;
      }
    }
    int[] left = new int[numLeft];
    int[] right = new int[indices.length - numLeft];
    int l = 0;
    int r = 0;
    for (int i : indices) {
      if (rows[i][feature] < split) {
        left[l++] = i;
      } else {
        right[r++] = i;
      }
    }
    return Node.internal(feature, split,
                         grow(rows, left, depth + 1, heightLimit, random),
                         grow(rows, right, depth + 1, heightLimit, random));
  }

  /**
   * @param x A standardized feature vector.
   * @return The path length of the given point, adjusted at the leaf by the expected path length of the rows that
   * were not isolated further.
   */
  double pathLength(double[] x) {
    Node node = _root;
    int depth = 0;
    while (node._feature != LEAF) {
      node = x[node._feature] < node._split ? node._left : node._right;
      depth++;
    }
    return depth + IsolationForest.averagePathLength(node._size);
  }

  private static final class Node {
    private final int _feature;
    private final double _split;
    private final Node _left;
    private final Node _right;
    private final int _size;

    private Node(int feature, double split, Node left, Node right, int size) {
      _feature = feature;
      _split = split;
      _left = left;
      _right = right;
      _size = size;
    }

    static Node leaf(int size) {
      return new Node(LEAF, Double.NaN, null, null, size);
    }

    static Node internal(int feature, double split, Node left, Node right) {
      return new Node(feature, split, left, right, 0);
    }
  }
}
