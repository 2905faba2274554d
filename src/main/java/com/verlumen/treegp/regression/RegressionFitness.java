package com.verlumen.treegp.regression;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.function.ToLongFunction;

/**
 * The fitness formula shared by the regression problems: the mean over all samples of {@code 1 -
 * |answer - expected| / 1000}, minus {@code log10(ceil(nodeCount / 30))} to penalize large trees.
 * An exact program of at most 30 nodes scores exactly 1.
 */
final class RegressionFitness {
  static final double ERROR_SCALE = 1000.0;
  static final int FREE_NODE_COUNT = 30;

  static double score(
      List<Sample> samples,
      int nodeCount,
      ToLongFunction<Sample> answer,
      ToLongFunction<Sample> expected) {
    checkArgument(!samples.isEmpty(), "At least one sample is required");
    double fitness = 0.0;
    for (Sample sample : samples) {
      // Wrapped answers must not produce a negative error.
      double error =
          Math.abs((double) answer.applyAsLong(sample) - (double) expected.applyAsLong(sample));
      fitness += 1.0 - error / ERROR_SCALE;
    }
    fitness /= samples.size();
    return fitness - sizePenalty(nodeCount);
  }

  static double sizePenalty(int nodeCount) {
    return Math.log10(Math.ceil(nodeCount / (double) FREE_NODE_COUNT));
  }

  private RegressionFitness() {}
}
