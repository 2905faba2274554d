package com.verlumen.treegp.evolution;

import com.verlumen.treegp.tree.TreeGenome;
import java.util.List;

/** Scores a whole generation at once. Larger fitness is better. */
@FunctionalInterface
public interface FitnessFunction {
  /**
   * Computes the fitness of every individual.
   *
   * @param individuals the individuals of the current generation; must not be modified
   * @return one fitness per individual, in the same order
   */
  double[] computeFitness(List<TreeGenome> individuals);
}
