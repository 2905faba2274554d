package com.verlumen.treegp.evolution;

import com.google.auto.value.AutoValue;

/** Fitness statistics of the last evaluated generation. */
@AutoValue
public abstract class GenerationStats {
  static GenerationStats create(
      int generation,
      double averageFitness,
      double fitnessVariance,
      double bestFitness,
      int bestIndividual) {
    return new AutoValue_GenerationStats(
        generation, averageFitness, fitnessVariance, bestFitness, bestIndividual);
  }

  /** The generation the fitness values were computed for. */
  public abstract int generation();

  public abstract double averageFitness();

  public abstract double fitnessVariance();

  public abstract double bestFitness();

  /** Index of the first individual with the best fitness. */
  public abstract int bestIndividual();
}
