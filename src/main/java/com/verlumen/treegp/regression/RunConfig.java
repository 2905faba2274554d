package com.verlumen.treegp.regression;

import com.google.auto.value.AutoValue;
import java.util.OptionalInt;

/** The settings of one regression run. */
@AutoValue
public abstract class RunConfig {
  static final long DEFAULT_SEED = 42;
  static final int DEFAULT_POPULATION_SIZE = 100;
  static final int DEFAULT_GENERATIONS = 100;
  static final double DEFAULT_MUTATION_RATE = 0.1;
  static final double DEFAULT_CROSSOVER_RATE = 0.895;

  public static Builder builder() {
    return new AutoValue_RunConfig.Builder()
        .setProblem(ProblemType.FUNCTION)
        .setSeed(DEFAULT_SEED)
        .setPopulationSize(DEFAULT_POPULATION_SIZE)
        .setGenerations(DEFAULT_GENERATIONS)
        .setMutationRate(DEFAULT_MUTATION_RATE)
        .setCrossoverRate(DEFAULT_CROSSOVER_RATE);
  }

  public abstract ProblemType problem();

  public abstract long seed();

  public abstract int populationSize();

  public abstract int generations();

  /** Depth ceiling of the initial trees; the problem's default when absent. */
  public abstract OptionalInt maxDepth();

  public abstract double mutationRate();

  public abstract double crossoverRate();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setProblem(ProblemType problem);

    public abstract Builder setSeed(long seed);

    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setMaxDepth(int maxDepth);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setCrossoverRate(double crossoverRate);

    public abstract RunConfig build();
  }
}
