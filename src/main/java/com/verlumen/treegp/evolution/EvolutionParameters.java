package com.verlumen.treegp.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** The rates that control how a generation is varied. */
@AutoValue
public abstract class EvolutionParameters {
  public static EvolutionParameters create(double mutationRate, double crossoverRate) {
    return builder().setMutationRate(mutationRate).setCrossoverRate(crossoverRate).build();
  }

  public static Builder builder() {
    return new AutoValue_EvolutionParameters.Builder().setMutationRate(0).setCrossoverRate(0);
  }

  /** Probability that an individual of the next generation is mutated. */
  public abstract double mutationRate();

  /** Probability that an individual of the next generation is crossed with a partner. */
  public abstract double crossoverRate();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setCrossoverRate(double crossoverRate);

    abstract EvolutionParameters autoBuild();

    /**
     * @throws IllegalArgumentException if a rate is outside {@code [0, 1]} or the rates sum to more
     *     than 1
     */
    public EvolutionParameters build() {
      EvolutionParameters parameters = autoBuild();
      checkArgument(
          parameters.mutationRate() >= 0 && parameters.mutationRate() <= 1,
          "Mutation rate must be within [0, 1], was %s",
          parameters.mutationRate());
      checkArgument(
          parameters.crossoverRate() >= 0 && parameters.crossoverRate() <= 1,
          "Crossover rate must be within [0, 1], was %s",
          parameters.crossoverRate());
      checkArgument(
          parameters.mutationRate() + parameters.crossoverRate() <= 1.0,
          "Mutation rate and crossover rate must not sum above 1, were %s and %s",
          parameters.mutationRate(),
          parameters.crossoverRate());
      return parameters;
    }
  }
}
