package com.verlumen.treegp.generation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** The options used to seed a population. */
@AutoValue
public abstract class InitializationOptions {
  public static InitializationOptions create(int maxTreeDepth, int populationSize) {
    checkArgument(maxTreeDepth >= 1, "Max tree depth must be at least 1, was %s", maxTreeDepth);
    checkArgument(populationSize > 0, "Population size must be positive, was %s", populationSize);
    return new AutoValue_InitializationOptions(maxTreeDepth, populationSize);
  }

  public abstract int maxTreeDepth();

  public abstract int populationSize();
}
