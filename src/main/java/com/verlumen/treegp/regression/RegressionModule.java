package com.verlumen.treegp.regression;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.treegp.evolution.EvolutionParameters;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/** Wires a {@link RegressionRunner} for one {@link RunConfig}. */
@AutoValue
abstract class RegressionModule extends AbstractModule {
  static final String RANDOM_ALGORITHM = "L64X128MixRandom";

  static RegressionModule create(RunConfig config) {
    return new AutoValue_RegressionModule(config);
  }

  abstract RunConfig config();

  @Provides
  RunConfig provideRunConfig() {
    return config();
  }

  @Provides
  @Singleton
  RandomGenerator provideRandomGenerator() {
    return RandomGeneratorFactory.of(RANDOM_ALGORITHM).create(config().seed());
  }

  @Provides
  EvolutionParameters provideEvolutionParameters() {
    return EvolutionParameters.create(config().mutationRate(), config().crossoverRate());
  }

  @Provides
  @Singleton
  RegressionProblem provideRegressionProblem() {
    return config().problem().create();
  }
}
