package com.verlumen.treegp.regression;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.treegp.evolution.EvolutionParameters;
import com.verlumen.treegp.evolution.GenerationStats;
import com.verlumen.treegp.evolution.Population;
import com.verlumen.treegp.generation.TreeGenerator;
import com.verlumen.treegp.printing.TreeGenomePrinter;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.random.RandomGenerator;

/** Evolves a population for a regression problem for a fixed number of generations. */
final class RegressionRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final RegressionProblem problem;
  private final EvolutionParameters parameters;
  private final RunConfig config;
  private final RandomGenerator random;

  @Inject
  RegressionRunner(
      RegressionProblem problem,
      EvolutionParameters parameters,
      RunConfig config,
      RandomGenerator random) {
    this.problem = problem;
    this.parameters = parameters;
    this.config = config;
    this.random = random;
  }

  RunResult run() {
    checkArgument(config.generations() >= 0, "Generations must not be negative");
    Population population =
        new Population(
            config.populationSize(),
            parameters,
            problem.grammar(),
            problem.fitnessFunction(),
            random);
    int maxDepth = config.maxDepth().orElse(problem.defaultInitialDepth());
    logger.atInfo().log(
        "Running %s: population %d, depth %d, %d generations, seed %d",
        problem.name(),
        config.populationSize(),
        maxDepth,
        config.generations(),
        config.seed());
    TreeGenerator generator = new TreeGenerator(problem.grammar(), random);
    population.initialize(maxDepth, problem.initializer(generator));
    for (int i = 0; i < config.generations(); i++) {
      population.nextGeneration();
    }
    int best = population.evaluateGeneration();
    GenerationStats stats = population.stats();
    TreeGenome bestIndividual = population.individual(best);
    String bestProgram =
        new TreeGenomePrinter(problem.grammar()).print(bestIndividual, problem.terminalPrinter());
    logger.atInfo().log(
        "Generation %d: average fitness %.4f, best fitness %.4f, %d failed crossovers",
        population.generation(),
        stats.averageFitness(),
        stats.bestFitness(),
        population.failedCrossovers());
    logger.atInfo().log("Best individual: %s", bestProgram);
    return RunResult.create(population.generation(), stats, bestIndividual, bestProgram);
  }
}
