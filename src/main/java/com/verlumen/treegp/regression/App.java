package com.verlumen.treegp.regression;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import java.util.Arrays;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/** Command line entry point that runs one of the regression problems. */
public final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("treegp starting up with %d arguments", args.length);
    ArgumentParser parser = createParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }
    try {
      RunConfig config = toRunConfig(namespace);
      RunResult result =
          Guice.createInjector(RegressionModule.create(config))
              .getInstance(RegressionRunner.class)
              .run();
      System.out.println(result.bestProgram());
      System.out.printf(
          "best fitness %f after %d generations%n",
          result.stats().bestFitness(), result.generation());
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Run failed");
      throw e;
    }
  }

  static RunConfig toRunConfig(Namespace namespace) {
    RunConfig.Builder builder =
        RunConfig.builder()
            .setProblem(ProblemType.forFlagName(namespace.getString("problem")))
            .setSeed(namespace.getLong("seed"))
            .setPopulationSize(namespace.getInt("populationSize"))
            .setGenerations(namespace.getInt("generations"))
            .setMutationRate(namespace.getDouble("mutationRate"))
            .setCrossoverRate(namespace.getDouble("crossoverRate"));
    Integer maxDepth = namespace.getInt("maxDepth");
    if (maxDepth != null) {
      builder.setMaxDepth(maxDepth);
    }
    return builder.build();
  }

  static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("treegp")
            .build()
            .defaultHelp(true)
            .description("Evolves programs for a symbolic regression problem");

    parser.addArgument("--problem")
        .choices(Arrays.stream(ProblemType.values()).map(ProblemType::flagName).toArray())
        .setDefault(ProblemType.FUNCTION.flagName())
        .help("Regression problem to solve");

    parser.addArgument("--seed")
        .type(Long.class)
        .setDefault(RunConfig.DEFAULT_SEED)
        .help("Seed of the random generator");

    parser.addArgument("--populationSize")
        .type(Integer.class)
        .setDefault(RunConfig.DEFAULT_POPULATION_SIZE)
        .help("Number of individuals");

    parser.addArgument("--generations")
        .type(Integer.class)
        .setDefault(RunConfig.DEFAULT_GENERATIONS)
        .help("Number of generations to evolve");

    parser.addArgument("--maxDepth")
        .type(Integer.class)
        .help("Depth ceiling of the initial trees (default: the problem's own)");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(RunConfig.DEFAULT_MUTATION_RATE)
        .help("Probability of mutating an individual");

    parser.addArgument("--crossoverRate")
        .type(Double.class)
        .setDefault(RunConfig.DEFAULT_CROSSOVER_RATE)
        .help("Probability of crossing an individual with a partner");

    return parser;
  }

  private App() {}
}
