package com.verlumen.treegp.evolution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.treegp.generation.GenerationStrategy;
import com.verlumen.treegp.generation.InitializationOptions;
import com.verlumen.treegp.generation.Initializer;
import com.verlumen.treegp.generation.TreeGenerator;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.printing.TreeGenomePrinter;
import com.verlumen.treegp.tree.TreeGenome;
import io.jenetics.stat.DoubleMomentStatistics;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;

/**
 * A fixed-size population of tree genomes evolved one generation at a time.
 *
 * <p>Each call to {@link #nextGeneration()} evaluates the current generation if needed, keeps the
 * best individual (twice as a candidate for variation, once untouched at the end), fills the rest
 * by 3-way tournament selection, and applies grammar-aware mutation and crossover. Fitness is
 * computed at most once per generation.
 *
 * <p>All randomness comes from the {@link RandomGenerator} given at construction, so a run is
 * reproducible from its seed.
 */
public final class Population {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int size;
  private final EvolutionParameters parameters;
  private final GrammarCatalog grammar;
  private final FitnessFunction fitnessFunction;
  private final RandomTreeFactory randomTreeFactory;
  private final RandomGenerator random;
  private final TreeGenomePrinter printer;
  private final double[] fitnesses;

  private List<TreeGenome> individuals = new ArrayList<>();
  private int generation = 0;
  private int evaluatedGeneration = -1;
  private int currentBestIndividual = 0;
  private long failedCrossovers = 0;

  /**
   * Creates a population whose mutations generate grow trees of depth {@link
   * EvolutionConstants#DEFAULT_MUTATION_DEPTH}.
   */
  public Population(
      int size,
      EvolutionParameters parameters,
      GrammarCatalog grammar,
      FitnessFunction fitnessFunction,
      RandomGenerator random) {
    this(
        size,
        parameters,
        grammar,
        fitnessFunction,
        defaultRandomTreeFactory(grammar, random),
        random);
  }

  /**
   * @throws IllegalArgumentException if {@code size} is below {@link
   *     EvolutionConstants#MIN_POPULATION_SIZE}
   */
  public Population(
      int size,
      EvolutionParameters parameters,
      GrammarCatalog grammar,
      FitnessFunction fitnessFunction,
      RandomTreeFactory randomTreeFactory,
      RandomGenerator random) {
    checkArgument(
        size >= EvolutionConstants.MIN_POPULATION_SIZE,
        "Population size must be at least %s, was %s",
        EvolutionConstants.MIN_POPULATION_SIZE,
        size);
    this.size = size;
    this.parameters = parameters;
    this.grammar = grammar;
    this.fitnessFunction = fitnessFunction;
    this.randomTreeFactory = randomTreeFactory;
    this.random = random;
    this.printer = new TreeGenomePrinter(grammar);
    this.fitnesses = new double[size];
  }

  private static RandomTreeFactory defaultRandomTreeFactory(
      GrammarCatalog grammar, RandomGenerator random) {
    TreeGenerator generator = new TreeGenerator(grammar, random);
    return type ->
        generator.newTree(
            EvolutionConstants.DEFAULT_MUTATION_DEPTH, GenerationStrategy.GROW, type);
  }

  /** Seeds the population with {@code size()} trees from {@code initializer}. */
  public void initialize(int maxDepth, Initializer initializer) {
    checkState(individuals.isEmpty(), "Population is already initialized");
    initializer.initialize(InitializationOptions.create(maxDepth, size), individuals::add);
    checkState(
        individuals.size() == size,
        "Initializer produced %s individuals, expected %s",
        individuals.size(),
        size);
    logger.atInfo().log("Initialized population of %d individuals", size);
  }

  public int size() {
    return size;
  }

  /** The number of generations advanced so far. */
  public int generation() {
    return generation;
  }

  /** Number of crossovers abandoned because the partner had no node of the required type. */
  public long failedCrossovers() {
    return failedCrossovers;
  }

  /** Returns a copy of the individual at {@code index}. */
  public TreeGenome individual(int index) {
    checkElementIndex(index, individuals.size(), "Individual index");
    return individuals.get(index).copy();
  }

  /** Returns copies of all individuals. */
  public ImmutableList<TreeGenome> individuals() {
    return individuals.stream().map(TreeGenome::copy).collect(toImmutableList());
  }

  /**
   * Evaluates the current generation and returns the index of its best individual, the first one
   * in case of ties. The fitness function is called at most once per generation.
   *
   * @throws IllegalStateException if the population is not initialized or the fitness function
   *     returns the wrong number of values
   */
  public int evaluateGeneration() {
    checkState(!individuals.isEmpty(), "Population is not initialized");
    if (evaluatedGeneration == generation) {
      return currentBestIndividual;
    }
    double[] computed = fitnessFunction.computeFitness(Collections.unmodifiableList(individuals));
    checkState(
        computed.length == individuals.size(),
        "Fitness function returned %s values for %s individuals",
        computed.length,
        individuals.size());
    System.arraycopy(computed, 0, fitnesses, 0, computed.length);
    currentBestIndividual = bestIndex();
    evaluatedGeneration = generation;
    return currentBestIndividual;
  }

  /**
   * Appends {@code count} copies of individuals chosen by 3-way tournament selection, based on the
   * last evaluated fitness values.
   */
  public void select(List<TreeGenome> buffer, int count) {
    checkState(!individuals.isEmpty(), "Population is not initialized");
    checkArgument(
        count > 0 && count <= individuals.size(),
        "Selection count must be within [1, %s], was %s",
        individuals.size(),
        count);
    for (int i = 0; i < count; i++) {
      int selected = random.nextInt(individuals.size());
      for (int j = 1; j < EvolutionConstants.TOURNAMENT_SIZE; j++) {
        int contender = random.nextInt(individuals.size());
        if (fitnesses[contender] > fitnesses[selected]) {
          selected = contender;
        }
      }
      buffer.add(individuals.get(selected).copy());
    }
  }

  /** Replaces the population with the next generation. */
  public void nextGeneration() {
    int best = evaluateGeneration();
    logStats();
    TreeGenome elite = individuals.get(best);

    List<TreeGenome> next = new ArrayList<>(size);
    next.add(elite.copy());
    next.add(elite.copy());
    select(next, size - EvolutionConstants.ELITE_COPIES);

    double mutationRate = parameters.mutationRate();
    double crossoverRate = parameters.crossoverRate();
    for (int i = 0; i < next.size(); i++) {
      double p = random.nextDouble();
      if (p <= mutationRate) {
        mutate(next.get(i));
      } else if (p <= mutationRate + crossoverRate) {
        int partner = i + 1 != next.size() ? i + 1 : random.nextInt(next.size());
        if (partner == i) {
          partner = i - 1;
        }
        if (crossover(next.get(i), next.get(partner))) {
          // The partner has been varied this round.
          i++;
        }
      }
    }
    next.add(elite.copy());

    individuals = next;
    generation++;
  }

  /**
   * Statistics of the last evaluation. Does not evaluate the current generation.
   *
   * @throws IllegalStateException if no generation has been evaluated yet
   */
  public GenerationStats stats() {
    checkState(evaluatedGeneration >= 0, "No generation has been evaluated");
    DoubleMomentStatistics statistics = new DoubleMomentStatistics();
    for (double fitness : fitnesses) {
      statistics.accept(fitness);
    }
    int best = bestIndex();
    return GenerationStats.create(
        evaluatedGeneration, statistics.mean(), statistics.variance(), fitnesses[best], best);
  }

  private int bestIndex() {
    int best = 0;
    for (int i = 1; i < fitnesses.length; i++) {
      if (fitnesses[i] > fitnesses[best]) {
        best = i;
      }
    }
    return best;
  }

  private void logStats() {
    if (!logger.atFine().isEnabled()) {
      return;
    }
    GenerationStats stats = stats();
    logger.atFine().log(
        "Generation %d: average fitness %.4f, best fitness %.4f (#%d) %s",
        stats.generation(),
        stats.averageFitness(),
        stats.bestFitness(),
        stats.bestIndividual(),
        printer.print(individuals.get(stats.bestIndividual())));
  }

  private void mutate(TreeGenome genome) {
    int nodeId = random.nextInt(genome.nodeCount());
    genome.replace(nodeId, randomTreeFactory.randomTreeOfType(typeOf(genome, nodeId)));
  }

  /**
   * Swaps a random subtree of {@code genome} with a random subtree of the same type in {@code
   * other}. Returns false, leaving both untouched, when {@code other} has no node of that type.
   */
  private boolean crossover(TreeGenome genome, TreeGenome other) {
    int nodeId = random.nextInt(genome.nodeCount());
    int type = typeOf(genome, nodeId);
    List<Integer> candidates = new ArrayList<>();
    for (int i = 0; i < other.nodeCount(); i++) {
      if (typeOf(other, i) == type) {
        candidates.add(i);
      }
    }
    if (candidates.isEmpty()) {
      failedCrossovers++;
      logger.atWarning().atMostEvery(5, TimeUnit.SECONDS).log(
          "Failed to crossover because no node of type %s was found in the partner",
          grammar.type(type).name());
      return false;
    }
    int otherId = candidates.get(random.nextInt(candidates.size()));
    TreeGenome x = genome.subTree(nodeId);
    TreeGenome y = other.subTree(otherId);
    genome.replace(nodeId, y);
    other.replace(otherId, x);
    return true;
  }

  private int typeOf(TreeGenome genome, int nodeId) {
    return grammar.definitionForValue(genome.node(nodeId).value()).typeId();
  }
}
