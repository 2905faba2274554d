package com.verlumen.treegp.evolution;

/** Constants of the evolutionary loop. */
public final class EvolutionConstants {
  /** Number of individuals sampled per tournament. */
  public static final int TOURNAMENT_SIZE = 3;

  /** Two elite copies open the next generation and one untouched copy closes it. */
  public static final int ELITE_COPIES = 3;

  public static final int MIN_POPULATION_SIZE = 4;

  /** Depth ceiling of the replacement subtrees generated by the default mutation. */
  public static final int DEFAULT_MUTATION_DEPTH = 2;

  private EvolutionConstants() {}
}
