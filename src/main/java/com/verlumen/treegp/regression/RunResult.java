package com.verlumen.treegp.regression;

import com.google.auto.value.AutoValue;
import com.verlumen.treegp.evolution.GenerationStats;
import com.verlumen.treegp.tree.TreeGenome;

/** The outcome of a regression run. */
@AutoValue
public abstract class RunResult {
  static RunResult create(
      int generation, GenerationStats stats, TreeGenome bestIndividual, String bestProgram) {
    return new AutoValue_RunResult(generation, stats, bestIndividual, bestProgram);
  }

  /** The generation the run stopped at. */
  public abstract int generation();

  /** Statistics of the final generation. */
  public abstract GenerationStats stats();

  public abstract TreeGenome bestIndividual();

  /** The best individual printed as an s-expression. */
  public abstract String bestProgram();
}
