package com.verlumen.treegp.generation;

import com.verlumen.treegp.tree.TreeGenome;
import java.util.function.Consumer;

/** Produces the initial trees of a population. */
public interface Initializer {
  /**
   * Generates {@code options.populationSize()} trees and hands each one to {@code consumer}, in
   * order.
   */
  void initialize(InitializationOptions options, Consumer<TreeGenome> consumer);
}
