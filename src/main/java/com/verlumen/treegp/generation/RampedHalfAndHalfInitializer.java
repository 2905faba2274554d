package com.verlumen.treegp.generation;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.function.Consumer;

/**
 * Ramped half-and-half initialization: the first half of the population is generated with {@link
 * GenerationStrategy#FULL}, the second half with {@link GenerationStrategy#GROW}, and within each
 * half the depth ceiling ramps linearly from 1 to the configured maximum.
 */
public final class RampedHalfAndHalfInitializer implements Initializer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final TreeGenerator generator;
  private final InitializerDelegate delegate;

  public RampedHalfAndHalfInitializer(TreeGenerator generator) {
    this(generator, new InitializerDelegate() {});
  }

  public RampedHalfAndHalfInitializer(TreeGenerator generator, InitializerDelegate delegate) {
    this.generator = generator;
    this.delegate = delegate;
  }

  @Override
  public void initialize(InitializationOptions options, Consumer<TreeGenome> consumer) {
    int size = options.populationSize();
    int maxDepth = options.maxTreeDepth();
    int half = size / 2;
    logger.atFine().log("Initializing %d trees, depth ramp 1..%d", size, maxDepth);
    for (int i = 0; i < half; i++) {
      consumer.accept(generate(GenerationStrategy.FULL, depthAt(i, maxDepth, half)));
    }
    for (int i = half; i < size; i++) {
      consumer.accept(generate(GenerationStrategy.GROW, depthAt(i - half, maxDepth, half)));
    }
  }

  /**
   * The depth ceiling of the {@code index}-th tree of a half, {@code floor(1 + index * (maxDepth -
   * 1) / half)} in exact integer arithmetic. Every tree gets depth 1 when {@code half} is 0.
   */
  static int depthAt(int index, int maxDepth, int half) {
    if (half == 0) {
      return 1;
    }
    return 1 + (int) ((long) index * (maxDepth - 1) / half);
  }

  private TreeGenome generate(GenerationStrategy strategy, int maxDepth) {
    TreeGenome.Builder builder = TreeGenome.builder();
    boolean handled =
        strategy == GenerationStrategy.FULL
            ? delegate.generateFull(generator, builder, maxDepth)
            : delegate.generateGrow(generator, builder, maxDepth);
    if (!handled) {
      checkState(builder.nodeCount() == 0, "Initializer delegate declined after adding nodes");
      generator.generate(builder, maxDepth, strategy);
    }
    return builder.build();
  }
}
