package com.verlumen.treegp.generation;

import com.verlumen.treegp.tree.TreeGenome;

/**
 * Lets a caller take over the construction of initial trees, for example to force a fixed root
 * before handing the rest of the tree back to the generator.
 *
 * <p>A method that returns {@code true} must leave a complete tree in the builder. A method that
 * returns {@code false} must not touch the builder; the default generation is used instead.
 */
public interface InitializerDelegate {
  default boolean generateFull(TreeGenerator generator, TreeGenome.Builder builder, int maxDepth) {
    return false;
  }

  default boolean generateGrow(TreeGenerator generator, TreeGenome.Builder builder, int maxDepth) {
    return false;
  }
}
