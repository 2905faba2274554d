package com.verlumen.treegp.generation;

import static com.google.common.base.Preconditions.checkState;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.DefinitionSet;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.random.RandomGenerator;

/**
 * Generates random trees from a grammar.
 *
 * <p>Values are drawn uniformly from a {@link DefinitionSet}'s local space, so every definition is
 * picked with probability proportional to its weight. When a type is required, only definitions of
 * that type are drawn.
 */
public final class TreeGenerator {
  private final GrammarCatalog grammar;
  private final RandomGenerator random;

  public TreeGenerator(GrammarCatalog grammar, RandomGenerator random) {
    this.grammar = grammar;
    this.random = random;
  }

  public GrammarCatalog grammar() {
    return grammar;
  }

  public int randomTerminalValue() {
    return randomTerminalValue(grammar.globalDefinitionSet());
  }

  public int randomFunctionValue() {
    return randomFunctionValue(grammar.globalDefinitionSet());
  }

  public int randomNodeValue() {
    return randomNodeValue(grammar.globalDefinitionSet());
  }

  public int randomTerminalValue(DefinitionSet set) {
    checkState(set.hasTerminals(), "Definition set has no terminals");
    return set.nodeValueFor(random.nextInt(set.terminalLimit()));
  }

  public int randomFunctionValue(DefinitionSet set) {
    checkState(set.hasFunctions(), "Definition set has no functions");
    return set.nodeValueFor(random.nextInt(set.terminalLimit(), set.functionLimit()));
  }

  public int randomNodeValue(DefinitionSet set) {
    return set.nodeValueFor(random.nextInt(set.functionLimit()));
  }

  public void generate(TreeGenome.Builder builder, int maxDepth, GenerationStrategy strategy) {
    generate(builder, maxDepth, strategy, GrammarCatalog.NO_TYPE);
  }

  /**
   * Appends a random tree of the given type to {@code builder}.
   *
   * <p>At depth 1 or below a terminal is drawn. A type that has no terminals still gets a function
   * there, so such trees can exceed {@code maxDepth}. A type that has no functions gets a terminal
   * at any depth.
   *
   * @param type a type id, or {@link GrammarCatalog#NO_TYPE} for no constraint
   * @throws IllegalStateException if the type has no definitions at all
   */
  public void generate(
      TreeGenome.Builder builder, int maxDepth, GenerationStrategy strategy, int type) {
    DefinitionSet set = grammar.definitionSetForType(type);
    checkState(
        set.hasTerminals() || set.hasFunctions(), "Type %s has no definitions", type);
    if (maxDepth <= 1 && set.hasTerminals()) {
      builder.add(randomTerminalValue(set));
      return;
    }
    int value;
    if (strategy == GenerationStrategy.GROW) {
      value = randomNodeValue(set);
    } else if (set.hasFunctions()) {
      value = randomFunctionValue(set);
    } else {
      value = randomTerminalValue(set);
    }
    Definition definition = grammar.definitionForValue(value);
    if (definition.isTerminal()) {
      builder.add(value);
      return;
    }
    builder.push(value);
    for (int i = 0; i < definition.arity(); i++) {
      generate(builder, maxDepth - 1, strategy, definition.argumentType(i));
    }
    builder.pop();
  }

  /** Appends a tree whose branches all grow until {@code maxDepth}. */
  public void generateFull(TreeGenome.Builder builder, int maxDepth) {
    generate(builder, maxDepth, GenerationStrategy.FULL);
  }

  public void generateFull(TreeGenome.Builder builder, int maxDepth, int type) {
    generate(builder, maxDepth, GenerationStrategy.FULL, type);
  }

  /** Appends a tree that may grow until {@code maxDepth}, but doesn't have to. */
  public void generateGrow(TreeGenome.Builder builder, int maxDepth) {
    generate(builder, maxDepth, GenerationStrategy.GROW);
  }

  public void generateGrow(TreeGenome.Builder builder, int maxDepth, int type) {
    generate(builder, maxDepth, GenerationStrategy.GROW, type);
  }

  /** Generates a complete tree of the given type. */
  public TreeGenome newTree(int maxDepth, GenerationStrategy strategy, int type) {
    TreeGenome.Builder builder = TreeGenome.builder();
    generate(builder, maxDepth, strategy, type);
    return builder.build();
  }
}
