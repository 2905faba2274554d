package com.verlumen.treegp.printing;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.Optional;

/**
 * Customizes how {@link TreeGenomeCompiler} renders nodes. Every hook declines by default.
 */
public interface CompilerDelegate {
  /** Returns the text for a terminal node, or empty for the definition's name. */
  default Optional<String> printTerminal(Definition definition, TreeGenome.Node node) {
    return Optional.empty();
  }

  /**
   * Returns the complete text for a function node, or empty for the default rendering. The
   * children have to be rendered by the delegate itself.
   */
  default Optional<String> printFunction(Definition definition, TreeGenome.Node node) {
    return Optional.empty();
  }

  /** Whether a unary or binary function is rendered as {@code (op x)} or {@code (x op y)}. */
  default boolean printAsOperator(Definition definition) {
    return false;
  }
}
