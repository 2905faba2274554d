package com.verlumen.treegp.printing;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.Optional;

/** Overrides how terminal nodes are rendered, for example to show which parameter a node is. */
@FunctionalInterface
public interface TerminalPrinter {
  /** A printer that always falls back to the definition's name. */
  TerminalPrinter DEFAULT = (definition, node) -> Optional.empty();

  /**
   * Returns the text for a terminal node, or empty to print the definition's name.
   */
  Optional<String> printTerminal(Definition definition, TreeGenome.Node node);
}
