package com.verlumen.treegp.printing;

import static com.google.common.base.Preconditions.checkState;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.Optional;

/** Prints tree genomes as s-expressions, e.g. {@code (+ (sin x) (* y (sin y)))}. */
public final class TreeGenomePrinter {
  private final GrammarCatalog grammar;

  public TreeGenomePrinter(GrammarCatalog grammar) {
    this.grammar = grammar;
  }

  public String print(TreeGenome tree) {
    return print(tree, TerminalPrinter.DEFAULT);
  }

  public String print(TreeGenome tree, TerminalPrinter terminalPrinter) {
    StringBuilder sb = new StringBuilder();
    print(tree.root(), sb, terminalPrinter);
    return sb.toString();
  }

  public void print(TreeGenome.Node node, StringBuilder sb, TerminalPrinter terminalPrinter) {
    Definition definition = grammar.definitionForValue(node.value());
    if (definition.isTerminal()) {
      checkState(node.isEmpty(), "Terminal %s has children", definition.name());
      Optional<String> custom = terminalPrinter.printTerminal(definition, node);
      sb.append(custom.orElse(definition.name()));
      return;
    }
    checkState(
        node.childCount() == definition.arity(),
        "Function %s has %s children, expected %s",
        definition.name(),
        node.childCount(),
        definition.arity());
    sb.append('(').append(definition.name());
    for (TreeGenome.Node child : node.children()) {
      sb.append(' ');
      print(child, sb, terminalPrinter);
    }
    sb.append(')');
  }
}
