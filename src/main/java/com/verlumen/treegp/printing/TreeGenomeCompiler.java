package com.verlumen.treegp.printing;

import static com.google.common.base.Preconditions.checkState;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.Optional;

/**
 * Converts a tree genome into the text of the program it stores: functions become calls such as
 * {@code max(x, y)}, or operators such as {@code (x + y)} when the delegate asks for it.
 */
public final class TreeGenomeCompiler {
  private final GrammarCatalog grammar;
  private final CompilerDelegate delegate;

  public TreeGenomeCompiler(GrammarCatalog grammar) {
    this(grammar, new CompilerDelegate() {});
  }

  public TreeGenomeCompiler(GrammarCatalog grammar, CompilerDelegate delegate) {
    this.grammar = grammar;
    this.delegate = delegate;
  }

  public String compile(TreeGenome tree) {
    StringBuilder sb = new StringBuilder();
    compile(tree.root(), sb);
    return sb.toString();
  }

  public void compile(TreeGenome.Node node, StringBuilder sb) {
    Definition definition = grammar.definitionForValue(node.value());
    if (definition.isTerminal()) {
      checkState(node.isEmpty(), "Terminal %s has children", definition.name());
      sb.append(delegate.printTerminal(definition, node).orElse(definition.name()));
      return;
    }
    checkState(
        node.childCount() == definition.arity(),
        "Function %s has %s children, expected %s",
        definition.name(),
        node.childCount(),
        definition.arity());
    Optional<String> custom = delegate.printFunction(definition, node);
    if (custom.isPresent()) {
      sb.append(custom.get());
      return;
    }
    if (delegate.printAsOperator(definition)) {
      switch (node.childCount()) {
        case 1:
          sb.append('(').append(definition.name()).append(' ');
          compile(node.child(0), sb);
          sb.append(')');
          return;
        case 2:
          sb.append('(');
          compile(node.child(0), sb);
          sb.append(' ').append(definition.name()).append(' ');
          compile(node.child(1), sb);
          sb.append(')');
          return;
        default:
          throw new IllegalStateException(
              String.format(
                  "Function %s with %d arguments cannot be an operator",
                  definition.name(), node.childCount()));
      }
    }
    sb.append(definition.name()).append('(');
    boolean first = true;
    for (TreeGenome.Node child : node.children()) {
      if (!first) {
        sb.append(", ");
      }
      compile(child, sb);
      first = false;
    }
    sb.append(')');
  }
}
