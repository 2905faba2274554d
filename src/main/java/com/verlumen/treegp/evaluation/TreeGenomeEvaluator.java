package com.verlumen.treegp.evaluation;

import static com.google.common.base.Preconditions.checkState;

import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.ArrayList;
import java.util.List;

/**
 * Interprets a tree genome bottom-up. Subclasses give terminals their values and functions their
 * semantics; arguments are evaluated before the function that consumes them.
 *
 * @param <T> the type of value the program computes
 */
public abstract class TreeGenomeEvaluator<T> {
  private final GrammarCatalog grammar;

  protected TreeGenomeEvaluator(GrammarCatalog grammar) {
    this.grammar = grammar;
  }

  protected final GrammarCatalog grammar() {
    return grammar;
  }

  public final T evaluate(TreeGenome tree) {
    return evaluate(tree.root());
  }

  public final T evaluate(TreeGenome.Node node) {
    Definition definition = grammar.definitionForValue(node.value());
    if (definition.isTerminal()) {
      checkState(node.isEmpty(), "Terminal %s has children", definition.name());
      return evaluateTerminal(definition, node);
    }
    checkState(
        node.childCount() == definition.arity(),
        "Function %s has %s children, expected %s",
        definition.name(),
        node.childCount(),
        definition.arity());
    List<T> values = new ArrayList<>(node.childCount());
    for (TreeGenome.Node child : node.children()) {
      values.add(evaluate(child));
    }
    switch (values.size()) {
      case 1:
        return evaluateUnaryFunction(definition, node, values.get(0));
      case 2:
        return evaluateBinaryFunction(definition, node, values.get(0), values.get(1));
      default:
        return evaluateFunction(definition, node, values);
    }
  }

  protected abstract T evaluateTerminal(Definition definition, TreeGenome.Node node);

  /** Defaults to the identity. */
  protected T evaluateUnaryFunction(Definition definition, TreeGenome.Node node, T x) {
    return x;
  }

  protected T evaluateBinaryFunction(Definition definition, TreeGenome.Node node, T x, T y) {
    throw new UnsupportedOperationException("No semantics for function " + definition.name());
  }

  protected T evaluateFunction(Definition definition, TreeGenome.Node node, List<T> arguments) {
    throw new UnsupportedOperationException("No semantics for function " + definition.name());
  }
}
