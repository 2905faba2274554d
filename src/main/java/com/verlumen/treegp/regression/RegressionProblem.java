package com.verlumen.treegp.regression;

import com.verlumen.treegp.evolution.FitnessFunction;
import com.verlumen.treegp.generation.Initializer;
import com.verlumen.treegp.generation.TreeGenerator;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.printing.TerminalPrinter;

/** A symbolic-regression problem: a grammar, a way to seed it and a way to score it. */
public interface RegressionProblem {
  String name();

  GrammarCatalog grammar();

  /** Depth ceiling of the initial trees. */
  int defaultInitialDepth();

  Initializer initializer(TreeGenerator generator);

  FitnessFunction fitnessFunction();

  default TerminalPrinter terminalPrinter() {
    return TerminalPrinter.DEFAULT;
  }
}
