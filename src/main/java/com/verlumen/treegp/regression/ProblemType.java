package com.verlumen.treegp.regression;

import java.util.function.Supplier;

/** The regression problems the command line can run. */
public enum ProblemType {
  FUNCTION("function", FunctionSolver::create),
  MULTI_FUNCTION("multi-function", MultiFunctionSolver::create);

  private final String flagName;
  private final Supplier<RegressionProblem> factory;

  ProblemType(String flagName, Supplier<RegressionProblem> factory) {
    this.flagName = flagName;
    this.factory = factory;
  }

  public String flagName() {
    return flagName;
  }

  RegressionProblem create() {
    return factory.get();
  }

  static ProblemType forFlagName(String flagName) {
    for (ProblemType type : values()) {
      if (type.flagName.equals(flagName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown problem: " + flagName);
  }
}
