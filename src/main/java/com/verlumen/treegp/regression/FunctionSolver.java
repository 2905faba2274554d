package com.verlumen.treegp.regression;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.treegp.evaluation.TreeGenomeEvaluator;
import com.verlumen.treegp.evolution.FitnessFunction;
import com.verlumen.treegp.generation.Initializer;
import com.verlumen.treegp.generation.RampedHalfAndHalfInitializer;
import com.verlumen.treegp.generation.TreeGenerator;
import com.verlumen.treegp.grammar.Declaration;
import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.grammar.Type;
import com.verlumen.treegp.printing.TerminalPrinter;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.List;
import java.util.Optional;

/**
 * Searches for {@code f(x, y) = x * y + (y - x * x)}, i.e. {@code (+ (* $0 $1) (- $1 (* $0
 * $0)))}.
 *
 * <p>The two inputs share one {@code parameter} terminal: its node value range is split evenly, and
 * the half a node value falls into selects the input.
 */
final class FunctionSolver implements RegressionProblem {
  static final int PARAMETER_COUNT = 2;
  static final int INITIAL_DEPTH = 10;

  private static final Type INT = Type.of("int");

  private final GrammarCatalog grammar;
  private final List<Sample> samples;
  private final int parameter;
  private final int one;
  private final int add;
  private final int subtract;
  private final int multiply;

  private FunctionSolver(GrammarCatalog grammar, List<Sample> samples) {
    this.grammar = grammar;
    this.samples = samples;
    this.parameter = grammar.definitionNamed("parameter").definitionId();
    this.one = grammar.definitionNamed("1").definitionId();
    this.add = grammar.definitionNamed("+").definitionId();
    this.subtract = grammar.definitionNamed("-").definitionId();
    this.multiply = grammar.definitionNamed("*").definitionId();
  }

  static FunctionSolver create() {
    return new FunctionSolver(createGrammar(), Sample.DEFAULT_SAMPLES);
  }

  static GrammarCatalog createGrammar() {
    return GrammarCatalog.create(
        ImmutableList.of(INT),
        Declaration.terminal("parameter", INT, 50),
        Declaration.terminal("1", INT, 50),
        Declaration.binaryFunction("+", INT, ImmutableList.of(INT, INT), 50),
        Declaration.binaryFunction("-", INT, ImmutableList.of(INT, INT), 50),
        Declaration.binaryFunction("*", INT, ImmutableList.of(INT, INT), 50));
  }

  static long target(long x, long y) {
    return x * y + (y - x * x);
  }

  /** Which input a {@code parameter} node refers to. */
  static int parameterId(Definition definition, TreeGenome.Node node) {
    int offset = node.value() - definition.nodeValue();
    int rangeOfParameter = definition.weight() / PARAMETER_COUNT;
    checkState(
        rangeOfParameter * PARAMETER_COUNT == definition.weight(),
        "Weight of %s must be divisible by %s",
        definition.name(),
        PARAMETER_COUNT);
    return offset / rangeOfParameter;
  }

  @Override
  public String name() {
    return "function";
  }

  @Override
  public GrammarCatalog grammar() {
    return grammar;
  }

  @Override
  public int defaultInitialDepth() {
    return INITIAL_DEPTH;
  }

  @Override
  public Initializer initializer(TreeGenerator generator) {
    return new RampedHalfAndHalfInitializer(generator);
  }

  @Override
  public FitnessFunction fitnessFunction() {
    return individuals ->
        individuals.stream().mapToDouble(this::computeFitnessForIndividual).toArray();
  }

  @Override
  public TerminalPrinter terminalPrinter() {
    return (definition, node) ->
        definition.definitionId() == parameter
            ? Optional.of("$" + parameterId(definition, node))
            : Optional.empty();
  }

  double computeFitnessForIndividual(TreeGenome individual) {
    return RegressionFitness.score(
        samples,
        individual.nodeCount(),
        sample -> evaluate(individual, sample),
        sample -> target(sample.x(), sample.y()));
  }

  long evaluate(TreeGenome individual, Sample sample) {
    return new Evaluator(sample).evaluate(individual);
  }

  private final class Evaluator extends TreeGenomeEvaluator<Long> {
    private final long[] parameters;

    Evaluator(Sample sample) {
      super(grammar);
      this.parameters = new long[] {sample.x(), sample.y()};
    }

    @Override
    protected Long evaluateTerminal(Definition definition, TreeGenome.Node node) {
      if (definition.definitionId() == parameter) {
        return parameters[parameterId(definition, node)];
      }
      checkState(definition.definitionId() == one, "Unexpected terminal %s", definition.name());
      return 1L;
    }

    @Override
    protected Long evaluateBinaryFunction(
        Definition definition, TreeGenome.Node node, Long x, Long y) {
      int id = definition.definitionId();
      if (id == add) {
        return x + y;
      } else if (id == subtract) {
        return x - y;
      }
      checkState(id == multiply, "Unexpected function %s", definition.name());
      return x * y;
    }
  }
}
