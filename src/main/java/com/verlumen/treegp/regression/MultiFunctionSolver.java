package com.verlumen.treegp.regression;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.verlumen.treegp.evaluation.TreeGenomeEvaluator;
import com.verlumen.treegp.evolution.FitnessFunction;
import com.verlumen.treegp.generation.Initializer;
import com.verlumen.treegp.generation.InitializerDelegate;
import com.verlumen.treegp.generation.RampedHalfAndHalfInitializer;
import com.verlumen.treegp.generation.TreeGenerator;
import com.verlumen.treegp.grammar.Declaration;
import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.grammar.Type;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.List;

/**
 * Searches for a program made of two functions: a helper {@code g(x, y)} over {@code int-base}
 * and a main expression over {@code int} that may {@code call} the helper.
 *
 * <p>Every individual is rooted at {@code functions(helper, main)}. The target is {@code f(x, y) =
 * g(x + 2, g(x, y)) - g(y, x * y)} with {@code g(x, y) = x * y - (y * y + x)}.
 */
final class MultiFunctionSolver implements RegressionProblem {
  static final int INITIAL_DEPTH = 6;

  private static final Type BASE = Type.of("int-base");
  private static final Type INT = Type.of("int");
  private static final Type FUNCTION_SET = Type.of("function-set");

  private final GrammarCatalog grammar;
  private final List<Sample> samples;
  private final int functions;
  private final ImmutableSet<Integer> x;
  private final ImmutableSet<Integer> y;
  private final ImmutableSet<Integer> one;
  private final ImmutableSet<Integer> add;
  private final ImmutableSet<Integer> subtract;
  private final ImmutableSet<Integer> multiply;
  private final ImmutableSet<Integer> call;

  private MultiFunctionSolver(GrammarCatalog grammar, List<Sample> samples) {
    this.grammar = grammar;
    this.samples = samples;
    this.functions = grammar.definitionNamed("functions").definitionId();
    this.x = idsNamed("x");
    this.y = idsNamed("y");
    this.one = idsNamed("1");
    this.add = idsNamed("+");
    this.subtract = idsNamed("-");
    this.multiply = idsNamed("*");
    this.call = idsNamed("call");
  }

  static MultiFunctionSolver create() {
    return new MultiFunctionSolver(createGrammar(), Sample.DEFAULT_SAMPLES);
  }

  static GrammarCatalog createGrammar() {
    ImmutableList<Type> intArguments = ImmutableList.of(INT, INT);
    ImmutableList<Type> baseArguments = ImmutableList.of(BASE, BASE);
    return GrammarCatalog.create(
        ImmutableList.of(BASE, INT, FUNCTION_SET),
        Declaration.terminal("x", INT, 25),
        Declaration.terminal("y", INT, 25),
        Declaration.terminal("1", INT, 50),
        Declaration.binaryFunction("+", INT, intArguments, 50),
        Declaration.binaryFunction("-", INT, intArguments, 50),
        Declaration.binaryFunction("*", INT, intArguments, 50),
        Declaration.binaryFunction("call", INT, intArguments, 200),
        Declaration.terminal("x", BASE, 25),
        Declaration.terminal("y", BASE, 25),
        Declaration.terminal("1", BASE, 50),
        Declaration.binaryFunction("+", BASE, baseArguments, 50),
        Declaration.binaryFunction("-", BASE, baseArguments, 50),
        Declaration.binaryFunction("*", BASE, baseArguments, 50),
        // First argument is the helper, second the main expression.
        Declaration.binaryFunction("functions", FUNCTION_SET, ImmutableList.of(BASE, INT), 50));
  }

  static long helper(long x, long y) {
    return x * y - (y * y + x);
  }

  static long target(long x, long y) {
    return helper(x + 1 + 1, helper(x, y)) - helper(y, x * y);
  }

  @Override
  public String name() {
    return "multi-function";
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
    return new RampedHalfAndHalfInitializer(
        generator, new RootTypeDelegate(grammar.typeByName(FUNCTION_SET.name())));
  }

  @Override
  public FitnessFunction fitnessFunction() {
    return individuals ->
        individuals.stream().mapToDouble(this::computeFitnessForIndividual).toArray();
  }

  double computeFitnessForIndividual(TreeGenome individual) {
    return RegressionFitness.score(
        samples,
        individual.nodeCount(),
        sample -> evaluate(individual, sample),
        sample -> target(sample.x(), sample.y()));
  }

  long evaluate(TreeGenome individual, Sample sample) {
    TreeGenome.Node root = individual.root();
    checkState(
        grammar.definitionForValue(root.value()).definitionId() == functions,
        "Individual must be rooted at 'functions'");
    TreeGenome.Node helper = root.child(0);
    return new Evaluator(helper, sample.x(), sample.y()).evaluate(root.child(1));
  }

  private ImmutableSet<Integer> idsNamed(String name) {
    return grammar.definitionsNamed(name).stream()
        .map(Definition::definitionId)
        .collect(toImmutableSet());
  }

  /** Generates every initial tree from the {@code function-set} type. */
  private static final class RootTypeDelegate implements InitializerDelegate {
    private final int rootType;

    RootTypeDelegate(int rootType) {
      this.rootType = rootType;
    }

    @Override
    public boolean generateFull(TreeGenerator generator, TreeGenome.Builder builder, int maxDepth) {
      generator.generateFull(builder, maxDepth, rootType);
      return true;
    }

    @Override
    public boolean generateGrow(TreeGenerator generator, TreeGenome.Builder builder, int maxDepth) {
      generator.generateGrow(builder, maxDepth, rootType);
      return true;
    }
  }

  private final class Evaluator extends TreeGenomeEvaluator<Long> {
    private final TreeGenome.Node helper;
    private final long px;
    private final long py;

    Evaluator(TreeGenome.Node helper, long px, long py) {
      super(grammar);
      this.helper = helper;
      this.px = px;
      this.py = py;
    }

    @Override
    protected Long evaluateTerminal(Definition definition, TreeGenome.Node node) {
      int id = definition.definitionId();
      if (x.contains(id)) {
        return px;
      } else if (y.contains(id)) {
        return py;
      }
      checkState(one.contains(id), "Unexpected terminal %s", definition.name());
      return 1L;
    }

    @Override
    protected Long evaluateBinaryFunction(
        Definition definition, TreeGenome.Node node, Long a, Long b) {
      int id = definition.definitionId();
      if (add.contains(id)) {
        return a + b;
      } else if (subtract.contains(id)) {
        return a - b;
      } else if (call.contains(id)) {
        return new Evaluator(helper, a, b).evaluate(helper);
      }
      checkState(multiply.contains(id), "Unexpected function %s", definition.name());
      return a * b;
    }
  }
}
