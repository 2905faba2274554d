package com.verlumen.treegp.generation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.treegp.grammar.Declaration;
import com.verlumen.treegp.grammar.Definition;
import com.verlumen.treegp.grammar.GrammarCatalog;
import com.verlumen.treegp.grammar.Type;
import com.verlumen.treegp.tree.TreeGenome;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class TreeGeneratorTest {
  private static final Type INT = Type.of("int");
  private static final Type COLOR = Type.of("color");

  private static GrammarCatalog arithmetic() {
    return GrammarCatalog.create(
        ImmutableList.of(INT),
        Declaration.terminal("x", INT, 10),
        Declaration.terminal("y", INT, 10),
        Declaration.binaryFunction("+", INT, ImmutableList.of(INT, INT), 5),
        Declaration.binaryFunction("*", INT, ImmutableList.of(INT, INT), 11),
        Declaration.unaryFunction("sin", INT, INT, 3));
  }

  private static GrammarCatalog colors() {
    return GrammarCatalog.create(
        ImmutableList.of(INT, COLOR),
        Declaration.terminal("x", INT, 10),
        Declaration.terminal("orange", COLOR, 1),
        Declaration.binaryFunction("+", INT, ImmutableList.of(INT, INT), 5),
        Declaration.ternaryFunction("rgb", COLOR, ImmutableList.of(INT, INT, INT), 5),
        Declaration.binaryFunction("darker", COLOR, ImmutableList.of(COLOR, INT), 2));
  }

  @Test
  public void generateFull_everyLeafAtMaxDepth(@TestParameter({"1", "2", "4", "6"}) int depth) {
    TreeGenerator generator = new TreeGenerator(arithmetic(), new SplittableRandom(1));

    for (int i = 0; i < 20; i++) {
      TreeGenome.Builder builder = TreeGenome.builder();
      generator.generateFull(builder, depth);
      TreeGenome tree = builder.build();

      assertThat(ImmutableSet.copyOf(leafDepths(tree))).containsExactly(depth);
    }
  }

  @Test
  public void generateGrow_neverExceedsMaxDepth(@TestParameter({"1", "3", "5"}) int depth) {
    TreeGenerator generator = new TreeGenerator(arithmetic(), new SplittableRandom(2));

    for (int i = 0; i < 50; i++) {
      TreeGenome.Builder builder = TreeGenome.builder();
      generator.generateGrow(builder, depth);

      for (int leafDepth : leafDepths(builder.build())) {
        assertThat(leafDepth).isAtMost(depth);
      }
    }
  }

  @Test
  public void generate_typedTree_respectsArgumentTypes(@TestParameter GenerationStrategy strategy) {
    GrammarCatalog grammar = colors();
    TreeGenerator generator = new TreeGenerator(grammar, new SplittableRandom(3));
    int color = grammar.typeByName("color");

    for (int i = 0; i < 50; i++) {
      TreeGenome tree = generator.newTree(4, strategy, color);

      assertThat(grammar.definitionForValue(tree.root().value()).typeId()).isEqualTo(color);
      assertWellTyped(grammar, tree.root());
    }
  }

  @Test
  public void generate_typeWithoutTerminals_exceedsMaxDepth() {
    // Arrange
    Type pair = Type.of("pair");
    GrammarCatalog grammar =
        GrammarCatalog.create(
            ImmutableList.of(INT, pair),
            Declaration.terminal("n", INT, 1),
            Declaration.binaryFunction("cons", pair, ImmutableList.of(INT, INT), 1));
    TreeGenerator generator = new TreeGenerator(grammar, new SplittableRandom(4));

    // Act
    TreeGenome tree = generator.newTree(1, GenerationStrategy.GROW, grammar.typeByName("pair"));

    // Assert
    assertThat(grammar.definitionForValue(tree.root().value()).name()).isEqualTo("cons");
    assertThat(tree.nodeCount()).isEqualTo(3);
    assertThat(leafDepths(tree)).containsExactly(2, 2);
  }

  @Test
  public void generateFull_typeWithoutFunctions_drawsTerminal() {
    Type flag = Type.of("flag");
    GrammarCatalog flags =
        GrammarCatalog.create(
            ImmutableList.of(INT, flag),
            Declaration.terminal("x", INT, 1),
            Declaration.terminal("yes", flag, 1),
            Declaration.unaryFunction("neg", INT, INT, 1));
    TreeGenerator generator = new TreeGenerator(flags, new SplittableRandom(5));

    TreeGenome tree = generator.newTree(5, GenerationStrategy.FULL, flags.typeByName("flag"));

    assertThat(tree.nodeCount()).isEqualTo(1);
    assertThat(flags.definitionForValue(tree.root().value()).name()).isEqualTo("yes");
  }

  @Test
  public void generate_typeWithoutDefinitions_throws() {
    Type unused = Type.of("unused");
    GrammarCatalog grammar =
        GrammarCatalog.create(ImmutableList.of(INT, unused), Declaration.terminal("x", INT, 1));
    TreeGenerator generator = new TreeGenerator(grammar, new SplittableRandom(6));

    assertThrows(
        IllegalStateException.class,
        () -> generator.newTree(3, GenerationStrategy.GROW, grammar.typeByName("unused")));
  }

  @Test
  public void randomTerminalValue_followsWeights() {
    GrammarCatalog grammar =
        GrammarCatalog.create(
            ImmutableList.of(INT),
            Declaration.terminal("rare", INT, 1),
            Declaration.terminal("common", INT, 9));
    TreeGenerator generator = new TreeGenerator(grammar, new SplittableRandom(7));
    int draws = 10_000;
    int common = 0;

    for (int i = 0; i < draws; i++) {
      if (grammar.definitionForValue(generator.randomTerminalValue()).name().equals("common")) {
        common++;
      }
    }

    assertThat(common / (double) draws).isWithin(0.05).of(0.9);
  }

  @Test
  public void randomFunctionValue_onlyDrawsFunctions() {
    GrammarCatalog grammar = arithmetic();
    TreeGenerator generator = new TreeGenerator(grammar, new SplittableRandom(8));

    for (int i = 0; i < 500; i++) {
      int value = generator.randomFunctionValue();
      assertThat(value).isAtLeast(grammar.terminalLimit());
      assertThat(grammar.definitionForValue(value).isFunction()).isTrue();
    }
  }

  @Test
  public void generate_sameSeed_sameTree() {
    TreeGenerator first = new TreeGenerator(arithmetic(), new SplittableRandom(9));
    TreeGenerator second = new TreeGenerator(arithmetic(), new SplittableRandom(9));

    for (int i = 0; i < 10; i++) {
      assertThat(first.newTree(5, GenerationStrategy.GROW, GrammarCatalog.NO_TYPE))
          .isEqualTo(second.newTree(5, GenerationStrategy.GROW, GrammarCatalog.NO_TYPE));
    }
  }

  static List<Integer> leafDepths(TreeGenome tree) {
    List<Integer> depths = new ArrayList<>();
    collectLeafDepths(tree.root(), 1, depths);
    return depths;
  }

  private static void collectLeafDepths(TreeGenome.Node node, int depth, List<Integer> depths) {
    if (node.isEmpty()) {
      depths.add(depth);
      return;
    }
    for (TreeGenome.Node child : node.children()) {
      collectLeafDepths(child, depth + 1, depths);
    }
  }

  private static void assertWellTyped(GrammarCatalog grammar, TreeGenome.Node node) {
    Definition definition = grammar.definitionForValue(node.value());
    assertThat(node.childCount()).isEqualTo(definition.arity());
    for (int i = 0; i < definition.arity(); i++) {
      TreeGenome.Node child = node.child(i);
      assertThat(grammar.definitionForValue(child.value()).typeId())
          .isEqualTo(definition.argumentType(i));
      assertWellTyped(grammar, child);
    }
  }
}
