package com.verlumen.treegp.tree;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TreeGenomeTest {
  private static final int PLUS = 0;
  private static final int ONE = 1;
  private static final int ZERO = 2;

  /** Builds {@code (+ (+ 1 1) 0)}. */
  private static TreeGenome onePlusOnePlusZero() {
    return TreeGenome.builder()
        .push(PLUS)
        .push(PLUS)
        .add(ONE)
        .add(ONE)
        .pop()
        .add(ZERO)
        .pop()
        .build();
  }

  private static String describe(TreeGenome tree) {
    return describe(tree.root());
  }

  private static String describe(TreeGenome.Node node) {
    switch (node.value()) {
      case PLUS:
        return node.children().stream()
            .map(TreeGenomeTest::describe)
            .collect(Collectors.joining(" ", "(+ ", ")"));
      case ONE:
        return "1";
      case ZERO:
        return "0";
      default:
        throw new AssertionError("Unexpected value " + node.value());
    }
  }

  @Test
  public void builder_buildsPreOrderLayout() {
    TreeGenome tree = onePlusOnePlusZero();

    assertThat(tree.nodeCount()).isEqualTo(5);
    assertThat(tree.preOrderValues()).containsExactly(PLUS, PLUS, ONE, ONE, ZERO).inOrder();
    assertThat(tree.root().subtreeSize()).isEqualTo(5);
    assertThat(tree.node(1).subtreeSize()).isEqualTo(3);
    assertThat(tree.node(1).childCount()).isEqualTo(2);
    assertThat(tree.node(4).isEmpty()).isTrue();
    assertThat(describe(tree)).isEqualTo("(+ (+ 1 1) 0)");
  }

  @Test
  public void replaceAndSubTree_produceExpectedTrees() {
    TreeGenome genome = onePlusOnePlusZero();
    TreeGenome sub = genome.subTree(1);
    assertThat(describe(sub)).isEqualTo("(+ 1 1)");
    assertThat(sub.nodeCount()).isEqualTo(3);

    genome.replace(4, sub);
    assertThat(describe(genome)).isEqualTo("(+ (+ 1 1) (+ 1 1))");
    assertThat(genome.nodeCount()).isEqualTo(7);

    genome.replace(0, sub);
    assertThat(describe(genome)).isEqualTo("(+ 1 1)");
    assertThat(genome.nodeCount()).isEqualTo(3);

    TreeGenome zero = TreeGenome.builder().add(ZERO).build();
    genome.replace(2, zero);
    assertThat(describe(genome)).isEqualTo("(+ 1 0)");

    genome.replace(1, zero);
    assertThat(describe(genome)).isEqualTo("(+ 0 0)");

    genome.replace(2, sub);
    assertThat(describe(genome)).isEqualTo("(+ 0 (+ 1 1))");
    assertThat(genome.nodeCount()).isEqualTo(5);

    TreeGenome zeroCopy = genome.subTree(1);
    genome.replace(2, zeroCopy);
    assertThat(describe(genome)).isEqualTo("(+ 0 0)");
    assertThat(genome.nodeCount()).isEqualTo(3);
  }

  @Test
  public void replace_deepNode_updatesEveryAncestor() {
    TreeGenome genome = onePlusOnePlusZero();

    genome.replace(2, genome.subTree(1));

    assertThat(describe(genome)).isEqualTo("(+ (+ (+ 1 1) 1) 0)");
    assertThat(genome.nodeCount()).isEqualTo(7);
    assertThat(genome.node(0).subtreeSize()).isEqualTo(7);
    assertThat(genome.node(1).subtreeSize()).isEqualTo(5);
    assertThat(genome.node(2).subtreeSize()).isEqualTo(3);
  }

  @Test
  public void replace_withItself_copiesFirst() {
    TreeGenome genome = onePlusOnePlusZero();

    genome.replace(4, genome);

    assertThat(describe(genome)).isEqualTo("(+ (+ 1 1) (+ (+ 1 1) 0))");
    assertThat(genome.nodeCount()).isEqualTo(9);
  }

  @Test
  public void replace_changesNodeCountByDelta() {
    TreeGenome genome = onePlusOnePlusZero();
    TreeGenome replacement = genome.subTree(1);
    int removed = genome.node(4).subtreeSize();

    genome.replace(4, replacement);

    assertThat(genome.nodeCount()).isEqualTo(5 - removed + replacement.nodeCount());
    assertThat(genome.subTree(4)).isEqualTo(replacement);
    assertThat(genome.root().subtreeSize()).isEqualTo(genome.nodeCount());
  }

  @Test
  public void subTree_isIndependentOfSource() {
    TreeGenome genome = onePlusOnePlusZero();
    TreeGenome sub = genome.subTree(1);

    sub.replace(1, TreeGenome.builder().add(ZERO).build());

    assertThat(describe(sub)).isEqualTo("(+ 0 1)");
    assertThat(describe(genome)).isEqualTo("(+ (+ 1 1) 0)");
  }

  @Test
  public void replace_copiesReplacement() {
    TreeGenome genome = onePlusOnePlusZero();
    TreeGenome replacement = TreeGenome.builder().push(PLUS).add(ONE).add(ZERO).pop().build();

    genome.replace(4, replacement);
    replacement.replace(1, TreeGenome.builder().add(ZERO).build());

    assertThat(describe(genome)).isEqualTo("(+ (+ 1 1) (+ 1 0))");
  }

  @Test
  public void children_iterateInOrder() {
    // 2(11, 42(13, 0, 9(7)), 90)
    TreeGenome tree =
        TreeGenome.builder()
            .push(2)
            .add(11)
            .push(42)
            .add(13)
            .add(0)
            .push(9)
            .add(7)
            .pop()
            .pop()
            .add(90)
            .pop()
            .build();

    TreeGenome.Node root = tree.root();
    assertThat(values(root.children())).containsExactly(11, 42, 90).inOrder();
    assertThat(values(root.child(1).children())).containsExactly(13, 0, 9).inOrder();
    assertThat(values(root.child(1).child(2).children())).containsExactly(7);
    assertThat(root.child(0).children()).isEmpty();
    assertThat(root.child(2).id()).isEqualTo(8);
    assertThat(tree.nodeCount()).isEqualTo(9);
    assertThat(root.child(1).subtreeSize()).isEqualTo(6);
  }

  @Test
  public void child_outOfRange_throws() {
    TreeGenome tree = onePlusOnePlusZero();

    assertThrows(IndexOutOfBoundsException.class, () -> tree.root().child(2));
    assertThrows(IndexOutOfBoundsException.class, () -> tree.node(5));
  }

  @Test
  public void equals_comparesContent() {
    TreeGenome tree = onePlusOnePlusZero();

    assertThat(tree.copy()).isEqualTo(tree);
    assertThat(tree.copy().hashCode()).isEqualTo(tree.hashCode());
    assertThat(tree.subTree(1)).isNotEqualTo(tree);
    assertThat(tree.toString()).isEqualTo("TreeGenome[0/2 0/2 1 1 2]");
  }

  @Test
  public void builder_popWithoutOpenNode_throws() {
    TreeGenome.Builder builder = TreeGenome.builder();

    assertThrows(IllegalStateException.class, builder::pop);
  }

  @Test
  public void builder_buildWithOpenNode_throws() {
    TreeGenome.Builder builder = TreeGenome.builder().push(PLUS).add(ONE);

    assertThat(builder.isComplete()).isFalse();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void builder_buildEmpty_throws() {
    assertThrows(IllegalStateException.class, () -> TreeGenome.builder().build());
  }

  @Test
  public void builder_secondRoot_throws() {
    TreeGenome.Builder builder = TreeGenome.builder().add(ONE);

    assertThat(builder.isComplete()).isTrue();
    assertThrows(IllegalStateException.class, () -> builder.add(ZERO));
  }

  @Test
  public void builder_reuseAfterBuild_throws() {
    TreeGenome.Builder builder = TreeGenome.builder().add(ONE);
    builder.build();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  public void builder_growsPastInitialCapacity() {
    TreeGenome.Builder builder = TreeGenome.builder().push(PLUS);
    for (int i = 0; i < 250; i++) {
      builder.add(ONE);
    }
    TreeGenome tree = builder.pop().build();

    assertThat(tree.nodeCount()).isEqualTo(251);
    assertThat(tree.root().childCount()).isEqualTo(250);
    assertThat(tree.root().child(249).id()).isEqualTo(250);
  }

  private static ImmutableList<Integer> values(ImmutableList<TreeGenome.Node> nodes) {
    return nodes.stream().map(TreeGenome.Node::value).collect(ImmutableList.toImmutableList());
  }
}
