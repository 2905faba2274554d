package com.verlumen.treegp.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * A rooted, ordered tree of integer node values stored as a flattened pre-order sequence.
 *
 * <p>Every node records its value, its child count and the size of the subtree rooted at it
 * (itself included). A node's children occupy the index ranges that immediately follow it, each as
 * long as that child's subtree size, so navigation is index arithmetic and a subtree is a
 * contiguous slice. For every node {@code n}, {@code subtreeSize(n) = 1 + Σ subtreeSize(child)},
 * and the root's subtree size is the node count.
 *
 * <p>Trees are only constructed through {@link Builder}. A tree exclusively owns its storage:
 * {@link #subTree(int)} returns an independent copy and {@link #replace(int, TreeGenome)} copies
 * the nodes of the tree it is given.
 */
public final class TreeGenome {
  private static final int INITIAL_CAPACITY = 100;

  private int[] values;
  private int[] childCounts;
  private int[] subtreeSizes;
  private int nodeCount;

  private TreeGenome(int capacity) {
    this.values = new int[capacity];
    this.childCounts = new int[capacity];
    this.subtreeSizes = new int[capacity];
  }

  private TreeGenome(TreeGenome source, int from, int length) {
    this.values = Arrays.copyOfRange(source.values, from, from + length);
    this.childCounts = Arrays.copyOfRange(source.childCounts, from, from + length);
    this.subtreeSizes = Arrays.copyOfRange(source.subtreeSizes, from, from + length);
    this.nodeCount = length;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int nodeCount() {
    return nodeCount;
  }

  public Node root() {
    checkState(nodeCount > 0, "Tree is empty");
    return new Node(0);
  }

  /**
   * Returns a view of the node at pre-order position {@code id}.
   *
   * @throws IndexOutOfBoundsException if {@code id >= nodeCount()}
   */
  public Node node(int id) {
    checkElementIndex(id, nodeCount, "Node id");
    return new Node(id);
  }

  /** The node values in pre-order. */
  public ImmutableList<Integer> preOrderValues() {
    ImmutableList.Builder<Integer> builder = ImmutableList.builderWithExpectedSize(nodeCount);
    for (int i = 0; i < nodeCount; i++) {
      builder.add(values[i]);
    }
    return builder.build();
  }

  public TreeGenome copy() {
    return new TreeGenome(this, 0, nodeCount);
  }

  /**
   * Returns a copy of the subtree rooted at {@code id}, re-rooted at position 0. This tree is left
   * unmodified.
   *
   * @throws IndexOutOfBoundsException if {@code id >= nodeCount()}
   */
  public TreeGenome subTree(int id) {
    checkElementIndex(id, nodeCount, "Node id");
    return new TreeGenome(this, id, subtreeSizes[id]);
  }

  /**
   * Replaces the subtree rooted at {@code id} with a copy of {@code subTree} and updates the
   * subtree sizes of every ancestor of {@code id}.
   *
   * @throws IndexOutOfBoundsException if {@code id >= nodeCount()}
   */
  public void replace(int id, TreeGenome subTree) {
    checkElementIndex(id, nodeCount, "Node id");
    checkArgument(subTree.nodeCount > 0, "Replacement tree is empty");
    if (subTree == this) {
      subTree = copy();
    }
    int removed = subtreeSizes[id];
    int inserted = subTree.nodeCount;
    int delta = inserted - removed;
    int newCount = nodeCount + delta;

    // Ancestors are found with the old sizes of their children, so walk before splicing.
    int ancestor = 0;
    while (ancestor != id) {
      subtreeSizes[ancestor] += delta;
      int child = ancestor + 1;
      while (child + subtreeSizes[child] <= id) {
        child += subtreeSizes[child];
      }
      ancestor = child;
    }

    values = splice(values, id, removed, subTree.values, inserted, newCount);
    childCounts = splice(childCounts, id, removed, subTree.childCounts, inserted, newCount);
    subtreeSizes = splice(subtreeSizes, id, removed, subTree.subtreeSizes, inserted, newCount);
    nodeCount = newCount;
    checkState(subtreeSizes[0] == nodeCount, "Subtree sizes are inconsistent after replace");
  }

  private int[] splice(
      int[] target, int at, int removed, int[] source, int inserted, int newCount) {
    int[] result = new int[Math.max(newCount, INITIAL_CAPACITY)];
    System.arraycopy(target, 0, result, 0, at);
    System.arraycopy(source, 0, result, at, inserted);
    System.arraycopy(target, at + removed, result, at + inserted, nodeCount - at - removed);
    return result;
  }

  private int addNode(int value) {
    if (nodeCount == values.length) {
      int capacity = values.length * 2;
      values = Arrays.copyOf(values, capacity);
      childCounts = Arrays.copyOf(childCounts, capacity);
      subtreeSizes = Arrays.copyOf(subtreeSizes, capacity);
    }
    values[nodeCount] = value;
    childCounts[nodeCount] = 0;
    subtreeSizes[nodeCount] = 1;
    return nodeCount++;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TreeGenome)) {
      return false;
    }
    TreeGenome that = (TreeGenome) o;
    return nodeCount == that.nodeCount
        && Arrays.equals(values, 0, nodeCount, that.values, 0, nodeCount)
        && Arrays.equals(childCounts, 0, nodeCount, that.childCounts, 0, nodeCount)
        && Arrays.equals(subtreeSizes, 0, nodeCount, that.subtreeSizes, 0, nodeCount);
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = 0; i < nodeCount; i++) {
      result = 31 * result + values[i];
      result = 31 * result + childCounts[i];
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("TreeGenome[");
    for (int i = 0; i < nodeCount; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(values[i]);
      if (childCounts[i] > 0) {
        sb.append('/').append(childCounts[i]);
      }
    }
    return sb.append(']').toString();
  }

  /** A view of one node of a tree. Views read the tree's current state. */
  public final class Node {
    private final int id;

    private Node(int id) {
      this.id = id;
    }

    /** The node's pre-order position in its tree. */
    public int id() {
      return id;
    }

    public int value() {
      return values[id];
    }

    public int childCount() {
      return childCounts[id];
    }

    public int subtreeSize() {
      return subtreeSizes[id];
    }

    public boolean isEmpty() {
      return childCount() == 0;
    }

    public Node child(int index) {
      checkElementIndex(index, childCount(), "Child index");
      int childId = id + 1;
      for (int i = 0; i < index; i++) {
        childId += subtreeSizes[childId];
      }
      return new Node(childId);
    }

    public ImmutableList<Node> children() {
      ImmutableList.Builder<Node> children = ImmutableList.builderWithExpectedSize(childCount());
      int childId = id + 1;
      for (int i = 0; i < childCount(); i++) {
        children.add(new Node(childId));
        childId += subtreeSizes[childId];
      }
      return children.build();
    }

    public TreeGenome tree() {
      return TreeGenome.this;
    }

    @Override
    public String toString() {
      return "Node{id=" + id + ", value=" + value() + ", childCount=" + childCount() + "}";
    }
  }

  /**
   * Constructs a tree in pre-order. {@link #push(int)} opens an internal node, {@link #add(int)}
   * appends a leaf and {@link #pop()} closes the most recently opened node. Every node is counted
   * as a child of the node open at the time it is appended.
   */
  public static final class Builder {
    private final TreeGenome tree = new TreeGenome(INITIAL_CAPACITY);
    private final Deque<Integer> openNodes = new ArrayDeque<>();
    private boolean built;

    private Builder() {}

    /** Opens a node that the following calls append children to. */
    public Builder push(int value) {
      checkAppendable();
      if (!openNodes.isEmpty()) {
        tree.childCounts[openNodes.peek()]++;
      }
      openNodes.push(tree.addNode(value));
      return this;
    }

    /** Appends a leaf to the open node. */
    public Builder add(int value) {
      checkAppendable();
      tree.addNode(value);
      if (!openNodes.isEmpty()) {
        int parent = openNodes.peek();
        tree.childCounts[parent]++;
        tree.subtreeSizes[parent]++;
      }
      return this;
    }

    /**
     * Closes the most recently opened node and adds its subtree size to its parent.
     *
     * @throws IllegalStateException if no node is open
     */
    public Builder pop() {
      checkState(!openNodes.isEmpty(), "pop() called with no open node");
      int size = tree.subtreeSizes[openNodes.pop()];
      if (!openNodes.isEmpty()) {
        tree.subtreeSizes[openNodes.peek()] += size;
      }
      return this;
    }

    /** Whether the root has been appended and every opened node closed. */
    public boolean isComplete() {
      return tree.nodeCount > 0 && openNodes.isEmpty();
    }

    public int nodeCount() {
      return tree.nodeCount;
    }

    /**
     * Returns the constructed tree. The builder cannot be used afterwards.
     *
     * @throws IllegalStateException if the tree is empty or a node is still open
     */
    public TreeGenome build() {
      checkState(!built, "Tree has already been built");
      checkState(tree.nodeCount > 0, "Tree is empty");
      checkState(openNodes.isEmpty(), "%s node(s) still open", openNodes.size());
      built = true;
      return tree;
    }

    private void checkAppendable() {
      checkState(!built, "Tree has already been built");
      checkState(
          tree.nodeCount == 0 || !openNodes.isEmpty(), "Tree already has a complete root");
    }
  }
}
