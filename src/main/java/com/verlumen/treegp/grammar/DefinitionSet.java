package com.verlumen.treegp.grammar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * A view of a grammar restricted to one type, or to the whole grammar.
 *
 * <p>The set renumbers the node values of its definitions into a dense local space: terminals
 * occupy {@code [0, terminalLimit())} and functions {@code [terminalLimit(), functionLimit())}.
 * Drawing a uniform local value and mapping it back with {@link #nodeValueFor(int)} therefore picks
 * a type-legal definition with probability proportional to its weight, without rejection sampling.
 */
public final class DefinitionSet {
  private final ImmutableList<Definition> terminals;
  private final ImmutableList<Definition> functions;
  private final ImmutableList<Definition> definitions;
  private final int[] localStarts;
  private final int terminalLimit;
  private final int functionLimit;

  DefinitionSet(ImmutableList<Definition> terminals, ImmutableList<Definition> functions) {
    this.terminals = terminals;
    this.functions = functions;
    this.definitions =
        ImmutableList.<Definition>builder().addAll(terminals).addAll(functions).build();
    this.localStarts = new int[definitions.size()];
    int limit = 0;
    for (int i = 0; i < definitions.size(); i++) {
      localStarts[i] = limit;
      limit += definitions.get(i).weight();
    }
    this.terminalLimit = terminals.stream().mapToInt(Definition::weight).sum();
    this.functionLimit = limit;
  }

  /** The exclusive end of the local terminal range. */
  public int terminalLimit() {
    return terminalLimit;
  }

  /** The exclusive end of the local function range, which is also the size of the local space. */
  public int functionLimit() {
    return functionLimit;
  }

  public boolean hasTerminals() {
    return !terminals.isEmpty();
  }

  public boolean hasFunctions() {
    return !functions.isEmpty();
  }

  public ImmutableList<Definition> terminals() {
    return terminals;
  }

  public ImmutableList<Definition> functions() {
    return functions;
  }

  /** All definitions of the set, terminals first, each kind in declaration order. */
  public ImmutableList<Definition> definitions() {
    return definitions;
  }

  public boolean contains(int definitionId) {
    return definitions.stream().anyMatch(definition -> definition.definitionId() == definitionId);
  }

  /** Maps a local value of this set to the grammar's global node value. */
  public int nodeValueFor(int localValue) {
    checkElementIndex(localValue, functionLimit, "Local node value");
    int index = floorIndex(localStarts, localValue);
    return definitions.get(index).nodeValue() + (localValue - localStarts[index]);
  }

  /** Maps a global node value back into this set's local space. */
  public int localValueFor(int nodeValue) {
    for (int i = 0; i < definitions.size(); i++) {
      Definition definition = definitions.get(i);
      if (definition.containsNodeValue(nodeValue)) {
        return localStarts[i] + (nodeValue - definition.nodeValue());
      }
    }
    throw new IllegalArgumentException(
        String.format("Node value %d does not belong to this definition set", nodeValue));
  }

  static int floorIndex(int[] starts, int value) {
    int found = Arrays.binarySearch(starts, value);
    int index = found >= 0 ? found : -found - 2;
    checkArgument(index >= 0, "Value %s precedes the first range", value);
    return index;
  }
}
