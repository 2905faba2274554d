package com.verlumen.treegp.grammar;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A terminal or function of a {@link GrammarCatalog}, with its dense definition id and the node
 * value range {@code [nodeValue, nodeValue + weight)} that identifies it inside a tree genome.
 */
@AutoValue
public abstract class Definition {
  /** Whether a definition is a leaf or takes arguments. */
  public enum Kind {
    TERMINAL,
    FUNCTION
  }

  static Definition create(
      String name,
      Kind kind,
      int typeId,
      ImmutableList<Integer> argumentTypeIds,
      int weight,
      int definitionId,
      int nodeValue) {
    return new AutoValue_Definition(
        name, kind, typeId, argumentTypeIds, weight, definitionId, nodeValue);
  }

  public abstract String name();

  public abstract Kind kind();

  public abstract int typeId();

  /** The required type of each argument, empty for terminals. */
  public abstract ImmutableList<Integer> argumentTypeIds();

  /** Relative selection mass during random generation. */
  public abstract int weight();

  public abstract int definitionId();

  /** The first node value of this definition's range. */
  public abstract int nodeValue();

  public final boolean isTerminal() {
    return kind() == Kind.TERMINAL;
  }

  public final boolean isFunction() {
    return kind() == Kind.FUNCTION;
  }

  public final int arity() {
    return argumentTypeIds().size();
  }

  public final int argumentType(int index) {
    return argumentTypeIds().get(index);
  }

  /** The exclusive end of this definition's node value range. */
  public final int nodeValueLimit() {
    return nodeValue() + weight();
  }

  public final boolean containsNodeValue(int value) {
    return value >= nodeValue() && value < nodeValueLimit();
  }
}
