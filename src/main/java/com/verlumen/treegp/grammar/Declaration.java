package com.verlumen.treegp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A grammar symbol as authored by the caller, before a {@link GrammarCatalog} has assigned it a
 * definition id and a node value range.
 */
@AutoValue
public abstract class Declaration {
  public static Declaration terminal(String name, Type type, int weight) {
    return create(name, Definition.Kind.TERMINAL, type, ImmutableList.of(), weight);
  }

  public static Declaration unaryFunction(String name, Type type, Type argumentType, int weight) {
    return function(name, type, ImmutableList.of(argumentType), weight);
  }

  public static Declaration binaryFunction(
      String name, Type type, List<Type> argumentTypes, int weight) {
    checkArgument(argumentTypes.size() == 2, "Binary function %s needs 2 arguments", name);
    return function(name, type, argumentTypes, weight);
  }

  public static Declaration ternaryFunction(
      String name, Type type, List<Type> argumentTypes, int weight) {
    checkArgument(argumentTypes.size() == 3, "Ternary function %s needs 3 arguments", name);
    return function(name, type, argumentTypes, weight);
  }

  /** Declares a function of any positive arity. */
  public static Declaration function(String name, Type type, List<Type> argumentTypes, int weight) {
    checkArgument(!argumentTypes.isEmpty(), "Function %s must take at least one argument", name);
    return create(
        name, Definition.Kind.FUNCTION, type, ImmutableList.copyOf(argumentTypes), weight);
  }

  private static Declaration create(
      String name,
      Definition.Kind kind,
      Type type,
      ImmutableList<Type> argumentTypes,
      int weight) {
    checkArgument(weight > 0, "Weight of %s must be positive, was %s", name, weight);
    return new AutoValue_Declaration(name, kind, type, argumentTypes, weight);
  }

  public abstract String name();

  public abstract Definition.Kind kind();

  public abstract Type type();

  public abstract ImmutableList<Type> argumentTypes();

  public abstract int weight();
}
