package com.verlumen.treegp.grammar;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.function.Predicate;

/**
 * An immutable, strongly-typed grammar: the terminals and functions that tree genomes are built
 * from.
 *
 * <p>Definitions are stored in a canonical order: all terminals, then all functions; within a kind
 * grouped by the declaration order of their types; within a type in declaration order. Each
 * definition owns the node value range {@code [nodeValue, nodeValue + weight)} and the ranges are
 * assigned by a cumulative sum over the canonical order, starting at 0.
 */
public final class GrammarCatalog {
  /** Type id meaning "no type constraint". */
  public static final int NO_TYPE = -1;

  private final ImmutableList<Type> types;
  private final ImmutableMap<String, Integer> typeIds;
  private final ImmutableList<Definition> definitions;
  private final ImmutableListMultimap<String, Definition> definitionsByName;
  private final ImmutableList<DefinitionSet> typeDefinitionSets;
  private final DefinitionSet globalDefinitionSet;
  private final int[] nodeValueStarts;
  private final int terminalLimit;
  private final int functionLimit;

  private GrammarCatalog(List<Type> types, List<Declaration> declarations) {
    this.types = ImmutableList.copyOf(types);
    ImmutableMap.Builder<String, Integer> typeIdsBuilder = ImmutableMap.builder();
    for (int i = 0; i < types.size(); i++) {
      typeIdsBuilder.put(types.get(i).name(), i);
    }
    this.typeIds = typeIdsBuilder.buildOrThrow();

    for (Declaration declaration : declarations) {
      checkDeclaredType(declaration, declaration.type());
      declaration.argumentTypes().forEach(type -> checkDeclaredType(declaration, type));
    }

    ImmutableList.Builder<Definition> definitionsBuilder = ImmutableList.builder();
    int nodeValue = 0;
    int definitionId = 0;
    int terminalWeight = 0;
    for (Definition.Kind kind : Definition.Kind.values()) {
      for (int typeId = 0; typeId < types.size(); typeId++) {
        for (Declaration declaration : declarations) {
          if (declaration.kind() != kind || typeIds.get(declaration.type().name()) != typeId) {
            continue;
          }
          definitionsBuilder.add(
              Definition.create(
                  declaration.name(),
                  kind,
                  typeId,
                  declaration.argumentTypes().stream()
                      .map(type -> typeIds.get(type.name()))
                      .collect(toImmutableList()),
                  declaration.weight(),
                  definitionId++,
                  nodeValue));
          nodeValue += declaration.weight();
          if (kind == Definition.Kind.TERMINAL) {
            terminalWeight += declaration.weight();
          }
        }
      }
    }
    this.definitions = definitionsBuilder.build();
    this.terminalLimit = terminalWeight;
    this.functionLimit = nodeValue - terminalWeight;

    this.nodeValueStarts = definitions.stream().mapToInt(Definition::nodeValue).toArray();

    ImmutableListMultimap.Builder<String, Definition> byName = ImmutableListMultimap.builder();
    definitions.forEach(definition -> byName.put(definition.name(), definition));
    this.definitionsByName = byName.build();

    ImmutableList.Builder<DefinitionSet> setsBuilder = ImmutableList.builder();
    for (int typeId = 0; typeId < types.size(); typeId++) {
      int id = typeId;
      setsBuilder.add(
          new DefinitionSet(
              filter(Definition.Kind.TERMINAL, definition -> definition.typeId() == id),
              filter(Definition.Kind.FUNCTION, definition -> definition.typeId() == id)));
    }
    this.typeDefinitionSets = setsBuilder.build();
    this.globalDefinitionSet =
        new DefinitionSet(
            filter(Definition.Kind.TERMINAL, definition -> true),
            filter(Definition.Kind.FUNCTION, definition -> true));
  }

  /**
   * Creates a grammar.
   *
   * @param types the value types, in the order that determines their ids
   * @param declarations the terminals and functions; every type they mention must be in {@code
   *     types}
   * @throws IllegalArgumentException if a type name repeats, a declaration uses an undeclared type,
   *     or the grammar has no terminals
   */
  public static GrammarCatalog create(List<Type> types, List<Declaration> declarations) {
    checkArgument(!types.isEmpty(), "Grammar must declare at least one type");
    checkArgument(
        declarations.stream().anyMatch(d -> d.kind() == Definition.Kind.TERMINAL),
        "Grammar must declare at least one terminal");
    return new GrammarCatalog(types, declarations);
  }

  public static GrammarCatalog create(List<Type> types, Declaration... declarations) {
    return create(types, ImmutableList.copyOf(declarations));
  }

  /** Sum of all terminal weights; terminal node values are {@code [0, terminalLimit())}. */
  public int terminalLimit() {
    return terminalLimit;
  }

  /** Sum of all function weights. */
  public int functionLimit() {
    return functionLimit;
  }

  /** The exclusive end of the node value space. */
  public int nodeLimit() {
    return terminalLimit + functionLimit;
  }

  public int definitionCount() {
    return definitions.size();
  }

  /** All definitions in canonical order; a definition's index is its definition id. */
  public ImmutableList<Definition> definitions() {
    return definitions;
  }

  public Definition definition(int definitionId) {
    checkElementIndex(definitionId, definitions.size(), "Definition id");
    return definitions.get(definitionId);
  }

  /**
   * Returns the definition whose node value range contains {@code value}.
   *
   * @throws IndexOutOfBoundsException if {@code value} is not in {@code [0, nodeLimit())}
   */
  public Definition definitionForValue(int value) {
    checkElementIndex(value, nodeLimit(), "Node value");
    return definitions.get(DefinitionSet.floorIndex(nodeValueStarts, value));
  }

  public int definitionIdForValue(int value) {
    return definitionForValue(value).definitionId();
  }

  /**
   * Returns the view of the definitions declared with the given type.
   *
   * @param typeId a type id, or {@link #NO_TYPE} for the whole grammar
   */
  public DefinitionSet definitionSetForType(int typeId) {
    if (typeId == NO_TYPE) {
      return globalDefinitionSet;
    }
    checkElementIndex(typeId, types.size(), "Type id");
    return typeDefinitionSets.get(typeId);
  }

  public DefinitionSet globalDefinitionSet() {
    return globalDefinitionSet;
  }

  public ImmutableList<Definition> terminalsForType(int typeId) {
    return definitionSetForType(typeId).terminals();
  }

  public ImmutableList<Definition> functionsForType(int typeId) {
    return definitionSetForType(typeId).functions();
  }

  /**
   * Returns the definition with the given name. When several definitions share the name, the one
   * with the lowest definition id is returned; use {@link #definitionsNamed(String)} to see them
   * all.
   *
   * @throws IllegalArgumentException if no definition has that name
   */
  public Definition definitionNamed(String name) {
    ImmutableList<Definition> named = definitionsByName.get(name);
    checkArgument(!named.isEmpty(), "No definition named '%s'", name);
    return named.get(0);
  }

  /** Returns every definition with the given name, in canonical order. */
  public ImmutableList<Definition> definitionsNamed(String name) {
    return definitionsByName.get(name);
  }

  public int typeByName(String name) {
    Integer typeId = typeIds.get(name);
    checkArgument(typeId != null, "No type named '%s'", name);
    return typeId;
  }

  public Type type(int typeId) {
    checkElementIndex(typeId, types.size(), "Type id");
    return types.get(typeId);
  }

  public int typeCount() {
    return types.size();
  }

  private ImmutableList<Definition> filter(
      Definition.Kind kind, Predicate<Definition> predicate) {
    return definitions.stream()
        .filter(definition -> definition.kind() == kind)
        .filter(predicate)
        .collect(toImmutableList());
  }

  private void checkDeclaredType(Declaration declaration, Type type) {
    checkArgument(
        typeIds.containsKey(type.name()),
        "Definition %s uses undeclared type %s",
        declaration.name(),
        type.name());
  }
}
