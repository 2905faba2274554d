package com.verlumen.treegp.grammar;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * A named value type of a grammar. Types are compared by name; a {@link GrammarCatalog} assigns
 * each one a dense id from its position in the catalog's type list.
 */
@AutoValue
public abstract class Type {
  public static Type of(String name) {
    checkArgument(!name.isEmpty(), "Type name cannot be empty");
    return new AutoValue_Type(name);
  }

  public abstract String name();
}
