package com.verlumen.treegp.evolution;

import com.verlumen.treegp.tree.TreeGenome;

/** Creates the replacement subtrees used by mutation. */
@FunctionalInterface
public interface RandomTreeFactory {
  /** Returns a new random tree whose root has the given type. */
  TreeGenome randomTreeOfType(int type);
}
