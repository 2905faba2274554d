package com.verlumen.treegp.generation;

/** How {@link TreeGenerator} chooses nodes above the depth ceiling. */
public enum GenerationStrategy {
  /** Only functions are drawn until the depth ceiling, so every branch reaches it. */
  FULL,
  /** Terminals and functions are drawn together, so branches may stop early. */
  GROW
}
