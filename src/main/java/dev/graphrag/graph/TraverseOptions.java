package dev.graphrag.graph;

import java.util.Objects;

/**
 * Options for {@link GraphStore#traverse(String, TraverseOptions)}.
 *
 * @param maxDepth maximum number of hops from the start node (must be >= 0)
 * @param direction which edge directions to follow
 * @param strategy frontier expansion order
 * @param limit maximum number of nodes returned; 0 means unlimited
 */
public record TraverseOptions(
    int maxDepth, Direction direction, TraversalStrategy strategy, int limit) {

  public TraverseOptions {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
    }
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(strategy, "strategy");
  }

  /** Breadth-first traversal in both directions. */
  public static TraverseOptions breadthFirst(int maxDepth, int limit) {
    return new TraverseOptions(maxDepth, Direction.BOTH, TraversalStrategy.BFS, limit);
  }

  boolean limitReached(int visited) {
    return limit > 0 && visited >= limit;
  }
}
