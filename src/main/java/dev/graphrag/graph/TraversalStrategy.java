package dev.graphrag.graph;

/** Order in which a traversal expands the frontier. */
public enum TraversalStrategy {
  BFS,
  DFS
}
