package dev.graphrag.search;

/** Which retrieval modalities a search runs. */
public enum SearchMode {
  /** Vector search and graph traversal, fused and reranked. */
  HYBRID,
  /** Vector similarity search only. */
  VECTOR,
  /** Entity extraction and graph traversal only. */
  GRAPH
}
