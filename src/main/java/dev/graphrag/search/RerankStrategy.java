package dev.graphrag.search;

/** Reordering law applied to fused candidates. See {@link Reranker}. */
public enum RerankStrategy {
  /** Keep fusion order. */
  SCORE,
  /** Greedy farthest-first over text similarity. */
  DIVERSITY,
  /** Maximal Marginal Relevance. */
  MMR
}
