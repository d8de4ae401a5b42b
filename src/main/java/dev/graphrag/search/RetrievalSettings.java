package dev.graphrag.search;

/**
 * Fully resolved, immutable retrieval configuration. Serves both as the retriever-level defaults
 * and as the effective options of a single call (see {@link SearchOptions#applyTo}).
 *
 * <p>The compact constructor validates every field, so an instance that exists is usable.
 *
 * @param mode which modalities to run
 * @param k maximum number of results (>= 1)
 * @param vectorWeight weight of the vector score in weighted fusion, in [0, 1]
 * @param graphWeight weight of the graph score in weighted fusion, in [0, 1]
 * @param maxTraverseDepth maximum traversal hops per extracted entity (>= 1)
 * @param fusionStrategy law combining vector and graph scores
 * @param rerankStrategy law reordering fused candidates
 * @param enableContextAugmentation whether to attach related-entity context to results
 * @param minScore floor applied to fused scores before truncation
 * @param mmrLambda relevance/diversity trade-off for MMR, in [0, 1]
 * @param rrfConstant the k constant of reciprocal rank fusion (> 0)
 */
public record RetrievalSettings(
    SearchMode mode,
    int k,
    double vectorWeight,
    double graphWeight,
    int maxTraverseDepth,
    FusionStrategy fusionStrategy,
    RerankStrategy rerankStrategy,
    boolean enableContextAugmentation,
    double minScore,
    double mmrLambda,
    double rrfConstant) {

  public static final int DEFAULT_K = 10;
  public static final double DEFAULT_VECTOR_WEIGHT = 0.6;
  public static final double DEFAULT_GRAPH_WEIGHT = 0.4;
  public static final int DEFAULT_MAX_TRAVERSE_DEPTH = 2;
  public static final double DEFAULT_MMR_LAMBDA = 0.5;

  /** Constant from the original RRF paper. */
  public static final double DEFAULT_RRF_CONSTANT = 60.0;

  public RetrievalSettings {
    if (mode == null) {
      throw new InvalidRetrieverConfigException("mode must not be null");
    }
    if (fusionStrategy == null) {
      throw new InvalidRetrieverConfigException("fusionStrategy must not be null");
    }
    if (rerankStrategy == null) {
      throw new InvalidRetrieverConfigException("rerankStrategy must not be null");
    }
    if (k < 1) {
      throw new InvalidRetrieverConfigException("k must be at least 1, got: " + k);
    }
    requireUnitInterval("vectorWeight", vectorWeight);
    requireUnitInterval("graphWeight", graphWeight);
    if (maxTraverseDepth < 1) {
      throw new InvalidRetrieverConfigException(
          "maxTraverseDepth must be at least 1, got: " + maxTraverseDepth);
    }
    requireUnitInterval("mmrLambda", mmrLambda);
    if (!(rrfConstant > 0.0) || Double.isInfinite(rrfConstant)) {
      throw new InvalidRetrieverConfigException(
          "rrfConstant must be a positive finite number, got: " + rrfConstant);
    }
    if (!Double.isFinite(minScore)) {
      throw new InvalidRetrieverConfigException("minScore must be finite, got: " + minScore);
    }
  }

  /** Hybrid search, 10 results, 0.6/0.4 weighted fusion, score order, no augmentation. */
  public static RetrievalSettings defaults() {
    return new RetrievalSettings(
        SearchMode.HYBRID,
        DEFAULT_K,
        DEFAULT_VECTOR_WEIGHT,
        DEFAULT_GRAPH_WEIGHT,
        DEFAULT_MAX_TRAVERSE_DEPTH,
        FusionStrategy.WEIGHTED,
        RerankStrategy.SCORE,
        false,
        0.0,
        DEFAULT_MMR_LAMBDA,
        DEFAULT_RRF_CONSTANT);
  }

  /**
   * Number of candidates requested from each modality before fusion: twice the result count, so
   * reranking and the score floor have material to work with.
   */
  public int candidatePoolSize() {
    return k > Integer.MAX_VALUE / 2 ? Integer.MAX_VALUE : k * 2;
  }

  private static void requireUnitInterval(String name, double value) {
    if (!(value >= 0.0 && value <= 1.0)) {
      throw new InvalidRetrieverConfigException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }
}
