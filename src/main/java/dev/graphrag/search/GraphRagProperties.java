package dev.graphrag.search;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the retriever.
 *
 * <p>Properties are bound from {@code graphrag.retrieval.*} in application.yml and become the
 * retriever-level {@link RetrievalSettings}; every call may override them through {@link
 * SearchOptions}.
 *
 * <ul>
 *   <li>{@code mode} - HYBRID, VECTOR or GRAPH (default HYBRID)
 *   <li>{@code k} - maximum number of results (default 10)
 *   <li>{@code vector-weight} / {@code graph-weight} - weighted fusion weights (default 0.6 / 0.4)
 *   <li>{@code max-traverse-depth} - hops per extracted entity (default 2)
 *   <li>{@code fusion-strategy} / {@code rerank-strategy} - WEIGHTED, RRF, MAX, MIN / SCORE,
 *       DIVERSITY, MMR
 *   <li>{@code search-timeout} - deadline for one call (default 30s)
 *   <li>{@code traversal-parallelism} - worker threads for vector search and traversals (default 4)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "graphrag.retrieval")
public class GraphRagProperties {

  private SearchMode mode = SearchMode.HYBRID;
  private int k = RetrievalSettings.DEFAULT_K;
  private double vectorWeight = RetrievalSettings.DEFAULT_VECTOR_WEIGHT;
  private double graphWeight = RetrievalSettings.DEFAULT_GRAPH_WEIGHT;
  private int maxTraverseDepth = RetrievalSettings.DEFAULT_MAX_TRAVERSE_DEPTH;
  private FusionStrategy fusionStrategy = FusionStrategy.WEIGHTED;
  private RerankStrategy rerankStrategy = RerankStrategy.SCORE;
  private boolean enableContextAugmentation;
  private double minScore;
  private double mmrLambda = RetrievalSettings.DEFAULT_MMR_LAMBDA;
  private double rrfConstant = RetrievalSettings.DEFAULT_RRF_CONSTANT;
  private Duration searchTimeout = GraphRagRetriever.DEFAULT_SEARCH_TIMEOUT;
  private int traversalParallelism = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      toSettings();
    } catch (InvalidRetrieverConfigException e) {
      throw new IllegalStateException(
          "Invalid graphrag.retrieval configuration: " + e.getMessage(), e);
    }
    if (searchTimeout == null || searchTimeout.isZero() || searchTimeout.isNegative()) {
      throw new IllegalStateException(
          "graphrag.retrieval.search-timeout must be positive, got: " + searchTimeout);
    }
    if (traversalParallelism < 1) {
      throw new IllegalStateException(
          "graphrag.retrieval.traversal-parallelism must be at least 1, got: "
              + traversalParallelism);
    }
  }

  /** The configured values as retriever defaults. */
  public RetrievalSettings toSettings() {
    return new RetrievalSettings(
        mode,
        k,
        vectorWeight,
        graphWeight,
        maxTraverseDepth,
        fusionStrategy,
        rerankStrategy,
        enableContextAugmentation,
        minScore,
        mmrLambda,
        rrfConstant);
  }

  public SearchMode getMode() {
    return mode;
  }

  public void setMode(SearchMode mode) {
    this.mode = mode;
  }

  public int getK() {
    return k;
  }

  public void setK(int k) {
    this.k = k;
  }

  public double getVectorWeight() {
    return vectorWeight;
  }

  public void setVectorWeight(double vectorWeight) {
    this.vectorWeight = vectorWeight;
  }

  public double getGraphWeight() {
    return graphWeight;
  }

  public void setGraphWeight(double graphWeight) {
    this.graphWeight = graphWeight;
  }

  public int getMaxTraverseDepth() {
    return maxTraverseDepth;
  }

  public void setMaxTraverseDepth(int maxTraverseDepth) {
    this.maxTraverseDepth = maxTraverseDepth;
  }

  public FusionStrategy getFusionStrategy() {
    return fusionStrategy;
  }

  public void setFusionStrategy(FusionStrategy fusionStrategy) {
    this.fusionStrategy = fusionStrategy;
  }

  public RerankStrategy getRerankStrategy() {
    return rerankStrategy;
  }

  public void setRerankStrategy(RerankStrategy rerankStrategy) {
    this.rerankStrategy = rerankStrategy;
  }

  public boolean isEnableContextAugmentation() {
    return enableContextAugmentation;
  }

  public void setEnableContextAugmentation(boolean enableContextAugmentation) {
    this.enableContextAugmentation = enableContextAugmentation;
  }

  public double getMinScore() {
    return minScore;
  }

  public void setMinScore(double minScore) {
    this.minScore = minScore;
  }

  public double getMmrLambda() {
    return mmrLambda;
  }

  public void setMmrLambda(double mmrLambda) {
    this.mmrLambda = mmrLambda;
  }

  public double getRrfConstant() {
    return rrfConstant;
  }

  public void setRrfConstant(double rrfConstant) {
    this.rrfConstant = rrfConstant;
  }

  public Duration getSearchTimeout() {
    return searchTimeout;
  }

  public void setSearchTimeout(Duration searchTimeout) {
    this.searchTimeout = searchTimeout;
  }

  public int getTraversalParallelism() {
    return traversalParallelism;
  }

  public void setTraversalParallelism(int traversalParallelism) {
    this.traversalParallelism = traversalParallelism;
  }
}
