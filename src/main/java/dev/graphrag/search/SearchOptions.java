package dev.graphrag.search;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Per-call overrides of the retriever defaults. Every field is optional; {@code null} means "use
 * the retriever's configured value".
 *
 * <pre>{@code
 * SearchOptions options =
 *     SearchOptions.builder()
 *         .mode(SearchMode.HYBRID)
 *         .k(5)
 *         .rerankStrategy(RerankStrategy.MMR)
 *         .build();
 * }</pre>
 */
public record SearchOptions(
    @Nullable SearchMode mode,
    @Nullable Integer k,
    @Nullable Double vectorWeight,
    @Nullable Double graphWeight,
    @Nullable Integer maxTraverseDepth,
    @Nullable FusionStrategy fusionStrategy,
    @Nullable RerankStrategy rerankStrategy,
    @Nullable Boolean enableContextAugmentation,
    @Nullable Double minScore,
    @Nullable Double mmrLambda,
    @Nullable Double rrfConstant) {

  /** Options that override nothing. */
  public static SearchOptions none() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Overlays these options on {@code defaults}.
   *
   * @param defaults the retriever-level settings
   * @return the effective settings for one call
   * @throws InvalidRetrieverConfigException if an override is out of range
   */
  public RetrievalSettings applyTo(RetrievalSettings defaults) {
    return new RetrievalSettings(
        Objects.requireNonNullElse(mode, defaults.mode()),
        Objects.requireNonNullElse(k, defaults.k()),
        Objects.requireNonNullElse(vectorWeight, defaults.vectorWeight()),
        Objects.requireNonNullElse(graphWeight, defaults.graphWeight()),
        Objects.requireNonNullElse(maxTraverseDepth, defaults.maxTraverseDepth()),
        Objects.requireNonNullElse(fusionStrategy, defaults.fusionStrategy()),
        Objects.requireNonNullElse(rerankStrategy, defaults.rerankStrategy()),
        Objects.requireNonNullElse(enableContextAugmentation, defaults.enableContextAugmentation()),
        Objects.requireNonNullElse(minScore, defaults.minScore()),
        Objects.requireNonNullElse(mmrLambda, defaults.mmrLambda()),
        Objects.requireNonNullElse(rrfConstant, defaults.rrfConstant()));
  }

  /** Fluent builder for {@link SearchOptions}. */
  public static final class Builder {

    private @Nullable SearchMode mode;
    private @Nullable Integer k;
    private @Nullable Double vectorWeight;
    private @Nullable Double graphWeight;
    private @Nullable Integer maxTraverseDepth;
    private @Nullable FusionStrategy fusionStrategy;
    private @Nullable RerankStrategy rerankStrategy;
    private @Nullable Boolean enableContextAugmentation;
    private @Nullable Double minScore;
    private @Nullable Double mmrLambda;
    private @Nullable Double rrfConstant;

    private Builder() {}

    public Builder mode(@Nullable SearchMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder k(@Nullable Integer k) {
      this.k = k;
      return this;
    }

    public Builder vectorWeight(@Nullable Double vectorWeight) {
      this.vectorWeight = vectorWeight;
      return this;
    }

    public Builder graphWeight(@Nullable Double graphWeight) {
      this.graphWeight = graphWeight;
      return this;
    }

    public Builder maxTraverseDepth(@Nullable Integer maxTraverseDepth) {
      this.maxTraverseDepth = maxTraverseDepth;
      return this;
    }

    public Builder fusionStrategy(@Nullable FusionStrategy fusionStrategy) {
      this.fusionStrategy = fusionStrategy;
      return this;
    }

    public Builder rerankStrategy(@Nullable RerankStrategy rerankStrategy) {
      this.rerankStrategy = rerankStrategy;
      return this;
    }

    public Builder enableContextAugmentation(@Nullable Boolean enableContextAugmentation) {
      this.enableContextAugmentation = enableContextAugmentation;
      return this;
    }

    public Builder minScore(@Nullable Double minScore) {
      this.minScore = minScore;
      return this;
    }

    public Builder mmrLambda(@Nullable Double mmrLambda) {
      this.mmrLambda = mmrLambda;
      return this;
    }

    public Builder rrfConstant(@Nullable Double rrfConstant) {
      this.rrfConstant = rrfConstant;
      return this;
    }

    public SearchOptions build() {
      return new SearchOptions(
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
  }
}
