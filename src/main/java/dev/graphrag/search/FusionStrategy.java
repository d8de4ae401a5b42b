package dev.graphrag.search;

import java.util.Locale;

/** Law combining a candidate's vector and graph scores into its fused score. */
public enum FusionStrategy {
  /** Weight-normalised linear combination of rank scores. */
  WEIGHTED("Weighted"),
  /** Reciprocal rank fusion: sum of {@code 1 / (k + rank)} across lists. */
  RRF("RRF"),
  /** The larger of the two rank scores. */
  MAX("Max"),
  /** The smaller score for candidates in both lists, the single score otherwise. */
  MIN("Min");

  private final String displayName;

  FusionStrategy(String displayName) {
    this.displayName = displayName;
  }

  /** Whether per-list scores are reciprocal ranks rather than linear rank scores. */
  boolean reciprocalRank() {
    return this == RRF;
  }

  /**
   * Renders how a fused score was obtained, e.g. {@code "Weighted: 0.750 (vector: 0.500, graph:
   * 1.000)"}.
   */
  public String explain(FusedResult result) {
    return String.format(
        Locale.ROOT,
        "%s: %.3f (vector: %.3f, graph: %.3f)",
        displayName,
        result.fusedScore(),
        result.vectorScore(),
        result.graphScore());
  }
}
