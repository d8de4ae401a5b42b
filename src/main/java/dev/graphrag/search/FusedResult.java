package dev.graphrag.search;

import dev.graphrag.document.Document;
import dev.graphrag.graph.GraphNode;
import java.util.List;

/**
 * A candidate produced by {@link FusionEngine}: a document with its per-modality scores, fused
 * score and current rank.
 *
 * @param document the retrievable payload
 * @param vectorScore rank-derived vector score, 0.0 when the vector list did not contain it
 * @param graphScore rank-derived graph score, 0.0 when the graph list did not contain it
 * @param fromVector whether the vector list contained this candidate
 * @param fromGraph whether the graph list contained this candidate
 * @param fusedScore score under the active fusion law
 * @param rank 1-based position after the most recent reorder (0 before the first sort)
 * @param relatedNodes graph nodes matched to this candidate
 * @param arrival 0-based arrival position across the vector list then the graph list; breaks
 *     fused-score ties
 */
public record FusedResult(
    Document document,
    double vectorScore,
    double graphScore,
    boolean fromVector,
    boolean fromGraph,
    double fusedScore,
    int rank,
    List<GraphNode> relatedNodes,
    int arrival) {

  public FusedResult {
    relatedNodes = List.copyOf(relatedNodes);
  }

  /** Identity used for merging; see {@link Document#key()}. */
  public String key() {
    return document.key();
  }

  public boolean inBothLists() {
    return fromVector && fromGraph;
  }

  FusedResult withRank(int newRank) {
    return new FusedResult(
        document,
        vectorScore,
        graphScore,
        fromVector,
        fromGraph,
        fusedScore,
        newRank,
        relatedNodes,
        arrival);
  }

  FusedResult withFusedScore(double newScore) {
    return new FusedResult(
        document,
        vectorScore,
        graphScore,
        fromVector,
        fromGraph,
        newScore,
        rank,
        relatedNodes,
        arrival);
  }
}
