package dev.graphrag.search;

import dev.graphrag.document.Document;
import dev.graphrag.graph.GraphNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure static utility merging a vector-ranked document list and a graph node list into one list
 * of {@link FusedResult}s under a {@link FusionStrategy}.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Score each list by position: {@code 1 - i/len} for the linear laws, {@code 1/(k + i + 1)}
 *       for RRF (0-based {@code i}, {@code k} = {@link RetrievalSettings#rrfConstant()})
 *   <li>Convert graph nodes to documents and merge both lists by {@link Document#key()} in an
 *       insertion-ordered map (vector list first); a key repeated inside one list keeps its first,
 *       best-ranked occurrence
 *   <li>Apply the fusion law to every merged candidate
 *   <li>Sort by fused score descending, ties by arrival order, and assign ranks 1..N
 * </ol>
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions, and the
 * output order does not depend on hash iteration order.
 */
public final class FusionEngine {

  /** Fused score descending, then first arrival first. */
  static final Comparator<FusedResult> BY_FUSED_SCORE =
      Comparator.comparingDouble(FusedResult::fusedScore)
          .reversed()
          .thenComparingInt(FusedResult::arrival);

  private FusionEngine() {}

  /**
   * Fuses vector and graph results.
   *
   * @param vectorDocs documents from vector search, most relevant first
   * @param graphNodes nodes from graph traversal, in first-seen order
   * @param settings supplies the fusion law, weights and RRF constant
   * @return fused candidates sorted by fused score with ranks 1..N assigned
   */
  public static List<FusedResult> fuse(
      List<Document> vectorDocs, List<GraphNode> graphNodes, RetrievalSettings settings) {
    if (vectorDocs.isEmpty() && graphNodes.isEmpty()) {
      return List.of();
    }
    FusionStrategy strategy = settings.fusionStrategy();

    // Step 1-2: rank-score each list and merge by key (insertion order is the tie-break)
    Map<String, Candidate> merged = new LinkedHashMap<>();
    int arrival = 0;

    for (int i = 0; i < vectorDocs.size(); i++) {
      Document doc = vectorDocs.get(i);
      if (merged.containsKey(doc.key())) {
        continue;
      }
      Candidate candidate = new Candidate(doc, arrival++);
      candidate.vectorScore = rankScore(strategy, i, vectorDocs.size(), settings.rrfConstant());
      candidate.fromVector = true;
      merged.put(doc.key(), candidate);
    }

    for (int j = 0; j < graphNodes.size(); j++) {
      GraphNode node = graphNodes.get(j);
      Document doc = node.toDocument();
      double score = rankScore(strategy, j, graphNodes.size(), settings.rrfConstant());

      Candidate existing = merged.get(doc.key());
      if (existing == null) {
        Candidate candidate = new Candidate(doc, arrival++);
        candidate.graphScore = score;
        candidate.fromGraph = true;
        candidate.relatedNodes.add(node);
        merged.put(doc.key(), candidate);
      } else if (!existing.fromGraph) {
        // Overlapping result: keep the vector document, add the graph contribution
        existing.graphScore = score;
        existing.fromGraph = true;
        existing.relatedNodes.add(node);
      }
    }

    // Step 3: apply the fusion law
    List<FusedResult> results = new ArrayList<>(merged.size());
    for (Candidate candidate : merged.values()) {
      results.add(candidate.toFusedResult(fusedScore(candidate, settings)));
    }

    // Step 4: sort and rank
    return sortAndRank(results);
  }

  /**
   * Score of the {@code index}-th item (0-based) of a list of {@code size} items.
   *
   * @param strategy the fusion law, selecting linear or reciprocal rank scores
   * @param index 0-based position
   * @param size list length
   * @param rrfConstant the RRF k constant
   * @return the rank score
   */
  static double rankScore(FusionStrategy strategy, int index, int size, double rrfConstant) {
    if (strategy.reciprocalRank()) {
      return 1.0 / (rrfConstant + index + 1);
    }
    return 1.0 - (double) index / size;
  }

  private static double fusedScore(Candidate c, RetrievalSettings settings) {
    return switch (settings.fusionStrategy()) {
      case WEIGHTED -> weighted(c, settings.vectorWeight(), settings.graphWeight());
      case RRF -> c.vectorScore + c.graphScore;
      case MAX -> Math.max(c.vectorScore, c.graphScore);
      case MIN -> c.fromVector && c.fromGraph
          ? Math.min(c.vectorScore, c.graphScore)
          : Math.max(c.vectorScore, c.graphScore);
    };
  }

  private static double weighted(Candidate c, double vectorWeight, double graphWeight) {
    double totalWeight = vectorWeight + graphWeight;
    if (totalWeight == 0.0) {
      return Math.max(c.vectorScore, c.graphScore);
    }
    return (vectorWeight * c.vectorScore + graphWeight * c.graphScore) / totalWeight;
  }

  /** Sorts by {@link #BY_FUSED_SCORE} and reassigns ranks 1..N. */
  static List<FusedResult> sortAndRank(List<FusedResult> results) {
    List<FusedResult> sorted = new ArrayList<>(results);
    sorted.sort(BY_FUSED_SCORE);
    return assignRanks(sorted);
  }

  /** Reassigns ranks 1..N in list order. */
  static List<FusedResult> assignRanks(List<FusedResult> ordered) {
    List<FusedResult> ranked = new ArrayList<>(ordered.size());
    for (int i = 0; i < ordered.size(); i++) {
      ranked.add(ordered.get(i).withRank(i + 1));
    }
    return List.copyOf(ranked);
  }

  /** Mutable accumulator for one key during merging. */
  private static final class Candidate {
    private final Document document;
    private final int arrival;
    private final List<GraphNode> relatedNodes = new ArrayList<>();
    private double vectorScore;
    private double graphScore;
    private boolean fromVector;
    private boolean fromGraph;

    private Candidate(Document document, int arrival) {
      this.document = document;
      this.arrival = arrival;
    }

    FusedResult toFusedResult(double fusedScore) {
      return new FusedResult(
          document,
          vectorScore,
          graphScore,
          fromVector,
          fromGraph,
          fusedScore,
          0,
          relatedNodes,
          arrival);
    }
  }
}
