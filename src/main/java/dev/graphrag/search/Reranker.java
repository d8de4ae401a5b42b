package dev.graphrag.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Reorders fused candidates under a {@link RerankStrategy}.
 *
 * <ul>
 *   <li>{@link RerankStrategy#SCORE} keeps fusion order.
 *   <li>{@link RerankStrategy#DIVERSITY} seeds with the top-scored candidate, then repeatedly
 *       takes the remaining candidate whose minimum similarity to the already-selected ones is the
 *       largest. All candidates are placed.
 *   <li>{@link RerankStrategy#MMR} seeds with the top-scored candidate, then repeatedly takes the
 *       candidate maximising {@code lambda * fusedScore - (1 - lambda) * maxSimilarity}, stopping
 *       after {@code k} selections.
 * </ul>
 *
 * <p>Both greedy laws break ties in favour of the candidate that comes first in fusion order, and
 * reassign ranks 1..N on the reordered list. Similarity is {@link TextSimilarity#jaccard} over
 * document content; each content is tokenised once per call. The calling thread's interrupt flag
 * is checked once per selection step.
 */
public final class Reranker {

  private Reranker() {}

  /**
   * Reranks fused candidates.
   *
   * @param candidates fused candidates in fusion order
   * @param query the search query (similarity is between candidates, not against the query)
   * @param settings supplies the strategy, {@code k} and {@code mmrLambda}
   * @return the reordered candidates with ranks reassigned
   * @throws SearchCancelledException if the calling thread is interrupted mid-selection
   */
  public static List<FusedResult> rerank(
      List<FusedResult> candidates, String query, RetrievalSettings settings) {
    if (candidates.size() <= 1) {
      return FusionEngine.assignRanks(candidates);
    }
    return switch (settings.rerankStrategy()) {
      case SCORE -> FusionEngine.assignRanks(candidates);
      case DIVERSITY -> byDiversity(candidates);
      case MMR -> byMarginalRelevance(candidates, settings.mmrLambda(), settings.k());
    };
  }

  /**
   * Rescores candidates with a caller-supplied function, replacing their fused score, then sorts
   * descending (ties keep their input order) and reassigns ranks.
   */
  public static List<FusedResult> rerankWith(
      List<FusedResult> candidates, ToDoubleFunction<FusedResult> scorer) {
    List<FusedResult> rescored = new ArrayList<>(candidates.size());
    for (FusedResult candidate : candidates) {
      rescored.add(candidate.withFusedScore(scorer.applyAsDouble(candidate)));
    }
    rescored.sort(Comparator.comparingDouble(FusedResult::fusedScore).reversed());
    return FusionEngine.assignRanks(rescored);
  }

  private static List<FusedResult> byDiversity(List<FusedResult> candidates) {
    Pool pool = new Pool(candidates);
    List<Integer> selected = new ArrayList<>();
    selected.add(pool.takeTopScored());

    while (!pool.isEmpty()) {
      checkInterrupted();
      double bestMinSim = -1.0;
      int bestPosition = 0;

      for (int position = 0; position < pool.remaining.size(); position++) {
        int candidate = pool.remaining.get(position);
        double minSim = 1.0;
        for (int chosen : selected) {
          minSim = Math.min(minSim, pool.similarity(candidate, chosen));
        }
        if (minSim > bestMinSim) {
          bestMinSim = minSim;
          bestPosition = position;
        }
      }
      selected.add(pool.remaining.remove(bestPosition));
    }
    return pool.toRanked(selected);
  }

  private static List<FusedResult> byMarginalRelevance(
      List<FusedResult> candidates, double lambda, int k) {
    Pool pool = new Pool(candidates);
    List<Integer> selected = new ArrayList<>();
    selected.add(pool.takeTopScored());

    while (selected.size() < k && !pool.isEmpty()) {
      checkInterrupted();
      double bestMmr = Double.NEGATIVE_INFINITY;
      int bestPosition = 0;

      for (int position = 0; position < pool.remaining.size(); position++) {
        int candidate = pool.remaining.get(position);
        double maxSim = 0.0;
        for (int chosen : selected) {
          maxSim = Math.max(maxSim, pool.similarity(candidate, chosen));
        }
        double mmr = lambda * pool.score(candidate) - (1.0 - lambda) * maxSim;
        if (mmr > bestMmr) {
          bestMmr = mmr;
          bestPosition = position;
        }
      }
      selected.add(pool.remaining.remove(bestPosition));
    }
    return pool.toRanked(selected);
  }

  private static void checkInterrupted() {
    if (Thread.currentThread().isInterrupted()) {
      throw new SearchCancelledException("Search interrupted during reranking");
    }
  }

  /** Candidates addressed by index, with word sets computed once. */
  private static final class Pool {
    private final List<FusedResult> candidates;
    private final List<Set<String>> words;
    private final List<Integer> remaining = new ArrayList<>();

    private Pool(List<FusedResult> candidates) {
      this.candidates = candidates;
      this.words = new ArrayList<>(candidates.size());
      for (int i = 0; i < candidates.size(); i++) {
        words.add(TextSimilarity.words(candidates.get(i).document().content()));
        remaining.add(i);
      }
    }

    /** Removes and returns the highest-scored index, earliest on ties. */
    int takeTopScored() {
      int bestPosition = 0;
      for (int position = 1; position < remaining.size(); position++) {
        if (score(remaining.get(position)) > score(remaining.get(bestPosition))) {
          bestPosition = position;
        }
      }
      return remaining.remove(bestPosition);
    }

    boolean isEmpty() {
      return remaining.isEmpty();
    }

    double score(int index) {
      return candidates.get(index).fusedScore();
    }

    double similarity(int a, int b) {
      return TextSimilarity.jaccard(words.get(a), words.get(b));
    }

    List<FusedResult> toRanked(List<Integer> order) {
      List<FusedResult> ordered = new ArrayList<>(order.size());
      for (int index : order) {
        ordered.add(candidates.get(index));
      }
      return FusionEngine.assignRanks(ordered);
    }
  }
}
