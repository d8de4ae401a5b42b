package dev.graphrag.search;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Volumes and timings of one search call. Purely observational; phases that did not run report
 * zero.
 *
 * @param vectorResultsCount documents returned by the vector store
 * @param graphResultsCount distinct nodes in the traversal union
 * @param fusedResultsCount candidates after fusion
 * @param entitiesExtracted entities found in the query
 * @param nodesTraversed nodes returned by all traversals before de-duplication
 * @param vectorSearchTime time spent in vector search
 * @param entityExtractionTime time spent extracting entities
 * @param graphSearchTime time spent traversing the graph
 * @param fusionTime time spent fusing
 * @param rerankTime time spent reranking
 * @param augmentationTime time spent attaching scores and graph context
 * @param totalTime wall-clock time of the whole call
 * @param degradedModalities modalities that failed without aborting the call
 */
public record SearchStatistics(
    int vectorResultsCount,
    int graphResultsCount,
    int fusedResultsCount,
    int entitiesExtracted,
    int nodesTraversed,
    Duration vectorSearchTime,
    Duration entityExtractionTime,
    Duration graphSearchTime,
    Duration fusionTime,
    Duration rerankTime,
    Duration augmentationTime,
    Duration totalTime,
    Set<Modality> degradedModalities) {

  public SearchStatistics {
    degradedModalities =
        degradedModalities.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(degradedModalities));
  }

  public static SearchStatistics empty() {
    return new Recorder().build(Duration.ZERO);
  }

  public boolean degraded() {
    return !degradedModalities.isEmpty();
  }

  /** Collects statistics on the calling thread as phases complete. */
  static final class Recorder {
    int vectorResultsCount;
    int graphResultsCount;
    int fusedResultsCount;
    int entitiesExtracted;
    int nodesTraversed;
    Duration vectorSearchTime = Duration.ZERO;
    Duration entityExtractionTime = Duration.ZERO;
    Duration graphSearchTime = Duration.ZERO;
    Duration fusionTime = Duration.ZERO;
    Duration rerankTime = Duration.ZERO;
    Duration augmentationTime = Duration.ZERO;
    final Set<Modality> degradedModalities = EnumSet.noneOf(Modality.class);

    SearchStatistics build(Duration totalTime) {
      return new SearchStatistics(
          vectorResultsCount,
          graphResultsCount,
          fusedResultsCount,
          entitiesExtracted,
          nodesTraversed,
          vectorSearchTime,
          entityExtractionTime,
          graphSearchTime,
          fusionTime,
          rerankTime,
          augmentationTime,
          totalTime,
          degradedModalities);
    }
  }
}
