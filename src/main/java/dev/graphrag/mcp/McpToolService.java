package dev.graphrag.mcp;

import dev.graphrag.search.FusionStrategy;
import dev.graphrag.search.GraphRagRetriever;
import dev.graphrag.search.Modality;
import dev.graphrag.search.RerankStrategy;
import dev.graphrag.search.RetrievalResult;
import dev.graphrag.search.SearchMode;
import dev.graphrag.search.SearchOptions;
import dev.graphrag.search.SearchStatistics;
import java.util.Locale;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the retriever as tool methods.
 *
 * <p>Tool methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code search_knowledge}, {@code retrieval_statistics}.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_RESULTS_LIMIT = 50;

  private final GraphRagRetriever retriever;
  private final ContextFormatter formatter;

  public McpToolService(GraphRagRetriever retriever, ContextFormatter formatter) {
    this.retriever = retriever;
    this.formatter = formatter;
  }

  /** Hybrid graph + vector search, formatted as prompt context within the token budget. */
  @Tool(
      name = "search_knowledge",
      description =
          "Search the knowledge base by combining semantic vector search with knowledge-graph "
              + "traversal from the entities named in the query. Returns ranked context passages "
              + "with related entities and relevance scores.")
  public String searchKnowledge(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 10)", required = false)
          @Nullable Integer maxResults,
      @ToolParam(description = "Retrieval mode: HYBRID, VECTOR or GRAPH", required = false)
          @Nullable String mode,
      @ToolParam(description = "Fusion law: WEIGHTED, RRF, MAX or MIN", required = false)
          @Nullable String fusionStrategy,
      @ToolParam(description = "Reranking law: SCORE, DIVERSITY or MMR", required = false)
          @Nullable String rerankStrategy,
      @ToolParam(
              description = "Append related graph entities to each passage (default true)",
              required = false)
          @Nullable Boolean includeGraphContext,
      @ToolParam(
              description = "Minimum fused relevance score (0.0-1.0). Lower results are excluded.",
              required = false)
          @Nullable Double minScore) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchOptions options =
          SearchOptions.builder()
              .k(clampMaxResults(maxResults))
              .mode(parseEnum(SearchMode.class, mode))
              .fusionStrategy(parseEnum(FusionStrategy.class, fusionStrategy))
              .rerankStrategy(parseEnum(RerankStrategy.class, rerankStrategy))
              .enableContextAugmentation(includeGraphContext == null || includeGraphContext)
              .minScore(minScore)
              .build();

      RetrievalResult result = retriever.search(query, options);
      if (result.isEmpty()) {
        return "No results found for '%s'.".formatted(query);
      }
      String context = formatter.format(result.documents(), true);
      if (result.statistics().degraded()) {
        context += "Note: partial results, unavailable: " + describe(result.statistics()) + "\n";
      }
      return context;
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.debug("search_knowledge failed", e);
      return "Error searching knowledge base: " + e.getMessage();
    }
  }

  /** Volumes and timings of the most recent search. */
  @Tool(
      name = "retrieval_statistics",
      description = "Show result counts and per-phase timings of the most recent search.")
  public String retrievalStatistics() {
    try {
      SearchStatistics stats = retriever.getStatistics();
      StringBuilder sb = new StringBuilder();
      sb.append(
          "Results: vector %d | graph %d | fused %d%n"
              .formatted(
                  stats.vectorResultsCount(),
                  stats.graphResultsCount(),
                  stats.fusedResultsCount()));
      sb.append(
          "Entities extracted: %d | nodes traversed: %d%n"
              .formatted(stats.entitiesExtracted(), stats.nodesTraversed()));
      sb.append(
          "Timings (ms): vector %d | extraction %d | graph %d | fusion %d | rerank %d"
                  .formatted(
                      stats.vectorSearchTime().toMillis(),
                      stats.entityExtractionTime().toMillis(),
                      stats.graphSearchTime().toMillis(),
                      stats.fusionTime().toMillis(),
                      stats.rerankTime().toMillis())
              + " | augmentation %d | total %d%n"
                  .formatted(
                      stats.augmentationTime().toMillis(), stats.totalTime().toMillis()));
      if (stats.degraded()) {
        sb.append("Degraded: %s%n".formatted(describe(stats)));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading retrieval statistics: " + e.getMessage();
    }
  }

  private static String describe(SearchStatistics stats) {
    return stats.degradedModalities().stream()
        .map(Modality::name)
        .map(name -> name.toLowerCase(Locale.ROOT).replace('_', ' '))
        .collect(Collectors.joining(", "));
  }

  private static int clampMaxResults(@Nullable Integer maxResults) {
    if (maxResults == null) {
      return 10;
    }
    return Math.max(1, Math.min(maxResults, MAX_RESULTS_LIMIT));
  }

  private static <E extends Enum<E>> @Nullable E parseEnum(Class<E> type, @Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown %s '%s'".formatted(type.getSimpleName(), value), e);
    }
  }
}
