package dev.graphrag.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.graphrag.document.Document;
import dev.graphrag.search.BackendUnavailableException;
import dev.graphrag.search.FusionStrategy;
import dev.graphrag.search.GraphRagRetriever;
import dev.graphrag.search.Modality;
import dev.graphrag.search.RerankStrategy;
import dev.graphrag.search.RetrievalResult;
import dev.graphrag.search.SearchMode;
import dev.graphrag.search.SearchOptions;
import dev.graphrag.search.SearchStatistics;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

  @Mock GraphRagRetriever retriever;

  @Captor ArgumentCaptor<SearchOptions> optionsCaptor;

  McpToolService service;

  @BeforeEach
  void setUp() {
    service = new McpToolService(retriever, new ContextFormatter(5000));
  }

  private static SearchStatistics statistics(Set<Modality> degraded) {
    return new SearchStatistics(
        3,
        4,
        6,
        1,
        5,
        Duration.ofMillis(12),
        Duration.ofMillis(3),
        Duration.ofMillis(7),
        Duration.ofMillis(1),
        Duration.ofMillis(2),
        Duration.ofMillis(1),
        Duration.ofMillis(25),
        degraded);
  }

  private static RetrievalResult result(Document... docs) {
    return new RetrievalResult(List.of(docs), SearchStatistics.empty());
  }

  @Test
  void searchKnowledgeRejectsBlankQuery() {
    String output = service.searchKnowledge("  ", null, null, null, null, null, null);

    assertThat(output).startsWith("Error: Query must not be empty");
    verify(retriever, never()).search(anyString(), any());
  }

  @Test
  void searchKnowledgeFormatsResultsAsContext() {
    given(retriever.search(eq("who is alice"), any()))
        .willReturn(result(Document.of("alice", "Person: Alice")));

    String output = service.searchKnowledge("who is alice", null, null, null, null, null, null);

    assertThat(output).startsWith("Context:").contains("Document 1:\nPerson: Alice");
  }

  @Test
  void searchKnowledgeDefaultsToTenResultsWithGraphContext() {
    given(retriever.search(eq("q"), optionsCaptor.capture())).willReturn(result());

    service.searchKnowledge("q", null, null, null, null, null, null);

    SearchOptions options = optionsCaptor.getValue();
    assertThat(options.k()).isEqualTo(10);
    assertThat(options.enableContextAugmentation()).isTrue();
    assertThat(options.mode()).isNull();
    assertThat(options.fusionStrategy()).isNull();
  }

  @Test
  void searchKnowledgeMapsToolParametersToOptions() {
    given(retriever.search(eq("q"), optionsCaptor.capture())).willReturn(result());

    service.searchKnowledge("q", 500, "graph", "rrf", " MMR ", false, 0.3);

    SearchOptions options = optionsCaptor.getValue();
    assertThat(options.k()).isEqualTo(McpToolService.MAX_RESULTS_LIMIT);
    assertThat(options.mode()).isEqualTo(SearchMode.GRAPH);
    assertThat(options.fusionStrategy()).isEqualTo(FusionStrategy.RRF);
    assertThat(options.rerankStrategy()).isEqualTo(RerankStrategy.MMR);
    assertThat(options.enableContextAugmentation()).isFalse();
    assertThat(options.minScore()).isEqualTo(0.3);
  }

  @Test
  void searchKnowledgeReportsUnknownEnumValues() {
    String output = service.searchKnowledge("q", null, "sideways", null, null, null, null);

    assertThat(output).isEqualTo("Error: Unknown SearchMode 'sideways'");
    verify(retriever, never()).search(anyString(), any());
  }

  @Test
  void searchKnowledgeReportsEmptyResults() {
    given(retriever.search(eq("nothing"), any())).willReturn(result());

    assertThat(service.searchKnowledge("nothing", null, null, null, null, null, null))
        .isEqualTo("No results found for 'nothing'.");
  }

  @Test
  void searchKnowledgeReturnsErrorStringInsteadOfThrowing() {
    given(retriever.search(eq("q"), any()))
        .willThrow(new BackendUnavailableException("Vector search failed: index offline"));

    assertThat(service.searchKnowledge("q", null, null, null, null, null, null))
        .isEqualTo("Error searching knowledge base: Vector search failed: index offline");
  }

  @Test
  void searchKnowledgeFlagsPartialResults() {
    given(retriever.search(eq("q"), any()))
        .willReturn(
            new RetrievalResult(
                List.of(Document.of("d", "vector only")),
                statistics(Set.of(Modality.ENTITY_EXTRACTION))));

    assertThat(service.searchKnowledge("q", null, null, null, null, null, null))
        .contains("Note: partial results, unavailable: entity extraction");
  }

  @Test
  void retrievalStatisticsShowsCountsTimingsAndDegradation() {
    given(retriever.getStatistics()).willReturn(statistics(Set.of(Modality.GRAPH_TRAVERSAL)));

    String output = service.retrievalStatistics();

    assertThat(output)
        .contains("Results: vector 3 | graph 4 | fused 6")
        .contains("Entities extracted: 1 | nodes traversed: 5")
        .contains("vector 12 | extraction 3 | graph 7")
        .contains("total 25")
        .contains("Degraded: graph traversal");
  }

  @Test
  void retrievalStatisticsOmitsDegradationWhenHealthy() {
    given(retriever.getStatistics()).willReturn(SearchStatistics.empty());

    assertThat(service.retrievalStatistics()).doesNotContain("Degraded");
  }
}
