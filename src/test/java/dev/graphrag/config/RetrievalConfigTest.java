package dev.graphrag.config;

import static dev.graphrag.fixture.KnowledgeGraphFixture.ALICE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import dev.graphrag.entity.EntityExtractor;
import dev.graphrag.entity.GazetteerEntityExtractor;
import dev.graphrag.graph.InMemoryGraphStore;
import dev.graphrag.search.GraphRagProperties;
import dev.graphrag.search.GraphRagRetriever;
import dev.graphrag.search.RetrievalResult;
import dev.graphrag.search.SearchMode;
import dev.graphrag.search.SearchOptions;
import dev.graphrag.vector.EmbeddingStoreVectorStore;
import dev.graphrag.vector.VectorStore;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RetrievalConfigTest {

  // The embedding model is mocked so the ONNX model is never loaded
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withBean("embeddingModel", EmbeddingModel.class, () -> mock(EmbeddingModel.class))
          .withUserConfiguration(
              EmbeddingConfig.class,
              ClockConfig.class,
              GraphRagProperties.class,
              RetrievalConfig.class);

  @Test
  void wiresRetrieverWithInMemoryCollaborators() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context).hasSingleBean(GraphRagRetriever.class);
          assertThat(context.getBean(VectorStore.class))
              .isInstanceOf(EmbeddingStoreVectorStore.class);
          assertThat(context.getBean(EntityExtractor.class))
              .isInstanceOf(GazetteerEntityExtractor.class);
          assertThat(context).hasSingleBean(InMemoryGraphStore.class);
        });
  }

  @Test
  void bindsRetrievalPropertiesIntoDefaults() {
    contextRunner
        .withPropertyValues(
            "graphrag.retrieval.k=5",
            "graphrag.retrieval.fusion-strategy=RRF",
            "graphrag.retrieval.search-timeout=5s")
        .run(
            context -> {
              GraphRagRetriever retriever = context.getBean(GraphRagRetriever.class);
              assertThat(retriever.getDefaults().k()).isEqualTo(5);
              assertThat(retriever.getDefaults().fusionStrategy().name()).isEqualTo("RRF");
            });
  }

  @Test
  void invalidPropertiesFailStartup() {
    contextRunner
        .withPropertyValues("graphrag.retrieval.vector-weight=1.5")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void graphSearchSeesNodesAddedToTheGraphBean() {
    contextRunner.run(
        context -> {
          context.getBean(InMemoryGraphStore.class).addNode(ALICE);

          RetrievalResult result =
              context
                  .getBean(GraphRagRetriever.class)
                  .search("Who is Alice?", SearchOptions.builder().mode(SearchMode.GRAPH).build());

          assertThat(result.documents()).extracting(doc -> doc.id()).containsExactly("alice");
        });
  }
}
