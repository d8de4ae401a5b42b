package dev.graphrag.config;

import dev.graphrag.entity.EntityExtractor;
import dev.graphrag.entity.GazetteerEntityExtractor;
import dev.graphrag.graph.GraphStore;
import dev.graphrag.graph.InMemoryGraphStore;
import dev.graphrag.search.GraphRagProperties;
import dev.graphrag.search.GraphRagRetriever;
import dev.graphrag.vector.EmbeddingStoreVectorStore;
import dev.graphrag.vector.VectorStore;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the retriever and its collaborators.
 *
 * <p>The graph store, vector store and entity extractor are exposed as beans that back off when the
 * application supplies its own, so a real graph database or embedding index can replace the
 * in-memory defaults without touching the retriever.
 */
@Configuration
public class RetrievalConfig {

  @Bean
  @ConditionalOnMissingBean(GraphStore.class)
  public InMemoryGraphStore graphStore() {
    return new InMemoryGraphStore();
  }

  /** Recognises the labels of the nodes currently in the in-memory graph. */
  @Bean
  @ConditionalOnMissingBean
  public EntityExtractor entityExtractor(InMemoryGraphStore graphStore) {
    return new GazetteerEntityExtractor(graphStore::nodes);
  }

  @Bean
  @ConditionalOnMissingBean
  public VectorStore vectorStore(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    return new EmbeddingStoreVectorStore(embeddingStore, embeddingModel);
  }

  /** Runs vector searches, entity extraction and per-entity traversals. */
  @Bean(destroyMethod = "shutdownNow")
  @Qualifier("retrievalExecutor")
  public ExecutorService retrievalExecutor(GraphRagProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads =
        runnable -> {
          Thread thread = new Thread(runnable, "graphrag-retrieval-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.getTraversalParallelism(), threads);
  }

  @Bean
  public GraphRagRetriever graphRagRetriever(
      VectorStore vectorStore,
      GraphStore graphStore,
      EntityExtractor entityExtractor,
      @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor,
      GraphRagProperties properties,
      Clock clock) {
    return new GraphRagRetriever(
        vectorStore,
        graphStore,
        entityExtractor,
        properties.toSettings(),
        retrievalExecutor,
        properties.getSearchTimeout(),
        clock);
  }
}
