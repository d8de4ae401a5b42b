package dev.graphrag.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the embedding model and the embedding store behind the vector modality.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process,
 * avoiding any external embedding API. The store is LangChain4j's {@link InMemoryEmbeddingStore};
 * nothing is persisted. Both beans back off when the application defines its own.
 *
 * @see dev.graphrag.vector.EmbeddingStoreVectorStore
 */
@Configuration
public class EmbeddingConfig {

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  @ConditionalOnMissingBean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  @Bean
  @ConditionalOnMissingBean
  public EmbeddingStore<TextSegment> embeddingStore() {
    return new InMemoryEmbeddingStore<>();
  }
}
