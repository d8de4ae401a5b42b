package dev.graphrag.vector;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link VectorStore} backed by a LangChain4j {@link EmbeddingStore} and {@link EmbeddingModel}.
 *
 * <p>The query is embedded with an optional instruction prefix (bge models expect one on queries
 * but not on documents), then matched against the store. Each match becomes a {@link Document}
 * whose id is the segment's {@code id} metadata when present (so documents describing a graph
 * entity can share the node's id), otherwise the store's embedding id.
 *
 * <p>Store and model exceptions propagate unchanged; the retriever decides whether they are fatal.
 */
public class EmbeddingStoreVectorStore implements VectorStore {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreVectorStore.class);

  /** Query instruction recommended by the bge-small-en-v1.5 model card. */
  public static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  static final String ID_METADATA_KEY = "id";

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final EmbeddingModel embeddingModel;
  private final String queryPrefix;

  public EmbeddingStoreVectorStore(
      EmbeddingStore<TextSegment> embeddingStore, EmbeddingModel embeddingModel) {
    this(embeddingStore, embeddingModel, BGE_QUERY_PREFIX);
  }

  public EmbeddingStoreVectorStore(
      EmbeddingStore<TextSegment> embeddingStore,
      EmbeddingModel embeddingModel,
      String queryPrefix) {
    this.embeddingStore = embeddingStore;
    this.embeddingModel = embeddingModel;
    this.queryPrefix = Objects.requireNonNull(queryPrefix, "queryPrefix");
  }

  @Override
  public List<Document> similaritySearch(String query, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1, got: " + k);
    }
    Embedding queryEmbedding = embeddingModel.embed(queryPrefix + query).content();

    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder().queryEmbedding(queryEmbedding).maxResults(k).build();

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
    log.debug("Embedding store returned {} matches for k={}", matches.size(), k);

    return matches.stream().filter(m -> m.embedded() != null).map(this::toDocument).toList();
  }

  private Document toDocument(EmbeddingMatch<TextSegment> match) {
    TextSegment segment = match.embedded();

    Map<String, MetadataValue> metadata = new LinkedHashMap<>();
    segment.metadata().toMap().forEach((key, value) -> metadata.put(key, MetadataValue.of(value)));
    metadata.put(MetadataKeys.VECTOR_SIMILARITY, MetadataValue.number(match.score()));

    String id = segment.metadata().getString(ID_METADATA_KEY);
    if (id == null || id.isEmpty()) {
      id = match.embeddingId();
    }
    return new Document(id, segment.text(), metadata);
  }
}
