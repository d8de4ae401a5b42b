package dev.graphrag.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class EmbeddingStoreVectorStoreTest {

  private static final Embedding QUERY_EMBEDDING = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Mock EmbeddingModel embeddingModel;

  @Captor ArgumentCaptor<EmbeddingSearchRequest> requestCaptor;

  EmbeddingStoreVectorStore vectorStore;

  @BeforeEach
  void setUp() {
    vectorStore = new EmbeddingStoreVectorStore(embeddingStore, embeddingModel);
  }

  private void stubQuery(String query, List<EmbeddingMatch<TextSegment>> matches) {
    given(embeddingModel.embed(EmbeddingStoreVectorStore.BGE_QUERY_PREFIX + query))
        .willReturn(Response.from(QUERY_EMBEDDING));
    given(embeddingStore.search(any())).willReturn(new EmbeddingSearchResult<>(matches));
  }

  @Test
  void embedsPrefixedQueryAndRequestsKResults() {
    stubQuery("graph databases", List.of());

    vectorStore.similaritySearch("graph databases", 7);

    verify(embeddingStore).search(requestCaptor.capture());
    assertThat(requestCaptor.getValue().maxResults()).isEqualTo(7);
    assertThat(requestCaptor.getValue().queryEmbedding()).isEqualTo(QUERY_EMBEDDING);
  }

  @Test
  void convertsMatchesInStoreOrder() {
    TextSegment first =
        TextSegment.from("Alice works at TechCorp.", new Metadata().put("source", "hr"));
    TextSegment second = TextSegment.from("TechCorp is in San Francisco.");
    stubQuery(
        "techcorp",
        List.of(
            new EmbeddingMatch<>(0.92, "emb-1", QUERY_EMBEDDING, first),
            new EmbeddingMatch<>(0.81, "emb-2", QUERY_EMBEDDING, second)));

    List<Document> docs = vectorStore.similaritySearch("techcorp", 5);

    assertThat(docs).extracting(Document::id).containsExactly("emb-1", "emb-2");
    assertThat(docs.get(0).content()).isEqualTo("Alice works at TechCorp.");
    assertThat(docs.get(0).metadataValue("source")).contains(MetadataValue.text("hr"));
    assertThat(docs.get(0).metadataValue(MetadataKeys.VECTOR_SIMILARITY))
        .contains(MetadataValue.number(0.92));
  }

  @Test
  void segmentIdMetadataOverridesEmbeddingId() {
    TextSegment segment =
        TextSegment.from("TechCorp profile", new Metadata().put("id", "techcorp"));
    stubQuery("techcorp", List.of(new EmbeddingMatch<>(0.9, "emb-9", QUERY_EMBEDDING, segment)));

    assertThat(vectorStore.similaritySearch("techcorp", 1))
        .extracting(Document::id)
        .containsExactly("techcorp");
  }

  @Test
  void skipsMatchesWithoutSegment() {
    stubQuery(
        "q",
        List.of(
            new EmbeddingMatch<TextSegment>(0.9, "emb-1", QUERY_EMBEDDING, null),
            new EmbeddingMatch<>(0.8, "emb-2", QUERY_EMBEDDING, TextSegment.from("kept"))));

    assertThat(vectorStore.similaritySearch("q", 2))
        .extracting(Document::id)
        .containsExactly("emb-2");
  }

  @Test
  void rejectsNonPositiveKWithoutTouchingTheStore() {
    assertThatThrownBy(() -> vectorStore.similaritySearch("q", 0))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(embeddingModel, embeddingStore);
  }

  @Test
  void storeFailuresPropagate() {
    given(embeddingModel.embed(any(String.class))).willReturn(Response.from(QUERY_EMBEDDING));
    given(embeddingStore.search(any())).willThrow(new IllegalStateException("index offline"));

    assertThatThrownBy(() -> vectorStore.similaritySearch("q", 3))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("index offline");
  }
}
