package dev.graphrag.vector;

import dev.graphrag.document.Document;
import java.util.List;

/** Dense similarity search over an embedded document collection. */
public interface VectorStore {

  /**
   * Returns up to {@code k} documents most similar to {@code query}, most relevant first.
   *
   * @param query the query text (may be empty)
   * @param k maximum number of documents to return
   * @return documents ordered by descending relevance
   */
  List<Document> similaritySearch(String query, int k);
}
