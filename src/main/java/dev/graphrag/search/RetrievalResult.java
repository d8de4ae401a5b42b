package dev.graphrag.search;

import dev.graphrag.document.Document;
import java.util.List;

/**
 * Outcome of {@link GraphRagRetriever#search}: the ranked documents and the statistics of the call
 * that produced them.
 *
 * @param documents at most {@code k} documents, best first (possibly empty)
 * @param statistics volumes and timings of the call
 */
public record RetrievalResult(List<Document> documents, SearchStatistics statistics) {

  public RetrievalResult {
    documents = List.copyOf(documents);
  }

  public boolean isEmpty() {
    return documents.isEmpty();
  }
}
