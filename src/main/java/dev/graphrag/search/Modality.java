package dev.graphrag.search;

/** Retrieval sources whose failure degrades, but does not abort, a hybrid search. */
public enum Modality {
  ENTITY_EXTRACTION,
  GRAPH_TRAVERSAL
}
