package dev.graphrag.document;

/** Metadata keys written by the retrieval pipeline. */
public final class MetadataKeys {

  public static final String FUSED_SCORE = "fused_score";
  public static final String VECTOR_SCORE = "vector_score";
  public static final String GRAPH_SCORE = "graph_score";
  public static final String RANK = "rank";
  public static final String RELATED_ENTITIES = "related_entities";
  public static final String NEIGHBOR_COUNT = "neighbor_count";
  public static final String GRAPH_DEPTH = "graph_depth";

  // Graph node provenance
  public static final String ENTITY_ID = "entity_id";
  public static final String ENTITY_TYPE = "entity_type";
  public static final String ENTITY_LABEL = "entity_label";

  // Graph structure attached to an existing document
  public static final String NODE_ID = "node_id";
  public static final String NODE_TYPE = "node_type";
  public static final String NODE_LABEL = "node_label";
  public static final String NODE_PROPERTY_PREFIX = "node_";
  public static final String NEIGHBORS = "neighbors";

  /** Raw similarity reported by the embedding store. */
  public static final String VECTOR_SIMILARITY = "vector_similarity";

  private MetadataKeys() {}
}
