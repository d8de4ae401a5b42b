package dev.graphrag.graph;

import java.util.Objects;

/**
 * A directed, weighted relationship between two nodes.
 *
 * @param id unique edge identifier
 * @param source id of the source node
 * @param target id of the target node
 * @param type relationship type, e.g. {@code WORKS_FOR}
 * @param weight edge weight used for path cost (defaults to 1.0 via {@link #of})
 */
public record GraphEdge(String id, String source, String target, String type, double weight) {

  public GraphEdge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    type = type == null ? "" : type;
  }

  public static GraphEdge of(String id, String source, String target, String type) {
    return new GraphEdge(id, source, target, type, 1.0);
  }

  /** Returns the endpoint opposite {@code nodeId}. */
  String otherEnd(String nodeId) {
    return source.equals(nodeId) ? target : source;
  }
}
