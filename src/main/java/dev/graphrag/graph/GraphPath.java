package dev.graphrag.graph;

import java.util.List;

/**
 * An ordered path between two nodes.
 *
 * @param nodes the nodes along the path, start first
 * @param edges the edges along the path, in traversal order
 * @param cost sum of the traversed edge weights
 */
public record GraphPath(List<GraphNode> nodes, List<GraphEdge> edges, double cost) {

  public GraphPath {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }

  /** Number of hops. */
  public int length() {
    return edges.size();
  }
}
