package dev.graphrag.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes and edges reached by a traversal.
 *
 * @param nodes visited nodes in visit order, the start node first
 * @param edges edges followed to discover new nodes
 * @param depths hop distance from the start node, keyed by node id
 */
public record TraversalResult(
    List<GraphNode> nodes, List<GraphEdge> edges, Map<String, Integer> depths) {

  public TraversalResult {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
    depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
  }

  public static TraversalResult empty() {
    return new TraversalResult(List.of(), List.of(), Map.of());
  }
}
