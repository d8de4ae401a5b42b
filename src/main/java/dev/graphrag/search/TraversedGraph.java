package dev.graphrag.search;

import dev.graphrag.graph.GraphNode;
import dev.graphrag.graph.TraversalResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The de-duplicated union of the traversals started from every extracted entity.
 *
 * @param nodes distinct nodes in first-seen order
 * @param depths minimum hop distance of each node from any seed entity
 * @param visits total nodes returned by all traversals before de-duplication
 */
public record TraversedGraph(List<GraphNode> nodes, Map<String, Integer> depths, int visits) {

  public TraversedGraph {
    nodes = List.copyOf(nodes);
    depths = Collections.unmodifiableMap(new LinkedHashMap<>(depths));
  }

  public static TraversedGraph empty() {
    return new TraversedGraph(List.of(), Map.of(), 0);
  }

  /**
   * Unions traversal results in the given order. A node reached from several seeds keeps its first
   * position and its smallest depth.
   */
  public static TraversedGraph union(List<TraversalResult> traversals) {
    Map<String, GraphNode> nodes = new LinkedHashMap<>();
    Map<String, Integer> depths = new LinkedHashMap<>();
    int visits = 0;

    for (TraversalResult traversal : traversals) {
      visits += traversal.nodes().size();
      for (GraphNode node : traversal.nodes()) {
        nodes.putIfAbsent(node.id(), node);
        Integer depth = traversal.depths().get(node.id());
        if (depth != null) {
          depths.merge(node.id(), depth, Math::min);
        }
      }
    }
    return new TraversedGraph(new ArrayList<>(nodes.values()), depths, visits);
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public OptionalInt depthOf(String nodeId) {
    Integer depth = depths.get(nodeId);
    return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
  }
}
