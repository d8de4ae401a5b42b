package dev.graphrag.graph;

import java.util.Optional;

/**
 * Read-only view of a knowledge graph used by the retriever.
 *
 * <p>Implementations must be safe for concurrent readers; the retriever fans traversals out across
 * threads.
 */
public interface GraphStore {

  Optional<GraphNode> getNode(String id);

  /**
   * Expands the graph from {@code startId}, visiting each node at most once.
   *
   * @param startId the node to start from
   * @param options depth, direction, strategy and result limit
   * @return the visited nodes (start node first) with their hop depths
   * @throws NodeNotFoundException if {@code startId} is not in the graph
   */
  TraversalResult traverse(String startId, TraverseOptions options);

  /**
   * Finds the path with the fewest hops between two nodes, ignoring edge direction.
   *
   * <p>The reported {@link GraphPath#cost()} is the sum of the edge weights along that path; with
   * non-uniform weights it is not necessarily the cheapest path.
   *
   * @param maxDepth maximum number of hops; zero or negative means unlimited
   * @throws NodeNotFoundException if either endpoint is unknown
   * @throws NoPathFoundException if the nodes are not connected within {@code maxDepth} hops
   */
  GraphPath shortestPath(String fromId, String toId, int maxDepth);
}
