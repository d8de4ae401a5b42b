package dev.graphrag.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory {@link GraphStore}.
 *
 * <p>Nodes and edges are kept in insertion order so traversals are deterministic. Reads share a
 * read lock; {@link #addNode} and {@link #addEdge} take the write lock.
 */
public class InMemoryGraphStore implements GraphStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
  private final Map<String, List<GraphEdge>> outgoing = new HashMap<>();
  private final Map<String, List<GraphEdge>> incoming = new HashMap<>();

  /** Adds a node, replacing any existing node with the same id. */
  public void addNode(GraphNode node) {
    lock.writeLock().lock();
    try {
      nodes.put(node.id(), node);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Adds an edge between two existing nodes.
   *
   * @throws NodeNotFoundException if either endpoint has not been added
   */
  public void addEdge(GraphEdge edge) {
    lock.writeLock().lock();
    try {
      if (!nodes.containsKey(edge.source())) {
        throw new NodeNotFoundException(edge.source());
      }
      if (!nodes.containsKey(edge.target())) {
        throw new NodeNotFoundException(edge.target());
      }
      outgoing.computeIfAbsent(edge.source(), id -> new ArrayList<>()).add(edge);
      incoming.computeIfAbsent(edge.target(), id -> new ArrayList<>()).add(edge);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Snapshot of all nodes in insertion order. */
  public Collection<GraphNode> nodes() {
    lock.readLock().lock();
    try {
      return List.copyOf(nodes.values());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Optional<GraphNode> getNode(String id) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(nodes.get(id));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public TraversalResult traverse(String startId, TraverseOptions options) {
    lock.readLock().lock();
    try {
      if (!nodes.containsKey(startId)) {
        throw new NodeNotFoundException(startId);
      }
      TraversalResult result =
          options.strategy() == TraversalStrategy.BFS
              ? breadthFirst(startId, options)
              : depthFirst(startId, options);
      log.debug(
          "Traversed from {} ({}, depth {}): {} nodes, {} edges",
          startId,
          options.strategy(),
          options.maxDepth(),
          result.nodes().size(),
          result.edges().size());
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  private TraversalResult breadthFirst(String startId, TraverseOptions options) {
    List<GraphNode> visited = new ArrayList<>();
    List<GraphEdge> followed = new ArrayList<>();
    // Discovered nodes with their hop depth; discovery order is BFS order so depths are minimal
    Map<String, Integer> depths = new LinkedHashMap<>();
    Deque<String> queue = new ArrayDeque<>();

    queue.add(startId);
    depths.put(startId, 0);

    while (!queue.isEmpty() && !options.limitReached(visited.size())) {
      String currentId = queue.poll();
      visited.add(nodes.get(currentId));

      int depth = depths.get(currentId);
      if (depth >= options.maxDepth()) {
        continue;
      }
      for (GraphEdge edge : neighbourEdges(currentId, options.direction())) {
        String nextId = edge.otherEnd(currentId);
        if (!depths.containsKey(nextId)) {
          depths.put(nextId, depth + 1);
          followed.add(edge);
          queue.add(nextId);
        }
      }
    }

    return new TraversalResult(visited, followed, retainVisited(depths, visited));
  }

  private TraversalResult depthFirst(String startId, TraverseOptions options) {
    List<GraphNode> visited = new ArrayList<>();
    List<GraphEdge> followed = new ArrayList<>();
    Map<String, Integer> depths = new LinkedHashMap<>();
    Deque<Frame> stack = new ArrayDeque<>();

    stack.push(new Frame(startId, 0, null));

    while (!stack.isEmpty() && !options.limitReached(visited.size())) {
      Frame frame = stack.pop();
      if (depths.containsKey(frame.nodeId())) {
        continue;
      }
      depths.put(frame.nodeId(), frame.depth());
      visited.add(nodes.get(frame.nodeId()));
      if (frame.via() != null) {
        followed.add(frame.via());
      }
      if (frame.depth() >= options.maxDepth()) {
        continue;
      }
      List<GraphEdge> edges = neighbourEdges(frame.nodeId(), options.direction());
      // Push in reverse so the first edge is expanded first
      for (int i = edges.size() - 1; i >= 0; i--) {
        GraphEdge edge = edges.get(i);
        String nextId = edge.otherEnd(frame.nodeId());
        if (!depths.containsKey(nextId)) {
          stack.push(new Frame(nextId, frame.depth() + 1, edge));
        }
      }
    }

    return new TraversalResult(visited, followed, depths);
  }

  @Override
  public GraphPath shortestPath(String fromId, String toId, int maxDepth) {
    lock.readLock().lock();
    try {
      if (!nodes.containsKey(fromId)) {
        throw new NodeNotFoundException(fromId);
      }
      if (!nodes.containsKey(toId)) {
        throw new NodeNotFoundException(toId);
      }

      // Unweighted BFS: fewest hops, cost reported as the sum of weights along that path
      Map<String, GraphEdge> reachedVia = new HashMap<>();
      Map<String, Integer> depths = new HashMap<>();
      Deque<String> queue = new ArrayDeque<>();
      queue.add(fromId);
      depths.put(fromId, 0);

      while (!queue.isEmpty()) {
        String currentId = queue.poll();
        if (currentId.equals(toId)) {
          return buildPath(fromId, toId, reachedVia);
        }
        int depth = depths.get(currentId);
        if (maxDepth > 0 && depth >= maxDepth) {
          continue;
        }
        for (GraphEdge edge : neighbourEdges(currentId, Direction.BOTH)) {
          String nextId = edge.otherEnd(currentId);
          if (!depths.containsKey(nextId)) {
            depths.put(nextId, depth + 1);
            reachedVia.put(nextId, edge);
            queue.add(nextId);
          }
        }
      }
      throw new NoPathFoundException(fromId, toId, maxDepth);
    } finally {
      lock.readLock().unlock();
    }
  }

  private GraphPath buildPath(String fromId, String toId, Map<String, GraphEdge> reachedVia) {
    Deque<GraphNode> pathNodes = new ArrayDeque<>();
    Deque<GraphEdge> pathEdges = new ArrayDeque<>();
    double cost = 0.0;

    String currentId = toId;
    pathNodes.push(nodes.get(currentId));
    while (!currentId.equals(fromId)) {
      GraphEdge edge = reachedVia.get(currentId);
      pathEdges.push(edge);
      cost += edge.weight();
      currentId = edge.otherEnd(currentId);
      pathNodes.push(nodes.get(currentId));
    }
    return new GraphPath(new ArrayList<>(pathNodes), new ArrayList<>(pathEdges), cost);
  }

  private List<GraphEdge> neighbourEdges(String nodeId, Direction direction) {
    List<GraphEdge> edges = new ArrayList<>();
    if (direction.followsOutbound()) {
      edges.addAll(outgoing.getOrDefault(nodeId, List.of()));
    }
    if (direction.followsInbound()) {
      edges.addAll(incoming.getOrDefault(nodeId, List.of()));
    }
    return edges;
  }

  private static Map<String, Integer> retainVisited(
      Map<String, Integer> depths, List<GraphNode> visited) {
    Set<String> visitedIds = new HashSet<>();
    visited.forEach(node -> visitedIds.add(node.id()));
    Map<String, Integer> retained = new LinkedHashMap<>();
    depths.forEach(
        (id, depth) -> {
          if (visitedIds.contains(id)) {
            retained.put(id, depth);
          }
        });
    return retained;
  }

  private record Frame(String nodeId, int depth, @Nullable GraphEdge via) {}
}
