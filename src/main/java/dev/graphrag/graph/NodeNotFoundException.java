package dev.graphrag.graph;

/** Thrown when an operation references a node id the graph does not contain. */
public class NodeNotFoundException extends RuntimeException {

  public NodeNotFoundException(String nodeId) {
    super("Node not found: " + nodeId);
  }
}
