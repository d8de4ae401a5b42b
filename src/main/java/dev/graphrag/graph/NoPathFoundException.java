package dev.graphrag.graph;

/** Thrown when no path connects two nodes within the requested depth. */
public class NoPathFoundException extends RuntimeException {

  public NoPathFoundException(String fromId, String toId, int maxDepth) {
    super("No path from %s to %s within %d hops".formatted(fromId, toId, maxDepth));
  }
}
