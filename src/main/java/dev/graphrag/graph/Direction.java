package dev.graphrag.graph;

/** Edge directions followed during traversal. */
public enum Direction {
  /** Follow edges from source to target. */
  OUTBOUND,
  /** Follow edges from target back to source. */
  INBOUND,
  /** Follow edges either way. */
  BOTH;

  boolean followsOutbound() {
    return this == OUTBOUND || this == BOTH;
  }

  boolean followsInbound() {
    return this == INBOUND || this == BOTH;
  }
}
