package dev.graphrag.graph;

import static dev.graphrag.fixture.KnowledgeGraphFixture.ALICE;
import static dev.graphrag.fixture.KnowledgeGraphFixture.BOB;
import static dev.graphrag.fixture.KnowledgeGraphFixture.SF;
import static dev.graphrag.fixture.KnowledgeGraphFixture.TECHCORP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.graphrag.fixture.KnowledgeGraphFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryGraphStoreTest {

  private InMemoryGraphStore store;

  @BeforeEach
  void setUp() {
    store = KnowledgeGraphFixture.companyGraph();
  }

  // --- traverse ---

  @Test
  void bfsDepthOneReturnsDirectNeighboursWithDepths() {
    TraversalResult result = store.traverse("alice", TraverseOptions.breadthFirst(1, 0));

    assertThat(result.nodes()).containsExactly(ALICE, TECHCORP);
    assertThat(result.depths()).containsEntry("alice", 0).containsEntry("techcorp", 1);
    assertThat(result.edges()).extracting(GraphEdge::id).containsExactly("e1");
  }

  @Test
  void bfsDepthTwoFollowsBothDirections() {
    TraversalResult result = store.traverse("alice", TraverseOptions.breadthFirst(2, 0));

    // techcorp expands outgoing edges before incoming ones
    assertThat(result.nodes()).containsExactly(ALICE, TECHCORP, SF, BOB);
    assertThat(result.depths()).containsEntry("sf", 2).containsEntry("bob", 2);
  }

  @Test
  void outboundTraversalIgnoresIncomingEdges() {
    TraversalResult result =
        store.traverse(
            "techcorp", new TraverseOptions(2, Direction.OUTBOUND, TraversalStrategy.BFS, 0));

    assertThat(result.nodes()).containsExactly(TECHCORP, SF);
  }

  @Test
  void inboundTraversalIgnoresOutgoingEdges() {
    TraversalResult result =
        store.traverse(
            "techcorp", new TraverseOptions(1, Direction.INBOUND, TraversalStrategy.BFS, 0));

    assertThat(result.nodes()).containsExactly(TECHCORP, ALICE, BOB);
  }

  @Test
  void limitCapsReturnedNodes() {
    TraversalResult result = store.traverse("alice", TraverseOptions.breadthFirst(3, 2));

    assertThat(result.nodes()).containsExactly(ALICE, TECHCORP);
    assertThat(result.depths()).containsOnlyKeys("alice", "techcorp");
  }

  @Test
  void depthZeroReturnsOnlyStartNode() {
    TraversalResult result = store.traverse("techcorp", TraverseOptions.breadthFirst(0, 0));

    assertThat(result.nodes()).containsExactly(TECHCORP);
    assertThat(result.edges()).isEmpty();
  }

  @Test
  void dfsGoesDeepBeforeWide() {
    InMemoryGraphStore chain = new InMemoryGraphStore();
    GraphNode a = GraphNode.of("a", "T", "A");
    GraphNode b = GraphNode.of("b", "T", "B");
    GraphNode c = GraphNode.of("c", "T", "C");
    GraphNode d = GraphNode.of("d", "T", "D");
    chain.addNode(a);
    chain.addNode(b);
    chain.addNode(c);
    chain.addNode(d);
    chain.addEdge(GraphEdge.of("ab", "a", "b", "NEXT"));
    chain.addEdge(GraphEdge.of("ad", "a", "d", "NEXT"));
    chain.addEdge(GraphEdge.of("bc", "b", "c", "NEXT"));

    TraversalResult dfs =
        chain.traverse("a", new TraverseOptions(3, Direction.OUTBOUND, TraversalStrategy.DFS, 0));
    TraversalResult bfs =
        chain.traverse("a", new TraverseOptions(3, Direction.OUTBOUND, TraversalStrategy.BFS, 0));

    assertThat(dfs.nodes()).containsExactly(a, b, c, d);
    assertThat(dfs.depths()).containsEntry("c", 2).containsEntry("d", 1);
    assertThat(bfs.nodes()).containsExactly(a, b, d, c);
  }

  @Test
  void traverseFromUnknownNodeThrows() {
    assertThatThrownBy(() -> store.traverse("nobody", TraverseOptions.breadthFirst(1, 0)))
        .isInstanceOf(NodeNotFoundException.class)
        .hasMessageContaining("nobody");
  }

  @Test
  void getNodeReturnsEmptyForUnknownId() {
    assertThat(store.getNode("alice")).contains(ALICE);
    assertThat(store.getNode("nobody")).isEmpty();
  }

  @Test
  void addEdgeRequiresBothEndpoints() {
    assertThatThrownBy(() -> store.addEdge(GraphEdge.of("x", "alice", "nobody", "KNOWS")))
        .isInstanceOf(NodeNotFoundException.class);
  }

  @Test
  void traverseOptionsRejectNegativeValues() {
    assertThatThrownBy(() -> TraverseOptions.breadthFirst(-1, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TraverseOptions.breadthFirst(1, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // --- shortestPath ---

  @Test
  void shortestPathReportsHopsAndWeightedCost() {
    GraphPath path = store.shortestPath("alice", "sf", 0);

    assertThat(path.nodes()).containsExactly(ALICE, TECHCORP, SF);
    assertThat(path.length()).isEqualTo(2);
    assertThat(path.cost()).isEqualTo(1.5);
  }

  @Test
  void shortestPathFollowsEdgesAgainstTheirDirection() {
    GraphPath path = store.shortestPath("alice", "bob", 0);

    assertThat(path.nodes()).containsExactly(ALICE, TECHCORP, BOB);
    assertThat(path.edges()).extracting(GraphEdge::id).containsExactly("e1", "e2");
  }

  @Test
  void shortestPathToSelfIsSingleNode() {
    GraphPath path = store.shortestPath("bob", "bob", 3);

    assertThat(path.nodes()).containsExactly(BOB);
    assertThat(path.length()).isZero();
    assertThat(path.cost()).isZero();
  }

  @Test
  void shortestPathRespectsMaxDepth() {
    assertThatThrownBy(() -> store.shortestPath("alice", "sf", 1))
        .isInstanceOf(NoPathFoundException.class);
  }

  @Test
  void shortestPathToDisconnectedNodeThrows() {
    assertThatThrownBy(() -> store.shortestPath("alice", "rust", 0))
        .isInstanceOf(NoPathFoundException.class);
  }
}
