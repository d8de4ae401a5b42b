package dev.graphrag.search;

import static dev.graphrag.fixture.KnowledgeGraphFixture.ALICE;
import static dev.graphrag.fixture.KnowledgeGraphFixture.BOB;
import static dev.graphrag.fixture.KnowledgeGraphFixture.TECHCORP;
import static org.assertj.core.api.Assertions.assertThat;

import dev.graphrag.graph.TraversalResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraversedGraphTest {

  @Test
  void unionKeepsFirstPositionAndSmallestDepth() {
    TraversalResult fromAlice =
        new TraversalResult(List.of(ALICE, TECHCORP), List.of(), Map.of("alice", 0, "techcorp", 1));
    TraversalResult fromBob =
        new TraversalResult(
            List.of(BOB, TECHCORP, ALICE), List.of(), Map.of("bob", 0, "techcorp", 1, "alice", 2));

    TraversedGraph union = TraversedGraph.union(List.of(fromAlice, fromBob));

    assertThat(union.nodes()).containsExactly(ALICE, TECHCORP, BOB);
    assertThat(union.depthOf("alice")).hasValue(0);
    assertThat(union.depthOf("bob")).hasValue(0);
    assertThat(union.visits()).isEqualTo(5);
  }

  @Test
  void emptyUnionHasNoNodes() {
    assertThat(TraversedGraph.union(List.of()).isEmpty()).isTrue();
    assertThat(TraversedGraph.empty().depthOf("alice")).isEmpty();
  }
}
