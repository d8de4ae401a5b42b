package dev.graphrag.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TextSimilarityTest {

  @Test
  void identicalTextsAreFullySimilar() {
    assertThat(TextSimilarity.jaccard("graph retrieval", "graph retrieval")).isEqualTo(1.0);
  }

  @Test
  void disjointTextsHaveZeroSimilarity() {
    assertThat(TextSimilarity.jaccard("alpha beta", "gamma delta")).isZero();
  }

  @Test
  void caseAndSurroundingPunctuationAreIgnored() {
    assertThat(TextSimilarity.jaccard("Hello, World!", "hello world")).isEqualTo(1.0);
    assertThat(TextSimilarity.words("(Graph) \"RAG\"; engines."))
        .containsExactlyInAnyOrder("graph", "rag", "engines");
  }

  @Test
  void partialOverlapIsIntersectionOverUnion() {
    // {a, b, c} vs {b, c, d}: 2 shared of 4
    assertThat(TextSimilarity.jaccard("a b c", "b c d")).isCloseTo(0.5, within(1e-12));
  }

  @Test
  void repeatedWordsCountOnce() {
    assertThat(TextSimilarity.jaccard("data data data", "data")).isEqualTo(1.0);
  }

  @Test
  void emptyTextHasZeroSimilarity() {
    assertThat(TextSimilarity.jaccard("", "anything")).isZero();
    assertThat(TextSimilarity.jaccard("  ", "  ")).isZero();
    assertThat(TextSimilarity.jaccard("...", "anything")).isZero();
  }

  @Test
  void similarityIsSymmetric() {
    String a = "knowledge graphs link entities";
    String b = "entities and their relations";

    assertThat(TextSimilarity.jaccard(a, b)).isEqualTo(TextSimilarity.jaccard(b, a));
  }
}
