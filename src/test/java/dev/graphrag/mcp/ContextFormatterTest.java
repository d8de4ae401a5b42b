package dev.graphrag.mcp;

import static org.assertj.core.api.Assertions.assertThat;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private static Document scored(String id, String content, double score) {
    return Document.of(id, content)
        .withMetadata(MetadataKeys.FUSED_SCORE, MetadataValue.number(score));
  }

  @Test
  void formatsDocumentsAsNumberedContextBlocks() {
    var formatter = new ContextFormatter(5000);

    String output =
        formatter.format(
            List.of(Document.of("a", "First passage"), Document.of("b", "Second passage")), false);

    assertThat(output)
        .isEqualTo(
            "Context:\n\nDocument 1:\nFirst passage\n\n---\n\n" +
                "Document 2:\nSecond passage\n\n---\n\n");
  }

  @Test
  void metadataBlockListsRelatedEntitiesAndRelevance() {
    var formatter = new ContextFormatter(5000);
    Document doc =
        scored("a", "TechCorp builds databases", 0.8125)
            .withMetadata(
                MetadataKeys.RELATED_ENTITIES,
                MetadataValue.textList(List.of("TechCorp (Company)", "Alice (Person)")))
            .withGraphContext("Related Entities: TechCorp (Company), Alice (Person)");

    String output = formatter.format(List.of(doc), true);

    assertThat(output)
        .contains(
            "TechCorp builds databases\n\nRelated Entities: TechCorp (Company), Alice (Person)\n")
        .contains("Metadata:\n  Related Entities: TechCorp (Company), Alice (Person)\n")
        .contains("  Relevance Score: 0.813\n");
  }

  @Test
  void metadataBlockIsOmittedWhenNothingToReport() {
    var formatter = new ContextFormatter(5000);

    String output = formatter.format(List.of(Document.of("a", "plain")), true);

    assertThat(output).doesNotContain("Metadata:");
  }

  @Test
  void metadataIsOmittedWhenNotRequested() {
    var formatter = new ContextFormatter(5000);

    String output = formatter.format(List.of(scored("a", "scored", 0.5)), false);

    assertThat(output).doesNotContain("Relevance Score");
  }

  @Test
  void documentsBeyondTheBudgetAreDropped() {
    // 30 tokens is about 120 chars: header plus two short blocks, not three
    var formatter = new ContextFormatter(30);
    List<Document> docs =
        List.of(
            Document.of("a", "First passage about graphs"),
            Document.of("b", "Second passage about vectors"),
            Document.of("c", "Third passage about fusion"));

    String output = formatter.format(docs, false);

    assertThat(output)
        .contains("First passage")
        .contains("Second passage")
        .doesNotContain("Third passage");
    assertThat(formatter.estimateTokens(output)).isLessThanOrEqualTo(30);
  }

  @Test
  void firstDocumentIsCutWhenItAloneExceedsTheBudget() {
    var formatter = new ContextFormatter(10);

    String output =
        formatter.format(
            List.of(Document.of("a", "x".repeat(500)), Document.of("b", "next")), false);

    assertThat(output).startsWith("Context:\n\nDocument 1:");
    assertThat(output.length()).isLessThanOrEqualTo(40);
    assertThat(output).doesNotContain("Document 2");
  }

  @Test
  void emptyInputProducesEmptyString() {
    var formatter = new ContextFormatter(5000);

    assertThat(formatter.format(Collections.emptyList(), true)).isEmpty();
    assertThat(formatter.format(null, true)).isEmpty();
  }
}
