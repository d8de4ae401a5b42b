package dev.graphrag.mcp;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved documents as an LLM prompt context, within a configurable token budget.
 *
 * <p>Output shape:
 *
 * <pre>
 * Context:
 *
 * Document 1:
 * (content, then the graph context when present)
 * Metadata:
 *   Related Entities: Alice (Person), TechCorp (Company)
 *   Relevance Score: 0.812
 *
 * ---
 * </pre>
 *
 * <p>The metadata block is written only when requested and when the document carries related
 * entities or a fused score. Tokens are estimated as characters / 4. Documents are appended until
 * the next one would exceed the budget; if even the first one does, it is cut at the character
 * level so that at least one document is always returned.
 */
@Component
public class ContextFormatter {

  static final String HEADER = "Context:\n\n";
  static final String SEPARATOR = "\n---\n\n";

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public ContextFormatter(@Value("${graphrag.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats documents in order until the token budget is spent.
   *
   * @param documents ranked documents, best first
   * @param includeMetadata whether to write the related-entity and relevance lines
   * @return the formatted context, or an empty string when there are no documents
   */
  public String format(@Nullable List<Document> documents, boolean includeMetadata) {
    if (documents == null || documents.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder(HEADER);
    int estimatedTokens = estimateTokens(HEADER);

    for (int i = 0; i < documents.size(); i++) {
      String formatted = formatDocument(i + 1, documents.get(i), includeMetadata);
      int documentTokens = estimateTokens(formatted);

      if (i == 0 && estimatedTokens + documentTokens > tokenBudget) {
        // First document alone exceeds the budget: cut at character level
        int maxChars = Math.max(0, (int) (tokenBudget * CHARS_PER_TOKEN) - HEADER.length());
        output.append(formatted, 0, Math.min(maxChars, formatted.length()));
        break;
      }
      if (estimatedTokens + documentTokens > tokenBudget) {
        break;
      }

      output.append(formatted);
      estimatedTokens += documentTokens;
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatDocument(int index, Document document, boolean includeMetadata) {
    StringBuilder block = new StringBuilder();
    block.append("Document ").append(index).append(":\n");
    block.append(document.renderedContent()).append('\n');

    if (includeMetadata) {
      String metadata = metadataLines(document);
      if (!metadata.isEmpty()) {
        block.append("Metadata:\n").append(metadata);
      }
    }
    block.append(SEPARATOR);
    return block.toString();
  }

  private static String metadataLines(Document document) {
    StringBuilder lines = new StringBuilder();
    MetadataValue entities =
        document.metadataValue(MetadataKeys.RELATED_ENTITIES).orElse(null);
    if (entities instanceof MetadataValue.TextList list && !list.values().isEmpty()) {
      lines.append("  Related Entities: ").append(String.join(", ", list.values())).append('\n');
    }
    OptionalDouble score = document.fusedScore();
    if (score.isPresent()) {
      lines.append(String.format(Locale.ROOT, "  Relevance Score: %.3f\n", score.getAsDouble()));
    }
    return lines.toString();
  }
}
