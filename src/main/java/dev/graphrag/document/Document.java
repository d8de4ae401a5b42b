package dev.graphrag.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;

/**
 * A retrievable unit of text returned by the vector store, synthesised from a graph node, or
 * produced by the retriever after fusion.
 *
 * <p>Documents are immutable: every {@code with*} method returns a copy. Graph context attached by
 * augmentation lives in {@link #graphContext()} rather than being appended to {@link #content()},
 * so augmenting twice yields the same document; {@link #renderedContent()} composes the two.
 *
 * @param id stable identifier (may be empty when the source provides none)
 * @param content the document text
 * @param metadata insertion-ordered metadata
 * @param graphContext human-readable graph context line, or null when none was attached
 */
public record Document(
    String id, String content, Map<String, MetadataValue> metadata, @Nullable String graphContext) {

  /** Number of leading content characters used as identity when the id is empty. */
  static final int CONTENT_KEY_LENGTH = 100;

  public Document {
    id = id == null ? "" : id;
    content = content == null ? "" : content;
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Document(String id, String content, Map<String, MetadataValue> metadata) {
    this(id, content, metadata, null);
  }

  public static Document of(String id, String content) {
    return new Document(id, content, Map.of(), null);
  }

  /**
   * Identity used for de-duplication: the id when non-empty, otherwise the first 100 characters of
   * the content. Two distinct id-less documents sharing a 100-character prefix collide.
   */
  public String key() {
    if (!id.isEmpty()) {
      return id;
    }
    return content.length() > CONTENT_KEY_LENGTH
        ? content.substring(0, CONTENT_KEY_LENGTH)
        : content;
  }

  public Document withMetadata(String key, MetadataValue value) {
    Map<String, MetadataValue> copy = new LinkedHashMap<>(metadata);
    copy.put(key, value);
    return new Document(id, content, copy, graphContext);
  }

  public Document withMetadata(Map<String, MetadataValue> additions) {
    Map<String, MetadataValue> copy = new LinkedHashMap<>(metadata);
    copy.putAll(additions);
    return new Document(id, content, copy, graphContext);
  }

  public Document withGraphContext(@Nullable String context) {
    return new Document(id, content, metadata, context);
  }

  public Optional<MetadataValue> metadataValue(String key) {
    return Optional.ofNullable(metadata.get(key));
  }

  /** The fused score recorded by the retriever, absent for single-modality results. */
  public OptionalDouble fusedScore() {
    MetadataValue value = metadata.get(MetadataKeys.FUSED_SCORE);
    return value == null ? OptionalDouble.empty() : value.asNumber();
  }

  /** Content with the graph context line appended, as presented to a language model. */
  public String renderedContent() {
    if (graphContext == null || graphContext.isEmpty()) {
      return content;
    }
    return content + "\n\n" + graphContext;
  }
}
