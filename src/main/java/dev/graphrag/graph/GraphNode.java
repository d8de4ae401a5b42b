package dev.graphrag.graph;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A knowledge-graph entity as returned by a {@link GraphStore}. Consumed read-only by the
 * retriever.
 *
 * @param id unique node identifier
 * @param type entity type, e.g. {@code Person} or {@code Organization}
 * @param label display name
 * @param properties node properties; a {@code description} text property is folded into the
 *     synthesised document content
 */
public record GraphNode(
    String id, String type, String label, Map<String, MetadataValue> properties) {

  static final String DESCRIPTION = "description";

  public GraphNode {
    Objects.requireNonNull(id, "id");
    type = type == null ? "" : type;
    label = label == null ? "" : label;
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public static GraphNode of(String id, String type, String label) {
    return new GraphNode(id, type, label, Map.of());
  }

  public static GraphNode of(String id, String type, String label, String description) {
    return new GraphNode(id, type, label, Map.of(DESCRIPTION, MetadataValue.text(description)));
  }

  public Optional<String> description() {
    MetadataValue value = properties.get(DESCRIPTION);
    return value == null ? Optional.empty() : value.asString();
  }

  /** Formats the node as {@code "label (type)"}. */
  public String displayName() {
    return "%s (%s)".formatted(label, type);
  }

  /**
   * Synthesises a document for this node: content {@code "type: label"} followed by the
   * description on its own line, metadata carrying the entity provenance plus every property.
   */
  public Document toDocument() {
    String content = type + ": " + label;
    Optional<String> description = description();
    if (description.isPresent()) {
      content = content + "\n" + description.get();
    }

    Map<String, MetadataValue> metadata = new LinkedHashMap<>();
    metadata.put(MetadataKeys.ENTITY_ID, MetadataValue.text(id));
    metadata.put(MetadataKeys.ENTITY_TYPE, MetadataValue.text(type));
    metadata.put(MetadataKeys.ENTITY_LABEL, MetadataValue.text(label));
    metadata.putAll(properties);
    return new Document(id, content, metadata);
  }
}
