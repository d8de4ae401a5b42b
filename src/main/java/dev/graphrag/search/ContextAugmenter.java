package dev.graphrag.search;

import dev.graphrag.document.Document;
import dev.graphrag.document.MetadataKeys;
import dev.graphrag.document.MetadataValue;
import dev.graphrag.graph.GraphNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Turns ranked candidates into result documents, attaching fusion scores and, on request, the
 * graph neighbourhood of each candidate.
 *
 * <p>Graph context goes into {@link Document#graphContext()} and metadata, never into the content
 * itself, so augmenting an already augmented document produces the same document.
 */
public final class ContextAugmenter {

  static final String RELATED_ENTITIES_PREFIX = "Related Entities: ";
  static final String CONNECTED_TO_PREFIX = "Connected to: ";

  /** Depth reported when no traversal recorded one for the related nodes. */
  static final int UNKNOWN_DEPTH = 1;

  private ContextAugmenter() {}

  /**
   * Attaches score and rank metadata ({@code fused_score}, {@code vector_score}, {@code
   * graph_score}, {@code rank}) without graph context.
   */
  public static List<Document> withScores(List<FusedResult> ranked) {
    List<Document> documents = new ArrayList<>(ranked.size());
    for (FusedResult result : ranked) {
      documents.add(result.document().withMetadata(scoreMetadata(result)));
    }
    return documents;
  }

  /**
   * Attaches score metadata plus, for candidates with related nodes, {@code related_entities}
   * ({@code "label (type)"}, de-duplicated), {@code neighbor_count}, {@code graph_depth} and a
   * {@code "Related Entities: ..."} context line.
   *
   * @param ranked candidates in final order
   * @param graph the traversal union, used for node depths
   * @return one document per candidate, in the same order
   */
  public static List<Document> augment(List<FusedResult> ranked, TraversedGraph graph) {
    List<Document> documents = new ArrayList<>(ranked.size());
    for (FusedResult result : ranked) {
      Document doc = result.document().withMetadata(scoreMetadata(result));
      if (!result.relatedNodes().isEmpty()) {
        doc = attachGraphContext(doc, result.relatedNodes(), graph);
      }
      documents.add(doc);
    }
    return documents;
  }

  /**
   * Describes the graph position of a single document: {@code node_id}, {@code node_type}, {@code
   * node_label} and one {@code node_<property>} entry per node property, plus {@code neighbors}
   * (labels), {@code neighbor_count} and a {@code "Connected to: ..."} context line when the node
   * has neighbours.
   *
   * <p>The context line replaces any earlier {@code "Connected to"} line and keeps other context
   * lines, so enhancing twice with the same arguments yields the same document.
   *
   * @param doc the document to enhance
   * @param node the graph node the document stands for, or null if unknown
   * @param neighbors adjacent nodes, in display order
   */
  public static Document enhanceWithGraphStructure(
      Document doc, @Nullable GraphNode node, @Nullable List<GraphNode> neighbors) {
    Map<String, MetadataValue> structure = new LinkedHashMap<>();
    if (node != null) {
      structure.put(MetadataKeys.NODE_ID, MetadataValue.text(node.id()));
      structure.put(MetadataKeys.NODE_TYPE, MetadataValue.text(node.type()));
      structure.put(MetadataKeys.NODE_LABEL, MetadataValue.text(node.label()));
      node.properties()
          .forEach(
              (name, value) -> structure.put(MetadataKeys.NODE_PROPERTY_PREFIX + name, value));
    }
    if (neighbors == null || neighbors.isEmpty()) {
      return doc.withMetadata(structure);
    }

    List<String> labels = neighbors.stream().map(GraphNode::label).toList();
    structure.put(MetadataKeys.NEIGHBORS, MetadataValue.textList(labels));
    structure.put(MetadataKeys.NEIGHBOR_COUNT, MetadataValue.number(labels.size()));
    return doc.withMetadata(structure)
        .withGraphContext(
            replaceLine(
                doc.graphContext(),
                CONNECTED_TO_PREFIX,
                CONNECTED_TO_PREFIX + String.join(", ", labels)));
  }

  private static String replaceLine(@Nullable String context, String prefix, String line) {
    List<String> lines = new ArrayList<>();
    if (context != null && !context.isEmpty()) {
      for (String existing : context.split("\n")) {
        if (!existing.startsWith(prefix)) {
          lines.add(existing);
        }
      }
    }
    lines.add(line);
    return String.join("\n", lines);
  }

  private static Document attachGraphContext(
      Document doc, List<GraphNode> relatedNodes, TraversedGraph graph) {
    Set<String> entityNames = new LinkedHashSet<>();
    for (GraphNode node : relatedNodes) {
      if (!node.label().isEmpty()) {
        entityNames.add(node.displayName());
      }
    }

    Map<String, MetadataValue> context = new LinkedHashMap<>();
    if (!entityNames.isEmpty()) {
      context.put(MetadataKeys.RELATED_ENTITIES, MetadataValue.textList(List.copyOf(entityNames)));
    }
    context.put(MetadataKeys.NEIGHBOR_COUNT, MetadataValue.number(relatedNodes.size()));
    context.put(MetadataKeys.GRAPH_DEPTH, MetadataValue.number(depth(relatedNodes, graph)));

    Document augmented = doc.withMetadata(context);
    if (entityNames.isEmpty()) {
      return augmented;
    }
    return augmented.withGraphContext(RELATED_ENTITIES_PREFIX + String.join(", ", entityNames));
  }

  /** Smallest recorded traversal depth among the related nodes. */
  private static int depth(List<GraphNode> relatedNodes, TraversedGraph graph) {
    int depth = Integer.MAX_VALUE;
    for (GraphNode node : relatedNodes) {
      OptionalInt nodeDepth = graph.depthOf(node.id());
      if (nodeDepth.isPresent()) {
        depth = Math.min(depth, nodeDepth.getAsInt());
      }
    }
    return depth == Integer.MAX_VALUE ? UNKNOWN_DEPTH : depth;
  }

  private static Map<String, MetadataValue> scoreMetadata(FusedResult result) {
    Map<String, MetadataValue> scores = new LinkedHashMap<>();
    scores.put(MetadataKeys.FUSED_SCORE, MetadataValue.number(result.fusedScore()));
    scores.put(MetadataKeys.VECTOR_SCORE, MetadataValue.number(result.vectorScore()));
    scores.put(MetadataKeys.GRAPH_SCORE, MetadataValue.number(result.graphScore()));
    scores.put(MetadataKeys.RANK, MetadataValue.number(result.rank()));
    return scores;
  }
}
