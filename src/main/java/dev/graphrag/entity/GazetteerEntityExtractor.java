package dev.graphrag.entity;

import dev.graphrag.graph.GraphNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dictionary-based {@link EntityExtractor} that recognises graph node labels in the text.
 *
 * <p>Matching is case-insensitive and anchored on word boundaries, so {@code "TechCorp"} matches
 * {@code "who runs techcorp?"} but not {@code "techcorporation"}. Entities are returned in order of
 * first appearance in the text; when two labels start at the same position the longer label wins.
 * Each node id is returned at most once.
 */
public class GazetteerEntityExtractor implements EntityExtractor {

  private final Supplier<? extends Collection<GraphNode>> vocabulary;

  /**
   * @param vocabulary supplies the nodes whose labels are recognised; read on every call so that
   *     nodes added to the graph later are picked up
   */
  public GazetteerEntityExtractor(Supplier<? extends Collection<GraphNode>> vocabulary) {
    this.vocabulary = vocabulary;
  }

  @Override
  public List<Entity> extract(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String haystack = text.toLowerCase(Locale.ROOT);

    List<Mention> mentions = new ArrayList<>();
    for (GraphNode node : vocabulary.get()) {
      if (node.label().isBlank()) {
        continue;
      }
      Matcher matcher = labelPattern(node.label()).matcher(haystack);
      if (matcher.find()) {
        mentions.add(new Mention(node, matcher.start(), node.label().length()));
      }
    }

    mentions.sort(
        Comparator.comparingInt(Mention::position)
            .thenComparing(Comparator.comparingInt(Mention::length).reversed()));

    Set<String> seen = new LinkedHashSet<>();
    List<Entity> entities = new ArrayList<>();
    for (Mention mention : mentions) {
      GraphNode node = mention.node();
      if (seen.add(node.id())) {
        entities.add(new Entity(node.id(), node.label(), node.type()));
      }
    }
    return entities;
  }

  private static Pattern labelPattern(String label) {
    return Pattern.compile(
        "(?<![\\p{L}\\p{N}])"
            + Pattern.quote(label.toLowerCase(Locale.ROOT))
            + "(?![\\p{L}\\p{N}])");
  }

  private record Mention(GraphNode node, int position, int length) {}
}
