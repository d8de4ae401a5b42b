package dev.graphrag.search;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Word-overlap similarity used by diversity and MMR reranking.
 *
 * <p>Text is lowercased, split on whitespace and stripped of surrounding punctuation ({@code
 * .,!?;:"'()[]{}}); similarity is the Jaccard index of the resulting word sets. Rerankers call
 * this O(n^2) times per request, so callers tokenise each text once with {@link #words(String)}
 * and compare sets with {@link #jaccard(Set, Set)}.
 */
public final class TextSimilarity {

  private static final String STRIPPED = ".,!?;:\"'()[]{}";

  private TextSimilarity() {}

  /**
   * Jaccard similarity of the word sets of two texts: symmetric, in [0, 1], and 0.0 when either
   * text has no words.
   */
  public static double jaccard(String a, String b) {
    return jaccard(words(a), words(b));
  }

  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    Set<String> smaller = a.size() <= b.size() ? a : b;
    Set<String> larger = smaller == a ? b : a;

    int intersection = 0;
    for (String word : smaller) {
      if (larger.contains(word)) {
        intersection++;
      }
    }
    int union = a.size() + b.size() - intersection;
    return (double) intersection / union;
  }

  /** Normalised word set of {@code text}. */
  public static Set<String> words(String text) {
    Set<String> words = new HashSet<>();
    if (text == null || text.isBlank()) {
      return words;
    }
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      String word = strip(token);
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }

  private static String strip(String token) {
    int start = 0;
    int end = token.length();
    while (start < end && STRIPPED.indexOf(token.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && STRIPPED.indexOf(token.charAt(end - 1)) >= 0) {
      end--;
    }
    return token.substring(start, end);
  }
}
