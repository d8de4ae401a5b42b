package dev.graphrag.entity;

import java.util.List;

/**
 * Finds knowledge-graph entities mentioned in free text. Extraction is best-effort: an empty list
 * is a legitimate answer, and implementations may throw when their backing model is unavailable.
 */
public interface EntityExtractor {

  List<Entity> extract(String text);
}
