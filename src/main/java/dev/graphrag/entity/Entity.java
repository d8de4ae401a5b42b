package dev.graphrag.entity;

/**
 * An entity mentioned in query text, resolved to a graph node id.
 *
 * @param id the graph node id traversal starts from
 * @param name the surface form found in the text
 * @param type the entity type
 */
public record Entity(String id, String name, String type) {}
