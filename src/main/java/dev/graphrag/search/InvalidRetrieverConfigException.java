package dev.graphrag.search;

/** Thrown when retriever settings or per-call search options are out of range. */
public class InvalidRetrieverConfigException extends IllegalArgumentException {

  public InvalidRetrieverConfigException(String message) {
    super(message);
  }
}
