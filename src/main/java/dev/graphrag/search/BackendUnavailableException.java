package dev.graphrag.search;

/**
 * Thrown when a retrieval backend the search cannot do without has failed: the vector store in
 * hybrid and vector mode, the graph path in graph mode.
 */
public class BackendUnavailableException extends RuntimeException {

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public BackendUnavailableException(String message) {
    super(message);
  }
}
