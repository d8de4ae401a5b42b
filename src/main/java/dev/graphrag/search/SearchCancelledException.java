package dev.graphrag.search;

/** Thrown when a search is interrupted or exceeds its deadline. */
public class SearchCancelledException extends RuntimeException {

  public SearchCancelledException(String message) {
    super(message);
  }

  public SearchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
