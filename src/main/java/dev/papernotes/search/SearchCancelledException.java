package dev.papernotes.search;

/** Thrown when the thread running a query is interrupted. The interrupt flag is left set. */
public class SearchCancelledException extends RuntimeException {

  public SearchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
