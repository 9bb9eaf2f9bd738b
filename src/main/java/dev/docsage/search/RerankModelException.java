package dev.docsage.search;

/** The cross-encoder could not score a batch, or returned unusable scores. */
public class RerankModelException extends RuntimeException {

  public RerankModelException(String message) {
    super(message);
  }

  public RerankModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
