package dev.docsage.search;

/**
 * Single typed failure surfaced to callers when a request cannot be served even in degraded mode.
 */
public class RetrievalFailedException extends RuntimeException {

  private final String userMessage;

  public RetrievalFailedException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Document search is temporarily unavailable. Please try again.";
  }

  /** Message safe to show to end users (no backend detail). */
  public String getUserMessage() {
    return userMessage;
  }
}
