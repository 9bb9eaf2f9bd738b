package dev.docsage.search;

/**
 * Domain request for a retrieval call.
 *
 * @param query the user question (must not be null or blank)
 * @param k retrieval breadth per source before fusion and reranking (must be >= 1)
 */
public record RetrievalRequest(String query, int k) {

  /** Default retrieval breadth when the caller does not specify one. */
  public static final int DEFAULT_K = 8;

  /** Compact constructor validating input. */
  public RetrievalRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (k < 1) {
      throw new IllegalArgumentException("k must be at least 1");
    }
  }

  /** Convenience constructor defaulting {@code k} to 8. */
  public RetrievalRequest(String query) {
    this(query, DEFAULT_K);
  }
}
